/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 *
 * This software is proprietary and confidential. Unauthorized copying,
 * distribution, modification, or use is strictly prohibited without
 * explicit written permission from the copyright holder.
 * Patent Pending.
 */
package com.sitepulse.common.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.sitepulse.common.exception.SitePulseException;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonUtilTest {

    record Stamp(String id, Instant at) {}

    @Test
    void writesInstantsAsIsoStrings() {
        String json = JsonUtil.toJson(new Stamp("t-1", Instant.parse("2025-01-01T00:00:00Z")));

        assertThat(json).contains("\"at\":\"2025-01-01T00:00:00Z\"");
    }

    @Test
    void convertsTreeToRecord() {
        JsonNode node = JsonUtil.readTree("{\"id\":\"t-2\",\"at\":\"2025-03-04T05:06:07Z\"}");

        Stamp stamp = JsonUtil.convert(node, Stamp.class);

        assertThat(stamp.id()).isEqualTo("t-2");
        assertThat(stamp.at()).isEqualTo(Instant.parse("2025-03-04T05:06:07Z"));
    }

    @Test
    void malformedJsonCarriesErrorCode() {
        assertThatThrownBy(() -> JsonUtil.readTree("{not json"))
                .isInstanceOf(SitePulseException.class)
                .extracting(e -> ((SitePulseException) e).getErrorCode())
                .isEqualTo("SP_JSON");
    }
}
