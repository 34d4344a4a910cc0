/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 *
 * This software is proprietary and confidential. Unauthorized copying,
 * distribution, modification, or use is strictly prohibited without
 * explicit written permission from the copyright holder.
 * Patent Pending.
 */
package com.sitepulse.common.exception;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SitePulseExceptionTest {

    @Test
    void defaultsToGenericCode() {
        assertThat(new SitePulseException("oops").getErrorCode()).isEqualTo(SitePulseException.GENERIC);
        assertThat(new SitePulseException(null, "oops").getErrorCode()).isEqualTo(SitePulseException.GENERIC);
    }

    @Test
    void toStringShowsCodeAndMessage() {
        SitePulseException e = new SitePulseException("SP_TEST", "broken", new IllegalStateException());

        assertThat(e).hasToString("SitePulseException[SP_TEST]: broken");
        assertThat(e.getCause()).isInstanceOf(IllegalStateException.class);
    }
}
