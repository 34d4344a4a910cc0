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

/**
 * Base unchecked exception for SitePulse modules. Every instance carries a short
 * error code so log lines and status payloads can be grouped without parsing messages.
 */
public class SitePulseException extends RuntimeException {

    public static final String GENERIC = "SP_GENERIC";
    public static final String JSON = "SP_JSON";

    private final String errorCode;

    public SitePulseException(String message) {
        this(GENERIC, message);
    }

    public SitePulseException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode == null ? GENERIC : errorCode;
    }

    public SitePulseException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode == null ? GENERIC : errorCode;
    }

    public String getErrorCode() { return errorCode; }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + errorCode + "]: " + getMessage();
    }
}
