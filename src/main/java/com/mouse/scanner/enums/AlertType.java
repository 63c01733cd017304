package com.mouse.scanner.enums;

/**
 * Alert categories produced by the built-in detectors.
 * Custom detectors may report any other code; the alert type is stored as plain text.
 */
public enum AlertType {
    WHALE_ACTIVITY("whale_activity"),
    DAY_TRADING("day_trading"),
    VOLUME_OI_SPIKE("volume_oi_spike");

    private final String code;

    AlertType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
