package com.mouse.scanner.enums;

import java.util.Locale;

public enum OptionType {
    CALL("C"),
    PUT("P");

    private final String right;

    OptionType(String right) {
        this.right = right;
    }

    public String getRight() {
        return right;
    }

    /**
     * Accepts "call"/"put" as well as the single-letter right ("C"/"P") used by the data feed.
     */
    public static OptionType fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Option type cannot be empty");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (OptionType type : values()) {
            if (type.name().equals(normalized) || type.right.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown option type: " + value);
    }
}
