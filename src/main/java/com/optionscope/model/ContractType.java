package com.optionscope.model;

import java.util.Locale;

public enum ContractType {
    CALL("Call"),
    PUT("Put");

    private final String label;

    ContractType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Case-insensitive match against "Call"/"Put"; anything else (including null) is unknown.
     */
    public static ContractType fromLabel(String raw) {
        if (raw == null) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (ContractType type : values()) {
            if (type.label.toLowerCase(Locale.ROOT).equals(normalized)) {
                return type;
            }
        }
        return null;
    }
}
