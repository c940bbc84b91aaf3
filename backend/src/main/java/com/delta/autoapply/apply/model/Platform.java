package com.delta.autoapply.apply.model;

import java.util.Locale;

public enum Platform {
    LINKEDIN("LinkedIn"),
    UPWORK("Upwork");

    private final String displayName;

    Platform(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Case-insensitive lookup; returns null for anything that is not a known platform.
     */
    public static Platform fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace("-", "").replace("_", "");
        for (Platform platform : values()) {
            if (platform.name().equals(normalized)) {
                return platform;
            }
        }
        return null;
    }
}
