package com.delta.autoapply.apply.model;

import java.time.Instant;

public record ApplicationAction(
    Instant timestamp,
    String actionType,
    String description,
    boolean success,
    String details,
    Long durationMs
) {
    public static ApplicationAction succeeded(String actionType, String description) {
        return new ApplicationAction(Instant.now(), actionType, description, true, null, null);
    }

    public static ApplicationAction succeeded(String actionType, String description, long durationMs) {
        return new ApplicationAction(Instant.now(), actionType, description, true, null, durationMs);
    }

    public static ApplicationAction failed(String actionType, String description, String details) {
        return new ApplicationAction(Instant.now(), actionType, description, false, details, null);
    }
}
