package com.delta.autoapply.apply.model;

import java.util.Map;
import java.util.UUID;

/**
 * Edits committed by the reviewer at approval time. A null message keeps the drafted one.
 */
public record ReviewEdits(String applicationMessage, Map<UUID, String> answers) {
    public ReviewEdits {
        answers = answers == null ? Map.of() : Map.copyOf(answers);
    }

    public static ReviewEdits none() {
        return new ReviewEdits(null, Map.of());
    }
}
