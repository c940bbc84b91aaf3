package com.delta.autoapply.apply.ai;

import java.util.List;

public record ApplicationMessageResult(
    String message,
    List<String> addressedRequirements,
    List<String> matchingSkills,
    int confidenceScore
) {
    public ApplicationMessageResult {
        message = message == null ? "" : message;
        addressedRequirements = addressedRequirements == null ? List.of() : List.copyOf(addressedRequirements);
        matchingSkills = matchingSkills == null ? List.of() : List.copyOf(matchingSkills);
        confidenceScore = Math.min(100, Math.max(0, confidenceScore));
    }
}
