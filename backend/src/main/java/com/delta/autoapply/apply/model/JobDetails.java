package com.delta.autoapply.apply.model;

import java.util.List;

public record JobDetails(
    String description,
    String recruiterEmail,
    String externalApplyUrl,
    boolean quickApply,
    String experienceLevel,
    List<String> requiredSkills,
    String projectDuration,
    Integer connectsRequired
) {
    public JobDetails {
        requiredSkills = requiredSkills == null ? List.of() : List.copyOf(requiredSkills);
    }
}
