package com.delta.autoapply.apply.model;

import java.util.List;

public record SearchFilter(
    String keywords,
    List<String> locations,
    List<String> experienceLevels,
    boolean remoteOnly,
    Integer maxResults
) {
    private static final int DEFAULT_MAX_RESULTS = 50;

    public SearchFilter {
        keywords = keywords == null ? "" : keywords.trim();
        locations = locations == null ? List.of() : List.copyOf(locations);
        experienceLevels = experienceLevels == null ? List.of() : List.copyOf(experienceLevels);
        maxResults = maxResults == null ? DEFAULT_MAX_RESULTS : Math.max(1, maxResults);
    }

    public String primaryLocation() {
        return locations.isEmpty() ? "" : locations.get(0);
    }
}
