package com.delta.autoapply.apply.model;

/**
 * A job as found on a platform. {@code connectsRequired} is the Upwork Connects cost of applying,
 * null where the platform has no such cost or the listing did not show it.
 */
public record JobListing(
    Platform platform,
    String externalJobId,
    String title,
    String company,
    String location,
    String applicationUrl,
    String description,
    Integer connectsRequired
) {
    public JobListing(
        Platform platform,
        String externalJobId,
        String title,
        String company,
        String location,
        String applicationUrl,
        String description
    ) {
        this(platform, externalJobId, title, company, location, applicationUrl, description, null);
    }

    public JobListing withDescription(String newDescription) {
        return new JobListing(platform, externalJobId, title, company, location, applicationUrl, newDescription, connectsRequired);
    }
}
