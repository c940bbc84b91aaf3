package com.delta.autoapply.apply.ai;

/**
 * The model's verdict on a job: a summary, a 1-10 rating and an optional discard recommendation.
 * {@code parseFailed} marks a reply that could not be read as JSON; such results carry a neutral
 * rating and never recommend discarding.
 */
public record JobSummaryResult(
    String summary,
    String shortSummary,
    int rating,
    boolean shouldDiscard,
    String discardReason,
    boolean parseFailed
) {
    public static final int MIN_RATING = 1;
    public static final int MAX_RATING = 10;
    public static final int NEUTRAL_RATING = 5;

    public JobSummaryResult {
        summary = summary == null ? "" : summary;
        shortSummary = shortSummary == null ? "" : shortSummary;
        rating = Math.min(MAX_RATING, Math.max(MIN_RATING, rating));
        discardReason = shouldDiscard ? discardReason : null;
    }
}
