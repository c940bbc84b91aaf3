package com.delta.autoapply.apply.model;

public final class ActionTypes {
    public static final String NAVIGATE = "navigate";
    public static final String OPEN_APPLICATION = "open_application";
    public static final String DETECT_PAGE = "detect_page";
    public static final String NEXT_PAGE = "next_page";
    public static final String REVIEW = "review";
    public static final String REWIND = "rewind";
    public static final String FILL = "fill";
    public static final String SKIP = "skip";
    public static final String SUBMIT = "submit";
    public static final String CONFIRMATION = "confirmation";
    public static final String VALIDATION_ERROR = "validation_error";
    public static final String CANCEL = "cancel";
    public static final String AI_MESSAGE = "ai_message";
    public static final String AI_ANSWERS = "ai_answers";
    public static final String REVIEW_DECISION = "review_decision";
    public static final String ERROR = "error";

    private ActionTypes() {
    }
}
