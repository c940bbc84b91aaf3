package com.delta.autoapply.apply.model;

public enum QuestionType {
    SHORT_TEXT,
    MULTI_LINE_TEXT,
    SINGLE_SELECT,
    CHOICE,
    CHECKBOX_GROUP,
    NUMERIC,
    BOOLEAN,
    PHONE,
    EMAIL,
    DATE,
    FILE_UPLOAD,
    UNKNOWN;

    public boolean isTextEntry() {
        return this == SHORT_TEXT
            || this == MULTI_LINE_TEXT
            || this == NUMERIC
            || this == PHONE
            || this == EMAIL
            || this == DATE;
    }
}
