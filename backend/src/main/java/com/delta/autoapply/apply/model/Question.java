package com.delta.autoapply.apply.model;

import java.util.List;
import java.util.UUID;

public class Question {
    private final UUID id;
    private final String text;
    private final QuestionType type;
    private final List<String> options;
    private final boolean required;
    private final boolean preFilled;
    private final String preFilledValue;
    private final int pageIndex;
    private final FieldReference fieldReference;
    private final Integer maxLength;
    private volatile String answer;

    public Question(
        String text,
        QuestionType type,
        List<String> options,
        boolean required,
        boolean preFilled,
        String preFilledValue,
        int pageIndex,
        FieldReference fieldReference,
        Integer maxLength
    ) {
        this.id = UUID.randomUUID();
        this.text = text == null ? "" : text.trim();
        this.type = type == null ? QuestionType.UNKNOWN : type;
        this.options = options == null ? List.of() : List.copyOf(options);
        this.required = required;
        this.preFilled = preFilled;
        this.preFilledValue = preFilled ? preFilledValue : null;
        this.pageIndex = pageIndex;
        this.fieldReference = fieldReference;
        this.maxLength = maxLength == null || maxLength <= 0 ? null : maxLength;
        this.answer = this.preFilledValue;
    }

    public UUID getId() {
        return id;
    }

    public String getText() {
        return text;
    }

    public QuestionType getType() {
        return type;
    }

    public List<String> getOptions() {
        return options;
    }

    public boolean isRequired() {
        return required;
    }

    public boolean isPreFilled() {
        return preFilled;
    }

    public String getPreFilledValue() {
        return preFilledValue;
    }

    public int getPageIndex() {
        return pageIndex;
    }

    public FieldReference getFieldReference() {
        return fieldReference;
    }

    public Integer getMaxLength() {
        return maxLength;
    }

    public String getAnswer() {
        return answer;
    }

    public boolean hasAnswer() {
        String current = answer;
        return current != null && !current.isBlank();
    }

    // Only the owning session may write answers; it enforces status and pre-fill rules.
    void assignAnswer(String value) {
        this.answer = value;
    }
}
