package com.delta.autoapply.api;

import com.delta.autoapply.apply.model.Question;

import java.util.List;
import java.util.UUID;

public record QuestionView(
    UUID id,
    String text,
    String type,
    List<String> options,
    boolean required,
    boolean preFilled,
    String answer,
    int pageIndex,
    Integer maxLength
) {
    static QuestionView from(Question question) {
        return new QuestionView(
            question.getId(),
            question.getText(),
            question.getType().name(),
            question.getOptions(),
            question.isRequired(),
            question.isPreFilled(),
            question.getAnswer(),
            question.getPageIndex(),
            question.getMaxLength()
        );
    }
}
