package com.delta.autoapply.apply.form;

import com.delta.autoapply.apply.model.Question;

import java.util.List;

public record FormScan(
    List<Question> questions,
    int totalPages,
    boolean pageCapReached,
    NavigationControl lastControl
) {
    public FormScan {
        questions = questions == null ? List.of() : List.copyOf(questions);
    }
}
