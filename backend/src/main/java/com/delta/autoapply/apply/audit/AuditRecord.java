package com.delta.autoapply.apply.audit;

import com.delta.autoapply.apply.model.ApplicationAction;
import com.delta.autoapply.apply.model.ApplicationSession;
import com.delta.autoapply.apply.model.Question;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

public record AuditRecord(
    UUID sessionId,
    String platform,
    String externalJobId,
    String jobTitle,
    String company,
    String jobUrl,
    String status,
    Instant startedAt,
    Instant approvedAt,
    Instant completedAt,
    String errorMessage,
    String applicationMessage,
    int confidenceScore,
    List<String> matchingSkills,
    List<String> addressedRequirements,
    int totalPages,
    List<QuestionEntry> questions,
    List<ApplicationAction> actions
) {
    public record QuestionEntry(
        UUID id,
        String text,
        String type,
        List<String> options,
        boolean required,
        boolean preFilled,
        String preFilledValue,
        String answer,
        int pageIndex,
        Integer maxLength,
        String field
    ) {
    }

    public static AuditRecord from(ApplicationSession session) {
        List<QuestionEntry> questions = new ArrayList<>();
        for (Question question : session.getQuestions()) {
            questions.add(new QuestionEntry(
                question.getId(),
                question.getText(),
                question.getType().name(),
                question.getOptions(),
                question.isRequired(),
                question.isPreFilled(),
                question.getPreFilledValue(),
                question.getAnswer(),
                question.getPageIndex(),
                question.getMaxLength(),
                question.getFieldReference() == null ? null : question.getFieldReference().describe()
            ));
        }
        return new AuditRecord(
            session.getId(),
            session.getPlatform() == null ? null : session.getPlatform().name(),
            session.getExternalJobId(),
            session.getJobTitle(),
            session.getCompany(),
            session.getJobUrl(),
            session.getStatus().name(),
            session.getStartedAt(),
            session.getApprovedAt(),
            session.getCompletedAt(),
            session.getErrorMessage(),
            session.getApplicationMessage(),
            session.getConfidenceScore(),
            session.getMatchingSkills(),
            session.getAddressedRequirements(),
            session.getTotalPages(),
            questions,
            session.getActions()
        );
    }
}
