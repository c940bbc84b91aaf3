package com.delta.autoapply.api;

import com.delta.autoapply.apply.model.ApplicationAction;
import com.delta.autoapply.apply.model.ApplicationSession;
import com.delta.autoapply.apply.model.Question;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record ApplicationSessionView(
    UUID id,
    String platform,
    String externalJobId,
    String jobTitle,
    String company,
    String jobUrl,
    Integer connectsRequired,
    String status,
    boolean inFlight,
    String latestProgress,
    Instant startedAt,
    Instant approvedAt,
    Instant completedAt,
    String applicationMessage,
    int confidenceScore,
    List<String> matchingSkills,
    List<String> addressedRequirements,
    int totalPages,
    int currentPage,
    List<QuestionView> questions,
    List<UUID> unansweredRequired,
    List<ApplicationAction> actions,
    String errorMessage
) {
    static ApplicationSessionView from(ApplicationSession session, boolean inFlight, String latestProgress) {
        return new ApplicationSessionView(
            session.getId(),
            session.getPlatform().name(),
            session.getExternalJobId(),
            session.getJobTitle(),
            session.getCompany(),
            session.getJobUrl(),
            session.getConnectsRequired(),
            session.getStatus().name(),
            inFlight,
            latestProgress,
            session.getStartedAt(),
            session.getApprovedAt(),
            session.getCompletedAt(),
            session.getApplicationMessage(),
            session.getConfidenceScore(),
            session.getMatchingSkills(),
            session.getAddressedRequirements(),
            session.getTotalPages(),
            session.getCurrentPage(),
            session.getQuestions().stream().map(QuestionView::from).toList(),
            session.unansweredRequiredQuestions().stream().map(Question::getId).toList(),
            session.getActions(),
            session.getErrorMessage()
        );
    }
}
