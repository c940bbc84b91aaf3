package com.delta.autoapply.apply.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One attempt to apply to one job. All mutation goes through methods that check the current
 * {@link ApplicationSessionStatus}, so an approved session can no longer have its content changed
 * and a terminal session can no longer change at all.
 */
public class ApplicationSession {
    private final UUID id;
    private final Platform platform;
    private final String externalJobId;
    private final String jobTitle;
    private final String company;
    private final String jobUrl;
    private final String jobDescription;
    private final Integer connectsRequired;
    private final Instant startedAt;
    private final List<Question> questions = new ArrayList<>();
    private final List<ApplicationAction> actions = new ArrayList<>();
    private final AtomicBoolean auditRecorded = new AtomicBoolean(false);

    private ApplicationSessionStatus status = ApplicationSessionStatus.PENDING;
    private Instant approvedAt;
    private Instant completedAt;
    private String applicationMessage = "";
    private int totalPages;
    private int currentPage;
    private List<String> matchingSkills = List.of();
    private List<String> addressedRequirements = List.of();
    private int confidenceScore;
    private String errorMessage;

    public ApplicationSession(
        Platform platform,
        String externalJobId,
        String jobTitle,
        String company,
        String jobUrl,
        String jobDescription
    ) {
        this(platform, externalJobId, jobTitle, company, jobUrl, jobDescription, null);
    }

    public ApplicationSession(
        Platform platform,
        String externalJobId,
        String jobTitle,
        String company,
        String jobUrl,
        String jobDescription,
        Integer connectsRequired
    ) {
        this.id = UUID.randomUUID();
        this.platform = platform;
        this.externalJobId = externalJobId;
        this.jobTitle = jobTitle;
        this.company = company;
        this.jobUrl = jobUrl;
        this.jobDescription = jobDescription == null ? "" : jobDescription;
        this.connectsRequired = connectsRequired;
        this.startedAt = Instant.now();
    }

    public static ApplicationSession forJob(JobListing job) {
        return new ApplicationSession(
            job.platform(),
            job.externalJobId(),
            job.title(),
            job.company(),
            job.applicationUrl(),
            job.description(),
            job.connectsRequired()
        );
    }

    public synchronized boolean canTransitionTo(ApplicationSessionStatus target) {
        return status.canTransitionTo(target);
    }

    public synchronized void transitionTo(ApplicationSessionStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalSessionStateException(
                "Session " + id + " cannot move from " + status + " to " + target
            );
        }
        status = target;
        if (target == ApplicationSessionStatus.APPROVED) {
            approvedAt = Instant.now();
        }
        if (target.isTerminal()) {
            completedAt = Instant.now();
        }
    }

    public synchronized void fail(String reason) {
        if (!status.canTransitionTo(ApplicationSessionStatus.FAILED)) {
            throw new IllegalSessionStateException("Session " + id + " cannot fail from " + status);
        }
        errorMessage = reason;
        transitionTo(ApplicationSessionStatus.FAILED);
    }

    /**
     * Moves to FAILED when that is still a legal edge; returns false if the session already left
     * the states that can fail.
     */
    public synchronized boolean failIfActive(String reason) {
        if (!status.canTransitionTo(ApplicationSessionStatus.FAILED)) {
            return false;
        }
        fail(reason);
        return true;
    }

    /**
     * Fails the session on behalf of the flow that owns it. An APPROVED session has no direct edge
     * to FAILED, so it passes through SUBMITTING first.
     */
    public synchronized boolean failFlow(String reason) {
        if (status == ApplicationSessionStatus.APPROVED) {
            transitionTo(ApplicationSessionStatus.SUBMITTING);
        }
        return failIfActive(reason);
    }

    public synchronized void recordQuestions(List<Question> detected, int pages) {
        if (status != ApplicationSessionStatus.PENDING) {
            throw new IllegalSessionStateException("Questions are recorded only while preparing, status is " + status);
        }
        questions.clear();
        if (detected != null) {
            questions.addAll(detected);
        }
        totalPages = Math.max(0, pages);
    }

    public synchronized void updateApplicationMessage(String message) {
        requireEditable("application message");
        applicationMessage = message == null ? "" : message;
    }

    public synchronized void recordAiMetadata(List<String> skills, List<String> requirements, int confidence) {
        requireEditable("AI metadata");
        matchingSkills = skills == null ? List.of() : List.copyOf(skills);
        addressedRequirements = requirements == null ? List.of() : List.copyOf(requirements);
        confidenceScore = Math.min(100, Math.max(0, confidence));
    }

    /**
     * Sets the answer for one question. Pre-filled and unknown questions are left alone.
     */
    public synchronized boolean answerQuestion(UUID questionId, String answer) {
        requireEditable("answers");
        for (Question question : questions) {
            if (question.getId().equals(questionId)) {
                if (question.isPreFilled()) {
                    return false;
                }
                question.assignAnswer(answer);
                return true;
            }
        }
        return false;
    }

    /**
     * Merges answers keyed by exact question text into questions that are neither pre-filled nor
     * already answered. Returns the number of questions updated.
     */
    public synchronized int applyAnswersByText(Map<String, String> answersByText) {
        requireEditable("answers");
        if (answersByText == null || answersByText.isEmpty()) {
            return 0;
        }
        int applied = 0;
        for (Question question : questions) {
            if (question.isPreFilled() || question.hasAnswer()) {
                continue;
            }
            String value = answersByText.get(question.getText());
            if (value != null) {
                question.assignAnswer(value);
                applied++;
            }
        }
        return applied;
    }

    public synchronized void setCurrentPage(int page) {
        if (status.isTerminal()) {
            throw new IllegalSessionStateException("Session " + id + " is terminal");
        }
        currentPage = Math.max(0, page);
    }

    /**
     * Appends to the action log. Terminal sessions are frozen, so the action is dropped and false
     * is returned.
     */
    public synchronized boolean logAction(ApplicationAction action) {
        if (status.isTerminal() || action == null) {
            return false;
        }
        actions.add(action);
        return true;
    }

    /**
     * Returns true exactly once for the lifetime of the session.
     */
    public boolean markAuditRecorded() {
        return auditRecorded.compareAndSet(false, true);
    }

    public boolean isAuditRecorded() {
        return auditRecorded.get();
    }

    public synchronized List<Question> unansweredRequiredQuestions() {
        List<Question> missing = new ArrayList<>();
        for (Question question : questions) {
            if (question.isRequired()
                && !question.isPreFilled()
                && !question.hasAnswer()
                && question.getType() != QuestionType.FILE_UPLOAD
                && question.getType() != QuestionType.UNKNOWN) {
                missing.add(question);
            }
        }
        return missing;
    }

    private void requireEditable(String what) {
        if (!status.allowsEdits()) {
            throw new IllegalSessionStateException("Cannot change " + what + " of session " + id + " in status " + status);
        }
    }

    public UUID getId() {
        return id;
    }

    public Platform getPlatform() {
        return platform;
    }

    public String getExternalJobId() {
        return externalJobId;
    }

    public String getJobTitle() {
        return jobTitle;
    }

    public String getCompany() {
        return company;
    }

    public String getJobUrl() {
        return jobUrl;
    }

    public String getJobDescription() {
        return jobDescription;
    }

    public Integer getConnectsRequired() {
        return connectsRequired;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public synchronized ApplicationSessionStatus getStatus() {
        return status;
    }

    public synchronized Instant getApprovedAt() {
        return approvedAt;
    }

    public synchronized Instant getCompletedAt() {
        return completedAt;
    }

    public synchronized String getApplicationMessage() {
        return applicationMessage;
    }

    public synchronized List<Question> getQuestions() {
        return List.copyOf(questions);
    }

    public synchronized List<ApplicationAction> getActions() {
        return List.copyOf(actions);
    }

    public synchronized int getTotalPages() {
        return totalPages;
    }

    public synchronized int getCurrentPage() {
        return currentPage;
    }

    public synchronized List<String> getMatchingSkills() {
        return matchingSkills;
    }

    public synchronized List<String> getAddressedRequirements() {
        return addressedRequirements;
    }

    public synchronized int getConfidenceScore() {
        return confidenceScore;
    }

    public synchronized String getErrorMessage() {
        return errorMessage;
    }
}
