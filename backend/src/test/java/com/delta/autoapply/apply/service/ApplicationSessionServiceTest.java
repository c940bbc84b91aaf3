package com.delta.autoapply.apply.service;

import com.delta.autoapply.apply.ai.AiCollaborator;
import com.delta.autoapply.apply.ai.AiCollaboratorException;
import com.delta.autoapply.apply.ai.ApplicationMessageResult;
import com.delta.autoapply.apply.ai.JobSummaryResult;
import com.delta.autoapply.apply.audit.AuditLogger;
import com.delta.autoapply.apply.flow.CancellationSignal;
import com.delta.autoapply.apply.flow.ProgressListener;
import com.delta.autoapply.apply.model.ActionTypes;
import com.delta.autoapply.apply.model.ApplicationAction;
import com.delta.autoapply.apply.model.ApplicationSession;
import com.delta.autoapply.apply.model.ApplicationSessionStatus;
import com.delta.autoapply.apply.model.IllegalSessionStateException;
import com.delta.autoapply.apply.model.JobDetails;
import com.delta.autoapply.apply.model.JobListing;
import com.delta.autoapply.apply.model.Platform;
import com.delta.autoapply.apply.model.Question;
import com.delta.autoapply.apply.model.QuestionType;
import com.delta.autoapply.apply.model.ReviewEdits;
import com.delta.autoapply.apply.model.SearchFilter;
import com.delta.autoapply.apply.platform.JobPlatformAdapter;
import com.delta.autoapply.apply.platform.PlatformAdapterRegistry;
import com.delta.autoapply.apply.platform.UnsupportedPlatformException;
import com.delta.autoapply.config.AutoApplyProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class ApplicationSessionServiceTest {
    private static final JobListing JOB = new JobListing(
        Platform.LINKEDIN,
        "4012",
        "Backend Engineer",
        "Acme",
        "Berlin",
        "https://www.linkedin.com/jobs/view/4012/",
        "Build payment services"
    );

    private ScriptedAdapter adapter;
    private AuditLogger auditLogger;
    private ActiveSessionRegistry registry;
    private List<Runnable> deferred;

    @BeforeEach
    void setUp() {
        adapter = new ScriptedAdapter();
        auditLogger = mock(AuditLogger.class);
        registry = new ActiveSessionRegistry();
        deferred = new ArrayList<>();
    }

    @Test
    void preparationReachesReviewEvenWhenAiIsUnavailable() {
        ApplicationSessionService service = service(Runnable::run);

        ApplicationSession session = service.startPreparation(JOB);

        assertThat(session.getStatus()).isEqualTo(ApplicationSessionStatus.READY_FOR_REVIEW);
        assertThat(session.getApplicationMessage()).isEmpty();
        assertThat(session.getActions())
            .filteredOn(action -> !action.success())
            .extracting(ApplicationAction::actionType)
            .containsExactly(ActionTypes.AI_MESSAGE, ActionTypes.AI_ANSWERS);
        assertThat(service.isInFlight(session.getId())).isFalse();
        assertThat(service.latestProgress(session.getId())).isEqualTo("Form scanned");
        verify(auditLogger, times(0)).record(any());
    }

    @Test
    void cancellingBeforeApprovalWritesExactlyOneAuditRecord() {
        ApplicationSessionService service = service(Runnable::run);
        ApplicationSession session = service.startPreparation(JOB);

        service.cancel(session.getId());

        assertThat(session.getStatus()).isEqualTo(ApplicationSessionStatus.CANCELLED);
        assertThat(adapter.dismissals).isEqualTo(1);
        assertThatThrownBy(() -> service.cancel(session.getId())).isInstanceOf(IllegalSessionStateException.class);
        assertThatThrownBy(() -> service.approve(session.getId(), ReviewEdits.none()))
            .isInstanceOf(IllegalSessionStateException.class);
        verify(auditLogger, times(1)).record(session);
    }

    @Test
    void approvalCommitsEditsThenSubmits() {
        ApplicationSessionService service = service(Runnable::run);
        ApplicationSession session = service.prepare(JOB);
        Question years = session.getQuestions().get(0);
        adapter.submitStep = (submitting, progress, cancel) -> {
            assertThat(submitting.getStatus()).isEqualTo(ApplicationSessionStatus.APPROVED);
            assertThat(submitting.getApplicationMessage()).isEqualTo("Edited message");
            assertThat(years.getAnswer()).isEqualTo("6");
            submitting.transitionTo(ApplicationSessionStatus.SUBMITTING);
            submitting.transitionTo(ApplicationSessionStatus.SUBMITTED);
            return true;
        };

        service.approve(session.getId(), new ReviewEdits("Edited message", Map.of(years.getId(), "6")));

        assertThat(session.getStatus()).isEqualTo(ApplicationSessionStatus.SUBMITTED);
        assertThat(session.getApprovedAt()).isNotNull();
        assertThat(session.getActions()).extracting(ApplicationAction::actionType).contains(ActionTypes.REVIEW_DECISION);
        verify(auditLogger, times(1)).record(session);
    }

    @Test
    void approvalWithUnansweredRequiredQuestionIsAllowed() {
        ApplicationSessionService service = service(Runnable::run);
        ApplicationSession session = service.prepare(JOB);
        assertThat(session.unansweredRequiredQuestions()).hasSize(1);

        service.approve(session.getId(), ReviewEdits.none());

        assertThat(session.getStatus()).isEqualTo(ApplicationSessionStatus.SUBMITTED);
    }

    @Test
    void submissionWithoutOutcomeIsFailed() {
        ApplicationSessionService service = service(Runnable::run);
        ApplicationSession session = service.prepare(JOB);
        adapter.submitStep = (submitting, progress, cancel) -> {
            submitting.transitionTo(ApplicationSessionStatus.SUBMITTING);
            return false;
        };

        service.approve(session.getId(), ReviewEdits.none());

        assertThat(session.getStatus()).isEqualTo(ApplicationSessionStatus.FAILED);
        assertThat(session.getErrorMessage()).isEqualTo("Submission ended without a confirmed result");
        verify(auditLogger, times(1)).record(session);
    }

    @Test
    void adapterErrorBeforeSubmittingStillEndsTheApprovedSession() {
        ApplicationSessionService service = service(Runnable::run);
        ApplicationSession session = service.prepare(JOB);
        adapter.submitStep = (submitting, progress, cancel) -> {
            throw new IllegalStateException("chrome not found");
        };

        service.approve(session.getId(), ReviewEdits.none());

        assertThat(session.getStatus()).isEqualTo(ApplicationSessionStatus.FAILED);
        assertThat(session.getErrorMessage()).isEqualTo("Submission failed: chrome not found");
        verify(auditLogger, times(1)).record(session);
    }

    @Test
    void rejectedSubmissionTaskFailsTheApprovedSession() {
        ApplicationSessionService service = service(task -> {
            throw new RejectedExecutionException("pool shut down");
        });
        ApplicationSession session = service.prepare(JOB);

        assertThatThrownBy(() -> service.approve(session.getId(), ReviewEdits.none()))
            .isInstanceOf(RejectedExecutionException.class);

        assertThat(session.getStatus()).isEqualTo(ApplicationSessionStatus.FAILED);
        assertThat(session.getErrorMessage()).isEqualTo("Could not schedule automation: pool shut down");
        assertThat(service.isInFlight(session.getId())).isFalse();
        verify(auditLogger, times(1)).record(session);
    }

    @Test
    void adapterWithoutLoginFailsTheSession() {
        adapter.prepareStep = (session, progress, cancel) -> null;
        ApplicationSessionService service = service(Runnable::run);

        ApplicationSession session = service.startPreparation(JOB);

        assertThat(session.getStatus()).isEqualTo(ApplicationSessionStatus.FAILED);
        assertThat(session.getErrorMessage()).isEqualTo("LinkedIn is not logged in");
        verify(auditLogger, times(1)).record(session);
    }

    @Test
    void unexpectedAdapterErrorFailsTheSession() {
        adapter.prepareStep = (session, progress, cancel) -> {
            throw new IllegalStateException("driver crashed");
        };
        ApplicationSessionService service = service(Runnable::run);

        ApplicationSession session = service.startPreparation(JOB);

        assertThat(session.getStatus()).isEqualTo(ApplicationSessionStatus.FAILED);
        assertThat(session.getErrorMessage()).isEqualTo("Preparation failed: driver crashed");
    }

    @Test
    void abortSignalsTheRunningFlow() {
        adapter.prepareStep = (session, progress, cancel) -> {
            if (cancel.isCancelled()) {
                session.fail("Preparation cancelled");
            }
            return session;
        };
        ApplicationSessionService service = service(deferred::add);
        ApplicationSession session = service.startPreparation(JOB);

        assertThat(service.isInFlight(session.getId())).isTrue();
        assertThatThrownBy(() -> service.approve(session.getId(), ReviewEdits.none()))
            .isInstanceOf(IllegalSessionStateException.class);
        assertThatThrownBy(() -> service.cancel(session.getId()))
            .isInstanceOf(IllegalSessionStateException.class);

        service.abort(session.getId());
        deferred.forEach(Runnable::run);

        assertThat(session.getStatus()).isEqualTo(ApplicationSessionStatus.FAILED);
        assertThat(session.getErrorMessage()).isEqualTo("Preparation cancelled");
        assertThat(service.isInFlight(session.getId())).isFalse();
        assertThatThrownBy(() -> service.abort(session.getId())).isInstanceOf(IllegalSessionStateException.class);
        verify(auditLogger, times(1)).record(session);
    }

    @Test
    void unknownSessionsAndPlatformsAreRejected() {
        ApplicationSessionService service = service(Runnable::run);
        JobListing upworkJob = new JobListing(Platform.UPWORK, "01ab", "API", "Client", null, "https://x", null);

        assertThatThrownBy(() -> service.find(UUID.randomUUID())).isInstanceOf(UnknownSessionException.class);
        assertThatThrownBy(() -> service.startPreparation(upworkJob)).isInstanceOf(UnsupportedPlatformException.class);
    }

    @Test
    void directSubmitRequiresApproval() {
        ApplicationSessionService service = service(Runnable::run);
        ApplicationSession session = service.prepare(JOB);

        assertThatThrownBy(() -> service.submit(session)).isInstanceOf(IllegalSessionStateException.class);
    }

    @Test
    void listsNewestSessionFirst() throws Exception {
        ApplicationSessionService service = service(Runnable::run);
        ApplicationSession first = service.prepare(JOB);
        Thread.sleep(5);
        ApplicationSession second = service.prepare(JOB);

        assertThat(service.list()).containsExactly(second, first);
    }

    private ApplicationSessionService service(Executor applicationExecutor) {
        AnswerResolver answerResolver = new AnswerResolver(new UnavailableAi(), new AutoApplyProperties());
        return new ApplicationSessionService(
            new PlatformAdapterRegistry(List.of(adapter)),
            answerResolver,
            auditLogger,
            registry,
            applicationExecutor,
            Runnable::run
        );
    }

    @FunctionalInterface
    private interface Step<T> {
        T run(ApplicationSession session, ProgressListener progress, CancellationSignal cancel);
    }

    private static final class ScriptedAdapter implements JobPlatformAdapter {
        private Step<ApplicationSession> prepareStep = (session, progress, cancel) -> {
            session.recordQuestions(List.of(
                new Question("Years of Java", QuestionType.SHORT_TEXT, List.of(), true, false, null, 0, null, null)
            ), 1);
            session.transitionTo(ApplicationSessionStatus.READY_FOR_REVIEW);
            progress.onProgress("Form scanned");
            return session;
        };
        private Step<Boolean> submitStep = (session, progress, cancel) -> {
            session.transitionTo(ApplicationSessionStatus.SUBMITTING);
            session.transitionTo(ApplicationSessionStatus.SUBMITTED);
            return true;
        };
        private int dismissals;

        @Override
        public Platform platform() {
            return Platform.LINKEDIN;
        }

        @Override
        public boolean isReady() {
            return true;
        }

        @Override
        public boolean checkLoginStatus() {
            return true;
        }

        @Override
        public void openLoginWindow() {
        }

        @Override
        public List<JobListing> searchJobs(SearchFilter filter, ProgressListener progress, CancellationSignal cancel) {
            return List.of();
        }

        @Override
        public JobDetails fetchJobDetails(String jobUrl) {
            return null;
        }

        @Override
        public ApplicationSession prepareApplication(ApplicationSession session, ProgressListener progress, CancellationSignal cancel) {
            return prepareStep.run(session, progress, cancel);
        }

        @Override
        public boolean submitApplication(ApplicationSession session, ProgressListener progress, CancellationSignal cancel) {
            return submitStep.run(session, progress, cancel);
        }

        @Override
        public void cancelApplication() {
            dismissals++;
        }

        @Override
        public void close() {
        }
    }

    private static final class UnavailableAi implements AiCollaborator {
        @Override
        public ApplicationMessageResult generateApplicationMessage(
            String jobDescription,
            String jobTitle,
            String company,
            String userProfile
        ) throws AiCollaboratorException {
            throw new AiCollaboratorException("AI API key is not configured");
        }

        @Override
        public Map<String, String> generateQuestionAnswers(
            List<Question> questions,
            String userProfile,
            String jobDescription
        ) throws AiCollaboratorException {
            throw new AiCollaboratorException("AI API key is not configured");
        }

        @Override
        public JobSummaryResult summarizeJob(String jobDescription, String userProfile) throws AiCollaboratorException {
            throw new AiCollaboratorException("AI API key is not configured");
        }

        @Override
        public void validateApiKey() throws AiCollaboratorException {
            throw new AiCollaboratorException("AI API key is not configured");
        }
    }
}
