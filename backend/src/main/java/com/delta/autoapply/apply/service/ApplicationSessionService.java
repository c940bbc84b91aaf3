package com.delta.autoapply.apply.service;

import com.delta.autoapply.apply.audit.AuditLogger;
import com.delta.autoapply.apply.flow.CancellationSignal;
import com.delta.autoapply.apply.flow.ProgressListener;
import com.delta.autoapply.apply.model.ActionTypes;
import com.delta.autoapply.apply.model.ApplicationAction;
import com.delta.autoapply.apply.model.ApplicationSession;
import com.delta.autoapply.apply.model.ApplicationSessionStatus;
import com.delta.autoapply.apply.model.IllegalSessionStateException;
import com.delta.autoapply.apply.model.JobListing;
import com.delta.autoapply.apply.model.Question;
import com.delta.autoapply.apply.model.ReviewEdits;
import com.delta.autoapply.apply.platform.JobPlatformAdapter;
import com.delta.autoapply.apply.platform.PlatformAdapterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Owns the lifecycle of application sessions: preparation, human review, submission and the
 * single audit write once a session reaches a terminal status.
 */
@Service
public class ApplicationSessionService {
    private static final Logger log = LoggerFactory.getLogger(ApplicationSessionService.class);

    private final PlatformAdapterRegistry adapters;
    private final AnswerResolver answerResolver;
    private final AuditLogger auditLogger;
    private final ActiveSessionRegistry registry;
    private final Executor applicationExecutor;
    private final Executor progressExecutor;

    public ApplicationSessionService(
        PlatformAdapterRegistry adapters,
        AnswerResolver answerResolver,
        AuditLogger auditLogger,
        ActiveSessionRegistry registry,
        @Qualifier("applicationExecutor") Executor applicationExecutor,
        @Qualifier("progressExecutor") Executor progressExecutor
    ) {
        this.adapters = adapters;
        this.answerResolver = answerResolver;
        this.auditLogger = auditLogger;
        this.registry = registry;
        this.applicationExecutor = applicationExecutor;
        this.progressExecutor = progressExecutor;
    }

    /**
     * Registers a PENDING session and prepares it in the background.
     */
    public ApplicationSession startPreparation(JobListing job) {
        JobPlatformAdapter adapter = adapters.get(job.platform());
        ApplicationSession session = ApplicationSession.forJob(job);
        registry.register(session);
        CancellationSignal cancel = registry.beginFlow(session.getId());
        log.info("Preparing {} application for '{}' at {} (session {})",
            adapter.platform().displayName(), job.title(), job.company(), session.getId());
        dispatch(session, () -> runPreparation(adapter, session, cancel));
        return session;
    }

    public ApplicationSession prepare(JobListing job) {
        JobPlatformAdapter adapter = adapters.get(job.platform());
        ApplicationSession session = ApplicationSession.forJob(job);
        registry.register(session);
        CancellationSignal cancel = registry.beginFlow(session.getId());
        runPreparation(adapter, session, cancel);
        return session;
    }

    /**
     * Commits the reviewer's edits, freezes the session and starts submission in the background.
     */
    public ApplicationSession approve(UUID sessionId, ReviewEdits edits) {
        ApplicationSession session = require(sessionId);
        if (registry.isInFlight(sessionId)) {
            throw new IllegalSessionStateException("Session " + sessionId + " is still being prepared");
        }
        ReviewEdits safeEdits = edits == null ? ReviewEdits.none() : edits;
        synchronized (session) {
            if (session.getStatus() != ApplicationSessionStatus.READY_FOR_REVIEW) {
                throw new IllegalSessionStateException(
                    "Only sessions in READY_FOR_REVIEW can be approved, session " + sessionId + " is " + session.getStatus()
                );
            }
            if (safeEdits.applicationMessage() != null) {
                session.updateApplicationMessage(safeEdits.applicationMessage());
            }
            for (Map.Entry<UUID, String> answer : safeEdits.answers().entrySet()) {
                session.answerQuestion(answer.getKey(), answer.getValue());
            }
            List<Question> missing = session.unansweredRequiredQuestions();
            if (!missing.isEmpty()) {
                log.warn("Session {} approved with {} unanswered required question(s)", sessionId, missing.size());
            }
            session.logAction(ApplicationAction.succeeded(ActionTypes.REVIEW_DECISION, "Approved by reviewer"));
            session.transitionTo(ApplicationSessionStatus.APPROVED);
        }
        JobPlatformAdapter adapter = adapters.get(session.getPlatform());
        CancellationSignal cancel = registry.beginFlow(sessionId);
        log.info("Session {} approved, submitting", sessionId);
        dispatch(session, () -> runSubmission(adapter, session, cancel));
        return session;
    }

    /**
     * Submits an APPROVED session on the calling thread.
     */
    public boolean submit(ApplicationSession session) {
        if (session.getStatus() != ApplicationSessionStatus.APPROVED) {
            throw new IllegalSessionStateException(
                "Only approved sessions can be submitted, session " + session.getId() + " is " + session.getStatus()
            );
        }
        registry.register(session);
        JobPlatformAdapter adapter = adapters.get(session.getPlatform());
        CancellationSignal cancel = registry.beginFlow(session.getId());
        runSubmission(adapter, session, cancel);
        return session.getStatus() == ApplicationSessionStatus.SUBMITTED;
    }

    /**
     * The reviewer declines the application. Only valid while the session awaits review.
     */
    public ApplicationSession cancel(UUID sessionId) {
        ApplicationSession session = require(sessionId);
        if (registry.isInFlight(sessionId)) {
            throw new IllegalSessionStateException("Session " + sessionId + " has a running flow, abort it instead");
        }
        synchronized (session) {
            if (session.getStatus() != ApplicationSessionStatus.READY_FOR_REVIEW) {
                throw new IllegalSessionStateException(
                    "Only sessions in READY_FOR_REVIEW can be cancelled, session " + sessionId + " is " + session.getStatus()
                );
            }
            adapters.get(session.getPlatform()).cancelApplication(session);
            session.logAction(ApplicationAction.succeeded(ActionTypes.REVIEW_DECISION, "Cancelled by reviewer"));
            session.transitionTo(ApplicationSessionStatus.CANCELLED);
        }
        log.info("Session {} cancelled by reviewer", sessionId);
        recordIfTerminal(session);
        return session;
    }

    /**
     * Asks the running flow of a session to stop at its next checkpoint.
     */
    public ApplicationSession abort(UUID sessionId) {
        ApplicationSession session = require(sessionId);
        CancellationSignal signal = registry.signalFor(sessionId);
        if (signal == null) {
            throw new IllegalSessionStateException("No automation flow is running for session " + sessionId);
        }
        signal.cancel();
        log.info("Abort requested for session {}", sessionId);
        return session;
    }

    public ApplicationSession find(UUID sessionId) {
        return require(sessionId);
    }

    public List<ApplicationSession> list() {
        return registry.list();
    }

    public boolean isInFlight(UUID sessionId) {
        return registry.isInFlight(sessionId);
    }

    public String latestProgress(UUID sessionId) {
        return registry.latestProgress(sessionId);
    }

    private void runPreparation(JobPlatformAdapter adapter, ApplicationSession session, CancellationSignal cancel) {
        try {
            ApplicationSession prepared = adapter.prepareApplication(session, progressFor(session), cancel);
            if (prepared == null) {
                session.failIfActive(adapter.platform().displayName() + " is not logged in");
            } else if (session.getStatus() == ApplicationSessionStatus.PENDING) {
                session.fail("Preparation ended without detecting the application form");
            }
            if (session.getStatus() == ApplicationSessionStatus.READY_FOR_REVIEW) {
                answerResolver.resolve(session);
                int missing = session.unansweredRequiredQuestions().size();
                if (missing > 0) {
                    log.info("Session {} awaits review with {} required question(s) unanswered", session.getId(), missing);
                }
            }
        } catch (RuntimeException e) {
            log.error("Preparation of session {} failed", session.getId(), e);
            session.failIfActive("Preparation failed: " + e.getMessage());
        } finally {
            registry.endFlow(session.getId());
            recordIfTerminal(session);
        }
        log.info("Session {} preparation finished with status {}", session.getId(), session.getStatus());
    }

    private void runSubmission(JobPlatformAdapter adapter, ApplicationSession session, CancellationSignal cancel) {
        try {
            adapter.submitApplication(session, progressFor(session), cancel);
            if (!session.getStatus().isTerminal()) {
                session.failFlow("Submission ended without a confirmed result");
            }
        } catch (RuntimeException e) {
            log.error("Submission of session {} failed", session.getId(), e);
            session.failFlow("Submission failed: " + e.getMessage());
        } finally {
            registry.endFlow(session.getId());
            recordIfTerminal(session);
        }
        log.info("Session {} submission finished with status {}", session.getId(), session.getStatus());
    }

    private void recordIfTerminal(ApplicationSession session) {
        if (session.getStatus().isTerminal() && session.markAuditRecorded()) {
            auditLogger.record(session);
        }
    }

    private ProgressListener progressFor(ApplicationSession session) {
        UUID sessionId = session.getId();
        return message -> {
            try {
                progressExecutor.execute(() -> {
                    registry.recordProgress(sessionId, message);
                    log.debug("Session {}: {}", sessionId, message);
                });
            } catch (RejectedExecutionException e) {
                log.debug("Dropped progress report for session {}: {}", sessionId, e.getMessage());
            }
        };
    }

    private void dispatch(ApplicationSession session, Runnable flow) {
        try {
            applicationExecutor.execute(flow);
        } catch (RejectedExecutionException e) {
            registry.endFlow(session.getId());
            session.failFlow("Could not schedule automation: " + e.getMessage());
            recordIfTerminal(session);
            throw e;
        }
    }

    private ApplicationSession require(UUID sessionId) {
        return registry.find(sessionId).orElseThrow(() -> new UnknownSessionException(sessionId));
    }
}
