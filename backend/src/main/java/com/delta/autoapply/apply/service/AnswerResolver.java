package com.delta.autoapply.apply.service;

import com.delta.autoapply.apply.ai.AiCollaborator;
import com.delta.autoapply.apply.ai.AiCollaboratorException;
import com.delta.autoapply.apply.ai.ApplicationMessageResult;
import com.delta.autoapply.apply.model.ActionTypes;
import com.delta.autoapply.apply.model.ApplicationAction;
import com.delta.autoapply.apply.model.ApplicationSession;
import com.delta.autoapply.apply.model.Question;
import com.delta.autoapply.config.AutoApplyProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Drafts the application message and answers for a session in review. Both AI calls are best
 * effort: a failure degrades the draft and is recorded in the action log, it never fails the session.
 */
@Service
public class AnswerResolver {
    private static final Logger log = LoggerFactory.getLogger(AnswerResolver.class);

    private final AiCollaborator aiCollaborator;
    private final AutoApplyProperties properties;

    public AnswerResolver(AiCollaborator aiCollaborator, AutoApplyProperties properties) {
        this.aiCollaborator = aiCollaborator;
        this.properties = properties;
    }

    public void resolve(ApplicationSession session) {
        String profile = properties.getProfile().resolve();
        draftMessage(session, profile);
        draftAnswers(session, profile);
    }

    private void draftMessage(ApplicationSession session, String profile) {
        long started = System.currentTimeMillis();
        try {
            ApplicationMessageResult result = aiCollaborator.generateApplicationMessage(
                session.getJobDescription(),
                session.getJobTitle(),
                session.getCompany(),
                profile
            );
            session.updateApplicationMessage(result.message());
            session.recordAiMetadata(result.matchingSkills(), result.addressedRequirements(), result.confidenceScore());
            session.logAction(ApplicationAction.succeeded(
                ActionTypes.AI_MESSAGE,
                "Drafted application message (confidence " + result.confidenceScore() + ")",
                System.currentTimeMillis() - started
            ));
        } catch (AiCollaboratorException e) {
            log.warn("Application message generation failed for session {}: {}", session.getId(), e.getMessage());
            session.updateApplicationMessage("");
            session.recordAiMetadata(List.of(), List.of(), 0);
            session.logAction(ApplicationAction.failed(ActionTypes.AI_MESSAGE, "Application message not drafted", e.getMessage()));
        }
    }

    private void draftAnswers(ApplicationSession session, String profile) {
        List<Question> targets = session.getQuestions().stream()
            .filter(question -> !question.isPreFilled() && !question.hasAnswer())
            .toList();
        if (targets.isEmpty()) {
            return;
        }
        long started = System.currentTimeMillis();
        try {
            Map<String, String> answers = aiCollaborator.generateQuestionAnswers(targets, profile, session.getJobDescription());
            int applied = session.applyAnswersByText(answers);
            session.logAction(ApplicationAction.succeeded(
                ActionTypes.AI_ANSWERS,
                "Drafted " + applied + " of " + targets.size() + " answer(s)",
                System.currentTimeMillis() - started
            ));
        } catch (AiCollaboratorException e) {
            log.warn("Question answering failed for session {}: {}", session.getId(), e.getMessage());
            session.logAction(ApplicationAction.failed(ActionTypes.AI_ANSWERS, "Answers not drafted", e.getMessage()));
        }
    }
}
