package com.delta.autoapply.apply.service;

import com.delta.autoapply.apply.ai.AiCollaborator;
import com.delta.autoapply.apply.ai.AiCollaboratorException;
import com.delta.autoapply.apply.ai.ApplicationMessageResult;
import com.delta.autoapply.apply.model.ActionTypes;
import com.delta.autoapply.apply.model.ApplicationAction;
import com.delta.autoapply.apply.model.ApplicationSession;
import com.delta.autoapply.apply.model.ApplicationSessionStatus;
import com.delta.autoapply.apply.model.Platform;
import com.delta.autoapply.apply.model.Question;
import com.delta.autoapply.apply.model.QuestionType;
import com.delta.autoapply.config.AutoApplyProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AnswerResolverTest {

    @Mock
    private AiCollaborator aiCollaborator;

    private AnswerResolver resolver;
    private ApplicationSession session;
    private Question years;
    private Question email;

    @BeforeEach
    void setUp() {
        AutoApplyProperties properties = new AutoApplyProperties();
        properties.getProfile().setText("Ten years of Java");
        resolver = new AnswerResolver(aiCollaborator, properties);
        session = new ApplicationSession(Platform.UPWORK, "01ab", "API work", "Client", "https://www.upwork.com/jobs/~01ab", "Build an API");
        years = new Question("Years of Java?", QuestionType.NUMERIC, List.of(), true, false, null, 0, null, null);
        email = new Question("Email", QuestionType.EMAIL, List.of(), true, true, "me@example.com", 0, null, null);
        session.recordQuestions(List.of(years, email), 1);
        session.transitionTo(ApplicationSessionStatus.READY_FOR_REVIEW);
    }

    @Test
    void draftsMessageAndAnswersOnlyOpenQuestions() throws Exception {
        when(aiCollaborator.generateApplicationMessage("Build an API", "API work", "Client", "Ten years of Java"))
            .thenReturn(new ApplicationMessageResult("I build APIs.", List.of("REST"), List.of("Java"), 81));
        when(aiCollaborator.generateQuestionAnswers(anyList(), eq("Ten years of Java"), eq("Build an API")))
            .thenReturn(Map.of("Years of Java?", "10", "Email", "other@example.com"));

        resolver.resolve(session);

        assertThat(session.getApplicationMessage()).isEqualTo("I build APIs.");
        assertThat(session.getConfidenceScore()).isEqualTo(81);
        assertThat(session.getMatchingSkills()).containsExactly("Java");
        assertThat(years.getAnswer()).isEqualTo("10");
        assertThat(email.getAnswer()).isEqualTo("me@example.com");

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<Question>> asked = ArgumentCaptor.forClass(List.class);
        verify(aiCollaborator).generateQuestionAnswers(asked.capture(), anyString(), anyString());
        assertThat(asked.getValue()).containsExactly(years);
    }

    @Test
    void messageFailureLeavesEmptyDraftAndLogsIt() throws Exception {
        when(aiCollaborator.generateApplicationMessage(anyString(), anyString(), anyString(), anyString()))
            .thenThrow(new AiCollaboratorException("AI endpoint returned HTTP 500"));
        when(aiCollaborator.generateQuestionAnswers(anyList(), anyString(), anyString()))
            .thenThrow(new AiCollaboratorException("timeout"));

        resolver.resolve(session);

        assertThat(session.getStatus()).isEqualTo(ApplicationSessionStatus.READY_FOR_REVIEW);
        assertThat(session.getApplicationMessage()).isEmpty();
        assertThat(session.getConfidenceScore()).isZero();
        assertThat(session.getActions())
            .filteredOn(action -> !action.success())
            .extracting(ApplicationAction::actionType)
            .containsExactly(ActionTypes.AI_MESSAGE, ActionTypes.AI_ANSWERS);
    }

    @Test
    void skipsAnswerCallWhenEverythingIsAnswered() throws Exception {
        session.answerQuestion(years.getId(), "7");
        when(aiCollaborator.generateApplicationMessage(anyString(), anyString(), anyString(), anyString()))
            .thenReturn(new ApplicationMessageResult("Hi", List.of(), List.of(), 50));

        resolver.resolve(session);

        verify(aiCollaborator, never()).generateQuestionAnswers(any(), any(), any());
        assertThat(years.getAnswer()).isEqualTo("7");
    }
}
