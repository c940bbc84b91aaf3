package com.delta.autoapply.apply.ai;

import com.delta.autoapply.apply.model.Question;

import java.util.List;
import java.util.Map;

public interface AiCollaborator {
    ApplicationMessageResult generateApplicationMessage(
        String jobDescription,
        String jobTitle,
        String company,
        String userProfile
    ) throws AiCollaboratorException;

    /**
     * Answers keyed by the exact question text.
     */
    Map<String, String> generateQuestionAnswers(
        List<Question> questions,
        String userProfile,
        String jobDescription
    ) throws AiCollaboratorException;

    JobSummaryResult summarizeJob(String jobDescription, String userProfile) throws AiCollaboratorException;

    /**
     * Makes a minimal request with the configured key. Throws with a reader-facing reason when the
     * endpoint refuses it.
     */
    void validateApiKey() throws AiCollaboratorException;
}
