package com.delta.autoapply.apply.ai;

import com.delta.autoapply.apply.model.Question;

import java.util.List;

final class PromptTemplates {
    static final String SYSTEM_PROMPT =
        "You are a professional job application assistant. Always respond with valid JSON only.";

    private static final String APPLICATION_MESSAGE = """
        Generate a personalized, concise application message.

        CANDIDATE PROFILE:
        {profile}

        JOB DETAILS:
        - Title: {jobTitle}
        - Company: {company}
        - Description: {jobDescription}

        INSTRUCTIONS:
        1. Write a professional, concise message (150-200 words maximum)
        2. Address 2-3 specific requirements mentioned in the job description
        3. Highlight relevant experience from the candidate's profile that matches
        4. Be genuine and enthusiastic, avoid generic cliches
        5. Do NOT include greetings like 'Dear Hiring Manager', start directly with content
        6. Do NOT include sign-offs, end with the last substantive sentence

        Respond with JSON only:
        {
          "message": "The application message text...",
          "addressedRequirements": ["requirement 1 from job", "requirement 2 from job"],
          "matchingSkills": ["skill1", "skill2"],
          "confidenceScore": 85
        }
        """;

    private static final String QUESTION_ANSWERS = """
        You are helping a job candidate answer application questions based on their profile.

        CANDIDATE PROFILE:
        {profile}

        JOB CONTEXT:
        {jobDescription}

        QUESTIONS TO ANSWER:
        {questions}

        INSTRUCTIONS:
        1. Answer each question concisely and professionally
        2. Use information from the candidate's profile when available
        3. For experience-related questions, extract years/details from the profile
        4. For yes/no questions, answer definitively based on profile
        5. For questions with options, answer with exactly one of the listed options
        6. If information is not in the profile, provide a reasonable professional answer

        Respond with JSON only, using each question text exactly as given as the key:
        {
          "answers": {
            "question text": "answer"
          }
        }
        """;

    private static final String JOB_SUMMARY = """
        Rate how well this job fits the candidate and summarize it.

        CANDIDATE PROFILE:
        {profile}

        JOB DESCRIPTION:
        {jobDescription}

        INSTRUCTIONS:
        1. Summarize the job in 3-5 short bullet points
        2. Give a short summary of a few words to show under the job title
        3. Rate the fit from 1 (poor) to 10 (excellent)
        4. Recommend discarding only when the job clearly does not match the profile, and say why

        Respond with JSON only:
        {
          "shortSummary": "few words",
          "summary": "- point one\\n- point two",
          "rating": 7,
          "shouldDiscard": false,
          "discardReason": null
        }
        """;

    private PromptTemplates() {
    }

    static String applicationMessage(String jobDescription, String jobTitle, String company, String profile) {
        return APPLICATION_MESSAGE
            .replace("{profile}", orNone(profile))
            .replace("{jobTitle}", orNone(jobTitle))
            .replace("{company}", orNone(company))
            .replace("{jobDescription}", orNone(jobDescription));
    }

    static String questionAnswers(List<Question> questions, String profile, String jobDescription) {
        StringBuilder rendered = new StringBuilder();
        for (Question question : questions) {
            rendered.append("- ").append(question.getText()).append(" [").append(question.getType()).append("]");
            if (!question.getOptions().isEmpty()) {
                rendered.append(" options: ").append(String.join(" | ", question.getOptions()));
            }
            if (question.getMaxLength() != null) {
                rendered.append(" (max ").append(question.getMaxLength()).append(" characters)");
            }
            rendered.append('\n');
        }
        return QUESTION_ANSWERS
            .replace("{profile}", orNone(profile))
            .replace("{jobDescription}", orNone(jobDescription))
            .replace("{questions}", rendered.toString().trim());
    }

    static String jobSummary(String jobDescription, String profile) {
        return JOB_SUMMARY
            .replace("{profile}", orNone(profile))
            .replace("{jobDescription}", orNone(jobDescription));
    }

    private static String orNone(String value) {
        return value == null || value.isBlank() ? "(not provided)" : value;
    }
}
