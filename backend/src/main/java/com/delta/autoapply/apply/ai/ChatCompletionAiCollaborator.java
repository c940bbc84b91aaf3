package com.delta.autoapply.apply.ai;

import com.delta.autoapply.apply.model.Question;
import com.delta.autoapply.config.AutoApplyProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Talks to an OpenAI-compatible {@code /chat/completions} endpoint.
 */
@Service
public class ChatCompletionAiCollaborator implements AiCollaborator {
    private static final Logger log = LoggerFactory.getLogger(ChatCompletionAiCollaborator.class);
    private static final int MAX_ERROR_BODY_CHARS = 300;

    private final AutoApplyProperties.Ai settings;
    private final ObjectMapper objectMapper;
    private final AiResponseParser parser;
    private final HttpClient client;

    public ChatCompletionAiCollaborator(AutoApplyProperties properties, ObjectMapper objectMapper) {
        this.settings = properties.getAi();
        this.objectMapper = objectMapper;
        this.parser = new AiResponseParser(objectMapper);
        this.client = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(settings.getTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .build();
    }

    @Override
    public ApplicationMessageResult generateApplicationMessage(
        String jobDescription,
        String jobTitle,
        String company,
        String userProfile
    ) throws AiCollaboratorException {
        String prompt = PromptTemplates.applicationMessage(jobDescription, jobTitle, company, userProfile);
        return parser.parseApplicationMessage(complete(prompt));
    }

    @Override
    public Map<String, String> generateQuestionAnswers(
        List<Question> questions,
        String userProfile,
        String jobDescription
    ) throws AiCollaboratorException {
        if (questions == null || questions.isEmpty()) {
            return Map.of();
        }
        String prompt = PromptTemplates.questionAnswers(questions, userProfile, jobDescription);
        return parser.parseAnswers(complete(prompt));
    }

    @Override
    public JobSummaryResult summarizeJob(String jobDescription, String userProfile) throws AiCollaboratorException {
        return parser.parseJobSummary(complete(PromptTemplates.jobSummary(jobDescription, userProfile)));
    }

    @Override
    public void validateApiKey() throws AiCollaboratorException {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", settings.getModel());
        body.put("max_tokens", 5);
        body.putArray("messages").addObject().put("role", "user").put("content", "Hi");
        HttpResponse<String> response = send(body);
        int status = response.statusCode();
        if (status >= 200 && status < 300) {
            log.info("AI API key accepted by {}", settings.getBaseUrl());
            return;
        }
        log.warn("AI API key check returned HTTP {}", status);
        switch (status) {
            case 401:
                throw new AiCollaboratorException("Invalid API key");
            case 403:
                throw new AiCollaboratorException("API key does not have permission");
            case 429:
                throw new AiCollaboratorException("API rate limit exceeded, try again later");
            case 404:
                throw new AiCollaboratorException("API endpoint not found at " + settings.getBaseUrl());
            case 400:
                throw new AiCollaboratorException("Invalid request, model '" + settings.getModel() + "' may not be available");
            default:
                throw new AiCollaboratorException("AI endpoint returned HTTP " + status + ": " + truncated(response.body()));
        }
    }

    String complete(String userPrompt) throws AiCollaboratorException {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", settings.getModel());
        body.put("temperature", settings.getTemperature());
        ArrayNode messages = body.putArray("messages");
        messages.addObject().put("role", "system").put("content", PromptTemplates.SYSTEM_PROMPT);
        messages.addObject().put("role", "user").put("content", userPrompt);

        HttpResponse<String> response = send(body);
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            log.warn("AI endpoint returned HTTP {}", response.statusCode());
            throw new AiCollaboratorException(
                "AI endpoint returned HTTP " + response.statusCode() + ": " + truncated(response.body())
            );
        }
        return messageContent(response.body());
    }

    private HttpResponse<String> send(ObjectNode body) throws AiCollaboratorException {
        if (!settings.isConfigured()) {
            throw new AiCollaboratorException("AI API key is not configured");
        }
        String json;
        try {
            json = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new AiCollaboratorException("Could not encode AI request", e);
        }
        HttpRequest request = HttpRequest.newBuilder(URI.create(settings.getBaseUrl() + "/chat/completions"))
            .timeout(Duration.ofSeconds(settings.getTimeoutSeconds()))
            .header("Authorization", "Bearer " + settings.getApiKey())
            .header("Content-Type", "application/json")
            .header("Accept", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8))
            .build();
        try {
            return client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            throw new AiCollaboratorException("AI request timed out", e);
        } catch (IOException e) {
            throw new AiCollaboratorException("AI request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AiCollaboratorException("AI request interrupted", e);
        }
    }

    private static String truncated(String body) {
        String text = body == null ? "" : body;
        return text.length() > MAX_ERROR_BODY_CHARS ? text.substring(0, MAX_ERROR_BODY_CHARS) : text;
    }

    private String messageContent(String responseBody) throws AiCollaboratorException {
        try {
            JsonNode root = objectMapper.readTree(responseBody == null ? "" : responseBody);
            JsonNode content = root == null ? null : root.path("choices").path(0).path("message").path("content");
            if (content == null || !content.isTextual() || content.asText().isBlank()) {
                throw new AiCollaboratorException("AI response has no message content");
            }
            return content.asText();
        } catch (JsonProcessingException e) {
            throw new AiCollaboratorException("AI response is not valid JSON", e);
        }
    }
}
