package com.delta.autoapply.apply.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads model replies that are supposed to be JSON but may arrive wrapped in code fences or prose.
 */
public class AiResponseParser {
    private static final Logger log = LoggerFactory.getLogger(AiResponseParser.class);
    private static final int MAX_FALLBACK_SUMMARY_CHARS = 500;
    private static final Pattern TEXT_RATING = Pattern.compile(
        "(?:rating\\s*[:=]\\s*(\\d{1,2}))|(?:\\b(\\d{1,2})\\s*/\\s*10\\b)", Pattern.CASE_INSENSITIVE);

    private final ObjectMapper objectMapper;

    public AiResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ApplicationMessageResult parseApplicationMessage(String content) throws AiCollaboratorException {
        JsonNode root = readObject(content);
        String message = root.path("message").asText("").trim();
        if (message.isEmpty()) {
            throw new AiCollaboratorException("AI response has no message");
        }
        return new ApplicationMessageResult(
            message,
            stringList(root.path("addressedRequirements")),
            stringList(root.path("matchingSkills")),
            confidence(root.path("confidenceScore"))
        );
    }

    public Map<String, String> parseAnswers(String content) throws AiCollaboratorException {
        JsonNode root = readObject(content);
        JsonNode answers = root.has("answers") ? root.get("answers") : root;
        if (!answers.isObject()) {
            throw new AiCollaboratorException("AI response has no answers object");
        }
        Map<String, String> result = new LinkedHashMap<>();
        answers.fields().forEachRemaining(entry -> {
            JsonNode value = entry.getValue();
            if (value == null || value.isNull()) {
                return;
            }
            String text = value.isArray() ? String.join(", ", stringList(value)) : value.asText("");
            if (!text.isBlank()) {
                result.put(entry.getKey(), text.trim());
            }
        });
        return result;
    }

    /**
     * Never fails. A reply that is not a JSON object becomes a parse-failed result with the raw
     * text as summary, a rating read from phrases like "Rating: 7" or "7/10" when present, and no
     * discard recommendation.
     */
    public JobSummaryResult parseJobSummary(String content) {
        JsonNode root;
        try {
            root = readObject(content);
        } catch (AiCollaboratorException e) {
            log.warn("Job summary reply unreadable: {}", e.getMessage());
            String text = content == null ? "" : content.trim();
            if (text.length() > MAX_FALLBACK_SUMMARY_CHARS) {
                text = text.substring(0, MAX_FALLBACK_SUMMARY_CHARS) + "...";
            }
            return new JobSummaryResult(text, "Parse failed, needs review", textRating(text), false, null, true);
        }
        boolean discard = firstOf(root, "shouldDiscard", "discard").asBoolean(false);
        return new JobSummaryResult(
            firstOf(root, "summary", "Summary").asText("").trim(),
            firstOf(root, "shortSummary", "short_summary").asText("").trim(),
            rating(firstOf(root, "rating", "Rating")),
            discard,
            discard ? firstOf(root, "discardReason", "discard_reason").asText(null) : null,
            false
        );
    }

    JsonNode readObject(String content) throws AiCollaboratorException {
        String json = extractJson(content);
        if (json == null) {
            throw new AiCollaboratorException("AI response contains no JSON object");
        }
        try {
            JsonNode node = objectMapper.readTree(json);
            if (node == null || !node.isObject()) {
                throw new AiCollaboratorException("AI response is not a JSON object");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new AiCollaboratorException("AI response is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    static String extractJson(String content) {
        if (content == null) {
            return null;
        }
        String text = content.trim();
        int fence = text.indexOf("```");
        if (fence >= 0) {
            int bodyStart = text.indexOf('\n', fence);
            int fenceEnd = bodyStart < 0 ? -1 : text.indexOf("```", bodyStart);
            if (fenceEnd > bodyStart) {
                text = text.substring(bodyStart + 1, fenceEnd).trim();
            }
        }
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return null;
        }
        return text.substring(start, end + 1);
    }

    private static List<String> stringList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node == null || !node.isArray()) {
            return values;
        }
        for (JsonNode item : node) {
            String text = item.asText("").trim();
            if (!text.isEmpty()) {
                values.add(text);
            }
        }
        return values;
    }

    private static JsonNode firstOf(JsonNode root, String... names) {
        for (String name : names) {
            JsonNode value = root.get(name);
            if (value != null && !value.isNull()) {
                return value;
            }
        }
        return root.path(names[0]);
    }

    private static int rating(JsonNode node) {
        if (node.isNumber()) {
            return (int) Math.round(node.asDouble());
        }
        return textRating(node.asText(""));
    }

    private static int textRating(String text) {
        Matcher matcher = TEXT_RATING.matcher(text);
        if (matcher.find()) {
            return Integer.parseInt(matcher.group(1) != null ? matcher.group(1) : matcher.group(2));
        }
        String digits = text.trim();
        return digits.matches("\\d{1,2}") ? Integer.parseInt(digits) : JobSummaryResult.NEUTRAL_RATING;
    }

    private static int confidence(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return 0;
        }
        double value;
        if (node.isNumber()) {
            value = node.asDouble();
        } else {
            try {
                value = Double.parseDouble(node.asText("").replace("%", "").trim());
            } catch (NumberFormatException e) {
                return 0;
            }
        }
        return (int) Math.round(Math.min(100, Math.max(0, value)));
    }
}
