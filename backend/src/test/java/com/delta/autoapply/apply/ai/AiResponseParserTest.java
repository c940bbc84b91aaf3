package com.delta.autoapply.apply.ai;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AiResponseParserTest {
    private final AiResponseParser parser = new AiResponseParser(new ObjectMapper());

    @Test
    void readsMessageInsideCodeFence() throws Exception {
        String content = """
            Here you go:
            ```json
            {"message": "I have built payment APIs.", "addressedRequirements": ["APIs"],
             "matchingSkills": ["Java", " "], "confidenceScore": "87.6%"}
            ```
            """;

        ApplicationMessageResult result = parser.parseApplicationMessage(content);

        assertThat(result.message()).isEqualTo("I have built payment APIs.");
        assertThat(result.addressedRequirements()).containsExactly("APIs");
        assertThat(result.matchingSkills()).containsExactly("Java");
        assertThat(result.confidenceScore()).isEqualTo(88);
    }

    @Test
    void clampsConfidenceAndDefaultsMissingLists() throws Exception {
        ApplicationMessageResult result = parser.parseApplicationMessage("{\"message\":\"Hi\",\"confidenceScore\":250}");

        assertThat(result.confidenceScore()).isEqualTo(100);
        assertThat(result.matchingSkills()).isEmpty();
    }

    @Test
    void rejectsMessageThatIsMissingOrNotJson() {
        assertThatThrownBy(() -> parser.parseApplicationMessage("{\"message\": \"  \"}"))
            .isInstanceOf(AiCollaboratorException.class);
        assertThatThrownBy(() -> parser.parseApplicationMessage("Sorry, I cannot help with that."))
            .isInstanceOf(AiCollaboratorException.class)
            .hasMessageContaining("no JSON object");
        assertThatThrownBy(() -> parser.parseApplicationMessage("{\"message\": }"))
            .isInstanceOf(AiCollaboratorException.class);
    }

    @Test
    void readsAnswersFromWrapperOrRootObject() throws Exception {
        Map<String, String> wrapped = parser.parseAnswers("""
            {"answers": {"Years of Java?": 6, "Languages": ["Java", "Go"], "Skip me": null, "Blank": ""}}
            """);
        Map<String, String> bare = parser.parseAnswers("{\"Willing to relocate?\": \"Yes\"}");

        assertThat(wrapped).containsExactly(
            Map.entry("Years of Java?", "6"),
            Map.entry("Languages", "Java, Go")
        );
        assertThat(bare).containsEntry("Willing to relocate?", "Yes");
    }

    @Test
    void extractsOutermostObject() {
        assertThat(AiResponseParser.extractJson("prefix {\"a\": {\"b\": 1}} suffix")).isEqualTo("{\"a\": {\"b\": 1}}");
        assertThat(AiResponseParser.extractJson("no braces")).isNull();
        assertThat(AiResponseParser.extractJson(null)).isNull();
    }

    @Test
    void readsJobSummaryAndClampsRating() {
        JobSummaryResult result = parser.parseJobSummary("""
            {"shortSummary": "Spring Boot API", "summary": "- REST\\n- Postgres", "rating": 14,
             "shouldDiscard": true, "discardReason": "Needs on-site work"}
            """);

        assertThat(result.shortSummary()).isEqualTo("Spring Boot API");
        assertThat(result.summary()).isEqualTo("- REST\n- Postgres");
        assertThat(result.rating()).isEqualTo(10);
        assertThat(result.shouldDiscard()).isTrue();
        assertThat(result.discardReason()).isEqualTo("Needs on-site work");
        assertThat(result.parseFailed()).isFalse();
    }

    @Test
    void acceptsAlternateSummaryKeysAndTextualRating() {
        JobSummaryResult result = parser.parseJobSummary(
            "{\"short_summary\": \"Data pipeline\", \"Summary\": \"Kafka work\", \"rating\": \"7/10\", \"discardReason\": \"ignored\"}"
        );

        assertThat(result.shortSummary()).isEqualTo("Data pipeline");
        assertThat(result.summary()).isEqualTo("Kafka work");
        assertThat(result.rating()).isEqualTo(7);
        assertThat(result.shouldDiscard()).isFalse();
        assertThat(result.discardReason()).isNull();
    }

    @Test
    void unreadableSummaryIsKeptForReviewAndNeverDiscarded() {
        String prose = "This looks like a decent fit. Rating: 3. " + "x".repeat(600);

        JobSummaryResult result = parser.parseJobSummary(prose);

        assertThat(result.parseFailed()).isTrue();
        assertThat(result.rating()).isEqualTo(3);
        assertThat(result.shouldDiscard()).isFalse();
        assertThat(result.summary()).hasSize(503).endsWith("...");
        assertThat(parser.parseJobSummary(null).rating()).isEqualTo(JobSummaryResult.NEUTRAL_RATING);
    }
}
