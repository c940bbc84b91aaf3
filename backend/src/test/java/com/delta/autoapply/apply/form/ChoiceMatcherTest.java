package com.delta.autoapply.apply.form;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ChoiceMatcherTest {

    @Test
    void recognisesYesNoPairsInEitherOrder() {
        assertThat(ChoiceMatcher.isBooleanPair(List.of("Yes", "No"))).isTrue();
        assertThat(ChoiceMatcher.isBooleanPair(List.of("No", "Yes"))).isTrue();
        assertThat(ChoiceMatcher.isBooleanPair(List.of("Yes", "Maybe"))).isFalse();
        assertThat(ChoiceMatcher.isBooleanPair(List.of("Yes", "No", "Prefer not to say"))).isFalse();
    }

    @Test
    void prefersExactMatchOverContainment() {
        List<String> options = List.of("Full-time remote", "Remote");
        assertThat(ChoiceMatcher.matchOption(options, "remote")).isEqualTo("Remote");
        assertThat(ChoiceMatcher.matchOption(options, "full-time")).isEqualTo("Full-time remote");
        assertThat(ChoiceMatcher.matchOption(options, "on site")).isNull();
        assertThat(ChoiceMatcher.matchOption(options, "  ")).isNull();
    }

    @Test
    void mapsFreeTextAnswersOntoBooleanOptions() {
        List<String> options = List.of("Yes", "No");
        assertThat(ChoiceMatcher.matchBooleanOption(options, "yes, I am authorized")).isEqualTo("Yes");
        assertThat(ChoiceMatcher.matchBooleanOption(options, "false")).isEqualTo("No");
        assertThat(ChoiceMatcher.matchBooleanOption(options, "sometimes")).isNull();
    }

    @Test
    void checkboxAnswersTickListedOptions() {
        List<String> options = List.of("Java", "Kotlin", "Go");
        assertThat(ChoiceMatcher.matchCheckboxOptions(options, "java; go")).containsExactly("Java", "Go");
        assertThat(ChoiceMatcher.matchCheckboxOptions(options, "no")).isEmpty();
        assertThat(ChoiceMatcher.matchCheckboxOptions(List.of("I agree to the terms"), "yes"))
            .containsExactly("I agree to the terms");
    }
}
