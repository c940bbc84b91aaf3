package com.delta.autoapply.apply.form;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Maps free-text answers onto the options a form actually offers.
 */
public final class ChoiceMatcher {
    private static final Set<String> AFFIRMATIVE = Set.of("yes", "y", "true", "1", "agree", "i agree", "accept", "ok");
    private static final Set<String> NEGATIVE = Set.of("no", "n", "false", "0", "disagree", "decline");

    private ChoiceMatcher() {
    }

    public static boolean isAffirmative(String value) {
        String normalized = normalize(value);
        return AFFIRMATIVE.contains(normalized) || normalized.startsWith("yes ") || normalized.startsWith("yes,");
    }

    public static boolean isNegative(String value) {
        String normalized = normalize(value);
        return NEGATIVE.contains(normalized) || normalized.startsWith("no ") || normalized.startsWith("no,");
    }

    /**
     * True for a two-option group made of one affirmative and one negative option.
     */
    public static boolean isBooleanPair(List<String> options) {
        if (options == null || options.size() != 2) {
            return false;
        }
        String first = options.get(0);
        String second = options.get(1);
        return (isAffirmative(first) && isNegative(second)) || (isNegative(first) && isAffirmative(second));
    }

    /**
     * Exact case-insensitive match first, then substring containment in either direction.
     */
    public static String matchOption(List<String> options, String answer) {
        if (options == null || options.isEmpty()) {
            return null;
        }
        String wanted = normalize(answer);
        if (wanted.isEmpty()) {
            return null;
        }
        for (String option : options) {
            if (normalize(option).equals(wanted)) {
                return option;
            }
        }
        for (String option : options) {
            String candidate = normalize(option);
            if (candidate.isEmpty()) {
                continue;
            }
            if (candidate.contains(wanted) || wanted.contains(candidate)) {
                return option;
            }
        }
        return null;
    }

    public static String matchBooleanOption(List<String> options, String answer) {
        if (options == null) {
            return null;
        }
        if (isAffirmative(answer)) {
            for (String option : options) {
                if (isAffirmative(option)) {
                    return option;
                }
            }
        }
        if (isNegative(answer)) {
            for (String option : options) {
                if (isNegative(option)) {
                    return option;
                }
            }
        }
        return matchOption(options, answer);
    }

    /**
     * Options to tick for a checkbox group. An affirmative answer ticks a lone checkbox; otherwise
     * the answer is read as a comma or semicolon separated list of option labels.
     */
    public static List<String> matchCheckboxOptions(List<String> options, String answer) {
        List<String> matched = new ArrayList<>();
        if (options == null || options.isEmpty() || answer == null || answer.isBlank()) {
            return matched;
        }
        if (isAffirmative(answer)) {
            if (options.size() == 1) {
                matched.add(options.get(0));
                return matched;
            }
        }
        if (isNegative(answer)) {
            return matched;
        }
        for (String part : answer.split("[,;]")) {
            String option = matchOption(options, part);
            if (option != null && !matched.contains(option)) {
                matched.add(option);
            }
        }
        return matched;
    }

    private static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    }
}
