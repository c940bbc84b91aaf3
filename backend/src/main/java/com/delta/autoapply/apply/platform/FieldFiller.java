package com.delta.autoapply.apply.platform;

import com.delta.autoapply.apply.browser.BrowserSurface;
import com.delta.autoapply.apply.flow.CancellationSignal;
import com.delta.autoapply.apply.form.ChoiceMatcher;
import com.delta.autoapply.apply.form.CssFieldReference;
import com.delta.autoapply.apply.model.Question;
import com.delta.autoapply.apply.pacing.PacingGovernor;

import java.util.List;

/**
 * Writes one answer into one live control, pacing each interaction.
 */
class FieldFiller {

    enum Outcome {
        FILLED,
        SKIPPED,
        NO_MATCH
    }

    record Result(Outcome outcome, String detail) {
        static Result filled(String detail) {
            return new Result(Outcome.FILLED, detail);
        }

        static Result skipped(String detail) {
            return new Result(Outcome.SKIPPED, detail);
        }

        static Result noMatch(String detail) {
            return new Result(Outcome.NO_MATCH, detail);
        }
    }

    private final BrowserSurface surface;
    private final PacingGovernor pacing;

    FieldFiller(BrowserSurface surface, PacingGovernor pacing) {
        this.surface = surface;
        this.pacing = pacing;
    }

    Result fill(Question field, String answer, CancellationSignal cancel) {
        if (!(field.getFieldReference() instanceof CssFieldReference reference)) {
            return Result.skipped("no locator for field");
        }
        switch (field.getType()) {
            case FILE_UPLOAD:
                return Result.skipped("file uploads are not automated");
            case UNKNOWN:
                return Result.noMatch("unclassified field");
            case SHORT_TEXT:
            case MULTI_LINE_TEXT:
            case NUMERIC:
            case PHONE:
            case EMAIL:
            case DATE:
                return typeText(reference, truncate(answer, field.getMaxLength()), cancel);
            case SINGLE_SELECT:
                return select(field, reference, answer, cancel);
            case CHOICE:
                return clickOption(reference, ChoiceMatcher.matchOption(field.getOptions(), answer), answer, cancel);
            case BOOLEAN:
                return clickOption(reference, ChoiceMatcher.matchBooleanOption(field.getOptions(), answer), answer, cancel);
            case CHECKBOX_GROUP:
                return tickCheckboxes(field, reference, answer, cancel);
            default:
                return Result.noMatch("unsupported field type " + field.getType());
        }
    }

    private Result typeText(CssFieldReference reference, String value, CancellationSignal cancel) {
        pacing.pause(cancel);
        surface.clear(reference.selector());
        pacing.type(value, character -> surface.typeCharacter(reference.selector(), character), cancel);
        return Result.filled(value.length() + " character(s)");
    }

    private Result select(Question field, CssFieldReference reference, String answer, CancellationSignal cancel) {
        String option = ChoiceMatcher.isBooleanPair(field.getOptions())
            ? ChoiceMatcher.matchBooleanOption(field.getOptions(), answer)
            : ChoiceMatcher.matchOption(field.getOptions(), answer);
        if (option == null) {
            return Result.noMatch("no option matches '" + answer + "'");
        }
        pacing.pause(cancel);
        surface.selectOption(reference.selector(), option);
        return Result.filled(option);
    }

    private Result clickOption(CssFieldReference reference, String option, String answer, CancellationSignal cancel) {
        if (option == null) {
            return Result.noMatch("no option matches '" + answer + "'");
        }
        String selector = reference.optionSelector(option);
        if (selector == null) {
            return Result.noMatch("option '" + option + "' has no locator");
        }
        pacing.pause(cancel);
        surface.click(selector);
        return Result.filled(option);
    }

    private Result tickCheckboxes(Question field, CssFieldReference reference, String answer, CancellationSignal cancel) {
        List<String> options = ChoiceMatcher.matchCheckboxOptions(field.getOptions(), answer);
        if (options.isEmpty()) {
            return ChoiceMatcher.isNegative(answer)
                ? Result.skipped("left unticked")
                : Result.noMatch("no option matches '" + answer + "'");
        }
        for (String option : options) {
            String selector = reference.optionSelector(option);
            if (selector == null || surface.isChecked(selector)) {
                continue;
            }
            pacing.pause(cancel);
            surface.click(selector);
        }
        return Result.filled(String.join(", ", options));
    }

    private static String truncate(String value, Integer maxLength) {
        if (value == null) {
            return "";
        }
        if (maxLength != null && value.length() > maxLength) {
            return value.substring(0, maxLength);
        }
        return value;
    }
}
