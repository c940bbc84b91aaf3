package com.delta.autoapply.apply.form;

import java.util.List;
import java.util.Locale;

/**
 * Selectors and vocabulary describing one platform's application form.
 *
 * @param fieldGroupSelector wraps one question each; when nothing matches every control is its own group
 * @param labelSelector question label inside a group
 * @param attachedFileSelector marker showing a file is already attached
 * @param buttonSelector candidate navigation controls
 * @param placeholderOptions select options that mean "nothing chosen"
 */
public record FormLayout(
    String fieldGroupSelector,
    String labelSelector,
    String attachedFileSelector,
    String buttonSelector,
    List<String> submitKeywords,
    List<String> reviewKeywords,
    List<String> nextKeywords,
    List<String> backKeywords,
    List<String> placeholderOptions
) {
    public FormLayout {
        submitKeywords = lower(submitKeywords);
        reviewKeywords = lower(reviewKeywords);
        nextKeywords = lower(nextKeywords);
        backKeywords = lower(backKeywords);
        placeholderOptions = lower(placeholderOptions);
    }

    private static List<String> lower(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream().map(value -> value.trim().toLowerCase(Locale.ROOT)).toList();
    }
}
