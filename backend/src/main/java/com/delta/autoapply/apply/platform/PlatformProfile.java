package com.delta.autoapply.apply.platform;

import com.delta.autoapply.apply.form.FormLayout;

import java.util.List;
import java.util.Locale;

/**
 * Everything platform-specific the shared form driver needs: how to open the application, where
 * the form lives and how the platform reports success or validation errors.
 *
 * @param entrySelectors apply buttons tried in order before falling back to {@code entryCaptions}
 * @param surfaceSelector root of the application form, waited for after the entry click
 * @param successPhrases text that confirms submission when no success marker element is present
 * @param messageFieldKeywords labels of the free-text field that receives the application message
 */
public record PlatformProfile(
    FormLayout formLayout,
    List<String> entrySelectors,
    List<String> entryCaptions,
    String surfaceSelector,
    String successSelector,
    List<String> successPhrases,
    String errorSelector,
    String dismissSelector,
    List<String> discardCaptions,
    List<String> messageFieldKeywords
) {
    public PlatformProfile {
        entrySelectors = entrySelectors == null ? List.of() : List.copyOf(entrySelectors);
        entryCaptions = lower(entryCaptions);
        successPhrases = lower(successPhrases);
        discardCaptions = lower(discardCaptions);
        messageFieldKeywords = lower(messageFieldKeywords);
    }

    public boolean isMessageField(String questionText) {
        if (questionText == null) {
            return false;
        }
        String normalized = questionText.toLowerCase(Locale.ROOT);
        for (String keyword : messageFieldKeywords) {
            if (normalized.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    private static List<String> lower(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream().map(value -> value.trim().toLowerCase(Locale.ROOT)).toList();
    }
}
