package com.delta.autoapply.apply.form;

import com.delta.autoapply.apply.model.FieldReference;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Locates a detected control by CSS selector. Radio and checkbox groups also carry one selector per
 * option label.
 */
public record CssFieldReference(String selector, Map<String, String> optionSelectors) implements FieldReference {
    public CssFieldReference {
        optionSelectors = optionSelectors == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(optionSelectors));
    }

    public static CssFieldReference of(String selector) {
        return new CssFieldReference(selector, Map.of());
    }

    public String optionSelector(String optionLabel) {
        return optionSelectors.get(optionLabel);
    }

    @Override
    public String describe() {
        if (optionSelectors.isEmpty()) {
            return "css:" + selector;
        }
        return "css:" + selector + " options=" + optionSelectors.keySet();
    }
}
