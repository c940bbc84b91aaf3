package com.delta.autoapply.apply.form;

import org.jsoup.nodes.Element;

/**
 * Attributes a live surface stamps onto its controls before serializing, so a snapshot reflects
 * values typed or selected after page load. Plain HTML falls back to the standard attributes.
 */
public final class LiveState {
    public static final String VALUE = "data-live-value";
    public static final String CHECKED = "data-live-checked";
    public static final String SELECTED = "data-live-selected";

    private LiveState() {
    }

    public static String value(Element control) {
        if (control.hasAttr(VALUE)) {
            return control.attr(VALUE);
        }
        if ("textarea".equals(control.normalName())) {
            return control.wholeText();
        }
        return control.attr("value");
    }

    public static boolean isChecked(Element control) {
        if (control.hasAttr(CHECKED)) {
            return "true".equalsIgnoreCase(control.attr(CHECKED));
        }
        return control.hasAttr("checked");
    }

    public static boolean isSelected(Element option) {
        if (option.hasAttr(SELECTED)) {
            return "true".equalsIgnoreCase(option.attr(SELECTED));
        }
        return option.hasAttr("selected");
    }
}
