package com.delta.autoapply.apply.form;

public record NavigationButton(NavigationControl control, String selector, String label) {
    private static final NavigationButton NONE = new NavigationButton(NavigationControl.NONE, null, null);

    public static NavigationButton none() {
        return NONE;
    }

    public boolean isTerminalPage() {
        return control == NavigationControl.SUBMIT || control == NavigationControl.NONE;
    }
}
