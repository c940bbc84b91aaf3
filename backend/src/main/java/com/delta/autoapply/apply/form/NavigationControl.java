package com.delta.autoapply.apply.form;

/**
 * Navigation affordance found on a form page, in descending priority.
 */
public enum NavigationControl {
    SUBMIT,
    REVIEW,
    NEXT,
    NONE
}
