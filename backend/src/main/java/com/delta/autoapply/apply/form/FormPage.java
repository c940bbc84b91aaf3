package com.delta.autoapply.apply.form;

import org.jsoup.nodes.Element;

/**
 * The application surface as seen by {@link FormInspector}: a snapshot of the current page and a
 * way to move past it.
 */
public interface FormPage {
    /**
     * Root element of the application surface, or null once the surface is gone.
     */
    Element snapshot();

    void advance(NavigationButton button);
}
