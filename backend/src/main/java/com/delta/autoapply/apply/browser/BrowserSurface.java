package com.delta.autoapply.apply.browser;

import java.time.Duration;

/**
 * The live page an adapter drives. Every locator is a CSS selector; failures surface as
 * {@link AutomationException}.
 */
public interface BrowserSurface {
    void navigate(String url);

    String currentUrl();

    /**
     * Serialized DOM of the current page, with the live state of form controls stamped on as
     * {@code data-live-*} attributes.
     */
    String pageSource();

    boolean isPresent(String cssSelector);

    boolean waitForPresent(String cssSelector, Duration timeout);

    /**
     * Visible text of the first match, or null when nothing matches.
     */
    String text(String cssSelector);

    void click(String cssSelector);

    void clear(String cssSelector);

    void typeCharacter(String cssSelector, String character);

    void selectOption(String cssSelector, String visibleText);

    boolean isChecked(String cssSelector);

    void close();
}
