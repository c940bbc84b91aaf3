package com.delta.autoapply.apply.browser;

import org.openqa.selenium.By;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.support.ui.ExpectedConditions;
import org.openqa.selenium.support.ui.Select;
import org.openqa.selenium.support.ui.WebDriverWait;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

public class SeleniumBrowserSurface implements BrowserSurface {
    private static final Logger log = LoggerFactory.getLogger(SeleniumBrowserSurface.class);

    private static final String SNAPSHOT_SCRIPT = String.join("\n",
        "var controls = document.querySelectorAll('input, textarea, select');",
        "for (var i = 0; i < controls.length; i++) {",
        "  var el = controls[i];",
        "  if (el.type === 'checkbox' || el.type === 'radio') {",
        "    el.setAttribute('data-live-checked', el.checked ? 'true' : 'false');",
        "  } else if (el.tagName === 'SELECT') {",
        "    for (var j = 0; j < el.options.length; j++) {",
        "      el.options[j].setAttribute('data-live-selected', el.options[j].selected ? 'true' : 'false');",
        "    }",
        "  } else if (el.type !== 'file') {",
        "    el.setAttribute('data-live-value', el.value || '');",
        "  }",
        "}",
        "return document.documentElement.outerHTML;"
    );

    private final WebDriver driver;

    public SeleniumBrowserSurface(WebDriver driver) {
        this.driver = driver;
    }

    @Override
    public void navigate(String url) {
        try {
            driver.get(url);
        } catch (WebDriverException e) {
            throw new AutomationException("Navigation to " + url + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public String currentUrl() {
        return driver.getCurrentUrl();
    }

    @Override
    public String pageSource() {
        try {
            Object html = ((JavascriptExecutor) driver).executeScript(SNAPSHOT_SCRIPT);
            if (html instanceof String value) {
                return value;
            }
        } catch (WebDriverException e) {
            log.debug("Live snapshot script failed, using raw page source: {}", e.getMessage());
        }
        return driver.getPageSource();
    }

    @Override
    public boolean isPresent(String cssSelector) {
        try {
            return !driver.findElements(By.cssSelector(cssSelector)).isEmpty();
        } catch (WebDriverException e) {
            throw new AutomationException("Lookup of " + cssSelector + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean waitForPresent(String cssSelector, Duration timeout) {
        try {
            new WebDriverWait(driver, timeout)
                .until(ExpectedConditions.presenceOfElementLocated(By.cssSelector(cssSelector)));
            return true;
        } catch (TimeoutException e) {
            return false;
        }
    }

    @Override
    public String text(String cssSelector) {
        List<WebElement> elements = driver.findElements(By.cssSelector(cssSelector));
        if (elements.isEmpty()) {
            return null;
        }
        return elements.get(0).getText();
    }

    @Override
    public void click(String cssSelector) {
        WebElement element = find(cssSelector);
        try {
            element.click();
        } catch (WebDriverException e) {
            // Overlays sometimes intercept native clicks; a script click still reaches the handler.
            log.debug("Native click on {} failed, retrying via script: {}", cssSelector, e.getMessage());
            ((JavascriptExecutor) driver).executeScript("arguments[0].click();", element);
        }
    }

    @Override
    public void clear(String cssSelector) {
        find(cssSelector).clear();
    }

    @Override
    public void typeCharacter(String cssSelector, String character) {
        find(cssSelector).sendKeys(character);
    }

    @Override
    public void selectOption(String cssSelector, String visibleText) {
        try {
            new Select(find(cssSelector)).selectByVisibleText(visibleText);
        } catch (WebDriverException e) {
            throw new AutomationException("Option '" + visibleText + "' not selectable in " + cssSelector, e);
        }
    }

    @Override
    public boolean isChecked(String cssSelector) {
        return find(cssSelector).isSelected();
    }

    @Override
    public void close() {
        try {
            driver.quit();
        } catch (WebDriverException e) {
            log.warn("Browser did not shut down cleanly: {}", e.getMessage());
        }
    }

    private WebElement find(String cssSelector) {
        List<WebElement> elements = driver.findElements(By.cssSelector(cssSelector));
        if (elements.isEmpty()) {
            throw new AutomationException("Element not found: " + cssSelector);
        }
        return elements.get(0);
    }
}
