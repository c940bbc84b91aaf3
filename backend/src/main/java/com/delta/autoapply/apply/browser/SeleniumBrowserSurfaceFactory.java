package com.delta.autoapply.apply.browser;

import com.delta.autoapply.apply.model.Platform;
import com.delta.autoapply.config.AutoApplyProperties;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;

/**
 * Opens Chrome with a persistent per-platform profile so a manual login survives restarts.
 */
@Component
public class SeleniumBrowserSurfaceFactory implements BrowserSurfaceFactory {
    private static final Logger log = LoggerFactory.getLogger(SeleniumBrowserSurfaceFactory.class);

    private final AutoApplyProperties properties;

    public SeleniumBrowserSurfaceFactory(AutoApplyProperties properties) {
        this.properties = properties;
    }

    @Override
    public BrowserSurface open(Platform platform) {
        AutoApplyProperties.Browser browser = properties.getBrowser();
        ChromeOptions options = new ChromeOptions();
        if (browser.getUserDataDir() != null && !browser.getUserDataDir().isBlank()) {
            Path profileDir = Path.of(browser.getUserDataDir(), platform.name().toLowerCase(Locale.ROOT));
            options.addArguments("--user-data-dir=" + profileDir.toAbsolutePath());
        }
        if (browser.isHeadless()) {
            options.addArguments("--headless=new");
        }
        if (browser.isStartMinimized()) {
            options.addArguments("--start-minimized");
        }
        options.addArguments("--disable-blink-features=AutomationControlled");
        options.addArguments("--window-size=1280,900");

        log.info("Starting browser for {} (headless={})", platform.displayName(), browser.isHeadless());
        ChromeDriver driver = new ChromeDriver(options);
        driver.manage().timeouts().pageLoadTimeout(Duration.ofSeconds(browser.getPageLoadTimeoutSeconds()));
        return new SeleniumBrowserSurface(driver);
    }
}
