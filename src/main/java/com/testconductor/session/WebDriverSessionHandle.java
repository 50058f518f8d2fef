package com.testconductor.session;

import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.OutputType;
import org.openqa.selenium.TakesScreenshot;
import org.openqa.selenium.WebDriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * {@link SessionHandle} backed by a Selenium {@link WebDriver}.
 */
public class WebDriverSessionHandle implements SessionHandle {

    private static final Logger log = LoggerFactory.getLogger(WebDriverSessionHandle.class);

    private static final String VISIBLE_TEXT_LENGTH_SCRIPT =
        "return document.body ? document.body.innerText.trim().length : 0;";

    private final WebDriver driver;

    public WebDriverSessionHandle(WebDriver driver) {
        if (driver == null) throw new IllegalArgumentException("driver is required");
        this.driver = driver;
    }

    public WebDriver getDriver() { return driver; }

    @Override
    public String currentUrl() {
        return driver.getCurrentUrl();
    }

    @Override
    public String title() {
        String title = driver.getTitle();
        return title != null ? title : "";
    }

    @Override
    public int visibleTextLength() {
        if (!(driver instanceof JavascriptExecutor js)) return 0;
        Object length = js.executeScript(VISIBLE_TEXT_LENGTH_SCRIPT);
        return length instanceof Number n ? n.intValue() : 0;
    }

    @Override
    public void saveScreenshot(Path target) throws IOException {
        if (!(driver instanceof TakesScreenshot camera)) {
            throw new IOException("Driver " + driver.getClass().getSimpleName() + " cannot take screenshots");
        }
        byte[] png = camera.getScreenshotAs(OutputType.BYTES);
        Path parent = target.getParent();
        if (parent != null) Files.createDirectories(parent);
        Files.write(target, png);
    }

    @Override
    public boolean isAlive() {
        try {
            driver.getWindowHandle();
            return true;
        } catch (Exception e) {
            log.debug("WebDriverSessionHandle: liveness probe failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public void close() {
        driver.quit();
    }
}
