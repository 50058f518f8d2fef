package com.testconductor.session;

import com.testconductor.core.TestConductorConfig;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Starts Chrome sessions for the run.
 *
 * ## Headless mode
 * Controlled by {@link TestConductorConfig#isHeadless()} (TESTCONDUCTOR_HEADLESS).
 * The driver binary is resolved by Selenium Manager.
 */
public class ChromeSessionFactory implements SessionFactory {

    private static final Logger log = LoggerFactory.getLogger(ChromeSessionFactory.class);

    private static final Duration PAGE_LOAD_TIMEOUT = Duration.ofSeconds(30);

    private final boolean headless;

    public ChromeSessionFactory(boolean headless) {
        this.headless = headless;
    }

    public ChromeSessionFactory(TestConductorConfig config) {
        this(config.isHeadless());
    }

    @Override
    public SessionHandle create() {
        ChromeOptions options = buildOptions();
        ChromeDriver driver = new ChromeDriver(options);
        driver.manage().timeouts().pageLoadTimeout(PAGE_LOAD_TIMEOUT);
        log.info("ChromeSessionFactory: Chrome started (headless={})", headless);
        return new WebDriverSessionHandle(driver);
    }

    ChromeOptions buildOptions() {
        ChromeOptions options = new ChromeOptions();
        if (headless) {
            options.addArguments("--headless=new");
        }
        options.addArguments(
            "--no-first-run",
            "--no-default-browser-check",
            "--no-sandbox",
            "--disable-dev-shm-usage",
            "--disable-gpu",
            "--disable-setuid-sandbox",
            "--disable-background-timer-throttling",
            "--disable-backgrounding-occluded-windows",
            "--disable-renderer-backgrounding",
            "--window-size=1440,900",
            "--disable-search-engine-choice-screen"
        );
        return options;
    }
}
