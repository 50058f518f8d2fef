package com.testconductor.session;

import org.openqa.selenium.NoSuchSessionException;
import org.openqa.selenium.WebDriverException;
import org.testng.annotations.Test;

import java.util.concurrent.ExecutionException;

import static org.assertj.core.api.Assertions.assertThat;

public class FatalSessionErrorsTest {

    @Test
    public void keywordMessages_areFatal() {
        assertThat(FatalSessionErrors.isFatal(new RuntimeException("Browser crashed unexpectedly"))).isTrue();
        assertThat(FatalSessionErrors.isFatal(new RuntimeException("connect: Connection refused"))).isTrue();
        assertThat(FatalSessionErrors.isFatal(new RuntimeException("Target closed"))).isTrue();
        assertThat(FatalSessionErrors.isFatal(new RuntimeException("browser has been closed"))).isTrue();
    }

    @Test
    public void lostWebDriverSession_isFatal() {
        assertThat(FatalSessionErrors.isFatal(new NoSuchSessionException("invalid session id"))).isTrue();
    }

    @Test
    public void fatalCause_isFoundThroughWrappers() {
        Throwable wrapped = new ExecutionException(new WebDriverException("boom", new RuntimeException("target closed")));

        assertThat(FatalSessionErrors.isFatal(wrapped)).isTrue();
    }

    @Test
    public void ordinaryStepFailures_areNotFatal() {
        assertThat(FatalSessionErrors.isFatal(new IllegalStateException("Element #submit not found"))).isFalse();
        assertThat(FatalSessionErrors.isFatal(new RuntimeException((String) null))).isFalse();
        assertThat(FatalSessionErrors.isFatal(null)).isFalse();
    }
}
