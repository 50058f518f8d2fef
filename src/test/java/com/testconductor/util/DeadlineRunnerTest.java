package com.testconductor.util;

import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class DeadlineRunnerTest {

    private DeadlineRunner runner;

    @BeforeMethod
    public void setUp() {
        runner = new DeadlineRunner("test");
    }

    @AfterMethod(alwaysRun = true)
    public void tearDown() {
        runner.close();
    }

    @Test
    public void returnsResultWithinDeadline() throws Exception {
        assertThat(runner.call(() -> "done", Duration.ofSeconds(1))).isEqualTo("done");
    }

    @Test
    public void failureIsWrappedWithOriginalCause() {
        assertThatThrownBy(() -> runner.call(() -> { throw new IllegalStateException("agent broke"); },
                Duration.ofSeconds(1)))
            .isInstanceOf(ExecutionException.class)
            .hasCauseInstanceOf(IllegalStateException.class)
            .hasRootCauseMessage("agent broke");
    }

    @Test
    public void expiredDeadline_interruptsTheWorker() throws Exception {
        AtomicBoolean interrupted = new AtomicBoolean();
        CountDownLatch finished = new CountDownLatch(1);

        assertThatThrownBy(() -> runner.call(() -> {
            try {
                Thread.sleep(10_000);
                return "late";
            } catch (InterruptedException e) {
                interrupted.set(true);
                throw e;
            } finally {
                finished.countDown();
            }
        }, Duration.ofMillis(100))).isInstanceOf(TimeoutException.class);

        assertThat(finished.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(interrupted.get()).isTrue();
    }

    @Test
    public void awaitAbandoned_waitsForAnOperationThatIgnoresInterruption() throws Exception {
        CountDownLatch release = new CountDownLatch(1);

        assertThatThrownBy(() -> runner.call(() -> {
            while (release.getCount() > 0) {
                Thread.onSpinWait();   // ignores interruption on purpose
            }
            return "finally";
        }, Duration.ofMillis(50))).isInstanceOf(TimeoutException.class);

        assertThat(runner.awaitAbandoned(Duration.ofMillis(100))).isFalse();

        release.countDown();
        assertThat(runner.awaitAbandoned(Duration.ofSeconds(2))).isTrue();
    }

    @Test
    public void awaitAbandoned_isTrueWhenNothingWasCancelled() throws Exception {
        runner.call(() -> "quick", Duration.ofSeconds(1));

        assertThat(runner.awaitAbandoned(Duration.ZERO)).isTrue();
    }

    @Test
    public void lateResult_goesToTheHandler() throws Exception {
        AtomicReference<String> late = new AtomicReference<>();
        CountDownLatch handled = new CountDownLatch(1);

        assertThatThrownBy(() -> runner.call(() -> {
            long until = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(300);
            while (System.nanoTime() < until) {
                Thread.onSpinWait();   // ignores interruption on purpose
            }
            return "browser";
        }, Duration.ofMillis(50), result -> {
            late.set(result);
            handled.countDown();
        })).isInstanceOf(TimeoutException.class);

        assertThat(handled.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(late.get()).isEqualTo("browser");
    }
}
