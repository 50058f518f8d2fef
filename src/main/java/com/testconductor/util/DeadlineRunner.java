package com.testconductor.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Runs one blocking operation on a worker thread under a wall-clock deadline.
 *
 * The caller blocks until the operation finishes or the deadline passes. On
 * expiry the worker is interrupted and the caller gets a {@link TimeoutException};
 * a result that still arrives after that point is handed to the optional
 * late-result handler instead of being lost (used to close a browser whose
 * start-up finished too late).
 *
 * Workers come from a cached pool, so an operation that ignores interruption
 * never blocks the next call by itself. Callers that must not overlap with such
 * an operation wait for it with {@link #awaitAbandoned(Duration)}.
 */
public class DeadlineRunner implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DeadlineRunner.class);

    private final String name;
    private final ExecutorService workers;
    private final List<Abandoned> abandoned = new CopyOnWriteArrayList<>();

    public DeadlineRunner(String name) {
        this.name = name;
        this.workers = Executors.newCachedThreadPool(daemonThreads(name));
    }

    /**
     * Runs {@code task} and waits at most {@code deadline} for its result.
     *
     * @throws TimeoutException     the deadline passed; the task was cancelled
     * @throws ExecutionException   the task threw; the cause is the original failure
     * @throws InterruptedException the calling thread was interrupted while waiting
     */
    public <T> T call(Callable<T> task, Duration deadline)
            throws TimeoutException, ExecutionException, InterruptedException {
        return call(task, deadline, null);
    }

    /**
     * As {@link #call(Callable, Duration)}; a result produced after the deadline is
     * passed to {@code onLateResult}.
     */
    public <T> T call(Callable<T> task, Duration deadline, Consumer<? super T> onLateResult)
            throws TimeoutException, ExecutionException, InterruptedException {
        Handoff<T> handoff = new Handoff<>(onLateResult);
        Abandoned tracker = new Abandoned();
        Future<T> future = workers.submit(() -> {
            tracker.started = true;
            try {
                return handoff.deliver(task.call());
            } finally {
                tracker.finished.countDown();
            }
        });
        try {
            return future.get(deadline.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            if (handoff.abandon()) {
                future.cancel(true);
                track(tracker);
                log.debug("DeadlineRunner[{}]: operation cancelled after {}ms", name, deadline.toMillis());
                throw e;
            }
            // The result was delivered while the deadline expired; it is ours to return.
            return future.get();
        } catch (InterruptedException e) {
            handoff.abandon();
            future.cancel(true);
            track(tracker);
            Thread.currentThread().interrupt();
            throw e;
        }
    }

    /**
     * Waits up to {@code grace} for operations cancelled at their deadline to
     * actually return. Cancellation only interrupts the worker, so an operation
     * that ignores interruption keeps running after {@link #call} has thrown.
     *
     * @return true when no abandoned operation is still running
     */
    public boolean awaitAbandoned(Duration grace) throws InterruptedException {
        long deadlineNanos = System.nanoTime() + grace.toNanos();
        for (Abandoned op : abandoned) {
            long remaining = deadlineNanos - System.nanoTime();
            if (op.isRunning() && remaining > 0) {
                op.finished.await(remaining, TimeUnit.NANOSECONDS);
            }
        }
        abandoned.removeIf(op -> !op.isRunning());
        if (!abandoned.isEmpty()) {
            log.debug("DeadlineRunner[{}]: {} cancelled operation(s) still running", name, abandoned.size());
        }
        return abandoned.isEmpty();
    }

    @Override
    public void close() {
        workers.shutdownNow();
    }

    // ── Private helpers ───────────────────────────────────────────────────────

    private void track(Abandoned op) {
        abandoned.removeIf(earlier -> !earlier.isRunning());
        abandoned.add(op);
    }

    private static ThreadFactory daemonThreads(String name) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread t = new Thread(runnable, name + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    /** Completion signal of one submitted operation. */
    private static final class Abandoned {
        final CountDownLatch finished = new CountDownLatch(1);
        volatile boolean started;

        /** False once the body returned, or when it was cancelled before a worker picked it up. */
        boolean isRunning() {
            return started && finished.getCount() > 0;
        }
    }

    /** Decides, exactly once, whether a result goes to the caller or to the late handler. */
    private static final class Handoff<T> {
        private final Consumer<? super T> onLateResult;
        private boolean delivered;
        private boolean abandoned;

        private Handoff(Consumer<? super T> onLateResult) {
            this.onLateResult = onLateResult;
        }

        T deliver(T result) {
            boolean late;
            synchronized (this) {
                late = abandoned;
                delivered = !late;
            }
            if (late && onLateResult != null && result != null) {
                try {
                    onLateResult.accept(result);
                } catch (RuntimeException e) {
                    log.warn("DeadlineRunner: late-result handler failed: {}", e.getMessage());
                }
            }
            return result;
        }

        /** @return true if the caller gave up first; false if the result was already delivered */
        synchronized boolean abandon() {
            if (delivered) return false;
            abandoned = true;
            return true;
        }
    }
}
