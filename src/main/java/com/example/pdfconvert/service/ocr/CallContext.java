package com.example.pdfconvert.service.ocr;

import com.example.pdfconvert.exception.RecognitionCancelledException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cancellation token and optional deadline for one recognition call.
 * <p>
 * Waits performed through {@link #sleep(Duration)} wake up as soon as the context is cancelled,
 * and hooks registered with {@link #onCancel(Runnable)} release outstanding network calls.
 */
public final class CallContext {

    private final Clock clock;
    private final Instant deadline;
    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final List<Runnable> cancelHooks = new CopyOnWriteArrayList<>();

    private CallContext(Clock clock, Instant deadline) {
        this.clock = clock;
        this.deadline = deadline;
    }

    /** A context with no deadline; it only ends when {@link #cancel()} is called. */
    public static CallContext background() {
        return new CallContext(Clock.systemUTC(), null);
    }

    public static CallContext withTimeout(Duration timeout) {
        Clock clock = Clock.systemUTC();
        return new CallContext(clock, clock.instant().plus(timeout));
    }

    public static CallContext withDeadline(Instant deadline) {
        return new CallContext(Clock.systemUTC(), deadline);
    }

    public void cancel() {
        if (cancelled.getCount() == 0) {
            return;
        }
        cancelled.countDown();
        for (Runnable hook : cancelHooks) {
            hook.run();
        }
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    public boolean isExpired() {
        return deadline != null && !clock.instant().isBefore(deadline);
    }

    /** True once the caller cancelled or the deadline passed. */
    public boolean isDone() {
        return isCancelled() || isExpired();
    }

    /**
     * Time left until the deadline, or {@code null} when the context has none.
     */
    public Duration remaining() {
        if (deadline == null) {
            return null;
        }
        Duration left = Duration.between(clock.instant(), deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }

    /**
     * Shortens {@code limit} to the time left in this context.
     */
    public Duration bound(Duration limit) {
        Duration left = remaining();
        if (left == null || left.compareTo(limit) >= 0) {
            return limit;
        }
        return left;
    }

    public void throwIfDone() {
        if (isCancelled()) {
            throw new RecognitionCancelledException("Recognition cancelled by caller");
        }
        if (isExpired()) {
            throw new RecognitionCancelledException("Caller deadline exceeded");
        }
    }

    /**
     * Suspends the current thread for {@code duration}, or less if the context ends first.
     *
     * @throws RecognitionCancelledException if the context is cancelled, expires or the thread is interrupted
     */
    public void sleep(Duration duration) {
        throwIfDone();
        Duration wait = bound(duration);
        try {
            cancelled.await(wait.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RecognitionCancelledException("Interrupted while waiting", e);
        }
        throwIfDone();
    }

    /**
     * Registers {@code hook} to run on cancellation. Runs it immediately if already cancelled.
     * Closing the returned handle unregisters it.
     */
    public Registration onCancel(Runnable hook) {
        cancelHooks.add(hook);
        if (isCancelled()) {
            hook.run();
        }
        return () -> cancelHooks.remove(hook);
    }

    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
