package io.xblive.broker;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Caller-owned cancellation signal observed by every suspension point of the broker: network
 * exchanges and the device-code poll wait.
 *
 * <p>
 * A signal is one-shot. Once {@link #cancel()} is called, pending {@link #await(Duration)} calls
 * return immediately, registered callbacks run once, and later registrations run inline.
 * </p>
 */
public final class Cancellation {

    private static final Logger LOGGER = Logger.getLogger(Cancellation.class.getName());

    private final CountDownLatch latch = new CountDownLatch(1);
    private final Object monitor = new Object();
    private final List<Runnable> callbacks = new ArrayList<>();

    /**
     * @return a fresh signal that nobody else holds, so it is never cancelled.
     */
    public static Cancellation none() {
        return new Cancellation();
    }

    /**
     * @return a signal that cancels itself once {@code timeout} has elapsed.
     */
    public static Cancellation withTimeout(Duration timeout) {
        Cancellation cancellation = new Cancellation();
        cancellation.cancelAfter(timeout);
        return cancellation;
    }

    public void cancel() {
        List<Runnable> pending;
        synchronized (monitor) {
            if (latch.getCount() == 0) {
                return;
            }
            latch.countDown();
            pending = new ArrayList<>(callbacks);
            callbacks.clear();
        }
        for (Runnable callback : pending) {
            runQuietly(callback);
        }
    }

    /**
     * Schedules {@link #cancel()} after the given delay without holding a dedicated thread.
     */
    public void cancelAfter(Duration delay) {
        Objects.requireNonNull(delay, "delay");
        if (delay.isZero() || delay.isNegative()) {
            cancel();
            return;
        }
        CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS).execute(this::cancel);
    }

    public boolean isCancelled() {
        return latch.getCount() == 0;
    }

    /**
     * Suspends the calling thread for up to {@code timeout}.
     *
     * @return {@code true} when the wait ended because the signal was cancelled.
     * @throws InterruptedException when the waiting thread is interrupted.
     */
    public boolean await(Duration timeout) throws InterruptedException {
        if (timeout.isZero() || timeout.isNegative()) {
            return isCancelled();
        }
        return latch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Registers a callback fired on cancellation. The returned handle removes it again; callers
     * use it in try-with-resources around the guarded operation.
     */
    public Registration onCancel(Runnable callback) {
        Objects.requireNonNull(callback, "callback");
        synchronized (monitor) {
            if (!isCancelled()) {
                callbacks.add(callback);
                return () -> {
                    synchronized (monitor) {
                        callbacks.remove(callback);
                    }
                };
            }
        }
        // already cancelled
        runQuietly(callback);
        return () -> { };
    }

    public void throwIfCancelled(String operation) throws OperationCancelledException {
        if (isCancelled()) {
            throw new OperationCancelledException(operation + " cancelled");
        }
    }

    private static void runQuietly(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException ex) {
            LOGGER.log(Level.WARNING, "[xblive] cancellation callback failed", ex);
        }
    }

    /**
     * Handle returned by {@link #onCancel(Runnable)}.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
