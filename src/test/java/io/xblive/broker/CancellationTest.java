package io.xblive.broker;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CancellationTest {

    @Test
    void awaitTimesOutWhenNotCancelled() throws Exception {
        Cancellation cancellation = Cancellation.none();

        assertFalse(cancellation.await(Duration.ofMillis(20)));
        assertFalse(cancellation.isCancelled());
        cancellation.throwIfCancelled("poll");
    }

    @Test
    void callbacksFireOnceAndLateRegistrationsRunInline() {
        Cancellation cancellation = Cancellation.none();
        AtomicInteger fired = new AtomicInteger();
        cancellation.onCancel(fired::incrementAndGet);

        cancellation.cancel();
        cancellation.cancel();
        assertEquals(1, fired.get());

        cancellation.onCancel(fired::incrementAndGet);
        assertEquals(2, fired.get());
    }

    @Test
    void closedRegistrationIsNotFired() {
        Cancellation cancellation = Cancellation.none();
        AtomicInteger fired = new AtomicInteger();

        try (Cancellation.Registration ignored = cancellation.onCancel(fired::incrementAndGet)) {
            assertFalse(cancellation.isCancelled());
        }
        cancellation.cancel();

        assertEquals(0, fired.get());
    }

    @Test
    void failingCallbackDoesNotStopOthers() {
        Cancellation cancellation = Cancellation.none();
        AtomicInteger fired = new AtomicInteger();
        cancellation.onCancel(() -> {
            throw new IllegalStateException("boom");
        });
        cancellation.onCancel(fired::incrementAndGet);

        cancellation.cancel();

        assertEquals(1, fired.get());
    }

    @Test
    void timeoutCancelsWaitingThread() throws Exception {
        Cancellation cancellation = Cancellation.withTimeout(Duration.ofMillis(50));

        assertTrue(cancellation.await(Duration.ofSeconds(5)));
        OperationCancelledException ex = assertThrows(OperationCancelledException.class,
            () -> cancellation.throwIfCancelled("device-code poll"));
        assertEquals("device-code poll cancelled", ex.getMessage());
    }

    @Test
    void nonPositiveDelayCancelsImmediately() {
        Cancellation cancellation = Cancellation.none();

        cancellation.cancelAfter(Duration.ZERO);

        assertTrue(cancellation.isCancelled());
    }

    @Test
    void registrationRacingCancelAlwaysFires() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        int lost = 0;
        try {
            for (int i = 0; i < 2_000; i++) {
                Cancellation cancellation = Cancellation.none();
                for (int j = 0; j < 4; j++) {
                    cancellation.onCancel(() -> { });
                }
                AtomicBoolean fired = new AtomicBoolean();
                CountDownLatch start = new CountDownLatch(1);

                Future<?> canceller = pool.submit(() -> {
                    start.await();
                    cancellation.cancel();
                    return null;
                });
                Future<?> registrar = pool.submit(() -> {
                    start.await();
                    cancellation.onCancel(() -> fired.set(true));
                    return null;
                });
                start.countDown();
                canceller.get(5, TimeUnit.SECONDS);
                registrar.get(5, TimeUnit.SECONDS);

                if (!fired.get()) {
                    lost++;
                }
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(0, lost);
    }
}
