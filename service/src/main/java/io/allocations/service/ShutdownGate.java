package io.allocations.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Hands a JVM shutdown to the main thread and holds the shutdown hook until the main thread has closed its
 * resources, so the JVM does not halt halfway through closing them.
 */
final class ShutdownGate {
    private static final Logger log = LoggerFactory.getLogger(ShutdownGate.class);

    private final CountDownLatch stopped = new CountDownLatch(1);
    private final CountDownLatch closed = new CountDownLatch(1);
    private final Duration closeTimeout;

    ShutdownGate(Duration closeTimeout) {
        this.closeTimeout = closeTimeout;
    }

    /** Body of the shutdown hook: signal the main thread and wait for {@link #closed()}. */
    void stopAndAwaitClose() {
        stopped.countDown();
        try {
            if (!closed.await(closeTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Resources still open after {} ms, letting the JVM exit", closeTimeout.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    void awaitStop() throws InterruptedException {
        stopped.await();
    }

    void closed() {
        closed.countDown();
    }

    Thread hook() {
        return new Thread(this::stopAndAwaitClose, "allocations-shutdown");
    }
}
