package io.taskgateway.client.transport;

import java.time.Duration;

/** Waits between retry attempts. Replaced in tests to avoid real sleeps. */
@FunctionalInterface
public interface BackoffSleeper {

    /** Sleeps on the calling thread. */
    BackoffSleeper THREAD_SLEEP = delay -> Thread.sleep(delay.toMillis());

    void sleep(Duration delay) throws InterruptedException;
}
