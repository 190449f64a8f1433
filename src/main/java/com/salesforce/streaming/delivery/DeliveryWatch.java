package com.salesforce.streaming.delivery;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Waits for delivery that the platform only promises on a best-effort
 * basis. Running out of time is not an error: the watch ends in
 * {@link DeliveryOutcome#SKIPPED_WITH_WARNING} and logs a warning. A
 * completion that failed is rethrown.
 */
@Slf4j
public class DeliveryWatch {

    public static final String TIMEOUT_WARNING = "Timeout waiting for streamed events. This may be due to high load "
            + "on the platform. The scenario won't fail but it may be less reliable. If you are uncertain about "
            + "the result, please run it more times.";

    private final String description;
    private final Duration timeout;
    private volatile DeliveryOutcome outcome = DeliveryOutcome.WAITING_FOR_EVENTS;

    public DeliveryWatch(String description, Duration timeout) {
        this.description = description;
        this.timeout = timeout;
    }

    public DeliveryOutcome await(CompletableFuture<?> completion) throws InterruptedException {
        try {
            completion.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            outcome = DeliveryOutcome.DONE;
        } catch (TimeoutException e) {
            outcome = DeliveryOutcome.SKIPPED_WITH_WARNING;
            log.warn("{} after {}: {}", description, timeout, TIMEOUT_WARNING);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException(description + " failed", cause);
        }
        return outcome;
    }

    public DeliveryOutcome getOutcome() {
        return outcome;
    }

    public boolean isSkipped() {
        return outcome == DeliveryOutcome.SKIPPED_WITH_WARNING;
    }
}
