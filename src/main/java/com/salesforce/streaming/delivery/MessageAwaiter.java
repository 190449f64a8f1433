package com.salesforce.streaming.delivery;

import com.salesforce.streaming.bayeux.MessageHandler;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

/**
 * Single-fire future fed by a subscription. The first message accepted by
 * the filter completes it; everything delivered afterwards is ignored.
 *
 * <pre>
 * MessageAwaiter&lt;GenericStreamingMessage&gt; awaiter = new MessageAwaiter&lt;&gt;();
 * Subscription subscription = channel.subscribe(awaiter, ReplayId.NEW_ONLY);
 * ...
 * GenericStreamingMessage message = awaiter.await(Duration.ofMinutes(1));
 * </pre>
 */
@Slf4j
public class MessageAwaiter<M> implements MessageHandler<M> {

    private final Predicate<M> filter;
    private final CompletableFuture<M> arrived = new CompletableFuture<>();

    public MessageAwaiter() {
        this(message -> true);
    }

    public MessageAwaiter(Predicate<M> filter) {
        this.filter = filter;
    }

    @Override
    public void onMessage(M message) {
        if (!filter.test(message)) {
            log.debug("Message filtered out: {}", message);
            return;
        }
        if (!arrived.complete(message)) {
            log.debug("Already completed, ignoring: {}", message);
        }
    }

    public M await(Duration timeout) throws InterruptedException, TimeoutException {
        try {
            return arrived.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Awaited message failed", e.getCause());
        }
    }

    public boolean isDone() {
        return arrived.isDone();
    }

    public CompletableFuture<M> future() {
        return arrived;
    }
}
