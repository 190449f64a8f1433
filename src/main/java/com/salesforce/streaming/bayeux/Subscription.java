package com.salesforce.streaming.bayeux;

import lombok.extern.slf4j.Slf4j;
import org.cometd.bayeux.client.ClientSessionChannel;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A handler registered on a channel at a replay cursor. The registration
 * stays live on the server until {@link #cancel()} is called; cancelling
 * more than once is a no-op.
 */
@Slf4j
public class Subscription {

    private final StreamingClient client;
    private final String channelName;
    private final long replayId;
    private final ClientSessionChannel.MessageListener listener;
    private final CompletableFuture<Void> ready = new CompletableFuture<>();
    private final AtomicBoolean active = new AtomicBoolean(true);

    Subscription(StreamingClient client, String channelName, long replayId,
                 ClientSessionChannel.MessageListener listener) {
        this.client = client;
        this.channelName = channelName;
        this.replayId = replayId;
        this.listener = listener;
    }

    public String getChannelName() {
        return channelName;
    }

    public long getReplayId() {
        return replayId;
    }

    public boolean isActive() {
        return active.get();
    }

    /**
     * Completes when the server acknowledged the subscribe request, or
     * exceptionally when it refused it.
     */
    public CompletableFuture<Void> ready() {
        return ready;
    }

    public void awaitReady(Duration timeout) throws InterruptedException, TimeoutException {
        try {
            ready.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw new StreamingException("Subscription to " + channelName + " failed", e.getCause());
        }
    }

    public void cancel() {
        if (active.compareAndSet(true, false)) {
            client.release(this);
        } else {
            log.debug("Subscription to {} already cancelled", channelName);
        }
    }

    public void unsubscribe() {
        cancel();
    }

    void markReady() {
        ready.complete(null);
    }

    void markFailed(Throwable cause) {
        ready.completeExceptionally(cause);
    }

    ClientSessionChannel.MessageListener getListener() {
        return listener;
    }
}
