package com.salesforce.streaming.bayeux;

/**
 * Receives messages of one subscription. Invoked on a CometD client thread.
 *
 * @param <M> the type delivered messages are converted into
 */
@FunctionalInterface
public interface MessageHandler<M> {

    void onMessage(M message);
}
