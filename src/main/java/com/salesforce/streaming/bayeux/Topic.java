package com.salesforce.streaming.bayeux;

import com.fasterxml.jackson.databind.JavaType;
import com.salesforce.streaming.model.StreamingMessage;

/**
 * Handle on a PushTopic. Notifications arrive on {@code /topic/<name>}.
 *
 * @param <T> the shape the changed record is mapped into
 */
public class Topic<T> {

    private final StreamingClient client;
    private final String name;
    private final JavaType messageType;

    Topic(StreamingClient client, String name, JavaType messageType) {
        this.client = client;
        this.name = name;
        this.messageType = messageType;
    }

    public String getName() {
        return name;
    }

    public String getChannelName() {
        return "/topic/" + name;
    }

    public Subscription subscribe(MessageHandler<StreamingMessage<T>> handler) {
        return subscribe(handler, ReplayId.NEW_ONLY);
    }

    public Subscription subscribe(MessageHandler<StreamingMessage<T>> handler, long replayId) {
        return client.subscribe(getChannelName(), messageType, handler, replayId);
    }
}
