package com.salesforce.streaming.bayeux;

import com.fasterxml.jackson.core.type.TypeReference;
import com.salesforce.streaming.model.GenericStreamingMessage;
import com.salesforce.streaming.model.PushEvent;
import com.salesforce.streaming.model.PushResult;
import com.salesforce.streaming.rest.Connection;
import com.salesforce.streaming.rest.QueryConditions;
import com.salesforce.streaming.rest.RestInvoker;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;

/**
 * Handle on a named channel: a generic streaming channel ({@code /u/...}),
 * a change event channel ({@code /data/...}) or a platform event channel
 * ({@code /event/...}). Only generic channels accept {@link #push}.
 */
@Slf4j
public class StreamingChannel {

    private static final TypeReference<List<PushResult>> PUSH_RESULTS = new TypeReference<List<PushResult>>() {
    };

    private final StreamingClient client;
    private final Connection connection;
    private final String name;
    private volatile String channelId;

    StreamingChannel(StreamingClient client, Connection connection, String name) {
        this.client = client;
        this.connection = connection;
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public Subscription subscribe(MessageHandler<GenericStreamingMessage> handler) {
        return subscribe(handler, ReplayId.NEW_ONLY);
    }

    public Subscription subscribe(MessageHandler<GenericStreamingMessage> handler, long replayId) {
        return subscribe(GenericStreamingMessage.class, handler, replayId);
    }

    /**
     * Subscribes with the message data left as a map, for channels whose
     * payload shape is not known up front.
     */
    public Subscription subscribeRaw(MessageHandler<Map<String, Object>> handler, long replayId) {
        return client.subscribe(name, client.converter().mapType(), handler, replayId);
    }

    public <M> Subscription subscribe(Class<M> messageType, MessageHandler<M> handler, long replayId) {
        return client.subscribe(name, client.converter().typeOf(messageType), handler, replayId);
    }

    public PushResult push(PushEvent event) {
        List<PushResult> results = push(List.of(event));
        if (results.isEmpty()) {
            throw new StreamingException("Push to " + name + " returned no result");
        }
        return results.get(0);
    }

    public List<PushResult> push(List<PushEvent> events) {
        RestInvoker rest = connection.rest();
        String path = rest.dataPath("/sobjects/StreamingChannel/" + resolveChannelId() + "/push");
        List<PushResult> results = rest.post(path, Map.of("pushEvents", events), PUSH_RESULTS);
        log.debug("Pushed {} event(s) to {}", events.size(), name);
        return results == null ? List.of() : results;
    }

    String resolveChannelId() {
        String id = channelId;
        if (id == null) {
            id = connection.sobject("StreamingChannel")
                    .findOne(QueryConditions.eq("Name", name), "Id")
                    .first()
                    .map(record -> (String) record.get("Id"))
                    .orElseThrow(() -> new StreamingException("No StreamingChannel named " + name));
            channelId = id;
        }
        return id;
    }
}
