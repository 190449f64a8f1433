package com.salesforce.streaming.bayeux;

import lombok.extern.slf4j.Slf4j;
import org.cometd.bayeux.Channel;
import org.cometd.bayeux.Message;
import org.cometd.bayeux.client.ClientSession;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Salesforce durable streaming on top of Bayeux. Requests replay support on
 * handshake, sends the cursor of a channel with its {@code /meta/subscribe}
 * and moves the cursor forward with every event received, so a subscription
 * re-sent after a re-handshake resumes after the last event seen.
 */
@Slf4j
public class ReplayExtension implements ClientSession.Extension {

    static final String EXTENSION_NAME = "replay";

    private final ConcurrentMap<String, Long> cursors = new ConcurrentHashMap<>();
    private volatile boolean supported;

    public void setReplayId(String channel, long replayId) {
        cursors.put(channel, replayId);
    }

    public Long getReplayId(String channel) {
        return cursors.get(channel);
    }

    public boolean isSupported() {
        return supported;
    }

    @Override
    public boolean rcv(ClientSession session, Message.Mutable message) {
        Long replayId = replayIdOf(message);
        if (replayId != null) {
            cursors.computeIfPresent(message.getChannel(), (channel, previous) -> replayId);
        }
        return true;
    }

    @Override
    public boolean rcvMeta(ClientSession session, Message.Mutable message) {
        if (Channel.META_HANDSHAKE.equals(message.getChannel()) && message.isSuccessful()) {
            Map<String, Object> ext = message.getExt(false);
            supported = ext != null && Boolean.TRUE.equals(ext.get(EXTENSION_NAME));
            if (!supported) {
                log.warn("Server does not support replay; subscriptions will receive new events only");
            }
        }
        return true;
    }

    @Override
    public boolean send(ClientSession session, Message.Mutable message) {
        return true;
    }

    @Override
    public boolean sendMeta(ClientSession session, Message.Mutable message) {
        switch (message.getChannel()) {
            case Channel.META_HANDSHAKE:
                message.getExt(true).put(EXTENSION_NAME, Boolean.TRUE);
                break;
            case Channel.META_SUBSCRIBE:
                Object subscription = message.get(Message.SUBSCRIPTION_FIELD);
                Long replayId = subscription == null ? null : cursors.get(subscription.toString());
                if (replayId != null && supported) {
                    message.getExt(true).put(EXTENSION_NAME, Map.of(subscription.toString(), replayId));
                }
                break;
            default:
                break;
        }
        return true;
    }

    static Long replayIdOf(Message message) {
        Map<String, Object> data = message.getDataAsMap();
        if (data == null) {
            return null;
        }
        Object event = data.get("event");
        if (!(event instanceof Map)) {
            return null;
        }
        Object replayId = ((Map<?, ?>) event).get("replayId");
        return replayId instanceof Number ? ((Number) replayId).longValue() : null;
    }
}
