package com.salesforce.streaming.bayeux;

import org.cometd.bayeux.Channel;
import org.cometd.bayeux.Message;
import org.cometd.common.HashMapMessage;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ReplayExtensionTest {

    private final ReplayExtension extension = new ReplayExtension();

    @Test
    void shouldAskForReplayOnHandshake() {
        HashMapMessage handshake = meta(Channel.META_HANDSHAKE);

        extension.sendMeta(null, handshake);

        assertThat(handshake.getExt()).containsEntry(ReplayExtension.EXTENSION_NAME, Boolean.TRUE);
    }

    @Test
    void shouldSendCursorOfSubscribedChannelOnly() {
        acceptHandshake(true);
        extension.setReplayId("/u/Channel", 42L);
        extension.setReplayId("/data/AccountChangeEvent", -2L);

        HashMapMessage subscribe = subscribe("/u/Channel");
        extension.sendMeta(null, subscribe);

        assertThat(subscribe.getExt())
                .containsEntry(ReplayExtension.EXTENSION_NAME, Map.of("/u/Channel", 42L));
    }

    @Test
    void shouldSendSpecialCursorsAsIs() {
        acceptHandshake(true);
        extension.setReplayId("/data/AccountChangeEvent", ReplayId.ALL_RETAINED);

        HashMapMessage subscribe = subscribe("/data/AccountChangeEvent");
        extension.sendMeta(null, subscribe);

        assertThat(subscribe.getExt())
                .containsEntry(ReplayExtension.EXTENSION_NAME, Map.of("/data/AccountChangeEvent", -2L));
    }

    @Test
    void shouldLeaveSubscribeAloneWhenServerLacksReplay() {
        acceptHandshake(false);
        extension.setReplayId("/u/Channel", 42L);

        HashMapMessage subscribe = subscribe("/u/Channel");
        extension.sendMeta(null, subscribe);

        assertThat(extension.isSupported()).isFalse();
        assertThat(subscribe.getExt()).isNull();
    }

    @Test
    void shouldAdvanceCursorWithReceivedEvents() {
        extension.setReplayId("/u/Channel", ReplayId.NEW_ONLY);

        extension.rcv(null, event("/u/Channel", 7));

        assertThat(extension.getReplayId("/u/Channel")).isEqualTo(7L);
    }

    @Test
    void shouldNotTrackChannelsThatWereNeverSubscribed() {
        extension.rcv(null, event("/u/Other", 7));

        assertThat(extension.getReplayId("/u/Other")).isNull();
    }

    @Test
    void shouldIgnoreMessagesWithoutReplayId() {
        extension.setReplayId("/u/Channel", 3L);
        HashMapMessage message = new HashMapMessage();
        message.setChannel("/u/Channel");
        message.setData(Map.of("payload", "no event"));

        extension.rcv(null, message);

        assertThat(extension.getReplayId("/u/Channel")).isEqualTo(3L);
    }

    private void acceptHandshake(boolean replaySupported) {
        HashMapMessage reply = meta(Channel.META_HANDSHAKE);
        reply.setSuccessful(true);
        if (replaySupported) {
            reply.getExt(true).put(ReplayExtension.EXTENSION_NAME, Boolean.TRUE);
        }
        extension.rcvMeta(null, reply);
    }

    private static HashMapMessage meta(String channel) {
        HashMapMessage message = new HashMapMessage();
        message.setChannel(channel);
        return message;
    }

    private static HashMapMessage subscribe(String channel) {
        HashMapMessage message = meta(Channel.META_SUBSCRIBE);
        message.put(Message.SUBSCRIPTION_FIELD, channel);
        return message;
    }

    private static HashMapMessage event(String channel, long replayId) {
        HashMapMessage message = new HashMapMessage();
        message.setChannel(channel);
        message.setData(Map.of("event", Map.of("replayId", replayId), "payload", "p"));
        return message;
    }
}
