package com.salesforce.streaming.bayeux;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.salesforce.streaming.config.SalesforceConfig;
import com.salesforce.streaming.rest.Connection;
import lombok.extern.slf4j.Slf4j;
import org.cometd.bayeux.Channel;
import org.cometd.bayeux.Message;
import org.cometd.bayeux.client.ClientSessionChannel;
import org.cometd.client.BayeuxClient;
import org.cometd.client.transport.ClientTransport;
import org.cometd.client.transport.LongPollingTransport;
import org.eclipse.jetty.client.HttpClient;
import org.eclipse.jetty.client.api.Request;
import org.eclipse.jetty.http.HttpHeader;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeoutException;

/**
 * Streaming API access for one {@link Connection}. A single Bayeux client is
 * handshaken on first subscribe and shared by every subscription made
 * through this instance. Active subscriptions are re-sent after every
 * successful handshake, so a re-handshake by the Bayeux client resumes them
 * from their replay cursors.
 */
@Slf4j
public class StreamingClient implements AutoCloseable {

    private final Connection connection;
    private final SalesforceConfig.Streaming settings;
    private final HttpClient httpClient;
    private final MessageConverter converter;
    private final ReplayExtension replayExtension = new ReplayExtension();

    // also the lock for subscribe, release and resubscribe; never held while connect() waits
    private final List<Subscription> active = new CopyOnWriteArrayList<>();

    private volatile BayeuxClient bayeuxClient;

    public StreamingClient(Connection connection, SalesforceConfig.Streaming settings, HttpClient httpClient,
                           ObjectMapper objectMapper) {
        this.connection = connection;
        this.settings = settings;
        this.httpClient = httpClient;
        this.converter = new MessageConverter(objectMapper);
    }

    public StreamingChannel channel(String name) {
        return new StreamingChannel(this, connection, name);
    }

    public Topic<Map<String, Object>> topic(String name) {
        return new Topic<>(this, name, converter.topicMessageOf(converter.mapType()));
    }

    public <T> Topic<T> topic(String name, Class<T> recordType) {
        return new Topic<>(this, name, converter.topicMessageOf(recordType));
    }

    public String endpoint() {
        return connection.getSessionInfo().getInstanceUrl() + "/cometd/" + connection.getApiVersion();
    }

    /**
     * Waits until a subscription is acknowledged, then for the settle delay.
     * The acknowledgement alone does not guarantee that events published
     * right after it reach the new subscriber.
     */
    public void waitUntilLive(Subscription subscription) throws InterruptedException, TimeoutException {
        subscription.awaitReady(settings.getSubscribeTimeout());
        Duration settle = settings.getSubscribeSettleDelay();
        if (!settle.isZero()) {
            Thread.sleep(settle.toMillis());
        }
    }

    <M> Subscription subscribe(String channelName, JavaType messageType, MessageHandler<M> handler, long replayId) {
        BayeuxClient client = connect();
        replayExtension.setReplayId(channelName, replayId);

        ClientSessionChannel.MessageListener listener =
                (channel, message) -> deliver(channelName, message, messageType, handler);
        Subscription subscription = new Subscription(this, channelName, replayId, listener);

        log.info("Subscribing to {} with replayId {}", channelName, replayId);
        synchronized (active) {
            active.add(subscription);
            if (!send(client, subscription)) {
                // the channel already had a listener, so no /meta/subscribe went out
                subscription.markReady();
            }
        }
        return subscription;
    }

    void release(Subscription subscription) {
        synchronized (active) {
            active.remove(subscription);
            BayeuxClient client = bayeuxClient;
            if (client != null) {
                client.getChannel(subscription.getChannelName()).unsubscribe(subscription.getListener());
            }
        }
        log.info("Cancelled subscription to {}", subscription.getChannelName());
    }

    List<Subscription> activeSubscriptions() {
        return List.copyOf(active);
    }

    private boolean send(BayeuxClient client, Subscription subscription) {
        String channelName = subscription.getChannelName();
        return client.getChannel(channelName).subscribe(subscription.getListener(), reply -> {
            if (reply.isSuccessful()) {
                log.info("Subscribed to {}", channelName);
                subscription.markReady();
            } else {
                log.error("Subscription to {} refused: {}", channelName, reply.get(Message.ERROR_FIELD));
                active.remove(subscription);
                subscription.markFailed(new StreamingException(
                        "Subscription to " + channelName + " refused: " + reply.get(Message.ERROR_FIELD)));
            }
        });
    }

    /**
     * A re-handshake drops every channel subscription of the Bayeux client.
     * Sends them again; the replay extension supplies each channel's cursor.
     */
    private void resubscribe(BayeuxClient client) {
        synchronized (active) {
            for (Subscription subscription : active) {
                ClientSessionChannel channel = client.getChannel(subscription.getChannelName());
                if (channel.getSubscribers().contains(subscription.getListener())) {
                    continue;
                }
                log.info("Resubscribing to {} with replayId {}", subscription.getChannelName(),
                        replayExtension.getReplayId(subscription.getChannelName()));
                send(client, subscription);
            }
        }
    }

    synchronized BayeuxClient connect() {
        if (bayeuxClient != null && !bayeuxClient.isDisconnected()) {
            return bayeuxClient;
        }
        String endpoint = endpoint();
        log.info("Connecting to Salesforce Streaming API at {}", endpoint);

        Map<String, Object> options = new HashMap<>();
        options.put(ClientTransport.MAX_NETWORK_DELAY_OPTION, settings.getMaxNetworkDelay().toMillis());
        options.put(ClientTransport.MAX_MESSAGE_SIZE_OPTION, settings.getMaxMessageSize());
        LongPollingTransport transport = new LongPollingTransport(options, httpClient) {
            @Override
            protected void customize(Request request) {
                request.header(HttpHeader.AUTHORIZATION, connection.getSessionInfo().authorizationHeader());
            }
        };

        BayeuxClient client = new BayeuxClient(endpoint, transport);
        client.addExtension(replayExtension);
        client.getChannel(Channel.META_HANDSHAKE).addListener((ClientSessionChannel.MessageListener) (channel, message) -> {
            if (message.isSuccessful()) {
                log.info("Handshake successful. Replay supported: {}", replayExtension.isSupported());
                resubscribe(client);
            } else {
                log.error("Handshake failed: {}", message);
            }
        });
        client.getChannel(Channel.META_CONNECT).addListener((ClientSessionChannel.MessageListener) (channel, message) -> {
            if (!message.isSuccessful()) {
                log.warn("Connect failed: {}", message);
            }
        });

        client.handshake();
        long timeout = settings.getHandshakeTimeout().toMillis();
        if (!client.waitFor(timeout, BayeuxClient.State.CONNECTED)) {
            client.disconnect();
            throw new StreamingException("Handshake with " + endpoint + " did not complete within " + timeout + " ms");
        }
        bayeuxClient = client;
        return client;
    }

    MessageConverter converter() {
        return converter;
    }

    ReplayExtension replayExtension() {
        return replayExtension;
    }

    private <M> void deliver(String channelName, Message message, JavaType messageType, MessageHandler<M> handler) {
        log.debug("Received message on {}", channelName);
        try {
            M converted = converter.convert(message, messageType);
            handler.onMessage(converted);
        } catch (Exception e) {
            log.error("Error processing message on {}", channelName, e);
        }
    }

    @Override
    public synchronized void close() {
        BayeuxClient client = bayeuxClient;
        if (client == null) {
            return;
        }
        bayeuxClient = null;
        log.info("Disconnecting from Salesforce Streaming API");
        if (!client.disconnect(settings.getHandshakeTimeout().toMillis())) {
            log.warn("Disconnect did not complete within {}", settings.getHandshakeTimeout());
        }
    }
}
