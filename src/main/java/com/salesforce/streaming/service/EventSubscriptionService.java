package com.salesforce.streaming.service;

import com.salesforce.streaming.bayeux.Subscription;
import com.salesforce.streaming.config.SalesforceConfig;
import com.salesforce.streaming.model.ReceivedEvent;
import com.salesforce.streaming.rest.Connection;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Tails one configured channel: every message is counted and republished
 * as a {@link ReceivedEvent}. Disabled unless
 * {@code salesforce.event.auto-start} is set.
 */
@Service
@Slf4j
public class EventSubscriptionService {

    @Autowired
    private SalesforceConfig config;

    @Autowired
    private ConnectionManager connectionManager;

    @Autowired
    private ApplicationEventPublisher eventPublisher;

    private Connection connection;
    private volatile Subscription subscription;

    private final AtomicBoolean isActive = new AtomicBoolean(false);
    private final AtomicInteger receivedEvents = new AtomicInteger(0);

    @Getter
    private String currentChannel;
    @Getter
    private volatile ConnectionStatus connectionStatus = ConnectionStatus.DISCONNECTED;

    @PostConstruct
    public void init() {
        if (!config.getEvent().isAutoStart()) {
            log.debug("Channel tail disabled");
            return;
        }
        try {
            connect();
            startSubscription();
        } catch (Exception e) {
            log.error("Failed to initialize event subscription", e);
            connectionStatus = ConnectionStatus.ERROR;
        }
    }

    void connect() throws Exception {
        connection = connectionManager.createConnection();
        connectionManager.establishConnection(connection);
        connectionStatus = ConnectionStatus.CONNECTED;
    }

    public void startSubscription() {
        if (connection == null) {
            throw new IllegalStateException("No connection. Call connect() first.");
        }
        if (isActive.compareAndSet(false, true)) {
            currentChannel = config.getEvent().getChannel();
            long replayId = config.getEvent().getReplayId();
            log.info("Starting subscription to channel: {} (replayId {})", currentChannel, replayId);
            connectionStatus = ConnectionStatus.SUBSCRIBING;

            Subscription started = connection.streaming().channel(currentChannel).subscribeRaw(this::onMessage, replayId);
            subscription = started;
            started.ready().whenComplete((ignored, error) -> {
                if (error == null) {
                    connectionStatus = ConnectionStatus.SUBSCRIBED;
                } else {
                    log.error("Error in subscription to {}", currentChannel, error);
                    connectionStatus = ConnectionStatus.ERROR;
                    isActive.set(false);
                }
            });
        }
    }

    public void stopSubscription() {
        if (isActive.compareAndSet(true, false)) {
            log.info("Stopping subscription");
            if (subscription != null) {
                subscription.cancel();
            }
            connectionStatus = ConnectionStatus.DISCONNECTED;
        }
    }

    void onMessage(Map<String, Object> data) {
        receivedEvents.incrementAndGet();
        eventPublisher.publishEvent(toReceivedEvent(data));
    }

    private ReceivedEvent toReceivedEvent(Map<String, Object> data) {
        Long replayId = null;
        String eventType = null;
        Object event = data.get("event");
        if (event instanceof Map) {
            Object replay = ((Map<?, ?>) event).get("replayId");
            replayId = replay instanceof Number ? ((Number) replay).longValue() : null;
            Object type = ((Map<?, ?>) event).get("type");
            eventType = type == null ? null : type.toString();
        }
        return ReceivedEvent.builder()
                .channel(currentChannel)
                .replayId(replayId)
                .eventType(eventType)
                .receivedAt(Instant.now())
                .data(data)
                .build();
    }

    @PreDestroy
    public void cleanup() {
        stopSubscription();
        if (connection != null) {
            connection.close();
        }
    }

    public int getTotalEventsReceived() {
        return receivedEvents.get();
    }

    public enum ConnectionStatus {
        DISCONNECTED,
        CONNECTED,
        SUBSCRIBING,
        SUBSCRIBED,
        ERROR
    }
}
