package com.salesforce.streaming.delivery;

import com.salesforce.streaming.bayeux.MessageHandler;
import com.salesforce.streaming.model.ChangeEventMessage;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Collects Change Data Capture events for records identified by name and
 * completes once each expected name was seen in at least one event.
 *
 * <p>A strict tracker fails on the first change event it cannot correlate;
 * a lenient one ignores such events. Either way the replay id of every
 * delivered message is recorded.
 */
@Slf4j
public class ChangeEventTracker implements MessageHandler<ChangeEventMessage> {

    private final boolean strict;
    private final Set<String> expectedNames = ConcurrentHashMap.newKeySet();
    private final List<ChangeEventMessage> received = new CopyOnWriteArrayList<>();
    private volatile CompletableFuture<Void> completion = new CompletableFuture<>();
    private volatile Long lastReplayId;

    private ChangeEventTracker(boolean strict) {
        this.strict = strict;
    }

    public static ChangeEventTracker strict() {
        return new ChangeEventTracker(true);
    }

    public static ChangeEventTracker lenient() {
        return new ChangeEventTracker(false);
    }

    public void expect(Collection<String> recordNames) {
        expectedNames.addAll(recordNames);
    }

    /**
     * Starts a new round: forgets expected names and collected events and
     * hands out a fresh completion. The last replay id is kept.
     */
    public synchronized void reset() {
        expectedNames.clear();
        received.clear();
        completion = new CompletableFuture<>();
    }

    @Override
    public void onMessage(ChangeEventMessage message) {
        if (message.getReplayId() != null) {
            lastReplayId = message.getReplayId();
        }
        if (correlates(message)) {
            received.add(message);
            log.debug("Change event for {} ({} of {} names covered)",
                    message.getPayload().getName(), coveredCount(), expectedNames.size());
            if (coversAll()) {
                completion.complete(null);
            }
        } else if (strict) {
            UnexpectedMessageException error = new UnexpectedMessageException(
                    "Received unexpected change event with replayId " + message.getReplayId());
            completion.completeExceptionally(error);
            throw error;
        }
    }

    public CompletableFuture<Void> completion() {
        return completion;
    }

    public boolean coversAll() {
        return !expectedNames.isEmpty() && coveredCount() == expectedNames.size();
    }

    public boolean covers(String recordName) {
        return received.stream().anyMatch(event -> recordName.equals(event.getPayload().getName()));
    }

    /**
     * Several records changed in one transaction may arrive as one event
     * per record or coalesced into a single event listing every record id.
     */
    public boolean isOnePerRecordOrCoalesced() {
        int expected = expectedNames.size();
        return received.size() == expected
                || (received.size() == 1 && received.get(0).getRecordIds().size() == expected);
    }

    public List<ChangeEventMessage> getReceived() {
        return List.copyOf(received);
    }

    public Long getLastReplayId() {
        return lastReplayId;
    }

    private boolean correlates(ChangeEventMessage message) {
        return message.getHeader() != null
                && message.getPayload().getName() != null
                && expectedNames.contains(message.getPayload().getName());
    }

    private long coveredCount() {
        return expectedNames.stream().filter(this::covers).count();
    }
}
