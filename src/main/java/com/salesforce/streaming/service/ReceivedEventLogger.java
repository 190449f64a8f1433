package com.salesforce.streaming.service;

import com.salesforce.streaming.model.ReceivedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class ReceivedEventLogger {

    @EventListener
    public void handleReceivedEvent(ReceivedEvent event) {
        log.info("Event on {} (replayId {}, type {})", event.getChannel(), event.getReplayId(), event.getEventType());
        log.debug("Event data: {}", event.getData());
    }
}
