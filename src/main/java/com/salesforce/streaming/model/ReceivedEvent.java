package com.salesforce.streaming.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * A Bayeux message as seen by the tail service, republished as a Spring
 * application event.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ReceivedEvent {

    private String channel;
    private Long replayId;
    private String eventType;
    private Instant receivedAt;
    private Map<String, Object> data;
}
