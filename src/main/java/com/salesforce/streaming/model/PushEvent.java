package com.salesforce.streaming.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One event pushed to a generic streaming channel. An empty {@code userIds}
 * list broadcasts to every subscriber.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PushEvent {

    private String payload;
    @Builder.Default
    private List<String> userIds = new ArrayList<>();

    public static PushEvent broadcast(String payload) {
        return new PushEvent(payload, new ArrayList<>());
    }
}
