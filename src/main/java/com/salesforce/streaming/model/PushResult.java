package com.salesforce.streaming.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of a generic streaming push. {@code fanoutCount} is {@code -1} when
 * the event was stored for durable delivery to an active subscription and
 * {@code 0} when nobody was listening.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PushResult {

    private int fanoutCount;
    private Map<String, Object> userOnlineStatus = new LinkedHashMap<>();
}
