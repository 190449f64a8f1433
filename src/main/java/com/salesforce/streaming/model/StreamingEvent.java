package com.salesforce.streaming.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The {@code event} descriptor carried by every Streaming API message.
 * {@code type} is only set for PushTopic notifications
 * ({@code created}, {@code updated}, {@code deleted}, {@code undeleted}).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class StreamingEvent {

    private String type;
    private String createdDate;
    private Long replayId;
}
