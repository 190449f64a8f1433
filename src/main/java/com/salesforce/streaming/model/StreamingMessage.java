package com.salesforce.streaming.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * PushTopic notification: the changed record plus the event descriptor.
 *
 * @param <T> the shape the record is mapped into
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class StreamingMessage<T> {

    private StreamingEvent event;
    private T sobject;
}
