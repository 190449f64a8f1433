package com.salesforce.streaming.bayeux;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.salesforce.streaming.model.StreamingMessage;
import org.cometd.bayeux.Message;

import java.util.Map;

/**
 * Maps the {@code data} of a Bayeux message onto the message model.
 */
public class MessageConverter {

    private final ObjectMapper objectMapper;

    public MessageConverter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public JavaType typeOf(Class<?> messageType) {
        return objectMapper.getTypeFactory().constructType(messageType);
    }

    public JavaType mapType() {
        return objectMapper.getTypeFactory().constructMapType(Map.class, String.class, Object.class);
    }

    public JavaType topicMessageOf(Class<?> recordType) {
        return topicMessageOf(typeOf(recordType));
    }

    public JavaType topicMessageOf(JavaType recordType) {
        return objectMapper.getTypeFactory().constructParametricType(StreamingMessage.class, recordType);
    }

    public <M> M convert(Message message, JavaType type) {
        Map<String, Object> data = message.getDataAsMap();
        if (data == null) {
            throw new IllegalArgumentException("Message on " + message.getChannel() + " carries no data");
        }
        return objectMapper.convertValue(data, type);
    }
}
