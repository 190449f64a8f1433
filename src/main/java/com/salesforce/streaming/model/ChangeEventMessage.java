package com.salesforce.streaming.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Change Data Capture message as delivered on {@code /data/...ChangeEvent}
 * channels.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ChangeEventMessage {

    private String schema;
    private StreamingEvent event;
    private Payload payload;

    @JsonIgnore
    public Long getReplayId() {
        return event == null ? null : event.getReplayId();
    }

    @JsonIgnore
    public ChangeEventHeader getHeader() {
        return payload == null ? null : payload.getChangeEventHeader();
    }

    @JsonIgnore
    public List<String> getRecordIds() {
        ChangeEventHeader header = getHeader();
        return header == null || header.getRecordIds() == null ? List.of() : header.getRecordIds();
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Payload {

        @JsonProperty("ChangeEventHeader")
        private ChangeEventHeader changeEventHeader;

        private Map<String, Object> fields = new LinkedHashMap<>();

        @JsonAnySetter
        public void setField(String name, Object value) {
            fields.put(name, value);
        }

        @JsonAnyGetter
        public Map<String, Object> getFields() {
            return fields;
        }

        public Object getField(String name) {
            return fields.get(name);
        }

        @JsonIgnore
        public String getName() {
            Object name = fields.get("Name");
            return name == null ? null : name.toString();
        }
    }
}
