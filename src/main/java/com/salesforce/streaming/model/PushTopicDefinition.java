package com.salesforce.streaming.model;

import lombok.Builder;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Field values for a {@code PushTopic} record.
 */
@Data
@Builder
public class PushTopicDefinition {

    private String name;
    private String query;
    @Builder.Default
    private String apiVersion = "54.0";
    @Builder.Default
    private String notifyForFields = "Referenced";
    @Builder.Default
    private boolean notifyForOperationCreate = true;
    @Builder.Default
    private boolean notifyForOperationUpdate = true;
    private boolean notifyForOperationDelete;
    private boolean notifyForOperationUndelete;

    public Map<String, Object> toFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("Name", name);
        fields.put("Query", query);
        fields.put("ApiVersion", apiVersion);
        fields.put("NotifyForFields", notifyForFields);
        fields.put("NotifyForOperationCreate", notifyForOperationCreate);
        fields.put("NotifyForOperationUpdate", notifyForOperationUpdate);
        fields.put("NotifyForOperationDelete", notifyForOperationDelete);
        fields.put("NotifyForOperationUndelete", notifyForOperationUndelete);
        return fields;
    }
}
