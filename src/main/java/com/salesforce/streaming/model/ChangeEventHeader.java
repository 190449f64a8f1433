package com.salesforce.streaming.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Header of a Change Data Capture event. A single event may cover several
 * records when the platform coalesces identical changes, hence
 * {@code recordIds} is a list.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ChangeEventHeader {

    private String entityName;
    private List<String> recordIds;
    private String changeType;
    private String changeOrigin;
    private String transactionKey;
    private Integer sequenceNumber;
    private Long commitTimestamp;
    private Long commitNumber;
    private String commitUser;
    private List<String> nulledFields;
    private List<String> diffFields;
    private List<String> changedFields;
}
