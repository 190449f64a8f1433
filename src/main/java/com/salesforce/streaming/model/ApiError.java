package com.salesforce.streaming.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Error entry as returned by the REST API, either in a 4xx body or inside a
 * {@link SaveResult}. The REST API spells the code {@code errorCode}, the
 * composite collection resources spell it {@code statusCode}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ApiError {

    private String errorCode;
    private String statusCode;
    private String message;
    private List<String> fields;

    public String code() {
        return errorCode != null ? errorCode : statusCode;
    }
}
