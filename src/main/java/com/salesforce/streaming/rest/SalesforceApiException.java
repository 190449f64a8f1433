package com.salesforce.streaming.rest;

import lombok.Getter;

/**
 * A REST call to the org failed, either with a non-2xx status or in
 * transport. {@code status} is {@code -1} for transport failures.
 */
@Getter
public class SalesforceApiException extends RuntimeException {

    private final int status;
    private final String errorCode;
    private final String responseBody;

    public SalesforceApiException(int status, String errorCode, String message, String responseBody) {
        super(message);
        this.status = status;
        this.errorCode = errorCode;
        this.responseBody = responseBody;
    }

    public SalesforceApiException(String message, Throwable cause) {
        super(message, cause);
        this.status = -1;
        this.errorCode = null;
        this.responseBody = null;
    }
}
