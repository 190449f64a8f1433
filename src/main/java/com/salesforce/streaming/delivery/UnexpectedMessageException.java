package com.salesforce.streaming.delivery;

/**
 * A handler received a message it cannot correlate with anything the
 * current scenario produced.
 */
public class UnexpectedMessageException extends RuntimeException {

    public UnexpectedMessageException(String message) {
        super(message);
    }
}
