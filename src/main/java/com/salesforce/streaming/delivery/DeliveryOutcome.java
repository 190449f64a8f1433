package com.salesforce.streaming.delivery;

public enum DeliveryOutcome {
    WAITING_FOR_EVENTS,
    DONE,
    SKIPPED_WITH_WARNING
}
