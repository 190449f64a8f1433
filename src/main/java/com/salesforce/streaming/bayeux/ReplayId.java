package com.salesforce.streaming.bayeux;

/**
 * Special replay cursors understood by the Streaming API. Any other value is
 * the replay id of a delivered event; delivery resumes after it.
 */
public final class ReplayId {

    /** Every event still inside the retention window. */
    public static final long ALL_RETAINED = -2L;

    /** Only events published after the subscription is registered. */
    public static final long NEW_ONLY = -1L;

    private ReplayId() {
    }
}
