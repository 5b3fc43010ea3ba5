package com.pharmos.events;

/**
 * What happens when a subscriber's buffer is full and another event arrives.
 */
public enum OverflowPolicy {

    /**
     * Discard the oldest buffered event and keep the stream open.
     */
    DROP_OLDEST,

    /**
     * Terminate the slow subscriber's stream with an overflow error.
     */
    DISCONNECT
}
