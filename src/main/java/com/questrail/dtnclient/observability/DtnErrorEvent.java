package com.questrail.dtnclient.observability;

import java.time.Instant;

/**
 * Record representing a failed call to dtnd.
 */
public record DtnErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
