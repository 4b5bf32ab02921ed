package com.questrail.soapd.observability;

import java.time.Instant;

/**
 * Record representing a failure inside an operation handler or the dispatcher.
 */
public record DispatchErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
