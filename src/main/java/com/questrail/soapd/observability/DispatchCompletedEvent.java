package com.questrail.soapd.observability;

import com.questrail.soapd.api.DispatchState;
import com.questrail.soapd.api.ProtocolVersion;
import com.questrail.soapd.api.SelectionStrategy;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Record describing the outcome of one dispatched request.
 *
 * @param operation  name of the answering operation, when one answered
 * @param failedIn   last state reached; equals {@code finalState} on success
 * @param elapsed    time spent inside the dispatcher, handler included
 */
public record DispatchCompletedEvent(
    Instant timestamp,
    Optional<ProtocolVersion> version,
    Optional<String> operation,
    SelectionStrategy selectedBy,
    int statusCode,
    String statusText,
    DispatchState finalState,
    DispatchState failedIn,
    Duration elapsed
) {
    public boolean isFault() {
        return finalState == DispatchState.FAULT;
    }
}
