package com.questrail.soapd.fault;

import com.questrail.soapd.api.DispatchResult;
import com.questrail.soapd.api.DispatchState;
import com.questrail.soapd.api.SelectionStrategy;
import org.apache.axiom.om.OMElement;

import java.util.Objects;
import java.util.Optional;

/**
 * A synthesized failure: status, short reason, human-readable message and,
 * when the protocol version of the request is known, a SOAP Fault envelope.
 */
public record FaultDescriptor(
        FaultCategory category,
        int statusCode,
        String reason,
        String message,
        Optional<OMElement> detail
) {
    public FaultDescriptor {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(reason, "reason");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(detail, "detail");
    }

    /**
     * Converts the fault into the dispatcher's answer.
     *
     * @param failedIn   last dispatch state reached before the failure
     * @param selectedBy strategy in effect when the failure happened
     */
    public DispatchResult toResult(DispatchState failedIn, SelectionStrategy selectedBy) {
        return new DispatchResult(statusCode, reason, detail, message, selectedBy,
                DispatchState.FAULT, failedIn);
    }
}
