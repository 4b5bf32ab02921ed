package com.questrail.soapd.api;

import org.apache.axiom.om.OMElement;

import java.util.Objects;
import java.util.Optional;

/**
 * The single answer produced for every dispatched request.
 *
 * <p>Transports render this onto their own wire: when {@link #payload()} is
 * present it is a complete SOAP envelope (a response or a SOAP Fault),
 * otherwise {@link #errorDetail()} explains the failure in plain text.</p>
 *
 * @param statusCode   transport-neutral status (HTTP numbering by convention)
 * @param statusText   short reason phrase
 * @param payload      response envelope, if any
 * @param errorDetail  human-readable detail; empty for successful answers
 * @param selectedBy   strategy that selected the answering handler
 * @param finalState   {@link DispatchState#RESPONSE_READY} or {@link DispatchState#FAULT}
 * @param failedIn     last state reached before a fault, {@code finalState} otherwise
 */
public record DispatchResult(
        int statusCode,
        String statusText,
        Optional<OMElement> payload,
        String errorDetail,
        SelectionStrategy selectedBy,
        DispatchState finalState,
        DispatchState failedIn
) {
    public DispatchResult {
        Objects.requireNonNull(statusText, "statusText");
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(errorDetail, "errorDetail");
        Objects.requireNonNull(selectedBy, "selectedBy");
        Objects.requireNonNull(finalState, "finalState");
        Objects.requireNonNull(failedIn, "failedIn");
    }

    public static DispatchResult answered(HandlerResult.Matched matched, SelectionStrategy selectedBy) {
        return new DispatchResult(matched.statusCode(), matched.statusText(),
                Optional.of(matched.payload()), "", selectedBy,
                DispatchState.RESPONSE_READY, DispatchState.RESPONSE_READY);
    }

    public boolean isFault() {
        return finalState == DispatchState.FAULT;
    }

    /**
     * Protocol version of the payload, derived from its envelope namespace.
     */
    public Optional<ProtocolVersion> payloadVersion() {
        return payload.flatMap(p -> ProtocolVersion.fromEnvelopeNamespace(p.getQName().getNamespaceURI()));
    }
}
