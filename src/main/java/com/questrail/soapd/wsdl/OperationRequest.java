package com.questrail.soapd.wsdl;

import com.questrail.soapd.api.MessageInfo;
import org.apache.axiom.om.OMElement;

import java.util.Objects;
import java.util.Optional;

/**
 * A recognised request, as handed to an {@link OperationCallback}.
 *
 * @param envelope the complete request envelope
 * @param body     first element of the request body, if any
 */
public record OperationRequest(
        OperationDefinition operation,
        OMElement envelope,
        Optional<OMElement> body,
        MessageInfo info
) {
    public OperationRequest {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(envelope, "envelope");
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(info, "info");
    }
}
