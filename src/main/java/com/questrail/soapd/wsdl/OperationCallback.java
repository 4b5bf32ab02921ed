package com.questrail.soapd.wsdl;

/**
 * Application code answering one WSDL operation.
 *
 * <p>Callbacks are only invoked for messages that were recognised as their
 * operation. They may block; they run on the transport's worker thread.
 * An exception thrown here is reported to the client as a generic failure.</p>
 */
@FunctionalInterface
public interface OperationCallback {
    OperationReply handle(OperationRequest request);
}
