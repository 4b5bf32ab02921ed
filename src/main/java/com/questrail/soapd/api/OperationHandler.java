package com.questrail.soapd.api;

import org.apache.axiom.om.OMElement;

/**
 * Handler bound to one operation of one protocol version.
 *
 * <p>Handlers are registered once at startup and invoked synchronously, on
 * the dispatching thread, for every request routed to them. A handler that
 * blocks holds its worker; imposing time limits is the transport's job.</p>
 *
 * <p>Returning {@link HandlerResult#noMatch()} tells the dispatcher that the
 * message is not meant for this operation. Exceptions thrown from here are
 * caught by the dispatcher and answered with a handler-failure fault.</p>
 */
@FunctionalInterface
public interface OperationHandler {

    /**
     * @param operationName name under which the handler was selected
     * @param envelope      the received {@code Envelope} element
     * @param info          structural metadata of the received message
     * @return the answer, or {@link HandlerResult.NoMatch}
     */
    HandlerResult handle(String operationName, OMElement envelope, MessageInfo info);
}
