package com.questrail.soapd.api;

/**
 * Stages a request passes through inside the dispatcher.
 *
 * <pre>
 *   RECEIVED → PARSED → VERSION_RESOLVED → OPERATION_RESOLVED
 *            → HANDLER_INVOKED → RESPONSE_READY
 * </pre>
 *
 * Any stage after {@link #RECEIVED} may exit to {@link #FAULT}. The state is
 * reported with each {@link DispatchResult} so that transports and
 * observability can tell where a request stopped.
 */
public enum DispatchState {
    RECEIVED,
    PARSED,
    VERSION_RESOLVED,
    OPERATION_RESOLVED,
    HANDLER_INVOKED,
    RESPONSE_READY,
    FAULT
}
