package com.questrail.soapd.observability;

/**
 * Receives observability events from the dispatcher.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface DispatchObservabilitySink {
    /**
     * Called once per dispatched request, after its answer is known.
     * @param event outcome of the request
     */
    void onDispatch(DispatchCompletedEvent event);

    /**
     * Called when a handler, or the dispatcher itself, fails unexpectedly.
     * @param event the error event
     */
    void onError(DispatchErrorEvent event);
}
