package com.questrail.soapd.observability;

/**
 * No-op implementation of DispatchObservabilitySink.
 */
public final class NullDispatchObservabilitySink implements DispatchObservabilitySink {
    public static final NullDispatchObservabilitySink INSTANCE = new NullDispatchObservabilitySink();

    private NullDispatchObservabilitySink() {}

    @Override
    public void onDispatch(DispatchCompletedEvent event) {}

    @Override
    public void onError(DispatchErrorEvent event) {}
}
