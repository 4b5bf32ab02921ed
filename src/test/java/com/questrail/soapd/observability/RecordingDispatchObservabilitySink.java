package com.questrail.soapd.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingDispatchObservabilitySink implements DispatchObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onDispatch(DispatchCompletedEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(DispatchErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<DispatchCompletedEvent> getDispatches() {
        return events.stream()
            .filter(e -> e instanceof DispatchCompletedEvent)
            .map(e -> (DispatchCompletedEvent) e)
            .collect(Collectors.toList());
    }

    public synchronized List<DispatchErrorEvent> getErrors() {
        return events.stream()
            .filter(e -> e instanceof DispatchErrorEvent)
            .map(e -> (DispatchErrorEvent) e)
            .collect(Collectors.toList());
    }
}
