package com.questrail.soapd.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of DispatchObservabilitySink that emits logs via SLF4J.
 *
 * <p>Successful dispatches are logged at trace, faults at info; neither
 * includes message content.</p>
 */
public final class Slf4jDispatchObservabilitySink implements DispatchObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jDispatchObservabilitySink.class);

    @Override
    public void onDispatch(DispatchCompletedEvent event) {
        if (event.isFault()) {
            log.info("SOAP fault {} {} (stopped in {}, {} ms)",
                event.statusCode(),
                event.statusText(),
                event.failedIn(),
                event.elapsed().toMillis());
            return;
        }

        if (log.isTraceEnabled()) {
            log.trace("data ready for {} {}, via {} ({} ms)",
                event.version().map(Enum::name).orElse("?"),
                event.operation().orElse("?"),
                event.selectedBy(),
                event.elapsed().toMillis());
        }
    }

    @Override
    public void onError(DispatchErrorEvent event) {
        log.error("SOAP dispatch error: {}", event.message(), event.cause());
    }
}
