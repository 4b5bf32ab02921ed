package com.questrail.soapd.api;

import org.apache.axiom.om.OMElement;

import java.util.Objects;

/**
 * Outcome of offering a message to an {@link OperationHandler}.
 *
 * <p>A handler either claims the message and answers it ({@link Matched}),
 * or declines it ({@link NoMatch}) so that the dispatcher moves on to its
 * next resolution strategy. Declining is not an error: several operations
 * may share an action, and only the handler can tell by looking at the body
 * whether the message is really its own.</p>
 */
public sealed interface HandlerResult permits HandlerResult.Matched, HandlerResult.NoMatch {

    static HandlerResult matched(int statusCode, String statusText, OMElement payload) {
        return new Matched(statusCode, statusText, payload);
    }

    static HandlerResult ok(OMElement payload) {
        return new Matched(200, "OK", payload);
    }

    static HandlerResult noMatch() {
        return NoMatch.INSTANCE;
    }

    /**
     * The handler recognised the message and produced an answer.
     *
     * @param statusCode transport-neutral status (HTTP numbering)
     * @param statusText short reason phrase
     * @param payload    the complete response envelope
     */
    record Matched(int statusCode, String statusText, OMElement payload) implements HandlerResult {
        public Matched {
            Objects.requireNonNull(statusText, "statusText");
            Objects.requireNonNull(payload, "payload");
        }
    }

    /**
     * The message is not for this handler.
     */
    enum NoMatch implements HandlerResult {
        INSTANCE
    }
}
