package com.questrail.soapd.api;

/**
 * How the dispatcher selected the handler that answered a message.
 *
 * <p>The order of the constants after {@link #NONE} is the order in which
 * the dispatcher tries the strategies.</p>
 */
public enum SelectionStrategy {

    /** No handler has been selected (yet). */
    NONE("none"),

    /** Reverse lookup of the WS-Addressing {@code Action} header. */
    WSA_ACTION("wsa-action"),

    /** Reverse lookup of the transport's SOAPAction value. */
    SOAP_ACTION("soap-action"),

    /** Every registered operation tried in turn. */
    ATTEMPT_ALL("attempt-all");

    private final String label;

    SelectionStrategy(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
