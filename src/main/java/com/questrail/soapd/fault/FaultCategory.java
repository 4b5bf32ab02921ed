package com.questrail.soapd.fault;

/**
 * Failure categories of the daemon, each with a fixed status and reason
 * phrase.
 *
 * <p>Status codes reuse HTTP numbering as a severity vocabulary only; the
 * core does not depend on HTTP, and a non-HTTP transport maps them onto its
 * own error space.</p>
 */
public enum FaultCategory {

    /** The body could not be parsed as XML. */
    INVALID_XML(422, "XML syntax error", null),

    /** Well-formed XML, but the root is not an {@code Envelope}. */
    NOT_SOAP_MESSAGE(403, "message not SOAP", null),

    /** The envelope namespace is not a supported SOAP version. */
    UNSUPPORTED_PROTOCOL_VERSION(501, "SOAP version not supported", null),

    /** Nothing matched, but operations exist under another SOAP version. */
    TRY_OTHER_PROTOCOL(303, "SOAP protocol not in use", "tryUpgrade"),

    /** No strategy matched any registered operation. */
    MESSAGE_NOT_RECOGNIZED(404, "message not recognized", "notRecognized"),

    /** The operation is only known from its description; nobody implemented it. */
    OPERATION_NOT_IMPLEMENTED(501, "procedure stub called", "notImplemented"),

    /** The selected handler threw. */
    HANDLER_FAILURE(500, "operation failed", "failed"),

    /** Transport only: the request method cannot carry a SOAP message. */
    METHOD_NOT_ALLOWED(405, "only POST or M-POST", null),

    /** Transport only: the request does not declare an XML content type. */
    NOT_ACCEPTABLE(406, "required is XML", null);

    private final int statusCode;
    private final String reason;
    private final String faultSubcode;

    FaultCategory(int statusCode, String reason, String faultSubcode) {
        this.statusCode = statusCode;
        this.reason = reason;
        this.faultSubcode = faultSubcode;
    }

    public int statusCode() {
        return statusCode;
    }

    public String reason() {
        return reason;
    }

    /**
     * Local name used in the SOAP fault code, or {@code null} for categories
     * that are answered before a SOAP version is known.
     */
    public String faultSubcode() {
        return faultSubcode;
    }
}
