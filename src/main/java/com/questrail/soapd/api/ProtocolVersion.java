package com.questrail.soapd.api;

import java.util.Objects;
import java.util.Optional;

/**
 * SOAP protocol versions understood by the daemon.
 *
 * <p>A version is identified solely by the namespace URI of the received
 * {@code Envelope} element. Each constant also carries the wire details that
 * differ between versions: the preferred envelope prefix, the media type used
 * when the message travels over HTTP, and the local names of the fault
 * structure.</p>
 */
public enum ProtocolVersion {

    SOAP11(SoapNamespaces.SOAP11_ENVELOPE, "SOAP-ENV", "text/xml; charset=\"utf-8\"", "Server"),
    SOAP12(SoapNamespaces.SOAP12_ENVELOPE, "env", "application/soap+xml; charset=utf-8", "Receiver");

    private final String envelopeNamespace;
    private final String preferredPrefix;
    private final String mediaType;
    private final String receiverFaultCode;

    ProtocolVersion(String envelopeNamespace,
                    String preferredPrefix,
                    String mediaType,
                    String receiverFaultCode) {
        this.envelopeNamespace = envelopeNamespace;
        this.preferredPrefix = preferredPrefix;
        this.mediaType = mediaType;
        this.receiverFaultCode = receiverFaultCode;
    }

    public String envelopeNamespace() {
        return envelopeNamespace;
    }

    public String preferredPrefix() {
        return preferredPrefix;
    }

    /**
     * Content type for messages of this version over HTTP.
     */
    public String mediaType() {
        return mediaType;
    }

    /**
     * Local name of the fault code signalling a receiver-side problem
     * ({@code Server} in 1.1, {@code Receiver} in 1.2).
     */
    public String receiverFaultCode() {
        return receiverFaultCode;
    }

    /**
     * Resolves the version whose envelope lives in the given namespace.
     *
     * @param namespaceUri envelope namespace, may be {@code null}
     * @return the matching version, or empty for unknown namespaces
     */
    public static Optional<ProtocolVersion> fromEnvelopeNamespace(String namespaceUri) {
        for (ProtocolVersion v : values()) {
            if (Objects.equals(v.envelopeNamespace, namespaceUri)) {
                return Optional.of(v);
            }
        }
        return Optional.empty();
    }
}
