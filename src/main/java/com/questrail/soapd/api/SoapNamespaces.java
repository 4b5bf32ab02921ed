package com.questrail.soapd.api;

/**
 * Namespace URIs and fixed names used across the daemon.
 */
public interface SoapNamespaces {

    /**
     * The namespace identifier for the SOAP 1.1 envelope.
     */
    String SOAP11_ENVELOPE = "http://schemas.xmlsoap.org/soap/envelope/";

    /**
     * The namespace identifier for the SOAP 1.2 envelope.
     */
    String SOAP12_ENVELOPE = "http://www.w3.org/2003/05/soap-envelope";

    /**
     * WS-Addressing 1.0 (W3C recommendation).
     */
    String WSA_10 = "http://www.w3.org/2005/08/addressing";

    /**
     * WS-Addressing member submission, still sent by older stacks.
     */
    String WSA_2004 = "http://schemas.xmlsoap.org/ws/2004/08/addressing";

    /**
     * WS-Addressing WSDL binding ({@code wsaw:Action}).
     */
    String WSAW = "http://www.w3.org/2006/05/addressing/wsdl";

    /**
     * WS-Addressing metadata ({@code wsam:Action}).
     */
    String WSAM = "http://www.w3.org/2007/05/addressing/metadata";

    String XML = "http://www.w3.org/XML/1998/namespace";

    /**
     * Namespace of the daemon's own fault subcodes.
     */
    String DAEMON_FAULT = "urn:questrail:soapd:fault";

    String ENVELOPE = "Envelope";
    String HEADER = "Header";
    String BODY = "Body";

    /**
     * Identifier of the SOAP extension in the HTTP Extension Framework
     * ({@code Man} header of an {@code M-POST}).
     */
    String HTTP_EXTENSION_ID = SOAP11_ENVELOPE;
}
