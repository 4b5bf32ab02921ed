package com.questrail.soapd.api;

import javax.xml.namespace.QName;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Structural metadata of one received SOAP message.
 *
 * <p>Created fresh for each request by the dispatcher, handed to every
 * handler it tries, and discarded once the response is produced. Instances
 * are immutable; the dispatcher derives a copy per resolution strategy with
 * {@link #selectedBy(SelectionStrategy)}.</p>
 *
 * @param version         protocol version resolved from the envelope namespace
 * @param headerElements  qualified names of the {@code Header} children, in order
 * @param bodyElements    qualified names of the {@code Body} children, in order
 * @param wsaAction       WS-Addressing {@code Action} header, if present
 * @param wsaMessageId    WS-Addressing {@code MessageID} header, if present
 * @param soapAction      normalized SOAPAction supplied by the transport, if any
 * @param selectedBy      strategy that selected the handler currently invoked
 * @param request         transport hints of the request
 */
public record MessageInfo(
        ProtocolVersion version,
        List<QName> headerElements,
        List<QName> bodyElements,
        Optional<String> wsaAction,
        Optional<String> wsaMessageId,
        Optional<String> soapAction,
        SelectionStrategy selectedBy,
        RequestMetadata request
) {
    public MessageInfo {
        Objects.requireNonNull(version, "version");
        headerElements = List.copyOf(headerElements);
        bodyElements = List.copyOf(bodyElements);
        Objects.requireNonNull(wsaAction, "wsaAction");
        Objects.requireNonNull(wsaMessageId, "wsaMessageId");
        Objects.requireNonNull(soapAction, "soapAction");
        Objects.requireNonNull(selectedBy, "selectedBy");
        Objects.requireNonNull(request, "request");
    }

    /**
     * Qualified name of the first body element; the usual "type" of a
     * document-style message.
     */
    public Optional<QName> bodyElement() {
        return bodyElements.isEmpty() ? Optional.empty() : Optional.of(bodyElements.get(0));
    }

    public MessageInfo selectedBy(SelectionStrategy strategy) {
        return new MessageInfo(version, headerElements, bodyElements, wsaAction,
                wsaMessageId, soapAction, strategy, request);
    }
}
