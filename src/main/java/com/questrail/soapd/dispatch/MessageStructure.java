package com.questrail.soapd.dispatch;

import com.questrail.soapd.api.MessageInfo;
import com.questrail.soapd.api.ProtocolVersion;
import com.questrail.soapd.api.RequestMetadata;
import com.questrail.soapd.api.SelectionStrategy;
import com.questrail.soapd.api.SoapEnvelopes;
import com.questrail.soapd.api.SoapNamespaces;
import org.apache.axiom.om.OMElement;

import javax.xml.namespace.QName;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Reads the structural metadata of a SOAP envelope into a {@link MessageInfo}.
 *
 * <p>Only the skeleton is inspected: the names of header and body children,
 * and the WS-Addressing {@code Action} and {@code MessageID} headers (both
 * the W3C and the 2004 member-submission namespaces are recognised). Message
 * content is left alone.</p>
 */
final class MessageStructure
{
    private static final Set<String> WSA_NAMESPACES = Set.of(SoapNamespaces.WSA_10, SoapNamespaces.WSA_2004);

    private MessageStructure() {}

    static MessageInfo describe(OMElement envelope,
                                ProtocolVersion version,
                                Optional<String> soapAction,
                                RequestMetadata request) {

        List<OMElement> headers = SoapEnvelopes.header(envelope)
                .map(SoapEnvelopes::children)
                .orElse(List.of());

        List<QName> bodyElements = SoapEnvelopes.body(envelope)
                .map(SoapEnvelopes::children)
                .orElse(List.of())
                .stream()
                .map(OMElement::getQName)
                .toList();

        return new MessageInfo(
                version,
                headers.stream().map(OMElement::getQName).toList(),
                bodyElements,
                addressingHeader(headers, "Action"),
                addressingHeader(headers, "MessageID"),
                soapAction,
                SelectionStrategy.NONE,
                request
        );
    }

    private static Optional<String> addressingHeader(List<OMElement> headers, String localName) {
        for (OMElement h : headers) {
            QName name = h.getQName();
            if (localName.equals(name.getLocalPart()) && WSA_NAMESPACES.contains(name.getNamespaceURI())) {
                String text = h.getText();
                if (text != null && !text.isBlank()) {
                    return Optional.of(text.strip());
                }
            }
        }
        return Optional.empty();
    }
}
