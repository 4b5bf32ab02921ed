package com.questrail.soapd.api;

import org.apache.axiom.om.OMAbstractFactory;
import org.apache.axiom.om.OMElement;
import org.apache.axiom.om.OMFactory;
import org.apache.axiom.om.OMNamespace;
import org.apache.axiom.om.OMNode;

import javax.xml.namespace.QName;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Helpers to build and take apart SOAP envelopes on top of the Axiom object
 * model.
 *
 * <p>Only the envelope skeleton is handled here ({@code Envelope},
 * {@code Header}, {@code Body}, {@code Fault}); message content is the
 * business of operation handlers.</p>
 */
public final class SoapEnvelopes {

    private static final OMFactory FACTORY = OMAbstractFactory.getOMFactory();

    private SoapEnvelopes() {}

    public static OMFactory factory() {
        return FACTORY;
    }

    /**
     * Creates an empty {@code Envelope} with a {@code Body} for the given version.
     */
    public static OMElement create(ProtocolVersion version) {
        Objects.requireNonNull(version, "version");
        OMNamespace ns = FACTORY.createOMNamespace(version.envelopeNamespace(), version.preferredPrefix());
        OMElement envelope = FACTORY.createOMElement(SoapNamespaces.ENVELOPE, ns);
        FACTORY.createOMElement(SoapNamespaces.BODY, ns, envelope);
        return envelope;
    }

    /**
     * Creates an envelope whose body carries the given element.
     * The element is detached from any tree it belonged to.
     */
    public static OMElement wrap(ProtocolVersion version, OMElement bodyContent) {
        OMElement envelope = create(version);
        body(envelope).orElseThrow().addChild(bodyContent);
        return envelope;
    }

    public static Optional<OMElement> body(OMElement envelope) {
        return child(envelope, SoapNamespaces.BODY);
    }

    public static Optional<OMElement> header(OMElement envelope) {
        return child(envelope, SoapNamespaces.HEADER);
    }

    /**
     * Returns the {@code Header} of an envelope, inserting one in front of
     * the {@code Body} when missing.
     */
    public static OMElement headerOrCreate(OMElement envelope) {
        Optional<OMElement> existing = header(envelope);
        if (existing.isPresent()) {
            return existing.get();
        }
        OMElement header = FACTORY.createOMElement(SoapNamespaces.HEADER, envelope.getNamespace());
        Optional<OMElement> body = body(envelope);
        if (body.isPresent()) {
            body.get().insertSiblingBefore(header);
        } else {
            envelope.addChild(header);
        }
        return header;
    }

    private static Optional<OMElement> child(OMElement envelope, String localName) {
        QName name = new QName(envelope.getQName().getNamespaceURI(), localName);
        return Optional.ofNullable(envelope.getFirstChildWithName(name));
    }

    /**
     * Child elements of an element, in document order.
     */
    public static List<OMElement> children(OMElement parent) {
        List<OMElement> out = new ArrayList<>();
        if (parent == null) {
            return out;
        }
        for (OMNode node = parent.getFirstOMChild(); node != null; node = node.getNextOMSibling()) {
            if (node instanceof OMElement el) {
                out.add(el);
            }
        }
        return out;
    }

    /**
     * First element in the body, the "payload" of a document-style message.
     */
    public static Optional<OMElement> firstBodyElement(OMElement envelope) {
        return body(envelope).map(OMElement::getFirstElement);
    }

    /**
     * Clark notation of a qualified name: {@code {namespace}local}, or just
     * {@code local} when the name has no namespace.
     */
    public static String typeOf(QName name) {
        if (name == null) {
            return "(none)";
        }
        String uri = name.getNamespaceURI();
        return uri == null || uri.isEmpty() ? name.getLocalPart() : "{" + uri + "}" + name.getLocalPart();
    }

    /**
     * Whether the body of an envelope holds a SOAP {@code Fault}.
     */
    public static boolean isFault(OMElement envelope) {
        return firstBodyElement(envelope)
                .map(el -> "Fault".equals(el.getLocalName())
                        && Objects.equals(el.getQName().getNamespaceURI(), envelope.getQName().getNamespaceURI()))
                .orElse(false);
    }

    /**
     * Builds a complete fault envelope.
     *
     * <p>For SOAP 1.1 the code is {@code Server.<subcode>}; for SOAP 1.2 it is
     * {@code Receiver} with {@code <subcode>} as subcode in the daemon's
     * fault namespace.</p>
     *
     * @param version the protocol version of the request being answered
     * @param subcode short machine-readable reason, e.g. {@code notRecognized}
     * @param reason  human-readable explanation
     * @param detail  optional extra text, placed in the fault detail
     */
    public static OMElement fault(ProtocolVersion version, String subcode, String reason, String detail) {
        String code = version == ProtocolVersion.SOAP11 && subcode != null
                ? version.receiverFaultCode() + "." + subcode
                : version.receiverFaultCode();
        return fault(version, new QName(version.envelopeNamespace(), code),
                version == ProtocolVersion.SOAP12 && subcode != null
                        ? new QName(SoapNamespaces.DAEMON_FAULT, subcode) : null,
                reason, detail);
    }

    /**
     * Builds a fault envelope from an explicit code.
     *
     * @param code    fault code; its namespace is declared on the fault when needed
     * @param subcode SOAP 1.2 subcode, ignored for SOAP 1.1
     */
    public static OMElement fault(ProtocolVersion version, QName code, QName subcode, String reason, String detail) {
        OMElement envelope = create(version);
        OMNamespace env = envelope.getNamespace();
        OMElement body = body(envelope).orElseThrow();
        OMElement fault = FACTORY.createOMElement("Fault", env, body);
        String text = reason == null ? "" : reason;

        if (version == ProtocolVersion.SOAP11) {
            OMElement faultcode = FACTORY.createOMElement("faultcode", null, fault);
            faultcode.setText(prefixed(fault, code));
            OMElement faultstring = FACTORY.createOMElement("faultstring", null, fault);
            faultstring.setText(text);
            if (detail != null && !detail.isEmpty()) {
                OMElement detailEl = FACTORY.createOMElement("detail", null, fault);
                detailEl.setText(detail);
            }
        } else {
            OMElement codeEl = FACTORY.createOMElement("Code", env, fault);
            OMElement value = FACTORY.createOMElement("Value", env, codeEl);
            value.setText(prefixed(fault, code));
            if (subcode != null) {
                OMElement sub = FACTORY.createOMElement("Subcode", env, codeEl);
                OMElement subValue = FACTORY.createOMElement("Value", env, sub);
                subValue.setText(prefixed(fault, subcode));
            }
            OMElement reasonEl = FACTORY.createOMElement("Reason", env, fault);
            OMElement reasonText = FACTORY.createOMElement("Text", env, reasonEl);
            reasonText.addAttribute("lang", "en", FACTORY.createOMNamespace(SoapNamespaces.XML, "xml"));
            reasonText.setText(text);
            if (detail != null && !detail.isEmpty()) {
                OMElement detailEl = FACTORY.createOMElement("Detail", env, fault);
                detailEl.setText(detail);
            }
        }
        return envelope;
    }

    private static String prefixed(OMElement scope, QName name) {
        String uri = name.getNamespaceURI();
        if (uri == null || uri.isEmpty()) {
            return name.getLocalPart();
        }
        OMNamespace ns = scope.findNamespaceURI(prefixHint(name));
        if (ns == null || !uri.equals(ns.getNamespaceURI())) {
            ns = scope.declareNamespace(uri, prefixHint(name));
        }
        return ns.getPrefix() + ":" + name.getLocalPart();
    }

    private static String prefixHint(QName name) {
        String prefix = name.getPrefix();
        if (prefix != null && !prefix.isEmpty()) {
            return prefix;
        }
        ProtocolVersion version = ProtocolVersion.fromEnvelopeNamespace(name.getNamespaceURI()).orElse(null);
        if (version != null) {
            return version.preferredPrefix();
        }
        return SoapNamespaces.DAEMON_FAULT.equals(name.getNamespaceURI()) ? "sd" : "ns";
    }
}
