package com.questrail.soapd.wsdl;

import com.questrail.soapd.api.HandlerResult;
import com.questrail.soapd.api.MessageInfo;
import com.questrail.soapd.api.OperationHandler;
import com.questrail.soapd.api.ProtocolVersion;
import com.questrail.soapd.api.SelectionStrategy;
import com.questrail.soapd.api.SoapEnvelopes;
import com.questrail.soapd.api.SoapNamespaces;
import org.apache.axiom.om.OMElement;
import org.apache.axiom.om.OMFactory;
import org.apache.axiom.om.OMNamespace;

import javax.xml.namespace.QName;
import java.util.Objects;
import java.util.Optional;

/**
 * ElementMatchingHandlerCompiler
 * -----------------------------------------------------------------------------
 * Default {@link HandlerCompiler}: recognises a request by the qualified name
 * of its first body element and wraps the callback's reply into a response
 * envelope.
 *
 * <h2>Recognition</h2>
 * <ul>
 *   <li>When the operation declares a request element, the first body
 *       element must carry exactly that name; anything else is declined.</li>
 *   <li>Without a request element the body cannot be checked. Such an
 *       operation only accepts messages routed to it by an action header,
 *       never during the exhaustive trial of all operations, where it would
 *       swallow every message.</li>
 * </ul>
 *
 * <h2>Response</h2>
 * The reply body goes into an envelope of the request's SOAP version. A fault
 * reply becomes a SOAP Fault. When the request used WS-Addressing the
 * response carries {@code wsa:Action} (the operation's output action) and
 * {@code wsa:RelatesTo} (the request's {@code wsa:MessageID}), in the
 * addressing namespace of the request.
 */
public final class ElementMatchingHandlerCompiler implements HandlerCompiler
{
    @Override
    public OperationHandler compile(OperationDefinition operation, OperationCallback callback) {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(callback, "callback");

        return (name, envelope, info) -> {
            Optional<OMElement> body = SoapEnvelopes.firstBodyElement(envelope);
            if (!accepts(operation, body, info)) {
                return HandlerResult.noMatch();
            }

            OperationReply reply = callback.handle(new OperationRequest(operation, envelope, body, info));
            if (reply == null) {
                throw new IllegalStateException("callback of operation '" + name + "' returned no reply");
            }

            OMElement response = reply.isFault()
                    ? faultEnvelope(info.version(), reply)
                    : answerEnvelope(info.version(), reply);
            addAddressingHeaders(response, operation, info, reply.isFault());
            return HandlerResult.matched(reply.statusCode(), reply.statusText(), response);
        };
    }

    static boolean accepts(OperationDefinition operation, Optional<OMElement> body, MessageInfo info) {
        if (operation.requestElement().isEmpty()) {
            return info.selectedBy() != SelectionStrategy.ATTEMPT_ALL;
        }
        return body.isPresent() && operation.requestElement().get().equals(body.get().getQName());
    }

    private static OMElement answerEnvelope(ProtocolVersion version, OperationReply reply) {
        return reply.body()
                .map(b -> SoapEnvelopes.wrap(version, b))
                .orElseGet(() -> SoapEnvelopes.create(version));
    }

    private static OMElement faultEnvelope(ProtocolVersion version, OperationReply reply) {
        String envNs = version.envelopeNamespace();
        QName code = reply.faultCode().orElse(new QName(envNs, version.receiverFaultCode()));

        if (version == ProtocolVersion.SOAP12 && !envNs.equals(code.getNamespaceURI())) {
            // SOAP 1.2 only allows its own codes at top level
            return SoapEnvelopes.fault(version, new QName(envNs, version.receiverFaultCode()), code,
                    reply.faultReason(), null);
        }
        return SoapEnvelopes.fault(version, code, null, reply.faultReason(), null);
    }

    private static void addAddressingHeaders(OMElement response,
                                             OperationDefinition operation,
                                             MessageInfo info,
                                             boolean fault) {
        if (info.wsaAction().isEmpty() && info.wsaMessageId().isEmpty()) {
            return;
        }
        Optional<String> action = fault ? Optional.empty() : operation.wsaOutputAction();
        if (action.isEmpty() && info.wsaMessageId().isEmpty()) {
            return;
        }

        OMFactory factory = SoapEnvelopes.factory();
        OMNamespace wsa = factory.createOMNamespace(addressingNamespace(info), "wsa");
        OMElement header = SoapEnvelopes.headerOrCreate(response);

        action.ifPresent(a -> factory.createOMElement("Action", wsa, header).setText(a));
        info.wsaMessageId().ifPresent(id -> factory.createOMElement("RelatesTo", wsa, header).setText(id));
    }

    private static String addressingNamespace(MessageInfo info) {
        for (QName h : info.headerElements()) {
            String ns = h.getNamespaceURI();
            if (SoapNamespaces.WSA_10.equals(ns) || SoapNamespaces.WSA_2004.equals(ns)) {
                return ns;
            }
        }
        return SoapNamespaces.WSA_10;
    }
}
