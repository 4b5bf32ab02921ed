package com.questrail.soapd.fault;

import com.questrail.soapd.api.ProtocolVersion;
import com.questrail.soapd.api.SoapEnvelopes;
import org.apache.axiom.om.OMElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * FaultSynthesizer
 * -----------------------------------------------------------------------------
 * Builds the {@link FaultDescriptor} for every failure the daemon reports.
 *
 * <p>Stateless and safe to share. It never throws; if a SOAP Fault envelope
 * cannot be built, the failure is logged and the descriptor is returned with
 * its text only.</p>
 *
 * <p>Failures detected before the SOAP version is known (unparseable XML, a
 * root that is not an {@code Envelope}, an unknown envelope namespace) have
 * no envelope: the daemon cannot speak a protocol it did not recognise. All
 * later failures carry a Fault in the request's own version.</p>
 */
public final class FaultSynthesizer
{
    private static final Logger log = LoggerFactory.getLogger(FaultSynthesizer.class);

    public FaultDescriptor invalidXml(String parseError) {
        return textOnly(FaultCategory.INVALID_XML,
                "The XML cannot be parsed: " + orUnknown(parseError));
    }

    /**
     * @param rootType qualified name of the actual root element, Clark notation
     */
    public FaultDescriptor notSoapMessage(String rootType) {
        return textOnly(FaultCategory.NOT_SOAP_MESSAGE,
                "The message was XML, but not SOAP; not an Envelope but '" + orUnknown(rootType) + "'");
    }

    public FaultDescriptor unsupportedProtocolVersion(String envelopeNamespace) {
        return textOnly(FaultCategory.UNSUPPORTED_PROTOCOL_VERSION,
                "The soap version '" + (envelopeNamespace == null ? "" : envelopeNamespace) + "' is not supported");
    }

    /**
     * @param bodyElement type of the first body element, Clark notation
     * @param others      versions that do have operations, sorted
     */
    public FaultDescriptor tryOtherProtocol(ProtocolVersion version, String bodyElement, List<ProtocolVersion> others) {
        String alternatives = others.stream().map(Enum::name).collect(Collectors.joining(", "));
        String text = "body element " + orNone(bodyElement) + " not available in " + version
                + ", try " + alternatives;
        return withEnvelope(FaultCategory.TRY_OTHER_PROTOCOL, version, text);
    }

    /**
     * @param available registered operation names to disclose, sorted; empty
     *                  when no disclosure is wanted
     * @param disclose  whether {@code available} may be shown at all
     */
    public FaultDescriptor messageNotRecognized(ProtocolVersion version,
                                                String bodyElement,
                                                Optional<String> soapAction,
                                                List<String> available,
                                                boolean disclose) {
        String text;
        if (!disclose) {
            text = version + " body element " + orNone(bodyElement) + " not recognized";
        } else if (available.isEmpty()) {
            text = version + " there are no handlers available, so also not for " + orNone(bodyElement);
        } else {
            text = version + " body element " + orNone(bodyElement)
                    + " not recognized, available ports are " + String.join(", ", available);
        }
        if (soapAction.isPresent() && !soapAction.get().isEmpty()) {
            text += "\nsoapAction " + soapAction.get();
        }
        return withEnvelope(FaultCategory.MESSAGE_NOT_RECOGNIZED, version, text);
    }

    public FaultDescriptor operationNotImplemented(ProtocolVersion version, String operationName) {
        return withEnvelope(FaultCategory.OPERATION_NOT_IMPLEMENTED, version,
                "procedure " + operationName + " for " + version + " is not yet implemented");
    }

    /**
     * A handler threw. The cause is not exposed to the client; callers log it.
     */
    public FaultDescriptor handlerFailure(ProtocolVersion version, String operationName) {
        return withEnvelope(FaultCategory.HANDLER_FAILURE, version,
                "procedure " + operationName + " for " + version + " failed unexpectedly");
    }

    /**
     * Something failed inside the daemon itself, outside any handler.
     */
    public FaultDescriptor internalFailure(Optional<ProtocolVersion> version) {
        String text = "internal error while dispatching the message";
        return version.isPresent()
                ? withEnvelope(FaultCategory.HANDLER_FAILURE, version.get(), text)
                : textOnly(FaultCategory.HANDLER_FAILURE, text);
    }

    public FaultDescriptor methodNotAllowed(String method) {
        return textOnly(FaultCategory.METHOD_NOT_ALLOWED, "attempt to connect via " + orUnknown(method));
    }

    public FaultDescriptor notAcceptable(String mediaType) {
        return textOnly(FaultCategory.NOT_ACCEPTABLE,
                "content-type seems to be " + orUnknown(mediaType) + ", must be some XML");
    }

    // ---------------------------------------------------------------------

    private static FaultDescriptor textOnly(FaultCategory category, String text) {
        return new FaultDescriptor(category, category.statusCode(), category.reason(), text, Optional.empty());
    }

    private static FaultDescriptor withEnvelope(FaultCategory category, ProtocolVersion version, String text) {
        Optional<OMElement> envelope;
        try {
            envelope = Optional.of(SoapEnvelopes.fault(version, category.faultSubcode(), text, null));
        } catch (RuntimeException e) {
            log.warn("cannot build {} fault envelope for {}, answering with text only", version, category, e);
            envelope = Optional.empty();
        }
        return new FaultDescriptor(category, category.statusCode(), category.reason(), text, envelope);
    }

    private static String orNone(String s) {
        return s == null || s.isEmpty() ? "(none)" : s;
    }

    private static String orUnknown(String s) {
        return s == null || s.isEmpty() ? "unknown" : s;
    }
}
