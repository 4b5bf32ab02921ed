package com.questrail.soapd.dispatch;

import com.questrail.soapd.api.DispatchResult;
import com.questrail.soapd.api.DispatchState;
import com.questrail.soapd.api.HandlerResult;
import com.questrail.soapd.api.MessageInfo;
import com.questrail.soapd.api.OperationHandler;
import com.questrail.soapd.api.ProtocolVersion;
import com.questrail.soapd.api.RequestMetadata;
import com.questrail.soapd.api.SelectionStrategy;
import com.questrail.soapd.api.SoapEnvelopes;
import com.questrail.soapd.api.SoapNamespaces;
import com.questrail.soapd.config.DispatcherConfig;
import com.questrail.soapd.fault.FaultDescriptor;
import com.questrail.soapd.fault.FaultSynthesizer;
import com.questrail.soapd.observability.DispatchCompletedEvent;
import com.questrail.soapd.observability.DispatchErrorEvent;
import com.questrail.soapd.observability.DispatchObservabilitySink;
import com.questrail.soapd.observability.NullDispatchObservabilitySink;
import com.questrail.soapd.registry.OperationRegistry;
import org.apache.axiom.om.OMContainer;
import org.apache.axiom.om.OMDocument;
import org.apache.axiom.om.OMElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;

/**
 * SoapDispatcher
 * -----------------------------------------------------------------------------
 * Turns one request body into exactly one {@link DispatchResult}.
 *
 * <h2>State machine</h2>
 * <pre>
 *   RECEIVED → PARSED → VERSION_RESOLVED → OPERATION_RESOLVED
 *            → HANDLER_INVOKED → RESPONSE_READY
 * </pre>
 * with an exit to {@link DispatchState#FAULT} from any state after
 * {@code RECEIVED}. The result records the state in which a fault happened.
 *
 * <h2>Operation resolution</h2>
 * Strategies are tried in a fixed order, and the first handler that answers
 * with {@link HandlerResult.Matched} wins:
 * <ol>
 *   <li>{@code wsa-action}: the WS-Addressing {@code Action} header, through
 *       the registry's WSA input table;</li>
 *   <li>{@code soap-action}: the transport's SOAPAction, through the
 *       registry's SOAPAction table;</li>
 *   <li>{@code attempt-all}: every handler of the resolved version, in
 *       registration order.</li>
 * </ol>
 * A selected handler may still decline with {@link HandlerResult.NoMatch}, in
 * which case resolution moves on.
 *
 * <p>The last strategy costs one handler call per registered operation for
 * every message that carries no usable action hint. Services exposed to
 * untrusted clients should publish actions in their WSDL and may switch it off
 * with {@link DispatcherConfig#acceptSlowSelect()}.</p>
 *
 * <h2>Failure policy</h2>
 * {@code dispatch} never throws. Unparseable input, unknown envelopes,
 * unroutable messages, handler failures and internal errors all become
 * fault results. Anything a handler throws counts, {@link Error}s included,
 * and ends resolution for that request.
 *
 * <p>Thread-safe: the dispatcher holds no per-request state and may be
 * shared by all transport workers.</p>
 */
public final class SoapDispatcher
{
    private static final Logger log = LoggerFactory.getLogger(SoapDispatcher.class);

    private final OperationRegistry registry;
    private final DispatcherConfig config;
    private final FaultSynthesizer faults;
    private final DispatchObservabilitySink sink;
    private final ActionExtractor actionExtractor = new ActionExtractor();
    private final EnvelopeParser parser = new EnvelopeParser();

    public SoapDispatcher(OperationRegistry registry) {
        this(registry, DispatcherConfig.defaults(), NullDispatchObservabilitySink.INSTANCE);
    }

    public SoapDispatcher(OperationRegistry registry,
                          DispatcherConfig config,
                          DispatchObservabilitySink sink) {
        this(registry, config, new FaultSynthesizer(), sink);
    }

    public SoapDispatcher(OperationRegistry registry,
                          DispatcherConfig config,
                          FaultSynthesizer faults,
                          DispatchObservabilitySink sink) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.config = Objects.requireNonNull(config, "config");
        this.faults = Objects.requireNonNull(faults, "faults");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    public OperationRegistry registry() {
        return registry;
    }

    public DispatcherConfig config() {
        return config;
    }

    // ---------------------------------------------------------------------
    // Entry points
    // ---------------------------------------------------------------------

    /**
     * Dispatches a raw body, taking the SOAPAction from the request headers.
     */
    public DispatchResult dispatch(byte[] body, RequestMetadata request) {
        RequestMetadata req = request == null ? RequestMetadata.none() : request;
        return dispatch(body, actionExtractor.extract(req).orElse(null), req);
    }

    /**
     * Dispatches a raw body.
     *
     * @param soapAction SOAPAction supplied by the transport, may be {@code null}
     */
    public DispatchResult dispatch(byte[] body, String soapAction, RequestMetadata request) {
        Progress p = new Progress(soapAction, request);
        try {
            OMElement root;
            try {
                root = parser.parse(body);
            } catch (InvalidXmlException e) {
                return p.fault(faults.invalidXml(e.getMessage()));
            }
            p.state = DispatchState.PARSED;
            return resolve(root, p);
        } catch (Throwable e) {
            return p.internalFailure(e);
        }
    }

    /**
     * Dispatches an already parsed document or element.
     */
    public DispatchResult dispatch(OMContainer xml, String soapAction, RequestMetadata request) {
        Progress p = new Progress(soapAction, request);
        try {
            OMElement root;
            if (xml instanceof OMDocument document) {
                root = document.getOMDocumentElement();
            } else if (xml instanceof OMElement element) {
                root = element;
            } else {
                root = null;
            }
            if (root == null) {
                return p.fault(faults.invalidXml("document has no root element"));
            }
            p.state = DispatchState.PARSED;
            return resolve(root, p);
        } catch (Throwable e) {
            return p.internalFailure(e);
        }
    }

    // ---------------------------------------------------------------------
    // Resolution
    // ---------------------------------------------------------------------

    private DispatchResult resolve(OMElement root, Progress p) {
        if (!SoapNamespaces.ENVELOPE.equals(root.getLocalName())) {
            return p.fault(faults.notSoapMessage(SoapEnvelopes.typeOf(root.getQName())));
        }

        String envNs = root.getQName().getNamespaceURI();
        Optional<ProtocolVersion> resolved = ProtocolVersion.fromEnvelopeNamespace(envNs)
                .filter(config.supportedVersions()::contains);
        if (resolved.isEmpty()) {
            return p.fault(faults.unsupportedProtocolVersion(envNs));
        }
        ProtocolVersion version = resolved.get();
        p.version = version;
        p.state = DispatchState.VERSION_RESOLVED;

        MessageInfo info = MessageStructure.describe(root, version, p.soapAction, p.request);

        // a. WS-Addressing
        if (info.wsaAction().isPresent()) {
            Optional<String> name = registry.lookupByWsaAction(info.wsaAction().get());
            if (name.isPresent()) {
                Optional<DispatchResult> r = attempt(name.get(), root, info.selectedBy(SelectionStrategy.WSA_ACTION), p);
                if (r.isPresent()) {
                    return r.get();
                }
            }
        }

        // b. SOAPAction
        if (info.soapAction().isPresent()) {
            Optional<String> name = registry.lookupBySoapAction(info.soapAction().get());
            if (name.isPresent()) {
                Optional<DispatchResult> r = attempt(name.get(), root, info.selectedBy(SelectionStrategy.SOAP_ACTION), p);
                if (r.isPresent()) {
                    return r.get();
                }
            }
        }

        // c. every operation of this version
        if (config.acceptSlowSelect()) {
            MessageInfo slow = info.selectedBy(SelectionStrategy.ATTEMPT_ALL);
            for (OperationRegistry.Registration reg : registry.handlers(version)) {
                Optional<DispatchResult> r = invoke(reg.name(), reg.handler(), root, slow, p);
                if (r.isPresent()) {
                    return r.get();
                }
            }
        }

        return unroutable(version, info, p);
    }

    private DispatchResult unroutable(ProtocolVersion version, MessageInfo info, Progress p) {
        String bodyType = info.bodyElement().map(SoapEnvelopes::typeOf).orElse(null);

        List<ProtocolVersion> others = new ArrayList<>();
        for (ProtocolVersion other : registry.versions()) {
            if (other != version && config.supportedVersions().contains(other)) {
                others.add(other);
            }
        }
        if (!others.isEmpty()) {
            return p.fault(faults.tryOtherProtocol(version, bodyType, others));
        }

        List<String> available = config.discloseOperations()
                ? new ArrayList<>(new TreeSet<>(registry.allNames(version)))
                : List.of();
        return p.fault(faults.messageNotRecognized(version, bodyType, info.soapAction(),
                available, config.discloseOperations()));
    }

    /**
     * Runs the handler registered under a name selected by an action table.
     */
    private Optional<DispatchResult> attempt(String name, OMElement root, MessageInfo info, Progress p) {
        Optional<OperationHandler> handler = registry.lookupByName(info.version(), name);
        if (handler.isEmpty()) {
            log.debug("{} selected '{}', which has no {} handler", info.selectedBy(), name, info.version());
            return Optional.empty();
        }
        return invoke(name, handler.get(), root, info, p);
    }

    /**
     * @return the final result when the handler answered or failed, empty
     *         when it declined the message
     */
    private Optional<DispatchResult> invoke(String name,
                                            OperationHandler handler,
                                            OMElement root,
                                            MessageInfo info,
                                            Progress p) {
        p.state = DispatchState.OPERATION_RESOLVED;
        p.operation = name;
        p.strategy = info.selectedBy();

        HandlerResult result;
        try {
            result = handler.handle(name, root, info);
        } catch (Throwable e) {
            p.state = DispatchState.HANDLER_INVOKED;
            p.error("handler of " + info.version() + " operation '" + name + "' failed", e);
            return Optional.of(p.fault(faults.handlerFailure(info.version(), name)));
        }
        p.state = DispatchState.HANDLER_INVOKED;

        if (result == null) {
            p.error("handler of " + info.version() + " operation '" + name + "' returned null", null);
            return Optional.of(p.fault(faults.handlerFailure(info.version(), name)));
        }
        if (result instanceof HandlerResult.Matched matched) {
            return Optional.of(p.answer(matched));
        }

        // declined: nothing is resolved yet
        p.state = DispatchState.VERSION_RESOLVED;
        p.operation = null;
        p.strategy = SelectionStrategy.NONE;
        return Optional.empty();
    }

    // ---------------------------------------------------------------------
    // Per-request bookkeeping
    // ---------------------------------------------------------------------

    /**
     * Mutable progress of one dispatch; confined to the calling thread.
     */
    private final class Progress
    {
        final long startNanos = System.nanoTime();
        final Optional<String> soapAction;
        final RequestMetadata request;

        DispatchState state = DispatchState.RECEIVED;
        ProtocolVersion version;
        String operation;
        SelectionStrategy strategy = SelectionStrategy.NONE;

        Progress(String soapAction, RequestMetadata request) {
            this.soapAction = ActionExtractor.normalize(soapAction);
            this.request = request == null ? RequestMetadata.none() : request;
        }

        DispatchResult answer(HandlerResult.Matched matched) {
            state = DispatchState.RESPONSE_READY;
            return complete(DispatchResult.answered(matched, strategy));
        }

        DispatchResult fault(FaultDescriptor fault) {
            return complete(fault.toResult(state, strategy));
        }

        DispatchResult internalFailure(Throwable e) {
            error("internal error in state " + state, e);
            return fault(faults.internalFailure(Optional.ofNullable(version)));
        }

        void error(String message, Throwable cause) {
            if (cause == null) {
                log.error(message);
            } else {
                log.error(message, cause);
            }
            try {
                sink.onError(new DispatchErrorEvent(Instant.now(), message, cause));
            } catch (RuntimeException e) {
                log.warn("observability sink rejected error event: {}", message, e);
            }
        }

        private DispatchResult complete(DispatchResult result) {
            DispatchCompletedEvent event = new DispatchCompletedEvent(
                    Instant.now(),
                    Optional.ofNullable(version),
                    result.isFault() ? Optional.empty() : Optional.ofNullable(operation),
                    result.selectedBy(),
                    result.statusCode(),
                    result.statusText(),
                    result.finalState(),
                    result.failedIn(),
                    Duration.ofNanos(System.nanoTime() - startNanos)
            );
            try {
                sink.onDispatch(event);
            } catch (RuntimeException e) {
                log.warn("observability sink rejected dispatch event", e);
            }
            return result;
        }
    }
}
