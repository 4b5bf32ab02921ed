package com.questrail.soapd.dispatch;

import com.questrail.soapd.api.DispatchResult;
import com.questrail.soapd.api.DispatchState;
import com.questrail.soapd.api.HandlerResult;
import com.questrail.soapd.api.ProtocolVersion;
import com.questrail.soapd.api.RequestMetadata;
import com.questrail.soapd.api.SelectionStrategy;
import com.questrail.soapd.api.SoapEnvelopes;
import com.questrail.soapd.api.SoapNamespaces;
import com.questrail.soapd.config.DispatcherConfig;
import com.questrail.soapd.observability.DispatchCompletedEvent;
import com.questrail.soapd.observability.DispatchErrorEvent;
import com.questrail.soapd.observability.DispatchObservabilitySink;
import com.questrail.soapd.observability.RecordingDispatchObservabilitySink;
import com.questrail.soapd.registry.ActionDirection;
import com.questrail.soapd.registry.OperationRegistry;
import com.questrail.soapd.test.TestEnvelopes.AnsweringHandler;
import com.questrail.soapd.test.TestEnvelopes.DecliningHandler;
import org.apache.axiom.om.OMDocument;
import org.apache.axiom.om.OMElement;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.questrail.soapd.api.ProtocolVersion.SOAP11;
import static com.questrail.soapd.api.ProtocolVersion.SOAP12;
import static com.questrail.soapd.test.TestEnvelopes.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * SoapDispatcherTest
 * -----------------------------------------------------------------------------
 * Behaviour of the dispatch state machine, from raw bytes to result.
 */
class SoapDispatcherTest {

    private OperationRegistry registry;
    private RecordingDispatchObservabilitySink sink;

    @BeforeEach
    void setUp() {
        registry = new OperationRegistry();
        sink = new RecordingDispatchObservabilitySink();
    }

    private SoapDispatcher dispatcher() {
        return dispatcher(DispatcherConfig.defaults());
    }

    private SoapDispatcher dispatcher(DispatcherConfig config) {
        return new SoapDispatcher(registry, config, sink);
    }

    private DispatchResult dispatch(String xml) {
        return dispatcher().dispatch(bytes(xml), null, RequestMetadata.none());
    }

    private static String bodyLocalName(DispatchResult result) {
        OMElement envelope = result.payload().orElseThrow();
        return SoapEnvelopes.firstBodyElement(envelope).orElseThrow().getLocalName();
    }

    // ---------------------------------------------------------------------
    // Parsing and version negotiation
    // ---------------------------------------------------------------------

    @Test
    void malformedXmlIsRejected() {
        DispatchResult r = dispatch("<env:Envelope xmlns:env='" + SoapNamespaces.SOAP11_ENVELOPE + "'><env:Body>");

        assertEquals(422, r.statusCode());
        assertEquals("XML syntax error", r.statusText());
        assertTrue(r.payload().isEmpty());
        assertTrue(r.errorDetail().startsWith("The XML cannot be parsed: "), r.errorDetail());
        assertEquals(DispatchState.FAULT, r.finalState());
        assertEquals(DispatchState.RECEIVED, r.failedIn());
    }

    @Test
    void emptyBodyIsRejectedAsInvalidXml() {
        DispatchResult r = dispatcher().dispatch(new byte[0], null, RequestMetadata.none());
        assertEquals(422, r.statusCode());
    }

    @Test
    void documentTypeDeclarationsAreRefused() {
        String xml = "<!DOCTYPE x [<!ENTITY e 'boom'>]>" + soap11("<x>&e;</x>");
        assertEquals(422, dispatch(xml).statusCode());
    }

    @Test
    void nonEnvelopeRootIsNotSoap() {
        DispatchResult r = dispatch("<n:getInfo xmlns:n='urn:example:names'/>");

        assertEquals(403, r.statusCode());
        assertEquals("message not SOAP", r.statusText());
        assertTrue(r.errorDetail().contains("{urn:example:names}getInfo"), r.errorDetail());
        assertEquals(DispatchState.PARSED, r.failedIn());
    }

    @Test
    void unknownEnvelopeNamespaceIsUnsupported() {
        DispatchResult r = dispatch("<Envelope xmlns='urn:not-soap'><Body/></Envelope>");

        assertEquals(501, r.statusCode());
        assertEquals("SOAP version not supported", r.statusText());
        assertTrue(r.errorDetail().contains("urn:not-soap"));
        assertTrue(r.payload().isEmpty());
    }

    @Test
    void disabledVersionIsUnsupported() {
        registry.register(SOAP12, "getInfo", new AnsweringHandler("getInfo"));
        DispatcherConfig soap11Only = DispatcherConfig.builder()
                .withSupportedVersions(Set.of(SOAP11))
                .build();

        DispatchResult r = dispatcher(soap11Only).dispatch(bytes(soap12(request("getInfo"))), null,
                RequestMetadata.none());

        assertEquals(501, r.statusCode());
    }

    // ---------------------------------------------------------------------
    // Resolution strategies
    // ---------------------------------------------------------------------

    @Test
    void wsAddressingTakesPriorityOverSoapAction() {
        AnsweringHandler a = new AnsweringHandler("getInfo");
        AnsweringHandler b = new AnsweringHandler("getInfo");
        registry.register(SOAP11, "A", a);
        registry.register(SOAP11, "B", b);
        registry.addActionMapping(ActionDirection.INPUT, Map.of("A", "urn:a"));
        registry.addSoapActionMapping(Map.of("B", "act-b"));

        String xml = soap11(wsaAction("urn:a"), request("getInfo"));
        DispatchResult r = dispatcher().dispatch(bytes(xml), "act-b", RequestMetadata.none());

        assertEquals(200, r.statusCode());
        assertEquals(SelectionStrategy.WSA_ACTION, r.selectedBy());
        assertEquals(List.of("A/wsa-action"), a.calls());
        assertFalse(b.invoked());
    }

    @Test
    void soapActionSelectsWhenNoAddressingHeader() {
        AnsweringHandler a = new AnsweringHandler("getInfo");
        AnsweringHandler b = new AnsweringHandler("getInfo");
        registry.register(SOAP11, "A", a);
        registry.register(SOAP11, "B", b);
        registry.addActionMapping(ActionDirection.INPUT, Map.of("A", "urn:a"));
        registry.addSoapActionMapping(Map.of("B", "act-b"));

        DispatchResult r = dispatcher().dispatch(bytes(soap11(request("getInfo"))), "\"act-b\"",
                RequestMetadata.none());

        assertEquals(200, r.statusCode());
        assertEquals(SelectionStrategy.SOAP_ACTION, r.selectedBy());
        assertFalse(a.invoked());
        assertEquals(List.of("B/soap-action"), b.calls());
    }

    @Test
    void attemptAllFindsTheOperationWithoutHints() {
        AnsweringHandler getInfo = new AnsweringHandler("getInfo");
        registry.register(SOAP11, "getInfo", getInfo);

        DispatchResult r = dispatch(soap11(request("getInfo")));

        assertEquals(200, r.statusCode());
        assertEquals("OK", r.statusText());
        assertEquals("getInfoResponse", bodyLocalName(r));
        assertEquals(SelectionStrategy.ATTEMPT_ALL, r.selectedBy());
        assertEquals(DispatchState.RESPONSE_READY, r.finalState());
        assertEquals(SOAP11, r.payloadVersion().orElseThrow());
    }

    @Test
    void attemptAllTriesHandlersInRegistrationOrder() {
        DecliningHandler first = new DecliningHandler();
        AnsweringHandler second = new AnsweringHandler("getInfo");
        DecliningHandler third = new DecliningHandler();
        registry.register(SOAP11, "first", first);
        registry.register(SOAP11, "second", second);
        registry.register(SOAP11, "third", third);

        DispatchResult r = dispatch(soap11(request("getInfo")));

        assertEquals(200, r.statusCode());
        assertEquals(List.of("first/attempt-all"), first.calls());
        assertTrue(third.calls().isEmpty());
    }

    @Test
    void declinedActionMatchFallsThroughToNextStrategy() {
        DecliningHandler byAction = new DecliningHandler();
        AnsweringHandler getInfo = new AnsweringHandler("getInfo");
        registry.register(SOAP11, "byAction", byAction);
        registry.register(SOAP11, "getInfo", getInfo);
        registry.addActionMapping(ActionDirection.INPUT, Map.of("byAction", "urn:shared"));

        DispatchResult r = dispatch(soap11(wsaAction("urn:shared"), request("getInfo")));

        assertEquals(200, r.statusCode());
        assertEquals(SelectionStrategy.ATTEMPT_ALL, r.selectedBy());
        assertEquals(List.of("byAction/wsa-action", "byAction/attempt-all"), byAction.calls());
    }

    @Test
    void actionNamingOperationOfOtherVersionIsSkipped() {
        AnsweringHandler soap12Only = new AnsweringHandler("getInfo");
        AnsweringHandler getInfo = new AnsweringHandler("getInfo");
        registry.register(SOAP12, "special", soap12Only);
        registry.register(SOAP11, "getInfo", getInfo);
        registry.addSoapActionMapping(Map.of("special", "act-special"));

        DispatchResult r = dispatcher().dispatch(bytes(soap11(request("getInfo"))), "act-special",
                RequestMetadata.none());

        assertEquals(200, r.statusCode());
        assertEquals(SelectionStrategy.ATTEMPT_ALL, r.selectedBy());
        assertFalse(soap12Only.invoked());
    }

    @Test
    void slowSelectDisabledInvokesNoHandlerWithoutHints() {
        AnsweringHandler getInfo = new AnsweringHandler("getInfo");
        registry.register(SOAP11, "getInfo", getInfo);
        DispatcherConfig fastOnly = DispatcherConfig.builder().withAcceptSlowSelect(false).build();

        DispatchResult r = dispatcher(fastOnly).dispatch(bytes(soap11(request("getInfo"))), null,
                RequestMetadata.none());

        assertEquals(404, r.statusCode());
        assertEquals("message not recognized", r.statusText());
        assertFalse(getInfo.invoked());
    }

    @Test
    void soapActionIsTakenFromRequestHeaders() {
        AnsweringHandler a = new AnsweringHandler("getInfo");
        registry.register(SOAP11, "A", a);
        registry.addSoapActionMapping(Map.of("A", "urn:a"));
        RequestMetadata request = RequestMetadata.builder()
                .withMethod("POST")
                .addHeader("SOAPAction", "\"urn:a\"")
                .build();

        DispatchResult r = dispatcher().dispatch(bytes(soap11(request("getInfo"))), request);

        assertEquals(SelectionStrategy.SOAP_ACTION, r.selectedBy());
    }

    @Test
    void parsedDocumentsAreAccepted() {
        registry.register(SOAP11, "getInfo", new AnsweringHandler("getInfo"));
        OMElement envelope = parse(soap11(request("getInfo")));
        OMDocument document = (OMDocument) envelope.getParent();

        assertEquals(200, dispatcher().dispatch(document, null, RequestMetadata.none()).statusCode());
        assertEquals(200, dispatcher().dispatch(envelope, null, RequestMetadata.none()).statusCode());
    }

    // ---------------------------------------------------------------------
    // Unroutable messages
    // ---------------------------------------------------------------------

    @Test
    void otherProtocolIsSuggestedWhenOnlyItHasOperations() {
        registry.register(SOAP11, "getInfo", new AnsweringHandler("getInfo"));

        DispatchResult r = dispatch(soap12(request("getInfo")));

        assertEquals(303, r.statusCode());
        assertEquals("SOAP protocol not in use", r.statusText());
        assertTrue(r.errorDetail().contains("try SOAP11"), r.errorDetail());
        assertEquals(ProtocolVersion.SOAP12, r.payloadVersion().orElseThrow());
        assertTrue(SoapEnvelopes.isFault(r.payload().orElseThrow()));
    }

    @Test
    void unrecognizedMessageListsSortedOperationNames() {
        registry.register(SOAP11, "c", new DecliningHandler());
        registry.register(SOAP11, "a", new DecliningHandler());
        registry.register(SOAP11, "b", new DecliningHandler());

        DispatchResult r = dispatch(soap11(request("unknown")));

        assertEquals(404, r.statusCode());
        assertTrue(r.errorDetail().contains("available ports are a, b, c"), r.errorDetail());
        assertTrue(r.errorDetail().contains("{urn:example:names}unknown"), r.errorDetail());
        assertEquals(DispatchState.VERSION_RESOLVED, r.failedIn());
        assertEquals(SelectionStrategy.NONE, r.selectedBy());
    }

    @Test
    void unrecognizedMessageMentionsSoapAction() {
        registry.register(SOAP11, "a", new DecliningHandler());

        DispatchResult r = dispatcher().dispatch(bytes(soap11(request("unknown"))), "urn:nothing",
                RequestMetadata.none());

        assertTrue(r.errorDetail().endsWith("\nsoapAction urn:nothing"), r.errorDetail());
    }

    @Test
    void operationNamesCanBeWithheld() {
        registry.register(SOAP11, "secret", new DecliningHandler());
        DispatcherConfig quiet = DispatcherConfig.builder().withDiscloseOperations(false).build();

        DispatchResult r = dispatcher(quiet).dispatch(bytes(soap11(request("unknown"))), null,
                RequestMetadata.none());

        assertEquals(404, r.statusCode());
        assertFalse(r.errorDetail().contains("secret"), r.errorDetail());
    }

    @Test
    void emptyRegistrySaysNoHandlersAvailable() {
        DispatchResult r = dispatch(soap11(request("getInfo")));

        assertEquals(404, r.statusCode());
        assertTrue(r.errorDetail().contains("no handlers available"), r.errorDetail());
    }

    // ---------------------------------------------------------------------
    // Failures
    // ---------------------------------------------------------------------

    @Test
    void throwingHandlerYieldsOperationFailed() {
        AnsweringHandler later = new AnsweringHandler("getInfo");
        registry.register(SOAP11, "broken", (name, env, info) -> {
            throw new IllegalStateException("database down");
        });
        registry.register(SOAP11, "getInfo", later);

        DispatchResult r = dispatch(soap11(request("getInfo")));

        assertEquals(500, r.statusCode());
        assertEquals("operation failed", r.statusText());
        assertEquals(DispatchState.HANDLER_INVOKED, r.failedIn());
        assertFalse(r.errorDetail().contains("database down"));
        assertFalse(later.invoked());

        List<DispatchErrorEvent> errors = sink.getErrors();
        assertEquals(1, errors.size());
        assertInstanceOf(IllegalStateException.class, errors.get(0).cause());
    }

    @Test
    void handlerErrorYieldsOperationFailed() {
        registry.register(SOAP11, "broken", (name, env, info) -> {
            throw new AssertionError("handler bug");
        });

        DispatchResult r = dispatch(soap11(request("getInfo")));

        assertEquals(500, r.statusCode());
        assertEquals("operation failed", r.statusText());
        assertEquals(DispatchState.HANDLER_INVOKED, r.failedIn());
        assertInstanceOf(AssertionError.class, sink.getErrors().get(0).cause());
    }

    @Test
    void handlerStackOverflowYieldsOperationFailed() {
        registry.register(SOAP12, "deep", (name, env, info) -> {
            throw new StackOverflowError();
        });

        DispatchResult r = dispatch(soap12(request("deep")));

        assertEquals(500, r.statusCode());
        assertTrue(r.isFault());
        assertEquals(1, sink.getErrors().size());
    }

    @Test
    void handlerReturningNullIsAFailure() {
        registry.register(SOAP11, "broken", (name, env, info) -> null);

        DispatchResult r = dispatch(soap11(request("getInfo")));

        assertEquals(500, r.statusCode());
    }

    @Test
    void failingSinkDoesNotBreakDispatch() {
        registry.register(SOAP11, "getInfo", new AnsweringHandler("getInfo"));
        DispatchObservabilitySink failing = new DispatchObservabilitySink() {
            @Override
            public void onDispatch(DispatchCompletedEvent event) {
                throw new IllegalStateException("sink broken");
            }

            @Override
            public void onError(DispatchErrorEvent event) {
                throw new IllegalStateException("sink broken");
            }
        };

        DispatchResult r = new SoapDispatcher(registry, DispatcherConfig.defaults(), failing)
                .dispatch(bytes(soap11(request("getInfo"))), null, RequestMetadata.none());

        assertEquals(200, r.statusCode());
    }

    // ---------------------------------------------------------------------
    // Observability
    // ---------------------------------------------------------------------

    @Test
    void everyDispatchEmitsOneCompletedEvent() {
        registry.register(SOAP11, "getInfo", new AnsweringHandler("getInfo"));
        SoapDispatcher dispatcher = dispatcher();

        dispatcher.dispatch(bytes(soap11(request("getInfo"))), null, RequestMetadata.none());
        dispatcher.dispatch(bytes("not xml"), null, RequestMetadata.none());

        List<DispatchCompletedEvent> events = sink.getDispatches();
        assertEquals(2, events.size());

        DispatchCompletedEvent ok = events.get(0);
        assertFalse(ok.isFault());
        assertEquals("getInfo", ok.operation().orElseThrow());
        assertEquals(SOAP11, ok.version().orElseThrow());
        assertEquals(SelectionStrategy.ATTEMPT_ALL, ok.selectedBy());

        DispatchCompletedEvent fault = events.get(1);
        assertTrue(fault.isFault());
        assertEquals(422, fault.statusCode());
        assertTrue(fault.version().isEmpty());
    }

    @Test
    void handlerSeesMessageMetadata() {
        registry.register(SOAP11, "getInfo", (op, env, info) -> {
            assertEquals("getInfo", op);
            assertEquals(SOAP11, info.version());
            assertEquals(name("getInfo"), info.bodyElement().orElseThrow());
            assertEquals("urn:a", info.wsaAction().orElseThrow());
            assertEquals("uuid:1", info.wsaMessageId().orElseThrow());
            assertEquals(SelectionStrategy.WSA_ACTION, info.selectedBy());
            return HandlerResult.ok(SoapEnvelopes.create(info.version()));
        });
        registry.addActionMapping(ActionDirection.INPUT, Map.of("getInfo", "urn:a"));

        DispatchResult r = dispatch(soap11(wsaAction("urn:a") + wsaMessageId("uuid:1"), request("getInfo")));

        assertEquals(200, r.statusCode());
    }
}
