package com.questrail.soapd.fault;

import com.questrail.soapd.api.DispatchResult;
import com.questrail.soapd.api.DispatchState;
import com.questrail.soapd.api.SelectionStrategy;
import com.questrail.soapd.api.SoapEnvelopes;
import com.questrail.soapd.api.SoapNamespaces;
import org.apache.axiom.om.OMElement;
import org.junit.jupiter.api.Test;

import javax.xml.namespace.QName;
import java.util.List;
import java.util.Optional;

import static com.questrail.soapd.api.ProtocolVersion.SOAP11;
import static com.questrail.soapd.api.ProtocolVersion.SOAP12;
import static org.junit.jupiter.api.Assertions.*;

class FaultSynthesizerTest {

    private final FaultSynthesizer faults = new FaultSynthesizer();

    private static OMElement faultElement(FaultDescriptor fd) {
        OMElement envelope = fd.detail().orElseThrow();
        assertTrue(SoapEnvelopes.isFault(envelope));
        return SoapEnvelopes.firstBodyElement(envelope).orElseThrow();
    }

    private static String text(OMElement parent, String... path) {
        OMElement el = parent;
        for (String local : path) {
            String ns = local.equals(local.toLowerCase()) ? "" : parent.getQName().getNamespaceURI();
            el = el.getFirstChildWithName(new QName(ns, local));
            assertNotNull(el, "missing " + local);
        }
        return el.getText();
    }

    @Test
    void failuresBeforeVersionResolutionCarryTextOnly() {
        assertTrue(faults.invalidXml("unexpected EOF").detail().isEmpty());
        assertTrue(faults.notSoapMessage("{urn:x}foo").detail().isEmpty());
        assertTrue(faults.unsupportedProtocolVersion("urn:x").detail().isEmpty());
    }

    @Test
    void categoriesFixStatusAndReason() {
        FaultDescriptor fd = faults.operationNotImplemented(SOAP11, "getInfo");

        assertEquals(FaultCategory.OPERATION_NOT_IMPLEMENTED, fd.category());
        assertEquals(501, fd.statusCode());
        assertEquals("procedure stub called", fd.reason());
        assertEquals("procedure getInfo for SOAP11 is not yet implemented", fd.message());
    }

    @Test
    void soap11FaultUsesServerDotSubcode() {
        FaultDescriptor fd = faults.messageNotRecognized(SOAP11, "{urn:x}foo", Optional.empty(),
                List.of("getInfo"), true);
        OMElement fault = faultElement(fd);

        assertEquals("SOAP-ENV:Server.notRecognized", text(fault, "faultcode"));
        assertEquals(fd.message(), text(fault, "faultstring"));
    }

    @Test
    void soap12FaultUsesReceiverWithSubcode() {
        FaultDescriptor fd = faults.tryOtherProtocol(SOAP12, "{urn:x}foo", List.of(SOAP11));
        OMElement fault = faultElement(fd);

        assertEquals(SoapNamespaces.SOAP12_ENVELOPE, fault.getQName().getNamespaceURI());
        assertEquals("env:Receiver", text(fault, "Code", "Value"));

        String subcode = text(fault, "Code", "Subcode", "Value");
        assertTrue(subcode.endsWith(":tryUpgrade"), subcode);
        String prefix = subcode.substring(0, subcode.indexOf(':'));
        assertEquals(SoapNamespaces.DAEMON_FAULT, fault.findNamespaceURI(prefix).getNamespaceURI());

        assertEquals(fd.message(), text(fault, "Reason", "Text"));
    }

    @Test
    void notRecognizedListsOperationsAndSoapAction() {
        FaultDescriptor fd = faults.messageNotRecognized(SOAP11, "{urn:x}foo", Optional.of("urn:act"),
                List.of("a", "b"), true);

        assertEquals("SOAP11 body element {urn:x}foo not recognized, available ports are a, b\nsoapAction urn:act",
                fd.message());
    }

    @Test
    void toResultMarksTheFailedState() {
        DispatchResult r = faults.handlerFailure(SOAP11, "getInfo")
                .toResult(DispatchState.HANDLER_INVOKED, SelectionStrategy.SOAP_ACTION);

        assertEquals(500, r.statusCode());
        assertEquals("operation failed", r.statusText());
        assertTrue(r.isFault());
        assertEquals(DispatchState.HANDLER_INVOKED, r.failedIn());
        assertEquals(SelectionStrategy.SOAP_ACTION, r.selectedBy());
        assertEquals(SOAP11, r.payloadVersion().orElseThrow());
    }

    @Test
    void transportFaultsExplainTheRejection() {
        assertEquals("attempt to connect via GET", faults.methodNotAllowed("GET").message());
        assertEquals(405, faults.methodNotAllowed("GET").statusCode());
        assertEquals("content-type seems to be text/plain, must be some XML",
                faults.notAcceptable("text/plain").message());
    }
}
