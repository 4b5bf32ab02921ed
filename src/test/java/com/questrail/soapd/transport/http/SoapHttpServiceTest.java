package com.questrail.soapd.transport.http;

import com.questrail.soapd.api.RequestMetadata;
import com.questrail.soapd.dispatch.SoapDispatcher;
import com.questrail.soapd.registry.OperationRegistry;
import com.questrail.soapd.test.TestEnvelopes.AnsweringHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;

import static com.questrail.soapd.api.ProtocolVersion.SOAP11;
import static com.questrail.soapd.api.ProtocolVersion.SOAP12;
import static com.questrail.soapd.test.TestEnvelopes.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * SoapHttpServiceTest
 * -----------------------------------------------------------------------------
 * Request gating and reply rendering, without a network.
 */
class SoapHttpServiceTest {

    private static final byte[] WSDL = "<definitions/>".getBytes(StandardCharsets.UTF_8);

    private OperationRegistry registry;
    private AnsweringHandler getInfo;
    private SoapHttpService service;

    @BeforeEach
    void setUp() {
        registry = new OperationRegistry();
        getInfo = new AnsweringHandler("getInfo");
        registry.register(SOAP11, "getInfo", getInfo);
        registry.register(SOAP12, "getInfo", getInfo);
        registry.addSoapActionMapping(Map.of("getInfo", "urn:getInfo"));
        service = new SoapHttpService(new SoapDispatcher(registry), "test daemon", Optional.of(WSDL));
    }

    private static RequestMetadata.Builder post(String contentType) {
        return RequestMetadata.builder()
                .withMethod("POST")
                .withContentType(contentType)
                .withRemoteAddress("127.0.0.1:50000");
    }

    // ---------------------------------------------------------------------
    // Gating
    // ---------------------------------------------------------------------

    @Test
    void getIsNotAllowed() {
        HttpReply reply = service.handle(RequestMetadata.builder().withMethod("GET").build(), new byte[0]);

        assertEquals(405, reply.status());
        assertEquals("only POST or M-POST", reply.reasonPhrase());
        assertEquals(HttpResponseRenderer.TEXT_PLAIN, reply.contentType());
        assertEquals("[405] attempt to connect via GET\n", reply.bodyAsString());
        assertFalse(getInfo.invoked());
    }

    @Test
    void nonXmlContentIsNotAcceptable() {
        HttpReply reply = service.handle(post("application/json").build(), bytes(soap11(request("getInfo"))));

        assertEquals(406, reply.status());
        assertEquals("required is XML", reply.reasonPhrase());
        assertEquals("[406] content-type seems to be application/json, must be some XML\n", reply.bodyAsString());
        assertFalse(getInfo.invoked());
    }

    @Test
    void missingContentTypeCountsAsPlainText() {
        HttpReply reply = service.handle(post(null).build(), bytes(soap11(request("getInfo"))));

        assertEquals(406, reply.status());
        assertTrue(reply.bodyAsString().contains("text/plain"));
    }

    @Test
    void anyXmlMediaTypeIsAccepted() {
        assertEquals(200, service.handle(post("text/xml; charset=utf-8").build(),
                bytes(soap11(request("getInfo")))).status());
        assertEquals(200, service.handle(post("application/soap+xml").build(),
                bytes(soap12(request("getInfo")))).status());
        assertEquals(200, service.handle(post("Application/XML").build(),
                bytes(soap11(request("getInfo")))).status());
    }

    @Test
    void mediaTypeDropsParametersAndCase() {
        assertEquals("text/xml", SoapHttpService.mediaType(post("Text/XML ; charset=\"utf-8\"").build()));
        assertEquals("text/plain", SoapHttpService.mediaType(post(null).build()));
        assertEquals("text/plain", SoapHttpService.mediaType(post(" ; charset=utf-8").build()));
    }

    // ---------------------------------------------------------------------
    // WSDL
    // ---------------------------------------------------------------------

    @Test
    void wsdlIsServedOnQuery() {
        HttpReply reply = service.handle(RequestMetadata.builder().withMethod("GET").withQueryString("wsdl").build(),
                new byte[0]);

        assertEquals(200, reply.status());
        assertEquals("WSDL specification", reply.reasonPhrase());
        assertEquals(SoapHttpService.WSDL_MEDIA_TYPE, reply.contentType());
        assertArrayEquals(WSDL, reply.body());
    }

    @Test
    void wsdlQueryWithoutDocumentIsNotAllowed() {
        SoapHttpService bare = new SoapHttpService(new SoapDispatcher(registry), "test daemon", Optional.empty());

        HttpReply reply = bare.handle(RequestMetadata.builder().withMethod("GET").withQueryString("WSDL").build(),
                new byte[0]);

        assertEquals(405, reply.status());
    }

    // ---------------------------------------------------------------------
    // Dispatch and rendering
    // ---------------------------------------------------------------------

    @Test
    void soap11AnswerIsTextXml() {
        HttpReply reply = service.handle(post("text/xml").addHeader("SOAPAction", "\"urn:getInfo\"").build(),
                bytes(soap11(request("getInfo"))));

        assertEquals(200, reply.status());
        assertEquals("OK", reply.reasonPhrase());
        assertEquals(SOAP11.mediaType(), reply.contentType());
        assertTrue(reply.bodyAsString().startsWith(HttpResponseRenderer.XML_DECLARATION));
        assertTrue(reply.bodyAsString().contains("getInfoResponse"));
        assertEquals("test daemon", reply.headers().get("Server"));
        assertEquals("199 OK", reply.headers().get("Warning"));
        assertFalse(reply.headers().containsKey("Ext"));
        assertEquals("getInfo/soap-action", getInfo.calls().get(0));
    }

    @Test
    void soap12AnswerIsSoapXml() {
        HttpReply reply = service.handle(post("application/soap+xml").build(), bytes(soap12(request("getInfo"))));

        assertEquals(200, reply.status());
        assertEquals(SOAP12.mediaType(), reply.contentType());
    }

    @Test
    void extensionFrameworkRequestGetsExtHeader() {
        RequestMetadata mpost = RequestMetadata.builder()
                .withMethod("M-POST")
                .withContentType("text/xml")
                .addHeader("Man", "\"http://schemas.xmlsoap.org/soap/envelope/\"; ns=42")
                .addHeader("42-SOAPAction", "urn:getInfo")
                .build();

        HttpReply reply = service.handle(mpost, bytes(soap11(request("getInfo"))));

        assertEquals(200, reply.status());
        assertEquals("", reply.headers().get("Ext"));
        assertEquals("getInfo/soap-action", getInfo.calls().get(0));
    }

    @Test
    void dispatchFailureWithoutEnvelopeIsPlainText() {
        HttpReply reply = service.handle(post("text/xml").build(), bytes("<not-closed>"));

        assertEquals(422, reply.status());
        assertEquals("XML syntax error", reply.reasonPhrase());
        assertEquals(HttpResponseRenderer.TEXT_PLAIN, reply.contentType());
        assertTrue(reply.bodyAsString().startsWith("[422] The XML cannot be parsed: "), reply.bodyAsString());
        assertEquals("199 XML syntax error", reply.headers().get("Warning"));
    }

    @Test
    void unrecognizedMessageIsSoapFault() {
        HttpReply reply = service.handle(post("text/xml").build(), bytes(soap11(request("getNothing"))));

        assertEquals(404, reply.status());
        assertEquals("message not recognized", reply.reasonPhrase());
        assertEquals(SOAP11.mediaType(), reply.contentType());
        assertTrue(reply.bodyAsString().contains("Fault"));
    }

    @Test
    void emptyPostIsASyntaxError() {
        HttpReply reply = service.handle(post("text/xml").build(), null);

        assertEquals(422, reply.status());
    }
}
