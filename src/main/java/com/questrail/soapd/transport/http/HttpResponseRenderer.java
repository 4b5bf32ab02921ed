package com.questrail.soapd.transport.http;

import com.questrail.soapd.api.DispatchResult;
import com.questrail.soapd.api.ProtocolVersion;
import com.questrail.soapd.api.RequestMetadata;
import com.questrail.soapd.fault.FaultDescriptor;
import org.apache.axiom.om.OMElement;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Renders dispatch results and transport-level faults as {@link HttpReply}.
 *
 * <ul>
 *   <li>an XML payload is sent as the media type of its SOAP version
 *       ({@code text/xml} for SOAP 1.1, {@code application/soap+xml} for 1.2);</li>
 *   <li>anything else is sent as {@code text/plain}: {@code "[status] detail"};</li>
 *   <li>every reply carries {@code Server} and {@code Warning: 199 <status text>};
 *       replies to {@code M-POST} also carry an empty {@code Ext} header, as
 *       the HTTP Extension Framework requires.</li>
 * </ul>
 * The status text also becomes the reason phrase of the status line.
 */
public final class HttpResponseRenderer
{
    static final String XML_DECLARATION = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>";
    static final String TEXT_PLAIN = "text/plain; charset=utf-8";

    private final String serverName;

    public HttpResponseRenderer(String serverName) {
        this.serverName = Objects.requireNonNull(serverName, "serverName");
    }

    public HttpReply render(DispatchResult result, RequestMetadata request) {
        Objects.requireNonNull(result, "result");
        if (result.payload().isPresent()) {
            OMElement payload = result.payload().get();
            String mediaType = result.payloadVersion().orElse(ProtocolVersion.SOAP11).mediaType();
            byte[] body = (XML_DECLARATION + payload.toString()).getBytes(StandardCharsets.UTF_8);
            return reply(result.statusCode(), result.statusText(), mediaType, body, request);
        }
        return text(result.statusCode(), result.statusText(), result.errorDetail(), request);
    }

    /**
     * Renders a fault raised by the transport itself, before dispatching.
     */
    public HttpReply render(FaultDescriptor fault, RequestMetadata request) {
        Objects.requireNonNull(fault, "fault");
        return text(fault.statusCode(), fault.reason(), fault.message(), request);
    }

    public HttpReply document(String statusText, String contentType, byte[] body, RequestMetadata request) {
        return reply(200, statusText, contentType, body, request);
    }

    private HttpReply text(int status, String statusText, String detail, RequestMetadata request) {
        byte[] body = ("[" + status + "] " + detail + "\n").getBytes(StandardCharsets.UTF_8);
        return reply(status, statusText, TEXT_PLAIN, body, request);
    }

    private HttpReply reply(int status, String statusText, String contentType, byte[] body, RequestMetadata request) {
        String reason = headerSafe(statusText);
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Server", serverName);
        headers.put("Warning", "199 " + reason);
        if (request != null && request.method().startsWith("M-")) {
            headers.put("Ext", "");
        }
        return new HttpReply(status, reason, contentType, headers, body);
    }

    private static String headerSafe(String s) {
        return s == null ? "" : s.replaceAll("[\\r\\n]+", " ").strip();
    }
}
