package com.questrail.soapd.transport.http;

import com.questrail.soapd.api.DispatchResult;
import com.questrail.soapd.api.RequestMetadata;
import com.questrail.soapd.dispatch.SoapDispatcher;
import com.questrail.soapd.fault.FaultSynthesizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * SoapHttpService
 * -----------------------------------------------------------------------------
 * The HTTP side of the daemon, free of any HTTP library: gates a request,
 * dispatches it and renders the answer.
 *
 * <ol>
 *   <li>{@code GET ...?WSDL} returns the configured WSDL document, when there is one;</li>
 *   <li>methods other than {@code POST} and {@code M-POST} get 405;</li>
 *   <li>content types that are not XML ({@code .../xml} or {@code ...+xml}) get 406;</li>
 *   <li>everything else goes to the {@link SoapDispatcher}.</li>
 * </ol>
 */
public final class SoapHttpService
{
    private static final Logger log = LoggerFactory.getLogger(SoapHttpService.class);

    static final String WSDL_MEDIA_TYPE = "application/wsdl+xml; charset=utf-8";
    private static final Pattern XML_MEDIA = Pattern.compile("[/+]xml$");

    private final SoapDispatcher dispatcher;
    private final HttpResponseRenderer renderer;
    private final FaultSynthesizer faults = new FaultSynthesizer();
    private final Optional<byte[]> wsdlDocument;

    public SoapHttpService(SoapDispatcher dispatcher, String serverName, Optional<byte[]> wsdlDocument) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.renderer = new HttpResponseRenderer(serverName);
        this.wsdlDocument = Objects.requireNonNull(wsdlDocument, "wsdlDocument");
    }

    public HttpReply handle(RequestMetadata request, byte[] body) {
        Objects.requireNonNull(request, "request");
        String method = request.method();

        if ("GET".equals(method) && wsdlDocument.isPresent()
                && request.queryString().map("WSDL"::equalsIgnoreCase).orElse(false)) {
            return renderer.document("WSDL specification", WSDL_MEDIA_TYPE, wsdlDocument.get(), request);
        }

        if (!"POST".equals(method) && !"M-POST".equals(method)) {
            log.debug("rejected {} request from {}", method, request.remoteAddress().orElse("?"));
            return renderer.render(faults.methodNotAllowed(method), request);
        }

        String mediaType = mediaType(request);
        if (!XML_MEDIA.matcher(mediaType).find()) {
            log.debug("rejected content type {} from {}", mediaType, request.remoteAddress().orElse("?"));
            return renderer.render(faults.notAcceptable(mediaType), request);
        }

        DispatchResult result = dispatcher.dispatch(body == null ? new byte[0] : body, request);
        return renderer.render(result, request);
    }

    /**
     * Content type without parameters, lower case; {@code text/plain} when absent.
     */
    static String mediaType(RequestMetadata request) {
        String ct = request.contentType().orElse("text/plain");
        int semi = ct.indexOf(';');
        String media = semi < 0 ? ct : ct.substring(0, semi);
        media = media.strip().toLowerCase(Locale.ROOT);
        return media.isEmpty() ? "text/plain" : media;
    }
}
