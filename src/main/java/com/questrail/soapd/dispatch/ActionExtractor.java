package com.questrail.soapd.dispatch;

import com.questrail.soapd.api.RequestMetadata;
import com.questrail.soapd.api.SoapNamespaces;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * ActionExtractor
 * -----------------------------------------------------------------------------
 * Derives the SOAPAction of a request from its transport headers.
 *
 * <ul>
 *   <li>{@code POST}: the {@code SOAPAction} header.</li>
 *   <li>{@code M-POST} (HTTP Extension Framework): the {@code Man} header
 *       announcing the SOAP extension assigns it a numeric namespace
 *       ({@code ns=NN}); the action is then in header {@code NN-SOAPAction}.</li>
 *   <li>Any other method carries no action.</li>
 * </ul>
 *
 * <p>SOAPAction is officially a routing hint for intermediaries and real
 * clients are sloppy with it: unquoted values, stray blanks, single quotes,
 * unbalanced quotes. All of these are normalized here; nothing is rejected.
 * An empty value counts as absent.</p>
 */
public final class ActionExtractor
{
    public static final String SOAP_ACTION_HEADER = "SOAPAction";
    public static final String MAN_HEADER = "Man";

    private static final String QUOTED_EXTENSION_ID = "\"" + SoapNamespaces.HTTP_EXTENSION_ID + "\"";
    private static final Pattern NS_PARAMETER = Pattern.compile(";\\s*ns=(\\d+)");

    /**
     * @return the normalized SOAPAction, or empty when the request has none
     */
    public Optional<String> extract(RequestMetadata request) {
        Objects.requireNonNull(request, "request");

        String method = request.method();
        if ("POST".equals(method)) {
            return request.header(SOAP_ACTION_HEADER).flatMap(ActionExtractor::normalize);
        }
        if ("M-POST".equals(method)) {
            return extensionNamespace(request)
                    .flatMap(ns -> request.header(ns + "-" + SOAP_ACTION_HEADER))
                    .flatMap(ActionExtractor::normalize);
        }
        return Optional.empty();
    }

    /**
     * Finds the {@code ns=NN} prefix the client assigned to the SOAP extension.
     */
    private static Optional<String> extensionNamespace(RequestMetadata request) {
        for (String man : request.headers(MAN_HEADER)) {
            // One Man header may declare several extensions, comma separated.
            for (String declaration : man.split(",")) {
                if (!declaration.contains(QUOTED_EXTENSION_ID)) {
                    continue;
                }
                Matcher m = NS_PARAMETER.matcher(declaration);
                if (m.find()) {
                    return Optional.of(m.group(1));
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Strips blanks and surrounding quotes from a raw SOAPAction value.
     *
     * <pre>
     *   "urn:a"      → urn:a
     *    'urn:a'     → urn:a
     *   urn:a        → urn:a
     *   "urn:a       → urn:a
     *   ""           → (absent)
     * </pre>
     */
    public static Optional<String> normalize(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String s = raw.strip();
        while (!s.isEmpty() && isQuote(s.charAt(0))) {
            s = s.substring(1);
        }
        while (!s.isEmpty() && isQuote(s.charAt(s.length() - 1))) {
            s = s.substring(0, s.length() - 1);
        }
        s = s.strip();
        return s.isEmpty() ? Optional.empty() : Optional.of(s);
    }

    private static boolean isQuote(char c) {
        return c == '"' || c == '\'';
    }
}
