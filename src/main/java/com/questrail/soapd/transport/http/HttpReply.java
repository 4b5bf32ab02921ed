package com.questrail.soapd.transport.http;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A complete HTTP answer, independent of any HTTP library.
 *
 * @param headers extra response headers, in insertion order; the content type
 *                and length are not among them
 */
public record HttpReply(
        int status,
        String reasonPhrase,
        String contentType,
        Map<String, String> headers,
        byte[] body
) {
    public HttpReply {
        Objects.requireNonNull(reasonPhrase, "reasonPhrase");
        Objects.requireNonNull(contentType, "contentType");
        Objects.requireNonNull(body, "body");
        headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }
}
