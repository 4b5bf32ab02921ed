package com.questrail.soapd.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Transport-level facts about a request, as handed over by a transport
 * adapter.
 *
 * <p>The dispatcher itself only needs the method and the headers (to find a
 * SOAPAction); the rest is carried along in {@link MessageInfo} for handlers
 * that want it. Header names are matched case-insensitively.</p>
 */
public final class RequestMetadata {

    private static final RequestMetadata NONE = builder().build();

    private final String method;
    private final String contentType;
    private final String queryString;
    private final String remoteAddress;
    private final Map<String, List<String>> headers;

    private RequestMetadata(Builder b) {
        this.method = b.method;
        this.contentType = b.contentType;
        this.queryString = b.queryString;
        this.remoteAddress = b.remoteAddress;

        Map<String, List<String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        b.headers.forEach((name, values) -> copy.put(name, List.copyOf(values)));
        this.headers = Collections.unmodifiableMap(copy);
    }

    /**
     * Metadata for callers that have no transport, such as tests or
     * in-process dispatch.
     */
    public static RequestMetadata none() {
        return NONE;
    }

    public String method() {
        return method;
    }

    public Optional<String> contentType() {
        return Optional.ofNullable(contentType);
    }

    public Optional<String> queryString() {
        return Optional.ofNullable(queryString);
    }

    public Optional<String> remoteAddress() {
        return Optional.ofNullable(remoteAddress);
    }

    /**
     * All values of a header, in arrival order; empty when absent.
     */
    public List<String> headers(String name) {
        return headers.getOrDefault(name, List.of());
    }

    /**
     * First value of a header.
     */
    public Optional<String> header(String name) {
        List<String> values = headers(name);
        return values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
    }

    public Map<String, List<String>> allHeaders() {
        return headers;
    }

    @Override
    public String toString() {
        return "RequestMetadata[" + method + " from " + remoteAddress + "]";
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String method = "POST";
        private String contentType;
        private String queryString;
        private String remoteAddress;
        private final Map<String, List<String>> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

        public Builder withMethod(String method) {
            this.method = Objects.requireNonNull(method, "method");
            return this;
        }

        public Builder withContentType(String contentType) {
            this.contentType = contentType;
            return this;
        }

        public Builder withQueryString(String queryString) {
            this.queryString = queryString;
            return this;
        }

        public Builder withRemoteAddress(String remoteAddress) {
            this.remoteAddress = remoteAddress;
            return this;
        }

        public Builder addHeader(String name, String value) {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(value, "value");
            headers.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
            return this;
        }

        public RequestMetadata build() {
            return new RequestMetadata(this);
        }
    }
}
