package com.questrail.soapd.config;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Settings of the HTTP binding.
 *
 * <h2>Connection lifetime</h2>
 * A client connection may live for {@code clientTimeout}, extended by
 * {@code clientRequestBonus} for every request it sends. Independently, the
 * connection is closed after {@code clientMaxRequests} requests. Together
 * they bound what one client can hold on to, including a worker stuck in a
 * slow handler.
 *
 * @param bindAddress        local address to listen on
 * @param serverName         value of the {@code Server} response header
 * @param clientTimeout      initial lifetime of a connection
 * @param clientMaxRequests  requests served per connection before closing it
 * @param clientRequestBonus lifetime added per received request
 * @param maxContentLength   largest accepted request body, in bytes
 * @param workerThreads      threads running the dispatcher and its handlers
 * @param wsdlDocument       document served for {@code GET ...?WSDL}, if any
 */
public record HttpDaemonConfig(
        InetSocketAddress bindAddress,
        String serverName,
        Duration clientTimeout,
        int clientMaxRequests,
        Duration clientRequestBonus,
        int maxContentLength,
        int workerThreads,
        Optional<byte[]> wsdlDocument
) {
    public HttpDaemonConfig {
        Objects.requireNonNull(bindAddress, "bindAddress");
        Objects.requireNonNull(serverName, "serverName");
        Objects.requireNonNull(clientTimeout, "clientTimeout");
        Objects.requireNonNull(clientRequestBonus, "clientRequestBonus");
        Objects.requireNonNull(wsdlDocument, "wsdlDocument");

        if (clientTimeout.isNegative() || clientTimeout.isZero()) {
            throw new IllegalArgumentException("clientTimeout must be positive");
        }
        if (clientRequestBonus.isNegative()) {
            throw new IllegalArgumentException("clientRequestBonus must be non-negative");
        }
        if (clientMaxRequests < 1) {
            throw new IllegalArgumentException("clientMaxRequests must be at least 1");
        }
        if (maxContentLength < 1) {
            throw new IllegalArgumentException("maxContentLength must be positive");
        }
        if (workerThreads < 1) {
            throw new IllegalArgumentException("workerThreads must be at least 1");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private InetSocketAddress bindAddress = new InetSocketAddress(8080);
        private String serverName = "soap daemon";
        private Duration clientTimeout = Duration.ofSeconds(30);
        private int clientMaxRequests = 100;
        private Duration clientRequestBonus = Duration.ZERO;
        private int maxContentLength = 4 * 1024 * 1024;
        private int workerThreads = 16;
        private byte[] wsdlDocument;

        public Builder withBindAddress(InetSocketAddress bindAddress) {
            this.bindAddress = bindAddress;
            return this;
        }

        public Builder withServerName(String serverName) {
            this.serverName = serverName;
            return this;
        }

        public Builder withClientTimeout(Duration clientTimeout) {
            this.clientTimeout = clientTimeout;
            return this;
        }

        public Builder withClientMaxRequests(int clientMaxRequests) {
            this.clientMaxRequests = clientMaxRequests;
            return this;
        }

        public Builder withClientRequestBonus(Duration clientRequestBonus) {
            this.clientRequestBonus = clientRequestBonus;
            return this;
        }

        public Builder withMaxContentLength(int maxContentLength) {
            this.maxContentLength = maxContentLength;
            return this;
        }

        public Builder withWorkerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
            return this;
        }

        public Builder withWsdlDocument(byte[] wsdlDocument) {
            this.wsdlDocument = wsdlDocument == null ? null : wsdlDocument.clone();
            return this;
        }

        public HttpDaemonConfig build() {
            return new HttpDaemonConfig(bindAddress, serverName, clientTimeout, clientMaxRequests,
                    clientRequestBonus, maxContentLength, workerThreads, Optional.ofNullable(wsdlDocument));
        }
    }
}
