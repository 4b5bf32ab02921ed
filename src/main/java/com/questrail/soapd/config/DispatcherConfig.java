package com.questrail.soapd.config;

import com.questrail.soapd.api.ProtocolVersion;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Behavioural switches of the dispatcher.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>acceptSlowSelect</b>: when no action hint selects a handler, offer
 *       the message to every registered operation of its version until one
 *       accepts it. Needed by clients that send neither a WS-Addressing action
 *       nor a usable SOAPAction, but costs one handler call per registered
 *       operation on every unroutable request, which is an easy way to load
 *       the server. Disable it when all clients send action hints.</li>
 *   <li><b>discloseOperations</b>: list the registered operation names in
 *       "message not recognized" faults. Convenient while developing a client,
 *       an information leak in production.</li>
 *   <li><b>supportedVersions</b>: envelope versions accepted at all; others
 *       are answered with "SOAP version not supported".</li>
 * </ul>
 */
public record DispatcherConfig(
        boolean acceptSlowSelect,
        boolean discloseOperations,
        Set<ProtocolVersion> supportedVersions
) {
    public DispatcherConfig {
        Objects.requireNonNull(supportedVersions, "supportedVersions");
        if (supportedVersions.isEmpty()) {
            throw new IllegalArgumentException("at least one protocol version must be supported");
        }
        supportedVersions = Set.copyOf(supportedVersions);
    }

    public static DispatcherConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private boolean acceptSlowSelect = true;
        private boolean discloseOperations = true;
        private Set<ProtocolVersion> supportedVersions = EnumSet.allOf(ProtocolVersion.class);

        public Builder withAcceptSlowSelect(boolean acceptSlowSelect) {
            this.acceptSlowSelect = acceptSlowSelect;
            return this;
        }

        public Builder withDiscloseOperations(boolean discloseOperations) {
            this.discloseOperations = discloseOperations;
            return this;
        }

        public Builder withSupportedVersions(Set<ProtocolVersion> versions) {
            this.supportedVersions = versions;
            return this;
        }

        public DispatcherConfig build() {
            return new DispatcherConfig(acceptSlowSelect, discloseOperations, supportedVersions);
        }
    }
}
