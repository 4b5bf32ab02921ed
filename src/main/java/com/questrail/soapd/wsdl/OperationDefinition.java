package com.questrail.soapd.wsdl;

import com.questrail.soapd.api.ProtocolVersion;

import javax.xml.namespace.QName;
import java.util.Objects;
import java.util.Optional;

/**
 * One operation of a service description, bound to a SOAP protocol version.
 *
 * @param requestElement  qualified name of the body element a request carries;
 *                        for rpc style {@code {soap:body namespace}operationName}
 * @param responseElement qualified name of the body element of the answer
 * @param soapAction      the binding's {@code soapAction}, when not empty
 * @param wsaInputAction  WS-Addressing action of the input message
 * @param wsaOutputAction WS-Addressing action of the output message
 */
public record OperationDefinition(
        String name,
        ProtocolVersion version,
        Optional<QName> requestElement,
        Optional<QName> responseElement,
        Optional<String> soapAction,
        Optional<String> wsaInputAction,
        Optional<String> wsaOutputAction,
        Style style
) {
    public enum Style { DOCUMENT, RPC }

    public OperationDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(requestElement, "requestElement");
        Objects.requireNonNull(responseElement, "responseElement");
        Objects.requireNonNull(soapAction, "soapAction");
        Objects.requireNonNull(wsaInputAction, "wsaInputAction");
        Objects.requireNonNull(wsaOutputAction, "wsaOutputAction");
        Objects.requireNonNull(style, "style");
        if (name.isBlank()) {
            throw new IllegalArgumentException("operation name must not be blank");
        }
    }

    public static Builder builder(String name, ProtocolVersion version) {
        return new Builder(name, version);
    }

    public static final class Builder {
        private final String name;
        private final ProtocolVersion version;
        private QName requestElement;
        private QName responseElement;
        private String soapAction;
        private String wsaInputAction;
        private String wsaOutputAction;
        private Style style = Style.DOCUMENT;

        private Builder(String name, ProtocolVersion version) {
            this.name = name;
            this.version = version;
        }

        public Builder withRequestElement(QName element) {
            this.requestElement = element;
            return this;
        }

        public Builder withResponseElement(QName element) {
            this.responseElement = element;
            return this;
        }

        public Builder withSoapAction(String action) {
            this.soapAction = action;
            return this;
        }

        public Builder withWsaInputAction(String action) {
            this.wsaInputAction = action;
            return this;
        }

        public Builder withWsaOutputAction(String action) {
            this.wsaOutputAction = action;
            return this;
        }

        public Builder withStyle(Style style) {
            this.style = style;
            return this;
        }

        public OperationDefinition build() {
            return new OperationDefinition(name, version,
                    Optional.ofNullable(requestElement),
                    Optional.ofNullable(responseElement),
                    nonBlank(soapAction),
                    nonBlank(wsaInputAction),
                    nonBlank(wsaOutputAction),
                    style);
        }

        private static Optional<String> nonBlank(String s) {
            return s == null || s.isBlank() ? Optional.empty() : Optional.of(s.strip());
        }
    }
}
