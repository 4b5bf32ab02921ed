package com.questrail.soapd.runtime;

import com.questrail.soapd.api.OperationHandler;
import com.questrail.soapd.api.ProtocolVersion;
import com.questrail.soapd.api.SoapConfigurationException;
import com.questrail.soapd.config.DispatcherConfig;
import com.questrail.soapd.config.HttpDaemonConfig;
import com.questrail.soapd.dispatch.SoapDispatcher;
import com.questrail.soapd.observability.DispatchObservabilitySink;
import com.questrail.soapd.observability.NullDispatchObservabilitySink;
import com.questrail.soapd.registry.ActionDirection;
import com.questrail.soapd.registry.OperationRegistry;
import com.questrail.soapd.transport.SoapTransport;
import com.questrail.soapd.transport.http.netty.NettySoapHttpServer;
import com.questrail.soapd.wsdl.HandlerCompiler;
import com.questrail.soapd.wsdl.ElementMatchingHandlerCompiler;
import com.questrail.soapd.wsdl.ImportReport;
import com.questrail.soapd.wsdl.OperationCallback;
import com.questrail.soapd.wsdl.WsdlImporter;
import com.questrail.soapd.wsdl.WsdlModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiFunction;

/**
 * SoapDaemonRuntime
 * =============================================================================
 * Composition root and lifecycle owner of a SOAP daemon.
 *
 * <p>{@link Builder#build()} is the startup phase: it fills the registry from
 * the WSDL models and manual registrations, in the order they were given, and
 * fails with {@link SoapConfigurationException} on any registration error.
 * Nothing is registered afterwards, which is what lets the dispatcher read the
 * registry without locking.</p>
 *
 * <pre>
 * SoapDaemonRuntime daemon = SoapDaemonRuntime.builder()
 *     .withHttpConfig(HttpDaemonConfig.builder().withBindAddress(addr).build())
 *     .withWsdl(Wsdl4jWsdlModel.read(url), Map.of("getInfo", myCallback))
 *     .build();
 * daemon.start();
 * </pre>
 */
public final class SoapDaemonRuntime {
    private static final Logger log = LoggerFactory.getLogger(SoapDaemonRuntime.class);

    private final OperationRegistry registry;
    private final SoapDispatcher dispatcher;
    private final SoapTransport transport;
    private final List<ImportReport> imports;

    private SoapDaemonRuntime(OperationRegistry registry,
                              SoapDispatcher dispatcher,
                              SoapTransport transport,
                              List<ImportReport> imports) {
        this.registry = registry;
        this.dispatcher = dispatcher;
        this.transport = transport;
        this.imports = List.copyOf(imports);
    }

    public void start() {
        if (registry.isEmpty()) {
            log.warn("starting without any registered operation");
        } else if (log.isInfoEnabled()) {
            log.info("operations available:\n{}", registry.index());
        }
        transport.start();
    }

    public void stop() {
        transport.stop();
    }

    public OperationRegistry registry() {
        return registry;
    }

    public SoapDispatcher dispatcher() {
        return dispatcher;
    }

    public SoapTransport transport() {
        return transport;
    }

    public List<ImportReport> imports() {
        return imports;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private DispatcherConfig dispatcherConfig = DispatcherConfig.defaults();
        private HttpDaemonConfig httpConfig = HttpDaemonConfig.builder().build();
        private OperationRegistry registry;
        private DispatchObservabilitySink observabilitySink = NullDispatchObservabilitySink.INSTANCE;
        private HandlerCompiler handlerCompiler = new ElementMatchingHandlerCompiler();
        private BiFunction<SoapDispatcher, HttpDaemonConfig, SoapTransport> transportFactory = NettySoapHttpServer::new;

        private final List<WsdlSource> wsdls = new ArrayList<>();
        private final List<ManualRegistration> handlers = new ArrayList<>();
        private final Map<String, String> wsaInput = new LinkedHashMap<>();
        private final Map<String, String> wsaOutput = new LinkedHashMap<>();
        private final Map<String, String> soapActions = new LinkedHashMap<>();

        private record WsdlSource(WsdlModel model, Map<String, OperationCallback> callbacks, OperationCallback fallback) {}

        private record ManualRegistration(ProtocolVersion version, String name, OperationHandler handler) {}

        public Builder withDispatcherConfig(DispatcherConfig config) {
            this.dispatcherConfig = config;
            return this;
        }

        public Builder withHttpConfig(HttpDaemonConfig config) {
            this.httpConfig = config;
            return this;
        }

        /**
         * Shares an existing registry, e.g. one filled by another daemon.
         */
        public Builder withRegistry(OperationRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder withObservabilitySink(DispatchObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withHandlerCompiler(HandlerCompiler compiler) {
            this.handlerCompiler = compiler;
            return this;
        }

        /**
         * Replaces the HTTP binding, e.g. with a test double.
         */
        public Builder withTransportFactory(BiFunction<SoapDispatcher, HttpDaemonConfig, SoapTransport> factory) {
            this.transportFactory = factory;
            return this;
        }

        public Builder withWsdl(WsdlModel model, Map<String, OperationCallback> callbacks) {
            return withWsdl(model, callbacks, null);
        }

        public Builder withWsdl(WsdlModel model, Map<String, OperationCallback> callbacks, OperationCallback defaultCallback) {
            wsdls.add(new WsdlSource(Objects.requireNonNull(model, "model"),
                    callbacks == null ? Map.of() : new LinkedHashMap<>(callbacks), defaultCallback));
            return this;
        }

        public Builder addHandler(ProtocolVersion version, String name, OperationHandler handler) {
            handlers.add(new ManualRegistration(version, name, handler));
            return this;
        }

        public Builder addWsaAction(ActionDirection direction, String name, String action) {
            (direction == ActionDirection.OUTPUT ? wsaOutput : wsaInput).putIfAbsent(name, action);
            return this;
        }

        public Builder addSoapAction(String name, String action) {
            soapActions.putIfAbsent(name, action);
            return this;
        }

        public SoapDaemonRuntime build() {
            Objects.requireNonNull(dispatcherConfig, "dispatcherConfig");
            Objects.requireNonNull(httpConfig, "httpConfig");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(handlerCompiler, "handlerCompiler");
            Objects.requireNonNull(transportFactory, "transportFactory");

            // 1. Registry: WSDL imports first, then manual handlers and tables
            OperationRegistry reg = registry != null ? registry : new OperationRegistry();
            WsdlImporter importer = new WsdlImporter(reg, handlerCompiler);
            List<ImportReport> reports = new ArrayList<>();
            for (WsdlSource w : wsdls) {
                reports.add(importer.importFrom(w.model(), w.callbacks(), w.fallback()));
            }
            for (ManualRegistration h : handlers) {
                reg.register(h.version(), h.name(), h.handler());
            }
            reg.addActionMapping(ActionDirection.INPUT, wsaInput);
            reg.addActionMapping(ActionDirection.OUTPUT, wsaOutput);
            reg.addSoapActionMapping(soapActions);

            // 2. Dispatcher and transport
            SoapDispatcher dispatcher = new SoapDispatcher(reg, dispatcherConfig, observabilitySink);
            SoapTransport transport = Objects.requireNonNull(
                    transportFactory.apply(dispatcher, httpConfig), "transport");

            return new SoapDaemonRuntime(reg, dispatcher, transport, reports);
        }
    }
}
