package com.questrail.soapd.wsdl;

import com.questrail.soapd.api.ProtocolVersion;
import com.questrail.soapd.api.SoapConfigurationException;
import com.questrail.soapd.api.SoapNamespaces;
import com.questrail.soapd.fault.FaultDescriptor;
import com.questrail.soapd.fault.FaultSynthesizer;
import com.questrail.soapd.registry.ActionDirection;
import com.questrail.soapd.registry.OperationRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.xml.namespace.QName;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * WsdlImporter
 * -----------------------------------------------------------------------------
 * Registers every operation of a {@link WsdlModel} in an
 * {@link OperationRegistry}.
 *
 * <h2>Callback selection</h2>
 * Per operation, in order: the callback registered under its name, the
 * default callback, or a stub answering "not implemented". Registering the
 * stub keeps the operation routable, so clients learn that it exists.
 *
 * <h2>Action tables</h2>
 * SOAPAction and WS-Addressing input/output actions of the operations are
 * merged into the registry. Existing entries win, so importing a second WSDL
 * into the same registry cannot re-route actions claimed by the first.
 *
 * <p>Callback names that match no operation are probably typos; each one is
 * logged as a warning and listed in the {@link ImportReport}.</p>
 */
public final class WsdlImporter
{
    private static final Logger log = LoggerFactory.getLogger(WsdlImporter.class);

    private final OperationRegistry registry;
    private final HandlerCompiler compiler;
    private final FaultSynthesizer faults = new FaultSynthesizer();

    public WsdlImporter(OperationRegistry registry) {
        this(registry, new ElementMatchingHandlerCompiler());
    }

    public WsdlImporter(OperationRegistry registry, HandlerCompiler compiler) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.compiler = Objects.requireNonNull(compiler, "compiler");
    }

    public ImportReport importFrom(WsdlModel model, Map<String, OperationCallback> callbacks) {
        return importFrom(model, callbacks, null);
    }

    /**
     * @param callbacks       callbacks per operation name, may be empty
     * @param defaultCallback used for operations without their own callback; may be {@code null}
     * @throws SoapConfigurationException when a callback is {@code null} or
     *                                    the registry rejects an operation
     */
    public ImportReport importFrom(WsdlModel model,
                                   Map<String, OperationCallback> callbacks,
                                   OperationCallback defaultCallback) {
        Objects.requireNonNull(model, "model");
        Map<String, OperationCallback> byName = callbacks == null ? Map.of() : callbacks;
        byName.forEach((name, callback) -> {
            if (callback == null) {
                throw new SoapConfigurationException("callback for operation '" + name + "' is null");
            }
        });

        Set<String> unused = new TreeSet<>(byName.keySet());
        Set<String> implemented = new LinkedHashSet<>();
        Set<String> stubbed = new LinkedHashSet<>();
        Map<String, String> wsaInput = new LinkedHashMap<>();
        Map<String, String> wsaOutput = new LinkedHashMap<>();
        Map<String, String> soapActions = new LinkedHashMap<>();

        List<OperationDefinition> operations = model.operations();
        for (OperationDefinition op : operations) {
            String name = op.name();
            OperationCallback callback = byName.get(name);
            if (callback != null) {
                unused.remove(name);
            } else {
                callback = defaultCallback;
            }

            if (callback != null) {
                implemented.add(name);
            } else {
                callback = stub(op);
                stubbed.add(name);
            }

            registry.register(op.version(), name, compiler.compile(op, callback));

            op.wsaInputAction().ifPresent(a -> wsaInput.putIfAbsent(name, a));
            op.wsaOutputAction().ifPresent(a -> wsaOutput.putIfAbsent(name, a));
            op.soapAction().ifPresent(a -> soapActions.putIfAbsent(name, a));
        }

        registry.addActionMapping(ActionDirection.INPUT, wsaInput);
        registry.addActionMapping(ActionDirection.OUTPUT, wsaOutput);
        registry.addSoapActionMapping(soapActions);

        if (operations.isEmpty()) {
            log.info("no operations in WSDL {}", model.location());
        } else {
            log.info("added {} operations from {}", operations.size(), model.location());
        }
        if (!stubbed.isEmpty()) {
            log.debug("operations without callback, answering 'not implemented': {}", stubbed);
        }
        for (String name : unused) {
            log.warn("no operation for callback handler {}", name);
        }

        return new ImportReport(model.location(), new ArrayList<>(implemented),
                new ArrayList<>(stubbed), new ArrayList<>(unused));
    }

    /**
     * Callback for operations nobody implemented: a Fault with status 501.
     */
    private OperationCallback stub(OperationDefinition op) {
        FaultDescriptor fd = faults.operationNotImplemented(op.version(), op.name());
        String subcode = fd.category().faultSubcode();
        QName code = op.version() == ProtocolVersion.SOAP11
                ? new QName(op.version().envelopeNamespace(), op.version().receiverFaultCode() + "." + subcode)
                : new QName(SoapNamespaces.DAEMON_FAULT, subcode);
        OperationReply reply = OperationReply.fault(code, fd.message()).withStatus(fd.statusCode(), fd.reason());
        return request -> reply;
    }
}
