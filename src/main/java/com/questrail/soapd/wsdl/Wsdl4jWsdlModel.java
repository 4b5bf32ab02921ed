package com.questrail.soapd.wsdl;

import com.questrail.soapd.api.ProtocolVersion;
import com.questrail.soapd.api.SoapNamespaces;

import javax.wsdl.Binding;
import javax.wsdl.BindingInput;
import javax.wsdl.BindingOperation;
import javax.wsdl.BindingOutput;
import javax.wsdl.Definition;
import javax.wsdl.Input;
import javax.wsdl.Message;
import javax.wsdl.Operation;
import javax.wsdl.Output;
import javax.wsdl.Part;
import javax.wsdl.WSDLElement;
import javax.wsdl.WSDLException;
import javax.wsdl.extensions.soap.SOAPBinding;
import javax.wsdl.extensions.soap.SOAPBody;
import javax.wsdl.extensions.soap.SOAPOperation;
import javax.wsdl.extensions.soap12.SOAP12Binding;
import javax.wsdl.extensions.soap12.SOAP12Body;
import javax.wsdl.extensions.soap12.SOAP12Operation;
import javax.wsdl.factory.WSDLFactory;
import javax.wsdl.xml.WSDLReader;
import javax.xml.namespace.QName;
import java.net.URL;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Wsdl4jWsdlModel
 * -----------------------------------------------------------------------------
 * {@link WsdlModel} over a WSDL 1.1 document read with wsdl4j.
 *
 * <p>Every binding carrying a {@code soap:binding} or {@code soap12:binding}
 * contributes its operations under the matching protocol version. Bindings
 * with other transports (plain HTTP, MIME) are ignored. Per operation:</p>
 * <ul>
 *   <li>style: the operation's {@code soap:operation style}, else the
 *       binding's, else document;</li>
 *   <li>document style: request/response element of the first message part
 *       declared with {@code element=};</li>
 *   <li>rpc style: {@code {soap:body namespace}operationName} and
 *       {@code ...Response};</li>
 *   <li>{@code soapAction} of the {@code soap:operation};</li>
 *   <li>{@code wsaw:Action} or {@code wsam:Action} on the portType's input
 *       and output.</li>
 * </ul>
 * When several bindings of the same version define the same operation name,
 * the first one (in binding name order) is kept.
 */
public final class Wsdl4jWsdlModel implements WsdlModel
{
    private static final List<String> ACTION_NAMESPACES = List.of(
            SoapNamespaces.WSAW, SoapNamespaces.WSAM, SoapNamespaces.WSA_10);

    private final String location;
    private final List<OperationDefinition> operations;

    public Wsdl4jWsdlModel(Definition definition) {
        Objects.requireNonNull(definition, "definition");
        String base = definition.getDocumentBaseURI();
        this.location = base != null ? base
                : definition.getQName() != null ? definition.getQName().toString() : "(wsdl)";
        this.operations = Collections.unmodifiableList(collect(definition));
    }

    /**
     * Reads a WSDL document, following its imports.
     *
     * @throws WsdlReadException when the document cannot be read or parsed
     */
    public static Wsdl4jWsdlModel read(String uri) {
        Objects.requireNonNull(uri, "uri");
        try {
            WSDLReader reader = WSDLFactory.newInstance().newWSDLReader();
            reader.setFeature("javax.wsdl.verbose", false);
            reader.setFeature("javax.wsdl.importDocuments", true);
            return new Wsdl4jWsdlModel(reader.readWSDL(uri));
        } catch (WSDLException e) {
            throw new WsdlReadException("cannot read WSDL " + uri + ": " + e.getMessage(), e);
        }
    }

    public static Wsdl4jWsdlModel read(URL url) {
        return read(Objects.requireNonNull(url, "url").toExternalForm());
    }

    @Override
    public String location() {
        return location;
    }

    @Override
    public List<OperationDefinition> operations() {
        return operations;
    }

    // ---------------------------------------------------------------------

    private static List<OperationDefinition> collect(Definition definition) {
        List<Binding> bindings = new ArrayList<>(values(definition.getAllBindings()));
        bindings.sort(Comparator.comparing(b -> String.valueOf(b.getQName())));

        List<OperationDefinition> out = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Binding binding : bindings) {
            SoapBindingInfo soap = soapBinding(binding);
            if (soap == null) {
                continue;
            }
            for (Object o : binding.getBindingOperations()) {
                BindingOperation bop = (BindingOperation) o;
                OperationDefinition op = operation(soap, bop);
                if (seen.add(op.version() + " " + op.name())) {
                    out.add(op);
                }
            }
        }
        return out;
    }

    private record SoapBindingInfo(ProtocolVersion version, String style) {}

    private static SoapBindingInfo soapBinding(Binding binding) {
        for (Object ext : binding.getExtensibilityElements()) {
            if (ext instanceof SOAPBinding sb) {
                return new SoapBindingInfo(ProtocolVersion.SOAP11, sb.getStyle());
            }
            if (ext instanceof SOAP12Binding sb) {
                return new SoapBindingInfo(ProtocolVersion.SOAP12, sb.getStyle());
            }
        }
        return null;
    }

    private static OperationDefinition operation(SoapBindingInfo soap, BindingOperation bop) {
        String name = bop.getName();
        OperationDefinition.Builder b = OperationDefinition.builder(name, soap.version());

        String style = soap.style();
        for (Object ext : bop.getExtensibilityElements()) {
            if (ext instanceof SOAPOperation so) {
                b.withSoapAction(so.getSoapActionURI());
                style = so.getStyle() != null ? so.getStyle() : style;
            } else if (ext instanceof SOAP12Operation so) {
                b.withSoapAction(so.getSoapActionURI());
                style = so.getStyle() != null ? so.getStyle() : style;
            }
        }
        boolean rpc = "rpc".equalsIgnoreCase(style);
        b.withStyle(rpc ? OperationDefinition.Style.RPC : OperationDefinition.Style.DOCUMENT);

        Operation abstractOp = bop.getOperation();
        Input input = abstractOp == null ? null : abstractOp.getInput();
        Output output = abstractOp == null ? null : abstractOp.getOutput();

        if (rpc) {
            BindingInput bin = bop.getBindingInput();
            BindingOutput bout = bop.getBindingOutput();
            if (bin != null) {
                b.withRequestElement(new QName(bodyNamespace(bin.getExtensibilityElements()), name));
            }
            if (bout != null) {
                b.withResponseElement(new QName(bodyNamespace(bout.getExtensibilityElements()), name + "Response"));
            }
        } else {
            if (input != null) {
                b.withRequestElement(firstElementPart(input.getMessage()));
            }
            if (output != null) {
                b.withResponseElement(firstElementPart(output.getMessage()));
            }
        }

        b.withWsaInputAction(action(input));
        b.withWsaOutputAction(action(output));
        return b.build();
    }

    private static String bodyNamespace(List<?> extensibilityElements) {
        for (Object ext : extensibilityElements) {
            String ns = null;
            if (ext instanceof SOAPBody body) {
                ns = body.getNamespaceURI();
            } else if (ext instanceof SOAP12Body body) {
                ns = body.getNamespaceURI();
            }
            if (ns != null) {
                return ns;
            }
        }
        return "";
    }

    private static QName firstElementPart(Message message) {
        if (message == null) {
            return null;
        }
        for (Object o : message.getOrderedParts(null)) {
            QName element = ((Part) o).getElementName();
            if (element != null) {
                return element;
            }
        }
        return null;
    }

    /**
     * wsdl4j keeps unknown attributes as strings, or as QNames when an
     * extension registry declared them so.
     */
    private static String action(WSDLElement element) {
        if (element == null) {
            return null;
        }
        for (String ns : ACTION_NAMESPACES) {
            Object value = element.getExtensionAttribute(new QName(ns, "Action"));
            if (value instanceof QName q) {
                return actionText(q);
            }
            if (value != null) {
                return value.toString();
            }
        }
        return null;
    }

    /**
     * An action such as {@code urn:x:y} parses as a QName with an undeclared
     * prefix; wsdl4j then keeps the whole value as local part.
     */
    private static String actionText(QName q) {
        if (q.getNamespaceURI().isEmpty()) {
            return q.getLocalPart();
        }
        return q.getPrefix().isEmpty()
                ? q.getNamespaceURI() + q.getLocalPart()
                : q.getPrefix() + ":" + q.getLocalPart();
    }

    @SuppressWarnings("unchecked")
    private static Collection<Binding> values(Map<?, ?> map) {
        return map == null ? List.of() : (Collection<Binding>) map.values();
    }
}
