package com.questrail.soapd.wsdl;

import java.util.List;

/**
 * Source of operation definitions, typically a parsed WSDL document.
 */
public interface WsdlModel {

    /**
     * Where the definitions came from; used in log messages only.
     */
    String location();

    /**
     * All SOAP operations, one entry per (protocol version, operation name).
     */
    List<OperationDefinition> operations();
}
