package com.questrail.soapd.wsdl;

import com.questrail.soapd.api.OperationHandler;

/**
 * Turns an operation definition plus application callback into an
 * {@link OperationHandler} the dispatcher can invoke.
 *
 * <p>This is where message decoding and encoding belongs. A schema-aware
 * implementation would validate the request body against the WSDL types and
 * hand the callback decoded data; {@link ElementMatchingHandlerCompiler}
 * only checks body element names.</p>
 */
@FunctionalInterface
public interface HandlerCompiler {
    OperationHandler compile(OperationDefinition operation, OperationCallback callback);
}
