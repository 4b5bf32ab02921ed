package com.questrail.soapd.transport;

import java.net.InetSocketAddress;
import java.util.Optional;

/**
 * SoapTransport
 * -----------------------------------------------------------------------------
 * Port for a binding that receives SOAP requests and hands them to the
 * dispatcher.
 *
 * <p>Implementations own their sockets and threads. Everything they need
 * from the core is the dispatcher's single entry point; everything the core
 * sees from them is plain bytes and {@link com.questrail.soapd.api.RequestMetadata}.</p>
 */
public interface SoapTransport
{
    /**
     * Binds and starts accepting requests. Returns once the transport is
     * listening.
     *
     * @throws IllegalStateException when the transport cannot be bound or was already started
     */
    void start();

    /**
     * Stops accepting requests and releases all resources. Idempotent.
     */
    void stop();

    /**
     * The address actually bound, once started.
     */
    Optional<InetSocketAddress> localAddress();
}
