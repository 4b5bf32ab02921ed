/**
 * SOAP transport bindings.
 * =============================================================================
 *
 * <p>Transports are thin adapters around {@link com.questrail.soapd.dispatch.SoapDispatcher}:
 * they turn a wire request into {@code (body bytes, RequestMetadata)} and
 * render the resulting {@link com.questrail.soapd.api.DispatchResult} back
 * onto the wire.</p>
 *
 * <h2>Constraints</h2>
 * A transport:
 * <ul>
 *   <li>does not interpret SOAP envelopes or select operations;</li>
 *   <li>enforces its own connection lifetime limits, since the core has no
 *       cancellation and a hung handler holds its worker;</li>
 *   <li>keeps framework types (Netty channels, buffers, event loops) inside
 *       its own package.</li>
 * </ul>
 */
package com.questrail.soapd.transport;
