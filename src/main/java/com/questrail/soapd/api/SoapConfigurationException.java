package com.questrail.soapd.api;

/**
 * Indicates a malformed registration or import request.
 *
 * <p>These are startup errors: they are raised while the registry is being
 * populated and are never deferred until a message arrives. Typical causes:</p>
 * <ul>
 *   <li>a {@code null} handler or callback</li>
 *   <li>a blank operation name</li>
 *   <li>an unknown action direction</li>
 * </ul>
 */
public final class SoapConfigurationException extends RuntimeException
{
    public SoapConfigurationException(String message) {
        super(message);
    }

    public SoapConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
