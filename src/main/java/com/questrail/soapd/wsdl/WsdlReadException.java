package com.questrail.soapd.wsdl;

/**
 * Indicates that a WSDL document could not be read or interpreted.
 */
public final class WsdlReadException extends RuntimeException
{
    public WsdlReadException(String message) {
        super(message);
    }

    public WsdlReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
