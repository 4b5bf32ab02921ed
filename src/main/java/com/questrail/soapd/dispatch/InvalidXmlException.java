package com.questrail.soapd.dispatch;

/**
 * Indicates that a request body is not well-formed XML.
 */
public final class InvalidXmlException extends RuntimeException
{
    public InvalidXmlException(String message) {
        super(message);
    }

    public InvalidXmlException(String message, Throwable cause) {
        super(message, cause);
    }
}
