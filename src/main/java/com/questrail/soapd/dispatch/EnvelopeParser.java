package com.questrail.soapd.dispatch;

import org.apache.axiom.om.OMDocument;
import org.apache.axiom.om.OMElement;
import org.apache.axiom.om.OMException;
import org.apache.axiom.om.OMXMLBuilderFactory;
import org.apache.axiom.om.OMXMLParserWrapper;
import org.apache.axiom.om.util.StAXParserConfiguration;

import java.io.ByteArrayInputStream;

/**
 * Turns raw request bytes into an Axiom element tree.
 *
 * <p>The parser runs with Axiom's SOAP configuration, which refuses document
 * type declarations: a SOAP message must not contain one, and accepting them
 * would expose the daemon to entity expansion. The whole document is built
 * eagerly so that every syntax error surfaces here rather than later, inside
 * a handler.</p>
 */
final class EnvelopeParser
{
    /**
     * @return the document element
     * @throws InvalidXmlException when the bytes are not a well-formed document
     */
    OMElement parse(byte[] body) {
        if (body == null || body.length == 0) {
            throw new InvalidXmlException("empty document");
        }

        try {
            OMXMLParserWrapper builder = OMXMLBuilderFactory.createOMBuilder(
                    StAXParserConfiguration.SOAP, new ByteArrayInputStream(body));
            OMDocument document = builder.getDocument();
            document.build();

            OMElement root = document.getOMDocumentElement();
            if (root == null) {
                throw new InvalidXmlException("document has no root element");
            }
            return root;
        } catch (OMException e) {
            throw new InvalidXmlException(describe(e), e);
        }
    }

    /**
     * The parser's own message is usually on the innermost cause.
     */
    private static String describe(Throwable e) {
        Throwable t = e;
        while (t.getCause() != null && t.getCause() != t) {
            t = t.getCause();
        }
        String message = t.getMessage();
        return message == null || message.isBlank() ? t.getClass().getSimpleName() : message.strip();
    }
}
