package com.questrail.soapd.wsdl;

import org.apache.axiom.om.OMElement;

import javax.xml.namespace.QName;
import java.util.Objects;
import java.util.Optional;

/**
 * What an {@link OperationCallback} answers: a body element or a SOAP Fault,
 * with the status the transport should report.
 *
 * <p>Answers default to {@code 200 OK}, faults to {@code 500 SOAP fault}.
 * {@link #withStatus} overrides either, for services that map application
 * errors onto other status codes.</p>
 */
public final class OperationReply
{
    public static final int FAULT_STATUS = 500;
    public static final String FAULT_STATUS_TEXT = "SOAP fault";

    private final int statusCode;
    private final String statusText;
    private final OMElement body;
    private final QName faultCode;
    private final String faultReason;

    private OperationReply(int statusCode,
                           String statusText,
                           OMElement body,
                           QName faultCode,
                           String faultReason) {
        this.statusCode = statusCode;
        this.statusText = statusText;
        this.body = body;
        this.faultCode = faultCode;
        this.faultReason = faultReason;
    }

    /**
     * A regular answer; {@code body} becomes the first element of the
     * response body. {@code null} yields an empty body.
     */
    public static OperationReply ok(OMElement body) {
        return new OperationReply(200, "OK", body, null, null);
    }

    /**
     * A SOAP Fault.
     *
     * @param code   fault code; {@code null} for the version's receiver code
     *               ({@code Server} / {@code Receiver}). A code outside the
     *               envelope namespace becomes a subcode under SOAP 1.2.
     * @param reason human-readable fault string
     */
    public static OperationReply fault(QName code, String reason) {
        return new OperationReply(FAULT_STATUS, FAULT_STATUS_TEXT, null, code,
                Objects.requireNonNull(reason, "reason"));
    }

    public OperationReply withStatus(int statusCode, String statusText) {
        if (statusCode < 100 || statusCode > 999) {
            throw new IllegalArgumentException("statusCode out of range: " + statusCode);
        }
        return new OperationReply(statusCode, Objects.requireNonNull(statusText, "statusText"),
                body, faultCode, faultReason);
    }

    public boolean isFault() {
        return faultReason != null;
    }

    public int statusCode() {
        return statusCode;
    }

    public String statusText() {
        return statusText;
    }

    public Optional<OMElement> body() {
        return Optional.ofNullable(body);
    }

    public Optional<QName> faultCode() {
        return Optional.ofNullable(faultCode);
    }

    public String faultReason() {
        return faultReason;
    }

    @Override
    public String toString() {
        return isFault()
                ? "OperationReply{" + statusCode + " fault " + faultCode + ": " + faultReason + "}"
                : "OperationReply{" + statusCode + " " + statusText + "}";
    }
}
