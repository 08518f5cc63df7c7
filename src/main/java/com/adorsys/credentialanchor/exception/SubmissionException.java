package com.adorsys.credentialanchor.exception;

import java.util.List;

/**
 * Exception thrown when the ledger rejects a transaction or cannot be reached.
 */
public class SubmissionException extends CredentialAnchorException {

    public static final String BAD_SEQUENCE = "tx_bad_seq";

    private final int statusCode;
    private final String transactionResultCode;
    private final List<String> operationResultCodes;

    public SubmissionException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
        this.transactionResultCode = null;
        this.operationResultCodes = List.of();
    }

    public SubmissionException(String message, int statusCode) {
        this(message, statusCode, null, List.of());
    }

    public SubmissionException(String message, int statusCode, String transactionResultCode,
                               List<String> operationResultCodes) {
        super(message);
        this.statusCode = statusCode;
        this.transactionResultCode = transactionResultCode;
        this.operationResultCodes = operationResultCodes != null ? List.copyOf(operationResultCodes) : List.of();
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getTransactionResultCode() {
        return transactionResultCode;
    }

    public List<String> getOperationResultCodes() {
        return operationResultCodes;
    }

    /**
     * @return true if the ledger refused the transaction because another one from the same
     * signer consumed the sequence number first
     */
    public boolean isSequenceConflict() {
        return BAD_SEQUENCE.equals(transactionResultCode);
    }
}
