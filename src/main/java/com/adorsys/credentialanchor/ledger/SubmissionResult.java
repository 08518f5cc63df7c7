package com.adorsys.credentialanchor.ledger;

/**
 * Outcome of a transaction accepted by the ledger.
 */
public record SubmissionResult(String transactionHash, long ledgerSequence) {
}
