package com.adorsys.credentialanchor.client;

import com.adorsys.credentialanchor.exception.AccountException;
import com.adorsys.credentialanchor.exception.SubmissionException;
import com.adorsys.credentialanchor.ledger.AccountState;
import com.adorsys.credentialanchor.ledger.SubmissionResult;
import com.adorsys.credentialanchor.ledger.xdr.SignedTransaction;

/**
 * Remote operations against the ledger. This abstraction allows for different implementations
 * (e.g., another RPC endpoint type, or an in-memory ledger for testing).
 */
public interface LedgerClient {

    /**
     * Loads the current state of an account, including its data entries.
     *
     * @param accountId the {@code G...} account id
     * @return the account state
     * @throws AccountException if the account does not exist
     * @throws SubmissionException if the ledger cannot be reached or answers with an error
     */
    AccountState loadAccount(String accountId) throws AccountException, SubmissionException;

    /**
     * Submits a signed transaction and waits for the ledger to include it.
     *
     * @param transaction the signed transaction
     * @return the transaction hash and ledger sequence
     * @throws SubmissionException if the ledger rejects the transaction or cannot be reached
     */
    SubmissionResult submitTransaction(SignedTransaction transaction) throws SubmissionException;

    /**
     * Checks if the ledger endpoint answers.
     *
     * @return true if the endpoint is healthy, false otherwise
     */
    boolean checkHealth();
}
