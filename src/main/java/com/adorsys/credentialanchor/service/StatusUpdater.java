package com.adorsys.credentialanchor.service;

import com.adorsys.credentialanchor.client.LedgerClient;
import com.adorsys.credentialanchor.config.LedgerConfig;
import com.adorsys.credentialanchor.exception.CredentialAnchorException;
import com.adorsys.credentialanchor.exception.SubmissionException;
import com.adorsys.credentialanchor.ledger.AccountState;
import com.adorsys.credentialanchor.ledger.LedgerKeyPair;
import com.adorsys.credentialanchor.ledger.SubmissionResult;
import com.adorsys.credentialanchor.ledger.xdr.ManageDataOperation;
import com.adorsys.credentialanchor.ledger.xdr.MemoText;
import com.adorsys.credentialanchor.ledger.xdr.PaymentOperation;
import com.adorsys.credentialanchor.ledger.xdr.SignedTransaction;
import com.adorsys.credentialanchor.ledger.xdr.Transaction;
import com.adorsys.credentialanchor.ledger.xdr.TransactionBuilder;
import com.adorsys.credentialanchor.model.CredentialStatus;
import com.adorsys.credentialanchor.model.StatusUpdateResult;
import com.adorsys.credentialanchor.model.StoredCredential;
import org.jboss.logging.Logger;

import java.time.Clock;

/**
 * Rewrites the status of an anchored credential. The hash is carried over from the stored
 * record whatever encoding it was written in; the new value always uses the current format.
 */
public class StatusUpdater {

    private static final Logger logger = Logger.getLogger(StatusUpdater.class);

    static final String UPDATE_MEMO_PREFIX = "UPDATE:";
    static final long RECORD_PAYMENT_STROOPS = 1L;

    private final LedgerClient ledgerClient;
    private final LedgerAccountValidator accountValidator;
    private final CredentialReader credentialReader;
    private final CredentialRecordCodec codec;
    private final SignerSubmissionQueue submissionQueue;
    private final LedgerKeyPair signer;
    private final LedgerConfig config;
    private final Clock clock;

    public StatusUpdater(LedgerClient ledgerClient, LedgerAccountValidator accountValidator,
                         CredentialReader credentialReader, CredentialRecordCodec codec,
                         SignerSubmissionQueue submissionQueue, LedgerKeyPair signer, LedgerConfig config,
                         Clock clock) {
        this.ledgerClient = ledgerClient;
        this.accountValidator = accountValidator;
        this.credentialReader = credentialReader;
        this.codec = codec;
        this.submissionQueue = submissionQueue;
        this.signer = signer;
        this.config = config;
        this.clock = clock;
    }

    /**
     * @throws com.adorsys.credentialanchor.exception.CredentialNotFoundException if nothing is anchored under the identifier
     * @throws com.adorsys.credentialanchor.exception.CredentialParseException    if the stored value cannot be decoded
     * @throws SubmissionException if the ledger rejects the update, including sequence conflicts
     */
    public StatusUpdateResult updateStatus(String identifier, CredentialStatus newStatus)
            throws CredentialAnchorException {
        try {
            return submissionQueue.execute(signer.getAccountId(), () -> submit(identifier, newStatus));
        } catch (SubmissionException e) {
            if (e.isSequenceConflict()) {
                logger.warnf("Status update of %s lost a sequence race with another writer", identifier);
            } else {
                logger.errorf(e, "Status update failed for %s: resultCode=%s, operationCodes=%s",
                        identifier, e.getTransactionResultCode(), e.getOperationResultCodes());
            }
            throw e;
        }
    }

    private StatusUpdateResult submit(String identifier, CredentialStatus newStatus) throws CredentialAnchorException {
        AccountState account = accountValidator.validateAccount(signer).account();
        StoredCredential previous = credentialReader.locate(account, identifier);
        StoredCredential updated = previous.withStatus(newStatus, clock.instant());

        String shortId = AnchorSubmitter.shortIdentifier(identifier);
        Transaction transaction = new TransactionBuilder(account, config.getBaseFee())
                .addOperation(new ManageDataOperation(CredentialRecordCodec.dataKey(identifier), codec.encode(updated)))
                .addOperation(new PaymentOperation(signer.getAccountId(), RECORD_PAYMENT_STROOPS))
                .setMemo(MemoText.of(UPDATE_MEMO_PREFIX + shortId + ":" + newStatus.getValue().charAt(0)))
                .setTimeout(config.getSubmissionTimeout())
                .setClock(clock)
                .build();
        SignedTransaction signed = transaction.sign(signer, config.getNetworkPassphrase());

        logger.infof("Updating %s from %s to %s (previous encoding %s, sequence %d)",
                identifier, previous.status().getValue(), newStatus.getValue(), previous.encoding(),
                transaction.getSequenceNumber());
        SubmissionResult result = ledgerClient.submitTransaction(signed);

        return new StatusUpdateResult(identifier, newStatus, result.transactionHash(), result.ledgerSequence());
    }
}
