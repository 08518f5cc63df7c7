package com.adorsys.credentialanchor.service;

import com.adorsys.credentialanchor.client.LedgerClient;
import com.adorsys.credentialanchor.config.LedgerConfig;
import com.adorsys.credentialanchor.exception.AccountException;
import com.adorsys.credentialanchor.exception.CredentialAnchorException;
import com.adorsys.credentialanchor.exception.SubmissionException;
import com.adorsys.credentialanchor.ledger.AccountState;
import com.adorsys.credentialanchor.ledger.LedgerKeyPair;
import com.adorsys.credentialanchor.ledger.SubmissionResult;
import com.adorsys.credentialanchor.ledger.xdr.ManageDataOperation;
import com.adorsys.credentialanchor.ledger.xdr.MemoText;
import com.adorsys.credentialanchor.ledger.xdr.SignedTransaction;
import com.adorsys.credentialanchor.ledger.xdr.Transaction;
import com.adorsys.credentialanchor.ledger.xdr.TransactionBuilder;
import com.adorsys.credentialanchor.model.AnchorRecord;
import com.adorsys.credentialanchor.model.CredentialStatus;
import com.adorsys.credentialanchor.model.StoredCredential;
import com.adorsys.credentialanchor.model.StoredEncoding;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Instant;

/**
 * Writes a new credential record to the signer account's data entries.
 */
public class AnchorSubmitter {

    private static final Logger logger = Logger.getLogger(AnchorSubmitter.class);

    static final String CREATE_MEMO_PREFIX = "CREATE:";

    private final LedgerClient ledgerClient;
    private final LedgerAccountValidator accountValidator;
    private final IdentifierDeriver identifierDeriver;
    private final CredentialRecordCodec codec;
    private final SignerSubmissionQueue submissionQueue;
    private final FallbackSimulator fallbackSimulator;
    private final LedgerKeyPair signer;
    private final LedgerConfig config;
    private final Clock clock;

    public AnchorSubmitter(LedgerClient ledgerClient, LedgerAccountValidator accountValidator,
                           IdentifierDeriver identifierDeriver, CredentialRecordCodec codec,
                           SignerSubmissionQueue submissionQueue, FallbackSimulator fallbackSimulator,
                           LedgerKeyPair signer, LedgerConfig config, Clock clock) {
        this.ledgerClient = ledgerClient;
        this.accountValidator = accountValidator;
        this.identifierDeriver = identifierDeriver;
        this.codec = codec;
        this.submissionQueue = submissionQueue;
        this.fallbackSimulator = fallbackSimulator;
        this.signer = signer;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Anchors a credential hash with status {@link CredentialStatus#ACTIVE}.
     *
     * @param credentialHash hex digest of the credential payload
     * @return the anchored record; {@code simulated} only if fallback is enabled and the write failed
     * @throws AccountException    if the signer account does not exist and fallback is disabled
     * @throws SubmissionException if the ledger rejected the transaction and fallback is disabled
     */
    public AnchorRecord anchor(String credentialHash) throws CredentialAnchorException {
        try {
            return submissionQueue.execute(signer.getAccountId(), () -> submit(credentialHash));
        } catch (AccountException | SubmissionException e) {
            logFailure(credentialHash, e);
            if (config.isAllowSimulatedFallback()) {
                return fallbackSimulator.simulate(credentialHash, e);
            }
            throw e;
        }
    }

    private AnchorRecord submit(String credentialHash) throws CredentialAnchorException {
        AccountState account = accountValidator.validateAccount(signer).account();

        String identifier = identifierDeriver.deriveDeterministic(credentialHash, signer.getAccountId());
        String dataKey = CredentialRecordCodec.dataKey(identifier);
        if (account.getDataEntries().containsKey(dataKey)) {
            logger.infof("Identifier %s already anchored by this signer, overwriting entry %s", identifier, dataKey);
        }

        Instant now = clock.instant();
        byte[] value = codec.encode(new StoredCredential(credentialHash, CredentialStatus.ACTIVE, now,
                StoredEncoding.BINARY_V1));

        Transaction transaction = new TransactionBuilder(account, config.getBaseFee())
                .addOperation(new ManageDataOperation(dataKey, value))
                .setMemo(MemoText.of(CREATE_MEMO_PREFIX + shortIdentifier(identifier)))
                .setTimeout(config.getSubmissionTimeout())
                .setClock(clock)
                .build();
        SignedTransaction signed = transaction.sign(signer, config.getNetworkPassphrase());

        logger.infof("Anchoring credential %s under %s (entry %s, sequence %d)",
                credentialHash, identifier, dataKey, transaction.getSequenceNumber());
        SubmissionResult result = ledgerClient.submitTransaction(signed);

        return new AnchorRecord(identifier, credentialHash, CredentialStatus.ACTIVE, result.transactionHash(),
                result.ledgerSequence(), now, false);
    }

    static String shortIdentifier(String identifier) {
        return identifier.substring(0, Math.min(CredentialRecordCodec.IDENTIFIER_KEY_LENGTH, identifier.length()));
    }

    private void logFailure(String credentialHash, CredentialAnchorException e) {
        if (e instanceof SubmissionException submission) {
            logger.errorf(e, "Anchoring failed for hash %s: kind=%s, message=%s, status=%d, resultCode=%s, operationCodes=%s",
                    credentialHash, e.getClass().getSimpleName(), e.getMessage(), submission.getStatusCode(),
                    submission.getTransactionResultCode(), submission.getOperationResultCodes());
        } else {
            logger.errorf(e, "Anchoring failed for hash %s: kind=%s, message=%s",
                    credentialHash, e.getClass().getSimpleName(), e.getMessage());
        }
    }
}
