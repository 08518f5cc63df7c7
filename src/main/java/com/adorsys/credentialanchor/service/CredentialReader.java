package com.adorsys.credentialanchor.service;

import com.adorsys.credentialanchor.client.LedgerClient;
import com.adorsys.credentialanchor.exception.AccountException;
import com.adorsys.credentialanchor.exception.CredentialNotFoundException;
import com.adorsys.credentialanchor.exception.CredentialParseException;
import com.adorsys.credentialanchor.exception.SubmissionException;
import com.adorsys.credentialanchor.ledger.AccountState;
import com.adorsys.credentialanchor.ledger.LedgerKeyPair;
import com.adorsys.credentialanchor.model.CredentialInfo;
import com.adorsys.credentialanchor.model.StoredCredential;
import com.adorsys.credentialanchor.model.StoredEncoding;
import org.jboss.logging.Logger;

/**
 * Reads credential records back from the signer account.
 */
public class CredentialReader {

    private static final Logger logger = Logger.getLogger(CredentialReader.class);

    private final LedgerClient ledgerClient;
    private final CredentialRecordCodec codec;
    private final LedgerKeyPair signer;

    public CredentialReader(LedgerClient ledgerClient, CredentialRecordCodec codec, LedgerKeyPair signer) {
        this.ledgerClient = ledgerClient;
        this.codec = codec;
        this.signer = signer;
    }

    /**
     * @throws CredentialNotFoundException if no entry exists for the identifier
     * @throws CredentialParseException    if the entry matches no known encoding
     */
    public CredentialInfo getCredential(String identifier)
            throws AccountException, SubmissionException, CredentialNotFoundException, CredentialParseException {
        AccountState account = ledgerClient.loadAccount(signer.getAccountId());
        StoredCredential stored = locate(account, identifier);
        return new CredentialInfo(identifier, stored.hash(), stored.status());
    }

    /**
     * Finds and decodes the entry of an identifier in an already loaded account.
     */
    public StoredCredential locate(AccountState account, String identifier)
            throws CredentialNotFoundException, CredentialParseException {
        String dataKey = CredentialRecordCodec.dataKey(identifier);
        byte[] value = account.getDataValue(dataKey)
                .orElseThrow(() -> new CredentialNotFoundException(identifier));

        StoredCredential stored = codec.decode(value);
        if (stored.encoding() != StoredEncoding.BINARY_V1) {
            logger.debugf("Entry %s uses legacy encoding %s", dataKey, stored.encoding());
        }
        return stored;
    }
}
