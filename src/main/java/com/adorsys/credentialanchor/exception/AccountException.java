package com.adorsys.credentialanchor.exception;

/**
 * Exception thrown when the signer account does not exist on the ledger.
 */
public class AccountException extends CredentialAnchorException {

    private final String accountId;

    public AccountException(String message, String accountId) {
        super(message);
        this.accountId = accountId;
    }

    public String getAccountId() {
        return accountId;
    }
}
