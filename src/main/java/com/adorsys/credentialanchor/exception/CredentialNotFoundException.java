package com.adorsys.credentialanchor.exception;

/**
 * Exception thrown when no data entry is stored for a credential identifier.
 */
public class CredentialNotFoundException extends CredentialAnchorException {

    private final String identifier;

    public CredentialNotFoundException(String identifier) {
        super("Credential not found for identifier: " + identifier);
        this.identifier = identifier;
    }

    public String getIdentifier() {
        return identifier;
    }
}
