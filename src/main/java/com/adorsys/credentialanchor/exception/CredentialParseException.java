package com.adorsys.credentialanchor.exception;

/**
 * Exception thrown when a stored credential value matches none of the known encodings.
 */
public class CredentialParseException extends CredentialAnchorException {

    public CredentialParseException(String message) {
        super(message);
    }

    public CredentialParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
