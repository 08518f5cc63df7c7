package com.adorsys.credentialanchor.exception;

public class CredentialAnchorException extends Exception {
    public CredentialAnchorException(String message) {
        super(message);
    }

    public CredentialAnchorException(String message, Throwable cause) {
        super(message, cause);
    }
}
