package com.adorsys.credentialanchor.exception;

/**
 * Exception thrown when the signing secret is missing or malformed, or when the
 * configured network and Horizon endpoint do not belong together.
 */
public class ConfigurationException extends CredentialAnchorException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
