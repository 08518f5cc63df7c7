package com.adorsys.credentialanchor.model;

public record StatusUpdateResult(String identifier, CredentialStatus status, String transactionHash, long ledgerSequence) {
}
