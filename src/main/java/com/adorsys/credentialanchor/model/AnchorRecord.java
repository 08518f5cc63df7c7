package com.adorsys.credentialanchor.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Result of anchoring a credential. {@code simulated} is true when the record was produced by the
 * fallback path and nothing was written to the ledger.
 */
public record AnchorRecord(
        @JsonProperty("identifier") String identifier,
        @JsonProperty("hash") String hash,
        @JsonProperty("status") CredentialStatus status,
        @JsonProperty("transactionHash") String transactionHash,
        @JsonProperty("ledgerSequence") long ledgerSequence,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("simulated") boolean simulated
) {
}
