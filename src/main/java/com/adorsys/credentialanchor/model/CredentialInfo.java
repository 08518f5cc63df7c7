package com.adorsys.credentialanchor.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Hash and status read back from the ledger for one identifier.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CredentialInfo(
        @JsonProperty("identifier") String identifier,
        @JsonProperty("hash") String hash,
        @JsonProperty("status") CredentialStatus status
) {
}
