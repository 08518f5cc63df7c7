package com.adorsys.credentialanchor.model;

import java.time.Instant;

/**
 * Decoded content of a credential data entry.
 *
 * @param hash      the anchored hash, lowercase hex
 * @param status    current status
 * @param updatedAt last write time, null for encodings that carry none
 * @param encoding  the encoding the value was stored in
 */
public record StoredCredential(String hash, CredentialStatus status, Instant updatedAt, StoredEncoding encoding) {

    public StoredCredential withStatus(CredentialStatus newStatus, Instant now) {
        return new StoredCredential(hash, newStatus, now, StoredEncoding.BINARY_V1);
    }
}
