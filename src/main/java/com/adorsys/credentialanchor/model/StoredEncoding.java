package com.adorsys.credentialanchor.model;

/**
 * Encodings a credential data entry may be stored in, newest first.
 */
public enum StoredEncoding {
    BINARY_V1,
    COMPACT_JSON,
    VERBOSE_JSON,
    PLAIN_HASH
}
