package com.adorsys.credentialanchor.service;

import com.adorsys.credentialanchor.util.Hashes;
import com.adorsys.credentialanchor.util.StrKey;

import java.time.Clock;

/**
 * Derives the on-ledger identifier of a credential, formatted as a contract address ({@code C...}).
 */
public class IdentifierDeriver {

    private final Clock clock;

    public IdentifierDeriver() {
        this(Clock.systemUTC());
    }

    public IdentifierDeriver(Clock clock) {
        this.clock = clock;
    }

    /**
     * Same hash and signer always give the same identifier, so callers can detect re-anchoring.
     */
    public String deriveDeterministic(String credentialHash, String signerAccountId) {
        return StrKey.encodeContract(Hashes.sha256(credentialHash + signerAccountId));
    }

    /**
     * Time-salted identifier, only for simulated records.
     */
    public String deriveRandomized(String credentialHash) {
        return StrKey.encodeContract(Hashes.sha256(credentialHash + clock.millis()));
    }
}
