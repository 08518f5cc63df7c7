package com.adorsys.credentialanchor.ledger;

import com.adorsys.credentialanchor.util.StrKey;
import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;
import org.bouncycastle.crypto.signers.Ed25519Signer;

import java.util.Arrays;

/**
 * Ed25519 signing identity of the ledger account that anchors credentials.
 * The secret seed never leaves this class.
 */
public final class LedgerKeyPair {

    private final Ed25519PrivateKeyParameters privateKey;
    private final byte[] publicKey;
    private final String accountId;

    private LedgerKeyPair(byte[] seed) {
        this.privateKey = new Ed25519PrivateKeyParameters(seed, 0);
        this.publicKey = privateKey.generatePublicKey().getEncoded();
        this.accountId = StrKey.encodeAccountId(publicKey);
    }

    /**
     * @param secretSeed a {@code S...} StrKey seed
     * @throws IllegalArgumentException if the seed is not a valid StrKey seed
     */
    public static LedgerKeyPair fromSecretSeed(String secretSeed) {
        byte[] seed = StrKey.decodeSecretSeed(secretSeed);
        try {
            return new LedgerKeyPair(seed);
        } finally {
            Arrays.fill(seed, (byte) 0);
        }
    }

    public static LedgerKeyPair fromRawSeed(byte[] seed) {
        if (seed == null || seed.length != StrKey.PAYLOAD_LENGTH) {
            throw new IllegalArgumentException("Ed25519 seed must be 32 bytes");
        }
        return new LedgerKeyPair(seed.clone());
    }

    public String getAccountId() {
        return accountId;
    }

    public byte[] getPublicKey() {
        return publicKey.clone();
    }

    /**
     * Last four bytes of the public key, attached to each signature so the ledger can find the signer.
     */
    public byte[] getSignatureHint() {
        return Arrays.copyOfRange(publicKey, publicKey.length - 4, publicKey.length);
    }

    public byte[] sign(byte[] data) {
        Ed25519Signer signer = new Ed25519Signer();
        signer.init(true, privateKey);
        signer.update(data, 0, data.length);
        return signer.generateSignature();
    }

    public boolean verify(byte[] data, byte[] signature) {
        Ed25519Signer verifier = new Ed25519Signer();
        verifier.init(false, new Ed25519PublicKeyParameters(publicKey, 0));
        verifier.update(data, 0, data.length);
        return verifier.verifySignature(signature);
    }

    @Override
    public String toString() {
        return "LedgerKeyPair{accountId='" + accountId + "'}";
    }
}
