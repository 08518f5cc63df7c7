package com.adorsys.credentialanchor.ledger.xdr;

import org.bouncycastle.util.encoders.Hex;

import java.util.Base64;

/**
 * Transaction with the signer's decorated signature, ready for submission.
 */
public final class SignedTransaction {

    private static final int MAX_SIGNATURE_LENGTH = 64;

    private final Transaction transaction;
    private final byte[] hash;
    private final byte[] signatureHint;
    private final byte[] signature;

    SignedTransaction(Transaction transaction, byte[] hash, byte[] signatureHint, byte[] signature) {
        this.transaction = transaction;
        this.hash = hash;
        this.signatureHint = signatureHint;
        this.signature = signature;
    }

    public Transaction getTransaction() {
        return transaction;
    }

    public String getHashHex() {
        return Hex.toHexString(hash);
    }

    public byte[] getSignature() {
        return signature.clone();
    }

    /**
     * @return the base64 XDR {@code TransactionEnvelope} the ledger endpoint accepts
     */
    public String toEnvelopeXdrBase64() {
        XdrOutputStream xdr = new XdrOutputStream();
        xdr.writeInt(Transaction.ENVELOPE_TYPE_TX);
        transaction.encode(xdr);
        xdr.writeUnsignedInt(1);
        xdr.writeFixedOpaque(signatureHint);
        xdr.writeVarOpaque(signature, MAX_SIGNATURE_LENGTH);
        return Base64.getEncoder().encodeToString(xdr.toByteArray());
    }
}
