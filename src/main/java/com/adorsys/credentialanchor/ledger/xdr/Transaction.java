package com.adorsys.credentialanchor.ledger.xdr;

import com.adorsys.credentialanchor.ledger.LedgerKeyPair;
import com.adorsys.credentialanchor.util.Hashes;
import com.adorsys.credentialanchor.util.StrKey;

import java.util.List;

/**
 * Unsigned ledger transaction. The hash that gets signed binds the transaction to one network
 * through the network id, the SHA-256 of the network passphrase.
 */
public final class Transaction {

    static final int ENVELOPE_TYPE_TX = 2;
    private static final int KEY_TYPE_ED25519 = 0;
    private static final int PRECOND_TIME = 1;

    private final String sourceAccountId;
    private final long fee;
    private final long sequenceNumber;
    private final long minTime;
    private final long maxTime;
    private final MemoText memo;
    private final List<Operation> operations;

    Transaction(String sourceAccountId, long fee, long sequenceNumber, long minTime, long maxTime,
                MemoText memo, List<Operation> operations) {
        this.sourceAccountId = sourceAccountId;
        this.fee = fee;
        this.sequenceNumber = sequenceNumber;
        this.minTime = minTime;
        this.maxTime = maxTime;
        this.memo = memo;
        this.operations = List.copyOf(operations);
    }

    public String getSourceAccountId() {
        return sourceAccountId;
    }

    public long getFee() {
        return fee;
    }

    public long getSequenceNumber() {
        return sequenceNumber;
    }

    public long getMaxTime() {
        return maxTime;
    }

    public MemoText getMemo() {
        return memo;
    }

    public List<Operation> getOperations() {
        return operations;
    }

    void encode(XdrOutputStream xdr) {
        xdr.writeInt(KEY_TYPE_ED25519);
        xdr.writeFixedOpaque(StrKey.decodeAccountId(sourceAccountId));
        xdr.writeUnsignedInt(fee);
        xdr.writeLong(sequenceNumber);
        xdr.writeInt(PRECOND_TIME);
        xdr.writeLong(minTime);
        xdr.writeLong(maxTime);
        memo.encode(xdr);
        xdr.writeUnsignedInt(operations.size());
        for (Operation operation : operations) {
            operation.encode(xdr);
        }
        xdr.writeInt(0); // ext
    }

    public byte[] signatureBase(String networkPassphrase) {
        XdrOutputStream xdr = new XdrOutputStream();
        xdr.writeFixedOpaque(Hashes.sha256(networkPassphrase));
        xdr.writeInt(ENVELOPE_TYPE_TX);
        encode(xdr);
        return xdr.toByteArray();
    }

    public byte[] hash(String networkPassphrase) {
        return Hashes.sha256(signatureBase(networkPassphrase));
    }

    public SignedTransaction sign(LedgerKeyPair signer, String networkPassphrase) {
        if (!signer.getAccountId().equals(sourceAccountId)) {
            throw new IllegalArgumentException("Signer " + signer.getAccountId()
                    + " is not the transaction source " + sourceAccountId);
        }
        byte[] hash = hash(networkPassphrase);
        return new SignedTransaction(this, hash, signer.getSignatureHint(), signer.sign(hash));
    }
}
