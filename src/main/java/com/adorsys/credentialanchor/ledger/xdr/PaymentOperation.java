package com.adorsys.credentialanchor.ledger.xdr;

import com.adorsys.credentialanchor.util.StrKey;

/**
 * Native asset payment, amount in stroops (1 XLM = 10^7 stroops).
 */
public final class PaymentOperation implements Operation {

    private static final int KEY_TYPE_ED25519 = 0;
    private static final int ASSET_TYPE_NATIVE = 0;

    private final String destinationAccountId;
    private final long amountStroops;

    public PaymentOperation(String destinationAccountId, long amountStroops) {
        if (amountStroops <= 0) {
            throw new IllegalArgumentException("Payment amount must be positive");
        }
        StrKey.decodeAccountId(destinationAccountId);
        this.destinationAccountId = destinationAccountId;
        this.amountStroops = amountStroops;
    }

    public String getDestinationAccountId() {
        return destinationAccountId;
    }

    public long getAmountStroops() {
        return amountStroops;
    }

    @Override
    public void encode(XdrOutputStream xdr) {
        xdr.writeBoolean(false);
        xdr.writeInt(PAYMENT);
        xdr.writeInt(KEY_TYPE_ED25519);
        xdr.writeFixedOpaque(StrKey.decodeAccountId(destinationAccountId));
        xdr.writeInt(ASSET_TYPE_NATIVE);
        xdr.writeLong(amountStroops);
    }

    @Override
    public String toString() {
        return "PaymentOperation{destination='" + destinationAccountId + "', amount=" + amountStroops + "}";
    }
}
