package com.adorsys.credentialanchor.ledger.xdr;

/**
 * A ledger operation carried by a transaction.
 */
public interface Operation {

    int MANAGE_DATA = 10;
    int PAYMENT = 1;

    void encode(XdrOutputStream xdr);
}
