package com.adorsys.credentialanchor.ledger;

import java.math.BigDecimal;
import java.util.Base64;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;

/**
 * Snapshot of the signer account as returned by the ledger. Loaded fresh before every
 * operation because the next transaction must use {@code sequence + 1}.
 */
public class AccountState {

    private final String accountId;
    private final long sequence;
    private final BigDecimal nativeBalance;
    private final Map<String, String> dataEntries;

    /**
     * @param dataEntries data entry values keyed by name, base64 encoded as the ledger returns them
     */
    public AccountState(String accountId, long sequence, BigDecimal nativeBalance, Map<String, String> dataEntries) {
        this.accountId = accountId;
        this.sequence = sequence;
        this.nativeBalance = nativeBalance != null ? nativeBalance : BigDecimal.ZERO;
        this.dataEntries = dataEntries != null ? Map.copyOf(dataEntries) : Collections.emptyMap();
    }

    public String getAccountId() {
        return accountId;
    }

    public long getSequence() {
        return sequence;
    }

    public BigDecimal getNativeBalance() {
        return nativeBalance;
    }

    public Map<String, String> getDataEntries() {
        return dataEntries;
    }

    public Optional<byte[]> getDataValue(String key) {
        String encoded = dataEntries.get(key);
        if (encoded == null) {
            return Optional.empty();
        }
        return Optional.of(Base64.getDecoder().decode(encoded));
    }

    @Override
    public String toString() {
        return "AccountState{accountId='" + accountId + "', sequence=" + sequence
                + ", nativeBalance=" + nativeBalance + ", dataEntries=" + dataEntries.size() + "}";
    }
}
