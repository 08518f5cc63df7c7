package com.adorsys.credentialanchor.ledger.xdr;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Sets (or, with a null value, deletes) a data entry on the source account.
 */
public final class ManageDataOperation implements Operation {

    public static final int MAX_NAME_LENGTH = 64;
    public static final int MAX_VALUE_LENGTH = 64;

    private final String name;
    private final byte[] value;

    public ManageDataOperation(String name, byte[] value) {
        if (name == null || name.isEmpty() || name.getBytes(StandardCharsets.UTF_8).length > MAX_NAME_LENGTH) {
            throw new IllegalArgumentException("Data entry name must be 1 to " + MAX_NAME_LENGTH + " bytes");
        }
        if (value != null && value.length > MAX_VALUE_LENGTH) {
            throw new IllegalArgumentException("Data entry value must not exceed " + MAX_VALUE_LENGTH + " bytes");
        }
        this.name = name;
        this.value = value != null ? value.clone() : null;
    }

    public String getName() {
        return name;
    }

    public byte[] getValue() {
        return value != null ? value.clone() : null;
    }

    @Override
    public void encode(XdrOutputStream xdr) {
        xdr.writeBoolean(false); // no per-operation source account
        xdr.writeInt(MANAGE_DATA);
        xdr.writeString(name, MAX_NAME_LENGTH);
        xdr.writeBoolean(value != null);
        if (value != null) {
            xdr.writeVarOpaque(value, MAX_VALUE_LENGTH);
        }
    }

    @Override
    public String toString() {
        return "ManageDataOperation{name='" + name + "', valueLength=" + (value != null ? value.length : -1) + "}";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ManageDataOperation that)) return false;
        return name.equals(that.name) && Arrays.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return 31 * name.hashCode() + Arrays.hashCode(value);
    }
}
