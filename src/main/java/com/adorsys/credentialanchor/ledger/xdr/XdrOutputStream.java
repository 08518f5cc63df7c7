package com.adorsys.credentialanchor.ledger.xdr;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Minimal XDR (RFC 4506) writer covering the types a Stellar transaction envelope needs.
 */
public class XdrOutputStream {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();

    public XdrOutputStream writeInt(int value) {
        out.write((value >>> 24) & 0xff);
        out.write((value >>> 16) & 0xff);
        out.write((value >>> 8) & 0xff);
        out.write(value & 0xff);
        return this;
    }

    public XdrOutputStream writeUnsignedInt(long value) {
        if (value < 0 || value > 0xffffffffL) {
            throw new IllegalArgumentException("Value out of uint32 range: " + value);
        }
        return writeInt((int) value);
    }

    public XdrOutputStream writeLong(long value) {
        writeInt((int) (value >>> 32));
        return writeInt((int) value);
    }

    public XdrOutputStream writeBoolean(boolean value) {
        return writeInt(value ? 1 : 0);
    }

    /**
     * Fixed length opaque; the caller guarantees the length the schema expects.
     */
    public XdrOutputStream writeFixedOpaque(byte[] bytes) {
        out.write(bytes, 0, bytes.length);
        return pad(bytes.length);
    }

    public XdrOutputStream writeVarOpaque(byte[] bytes, int maxLength) {
        if (bytes.length > maxLength) {
            throw new IllegalArgumentException("Opaque of " + bytes.length + " bytes exceeds limit " + maxLength);
        }
        writeInt(bytes.length);
        return writeFixedOpaque(bytes);
    }

    public XdrOutputStream writeString(String value, int maxLength) {
        return writeVarOpaque(value.getBytes(StandardCharsets.UTF_8), maxLength);
    }

    public byte[] toByteArray() {
        return out.toByteArray();
    }

    private XdrOutputStream pad(int length) {
        int padding = (4 - (length % 4)) % 4;
        for (int i = 0; i < padding; i++) {
            out.write(0);
        }
        return this;
    }
}
