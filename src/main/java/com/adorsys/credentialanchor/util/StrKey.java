package com.adorsys.credentialanchor.util;

import com.google.common.io.BaseEncoding;

import java.util.Arrays;

/**
 * Stellar "StrKey" encoding: base32 of a version byte, a 32 byte payload and a CRC16-XModem
 * checksum stored little-endian. Produces the 56 character {@code G...}, {@code S...} and
 * {@code C...} strings used for accounts, secret seeds and contract addresses.
 */
public final class StrKey {

    public static final int PAYLOAD_LENGTH = 32;
    public static final int ENCODED_LENGTH = 56;

    private static final BaseEncoding BASE32 = BaseEncoding.base32().omitPadding();

    public enum VersionByte {
        ACCOUNT_ID((byte) (6 << 3)),
        SEED((byte) (18 << 3)),
        CONTRACT((byte) (2 << 3));

        private final byte value;

        VersionByte(byte value) {
            this.value = value;
        }

        public byte getValue() {
            return value;
        }
    }

    private StrKey() {
    }

    public static String encodeAccountId(byte[] publicKey) {
        return encode(VersionByte.ACCOUNT_ID, publicKey);
    }

    public static String encodeSecretSeed(byte[] seed) {
        return encode(VersionByte.SEED, seed);
    }

    public static String encodeContract(byte[] contractHash) {
        return encode(VersionByte.CONTRACT, contractHash);
    }

    public static byte[] decodeAccountId(String accountId) {
        return decode(VersionByte.ACCOUNT_ID, accountId);
    }

    public static byte[] decodeSecretSeed(String seed) {
        return decode(VersionByte.SEED, seed);
    }

    public static byte[] decodeContract(String contractId) {
        return decode(VersionByte.CONTRACT, contractId);
    }

    public static boolean isValid(VersionByte versionByte, String encoded) {
        try {
            decode(versionByte, encoded);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    public static String encode(VersionByte versionByte, byte[] payload) {
        if (payload == null || payload.length != PAYLOAD_LENGTH) {
            throw new IllegalArgumentException("StrKey payload must be " + PAYLOAD_LENGTH + " bytes");
        }
        byte[] data = new byte[1 + PAYLOAD_LENGTH + 2];
        data[0] = versionByte.getValue();
        System.arraycopy(payload, 0, data, 1, PAYLOAD_LENGTH);
        int checksum = crc16(data, 0, 1 + PAYLOAD_LENGTH);
        data[data.length - 2] = (byte) (checksum & 0xff);
        data[data.length - 1] = (byte) ((checksum >>> 8) & 0xff);
        return BASE32.encode(data);
    }

    /**
     * @throws IllegalArgumentException on wrong length, alphabet, version byte or checksum
     */
    public static byte[] decode(VersionByte versionByte, String encoded) {
        if (encoded == null || encoded.length() != ENCODED_LENGTH) {
            throw new IllegalArgumentException("StrKey must be " + ENCODED_LENGTH + " characters");
        }
        byte[] data = BASE32.decode(encoded);
        if (data.length != 1 + PAYLOAD_LENGTH + 2) {
            throw new IllegalArgumentException("Invalid StrKey length");
        }
        if (data[0] != versionByte.getValue()) {
            throw new IllegalArgumentException("StrKey is not of type " + versionByte);
        }
        int expected = crc16(data, 0, 1 + PAYLOAD_LENGTH);
        int actual = (data[data.length - 2] & 0xff) | ((data[data.length - 1] & 0xff) << 8);
        if (expected != actual) {
            throw new IllegalArgumentException("StrKey checksum mismatch");
        }
        return Arrays.copyOfRange(data, 1, 1 + PAYLOAD_LENGTH);
    }

    static int crc16(byte[] bytes, int offset, int length) {
        int crc = 0;
        for (int i = offset; i < offset + length; i++) {
            crc ^= (bytes[i] & 0xff) << 8;
            for (int bit = 0; bit < 8; bit++) {
                crc = (crc & 0x8000) != 0 ? (crc << 1) ^ 0x1021 : crc << 1;
                crc &= 0xffff;
            }
        }
        return crc;
    }
}
