package com.adorsys.credentialanchor.service;

import com.adorsys.credentialanchor.exception.CredentialParseException;
import com.adorsys.credentialanchor.ledger.xdr.ManageDataOperation;
import com.adorsys.credentialanchor.model.CredentialStatus;
import com.adorsys.credentialanchor.model.StoredCredential;
import com.adorsys.credentialanchor.model.StoredEncoding;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.bouncycastle.util.encoders.Hex;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Encodes and decodes the value of a credential data entry.
 *
 * <p>Records are written in one format, the versioned binary record:
 * <pre>
 *   byte 0      version tag (0x01)
 *   byte 1      status code
 *   bytes 2-9   last update, epoch millis, big-endian
 *   bytes 10-   hash bytes, at most 54
 * </pre>
 * A hash longer than 54 bytes is cut after its 54th byte so the value stays within the 64 byte
 * entry limit. Values written by earlier releases are still read: compact JSON
 * ({@code h}, {@code s}, {@code t}), verbose JSON ({@code hash}, {@code status}, {@code createdAt})
 * and a bare hex hash, which implies {@link CredentialStatus#ACTIVE}.
 */
public class CredentialRecordCodec {

    private static final Logger logger = Logger.getLogger(CredentialRecordCodec.class);

    public static final String DATA_KEY_PREFIX = "cred_";
    public static final int IDENTIFIER_KEY_LENGTH = 16;

    static final byte VERSION_1 = 0x01;
    static final int HEADER_LENGTH = 10;
    static final int MAX_HASH_BYTES = ManageDataOperation.MAX_VALUE_LENGTH - HEADER_LENGTH;

    private static final Pattern HEX = Pattern.compile("^(?:[0-9a-fA-F]{2})+$");

    private final ObjectMapper objectMapper;

    public CredentialRecordCodec() {
        this(new ObjectMapper());
    }

    public CredentialRecordCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Data entry key for an identifier; identical for create, read and update.
     */
    public static String dataKey(String identifier) {
        return DATA_KEY_PREFIX + identifier.substring(0, Math.min(IDENTIFIER_KEY_LENGTH, identifier.length()));
    }

    public byte[] encode(StoredCredential record) {
        if (record.hash() == null || !HEX.matcher(record.hash()).matches()) {
            throw new IllegalArgumentException("Credential hash must be an even-length hex string");
        }
        byte[] hash = Hex.decode(record.hash());
        if (hash.length > MAX_HASH_BYTES) {
            logger.warnf("Hash of %d bytes truncated to %d bytes to fit the data entry", hash.length, MAX_HASH_BYTES);
            hash = Arrays.copyOf(hash, MAX_HASH_BYTES);
        }
        Instant updatedAt = record.updatedAt() != null ? record.updatedAt() : Instant.EPOCH;
        return ByteBuffer.allocate(HEADER_LENGTH + hash.length)
                .put(VERSION_1)
                .put(record.status().getCode())
                .putLong(updatedAt.toEpochMilli())
                .put(hash)
                .array();
    }

    /**
     * @throws CredentialParseException if the value matches none of the known encodings
     */
    public StoredCredential decode(byte[] value) throws CredentialParseException {
        if (value == null || value.length == 0) {
            throw new CredentialParseException("Stored credential value is empty");
        }
        if (value[0] == VERSION_1) {
            return decodeBinary(value);
        }
        String text = new String(value, StandardCharsets.UTF_8).trim();
        if (text.startsWith("{")) {
            return decodeJson(text);
        }
        if (HEX.matcher(text).matches()) {
            return new StoredCredential(text.toLowerCase(Locale.ROOT), CredentialStatus.ACTIVE, null,
                    StoredEncoding.PLAIN_HASH);
        }
        throw new CredentialParseException("Unrecognized stored credential encoding");
    }

    private StoredCredential decodeBinary(byte[] value) throws CredentialParseException {
        if (value.length <= HEADER_LENGTH) {
            throw new CredentialParseException("Binary credential record too short: " + value.length + " bytes");
        }
        ByteBuffer buffer = ByteBuffer.wrap(value);
        buffer.get(); // version
        CredentialStatus status;
        try {
            status = CredentialStatus.fromCode(buffer.get());
        } catch (IllegalArgumentException e) {
            throw new CredentialParseException(e.getMessage(), e);
        }
        Instant updatedAt = Instant.ofEpochMilli(buffer.getLong());
        byte[] hash = new byte[buffer.remaining()];
        buffer.get(hash);
        return new StoredCredential(Hex.toHexString(hash), status, updatedAt, StoredEncoding.BINARY_V1);
    }

    private StoredCredential decodeJson(String text) throws CredentialParseException {
        JsonNode node;
        try {
            node = objectMapper.readTree(text);
        } catch (IOException e) {
            throw new CredentialParseException("Stored credential value is not valid JSON", e);
        }
        if (node == null || !node.isObject()) {
            throw new CredentialParseException("Stored credential JSON is not an object");
        }
        if (node.hasNonNull("h")) {
            return new StoredCredential(requireHash(node, "h"), requireStatus(node, "s"),
                    optionalTimestamp(node, "t"), StoredEncoding.COMPACT_JSON);
        }
        if (node.hasNonNull("hash")) {
            Instant updatedAt = optionalTimestamp(node, "updatedAt");
            return new StoredCredential(requireHash(node, "hash"), requireStatus(node, "status"),
                    updatedAt != null ? updatedAt : optionalTimestamp(node, "createdAt"), StoredEncoding.VERBOSE_JSON);
        }
        throw new CredentialParseException("Stored credential JSON carries no hash field");
    }

    private static String requireHash(JsonNode node, String field) throws CredentialParseException {
        String hash = node.get(field).asText();
        if (!HEX.matcher(hash).matches()) {
            throw new CredentialParseException("Stored hash field '" + field + "' is not hex");
        }
        return hash.toLowerCase(Locale.ROOT);
    }

    private static CredentialStatus requireStatus(JsonNode node, String field) throws CredentialParseException {
        JsonNode status = node.get(field);
        if (status == null || !status.isTextual()) {
            throw new CredentialParseException("Stored credential JSON lacks status field '" + field + "'");
        }
        try {
            return CredentialStatus.fromValue(status.asText());
        } catch (IllegalArgumentException e) {
            throw new CredentialParseException(e.getMessage(), e);
        }
    }

    private static Instant optionalTimestamp(JsonNode node, String field) throws CredentialParseException {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isIntegralNumber()) {
            return Instant.ofEpochMilli(value.asLong());
        }
        try {
            return Instant.parse(value.asText());
        } catch (DateTimeParseException e) {
            throw new CredentialParseException("Stored timestamp '" + field + "' is not a valid instant", e);
        }
    }
}
