package com.adorsys.credentialanchor.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;

public enum CredentialStatus {
    ACTIVE("Active", (byte) 0),
    REVOKED("Revoked", (byte) 1),
    SUSPENDED("Suspended", (byte) 2);

    private final String value;
    private final byte code;

    CredentialStatus(String value, byte code) {
        this.value = value;
        this.code = code;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Single byte used by the binary ledger record.
     */
    public byte getCode() {
        return code;
    }

    /**
     * Parses a status name, ignoring case.
     *
     * @throws IllegalArgumentException if the value names no status
     */
    @JsonCreator
    public static CredentialStatus fromValue(String value) {
        if (value != null) {
            for (CredentialStatus status : values()) {
                if (status.value.equalsIgnoreCase(value.trim())) {
                    return status;
                }
            }
        }
        throw new IllegalArgumentException("Unknown credential status: " + value);
    }

    public static CredentialStatus fromCode(byte code) {
        for (CredentialStatus status : values()) {
            if (status.code == code) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown credential status code: " + code);
    }

    public static List<String> validValues() {
        return Arrays.stream(values()).map(CredentialStatus::getValue).toList();
    }
}
