package com.adorsys.credentialanchor.service;

import com.adorsys.credentialanchor.exception.CredentialNotFoundException;
import com.adorsys.credentialanchor.exception.CredentialParseException;
import com.adorsys.credentialanchor.ledger.LedgerKeyPair;
import com.adorsys.credentialanchor.model.CredentialInfo;
import com.adorsys.credentialanchor.model.CredentialStatus;
import com.adorsys.credentialanchor.model.StoredCredential;
import com.adorsys.credentialanchor.model.StoredEncoding;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class CredentialReaderTest {

    private static final String SECRET = "SAAQEAYEAUDAOCAJBIFQYDIOB4IBCEQTCQKRMFYYDENBWHA5DYPSBF5K";
    private static final String HASH = "0d7df82c646dc671aad9150917aff4d6d047eb1cf76cc97c2a1543c6ef6e0767";
    private static final String IDENTIFIER = "CAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAABSC4";

    private InMemoryLedgerClient ledger;
    private CredentialRecordCodec codec;
    private CredentialReader reader;

    @BeforeEach
    void setUp() {
        LedgerKeyPair signer = LedgerKeyPair.fromSecretSeed(SECRET);
        ledger = new InMemoryLedgerClient(signer.getAccountId());
        codec = new CredentialRecordCodec();
        reader = new CredentialReader(ledger, codec, signer);
    }

    @Test
    void readsCurrentFormat() throws Exception {
        ledger.putEntry(CredentialRecordCodec.dataKey(IDENTIFIER), codec.encode(new StoredCredential(
                HASH, CredentialStatus.SUSPENDED, Instant.now(), StoredEncoding.BINARY_V1)));

        CredentialInfo info = reader.getCredential(IDENTIFIER);

        assertEquals(new CredentialInfo(IDENTIFIER, HASH, CredentialStatus.SUSPENDED), info);
    }

    @Test
    void legacyPlainHashReadsAsActive() throws Exception {
        ledger.putEntry("cred_CAAAAAAAAAAAAAAA", HASH.getBytes(StandardCharsets.UTF_8));

        CredentialInfo info = reader.getCredential(IDENTIFIER);

        assertEquals(HASH, info.hash());
        assertEquals(CredentialStatus.ACTIVE, info.status());
    }

    @Test
    void legacyCompactJsonIsRead() throws Exception {
        ledger.putEntry("cred_CAAAAAAAAAAAAAAA",
                "{\"h\":\"0d7df82c646dc671\",\"s\":\"Revoked\",\"t\":1714564800000}".getBytes(StandardCharsets.UTF_8));

        assertEquals(CredentialStatus.REVOKED, reader.getCredential(IDENTIFIER).status());
    }

    @Test
    void unknownIdentifierIsNotFound() {
        CredentialNotFoundException e = assertThrows(CredentialNotFoundException.class,
                () -> reader.getCredential(IDENTIFIER));

        assertEquals(IDENTIFIER, e.getIdentifier());
    }

    @Test
    void garbageEntryIsParseError() {
        ledger.putEntry("cred_CAAAAAAAAAAAAAAA", "???".getBytes(StandardCharsets.UTF_8));

        assertThrows(CredentialParseException.class, () -> reader.getCredential(IDENTIFIER));
    }
}
