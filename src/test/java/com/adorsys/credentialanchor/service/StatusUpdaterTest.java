package com.adorsys.credentialanchor.service;

import com.adorsys.credentialanchor.config.LedgerConfig;
import com.adorsys.credentialanchor.exception.CredentialNotFoundException;
import com.adorsys.credentialanchor.exception.CredentialParseException;
import com.adorsys.credentialanchor.exception.SubmissionException;
import com.adorsys.credentialanchor.ledger.LedgerKeyPair;
import com.adorsys.credentialanchor.ledger.xdr.ManageDataOperation;
import com.adorsys.credentialanchor.ledger.xdr.PaymentOperation;
import com.adorsys.credentialanchor.ledger.xdr.Transaction;
import com.adorsys.credentialanchor.model.CredentialStatus;
import com.adorsys.credentialanchor.model.StatusUpdateResult;
import com.adorsys.credentialanchor.model.StoredCredential;
import com.adorsys.credentialanchor.model.StoredEncoding;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StatusUpdaterTest {

    private static final String SECRET = "SAAQEAYEAUDAOCAJBIFQYDIOB4IBCEQTCQKRMFYYDENBWHA5DYPSBF5K";
    private static final String HASH = "0d7df82c646dc671aad9150917aff4d6d047eb1cf76cc97c2a1543c6ef6e0767";
    private static final String IDENTIFIER = "CAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAABSC4";
    private static final String DATA_KEY = "cred_CAAAAAAAAAAAAAAA";
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private LedgerKeyPair signer;
    private InMemoryLedgerClient ledger;
    private CredentialRecordCodec codec;
    private StatusUpdater updater;

    @BeforeEach
    void setUp() {
        signer = LedgerKeyPair.fromSecretSeed(SECRET);
        ledger = new InMemoryLedgerClient(signer.getAccountId());
        codec = new CredentialRecordCodec();
        LedgerConfig config = LedgerConfig.builder().secretKey(SECRET).build();
        updater = new StatusUpdater(ledger, new LedgerAccountValidator(ledger, config),
                new CredentialReader(ledger, codec, signer), codec,
                new SignerSubmissionQueue(true, Duration.ofSeconds(5)), signer, config, new MutableClock(NOW));
    }

    @Test
    void updateRewritesStatusAndKeepsHash() throws Exception {
        ledger.putEntry(DATA_KEY, codec.encode(new StoredCredential(HASH, CredentialStatus.ACTIVE,
                NOW.minusSeconds(3600), StoredEncoding.BINARY_V1)));

        StatusUpdateResult result = updater.updateStatus(IDENTIFIER, CredentialStatus.REVOKED);

        StoredCredential stored = codec.decode(ledger.getEntry(DATA_KEY));
        assertAll(
                () -> assertEquals(IDENTIFIER, result.identifier()),
                () -> assertEquals(CredentialStatus.REVOKED, result.status()),
                () -> assertEquals(501L, result.ledgerSequence()),
                () -> assertEquals(HASH, stored.hash()),
                () -> assertEquals(CredentialStatus.REVOKED, stored.status()),
                () -> assertEquals(NOW, stored.updatedAt())
        );
    }

    @Test
    void updateTransactionCarriesSelfPaymentAndMemo() throws Exception {
        ledger.putEntry(DATA_KEY, HASH.getBytes(StandardCharsets.UTF_8));

        updater.updateStatus(IDENTIFIER, CredentialStatus.SUSPENDED);

        Transaction transaction = ledger.getSubmitted().get(0).getTransaction();
        assertEquals(2, transaction.getOperations().size());
        assertInstanceOf(ManageDataOperation.class, transaction.getOperations().get(0));
        PaymentOperation payment = assertInstanceOf(PaymentOperation.class, transaction.getOperations().get(1));
        assertEquals(signer.getAccountId(), payment.getDestinationAccountId());
        assertEquals(1L, payment.getAmountStroops());
        assertEquals(200L, transaction.getFee());
        assertEquals("UPDATE:CAAAAAAAAAAAAAAA:S", transaction.getMemo().getText());
    }

    @Test
    void legacyValuesAreMigratedWithFullHash() throws Exception {
        ledger.putEntry(DATA_KEY, ("{\"hash\":\"" + HASH + "\",\"status\":\"Active\",\"createdAt\":\"2023-01-01T00:00:00Z\"}")
                .getBytes(StandardCharsets.UTF_8));

        updater.updateStatus(IDENTIFIER, CredentialStatus.REVOKED);

        StoredCredential stored = codec.decode(ledger.getEntry(DATA_KEY));
        assertEquals(StoredEncoding.BINARY_V1, stored.encoding());
        assertEquals(HASH, stored.hash());
        assertEquals(CredentialStatus.REVOKED, stored.status());
    }

    @Test
    void applyingSameStatusTwiceIsStable() throws Exception {
        ledger.putEntry(DATA_KEY, HASH.getBytes(StandardCharsets.UTF_8));

        StatusUpdateResult first = updater.updateStatus(IDENTIFIER, CredentialStatus.REVOKED);
        StoredCredential afterFirst = codec.decode(ledger.getEntry(DATA_KEY));
        StatusUpdateResult second = updater.updateStatus(IDENTIFIER, CredentialStatus.REVOKED);
        StoredCredential afterSecond = codec.decode(ledger.getEntry(DATA_KEY));

        assertEquals(afterFirst.hash(), afterSecond.hash());
        assertEquals(afterFirst.status(), afterSecond.status());
        assertNotEquals(first.transactionHash(), second.transactionHash());
    }

    @Test
    void missingEntryIsNotFound() {
        assertThrows(CredentialNotFoundException.class,
                () -> updater.updateStatus(IDENTIFIER, CredentialStatus.REVOKED));
        assertTrue(ledger.getSubmitted().isEmpty());
    }

    @Test
    void undecodableEntryIsNotOverwritten() {
        ledger.putEntry(DATA_KEY, "not a record".getBytes(StandardCharsets.UTF_8));

        assertThrows(CredentialParseException.class,
                () -> updater.updateStatus(IDENTIFIER, CredentialStatus.REVOKED));
        assertTrue(ledger.getSubmitted().isEmpty());
    }

    @Test
    void sequenceConflictSurfacesAsSubmissionException() {
        ledger.putEntry(DATA_KEY, HASH.getBytes(StandardCharsets.UTF_8));
        ledger.failNextSubmission(new SubmissionException("Transaction rejected by the ledger: tx_bad_seq", 400,
                SubmissionException.BAD_SEQUENCE, List.of()));

        SubmissionException e = assertThrows(SubmissionException.class,
                () -> updater.updateStatus(IDENTIFIER, CredentialStatus.REVOKED));

        assertTrue(e.isSequenceConflict());
    }
}
