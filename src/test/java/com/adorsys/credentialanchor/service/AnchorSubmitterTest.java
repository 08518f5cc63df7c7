package com.adorsys.credentialanchor.service;

import com.adorsys.credentialanchor.config.LedgerConfig;
import com.adorsys.credentialanchor.exception.AccountException;
import com.adorsys.credentialanchor.exception.SubmissionException;
import com.adorsys.credentialanchor.ledger.LedgerKeyPair;
import com.adorsys.credentialanchor.ledger.xdr.SignedTransaction;
import com.adorsys.credentialanchor.ledger.xdr.Transaction;
import com.adorsys.credentialanchor.model.AnchorRecord;
import com.adorsys.credentialanchor.model.CredentialStatus;
import com.adorsys.credentialanchor.model.StoredCredential;
import com.adorsys.credentialanchor.util.StrKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class AnchorSubmitterTest {

    private static final String SECRET = "SAAQEAYEAUDAOCAJBIFQYDIOB4IBCEQTCQKRMFYYDENBWHA5DYPSBF5K";
    private static final String HASH = "0d7df82c646dc671aad9150917aff4d6d047eb1cf76cc97c2a1543c6ef6e0767";
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private LedgerKeyPair signer;
    private InMemoryLedgerClient ledger;
    private MutableClock clock;
    private IdentifierDeriver identifierDeriver;
    private CredentialRecordCodec codec;

    @BeforeEach
    void setUp() {
        signer = LedgerKeyPair.fromSecretSeed(SECRET);
        ledger = new InMemoryLedgerClient(signer.getAccountId());
        clock = new MutableClock(NOW);
        identifierDeriver = new IdentifierDeriver(clock);
        codec = new CredentialRecordCodec();
    }

    private AnchorSubmitter submitter(boolean allowFallback) {
        LedgerConfig config = LedgerConfig.builder()
                .secretKey(SECRET)
                .allowSimulatedFallback(allowFallback)
                .build();
        return new AnchorSubmitter(ledger, new LedgerAccountValidator(ledger, config), identifierDeriver, codec,
                new SignerSubmissionQueue(true, Duration.ofSeconds(5)),
                new FallbackSimulator(identifierDeriver, clock), signer, config, clock);
    }

    @Test
    void anchorWritesRecordUnderDerivedKey() throws Exception {
        AnchorRecord record = submitter(false).anchor(HASH);

        String expectedId = identifierDeriver.deriveDeterministic(HASH, signer.getAccountId());
        StoredCredential stored = codec.decode(ledger.getEntry(CredentialRecordCodec.dataKey(expectedId)));
        SignedTransaction submitted = ledger.getSubmitted().get(0);
        Transaction transaction = submitted.getTransaction();

        assertAll(
                () -> assertEquals(expectedId, record.identifier()),
                () -> assertEquals(HASH, record.hash()),
                () -> assertEquals(CredentialStatus.ACTIVE, record.status()),
                () -> assertFalse(record.simulated()),
                () -> assertEquals(NOW, record.createdAt()),
                () -> assertEquals(501L, record.ledgerSequence()),
                () -> assertEquals(submitted.getHashHex(), record.transactionHash()),
                () -> assertEquals(HASH, stored.hash()),
                () -> assertEquals(CredentialStatus.ACTIVE, stored.status()),
                () -> assertEquals("CREATE:" + expectedId.substring(0, 16), transaction.getMemo().getText()),
                () -> assertEquals(1, transaction.getOperations().size()),
                () -> assertEquals(100L, transaction.getFee()),
                () -> assertEquals(1001L, transaction.getSequenceNumber())
        );
    }

    @Test
    void reanchoringSamePayloadKeepsIdentifier() throws Exception {
        AnchorSubmitter submitter = submitter(false);

        AnchorRecord first = submitter.anchor(HASH);
        AnchorRecord second = submitter.anchor(HASH);

        assertEquals(first.identifier(), second.identifier());
        assertEquals(2, ledger.getSubmitted().size());
    }

    @Test
    void lowBalanceDoesNotBlockSubmission() throws Exception {
        ledger.setBalance(new BigDecimal("1"));

        AnchorRecord record = submitter(false).anchor(HASH);

        assertFalse(record.simulated());
        assertEquals(1, ledger.getSubmitted().size());
    }

    @Test
    void submissionFailurePropagatesWithoutFallback() {
        ledger.failNextSubmission(new SubmissionException("Transaction rejected by the ledger: tx_insufficient_fee",
                400, "tx_insufficient_fee", java.util.List.of()));

        SubmissionException e = assertThrows(SubmissionException.class, () -> submitter(false).anchor(HASH));

        assertEquals("tx_insufficient_fee", e.getTransactionResultCode());
    }

    @Test
    void missingAccountPropagatesWithoutFallback() {
        ledger.setAccountExists(false);

        assertThrows(AccountException.class, () -> submitter(false).anchor(HASH));
        assertTrue(ledger.getSubmitted().isEmpty());
    }

    @Test
    void fallbackReturnsFlaggedSimulatedRecord() throws Exception {
        ledger.failNextSubmission(new SubmissionException("Failed to submit transaction", 503));

        AnchorRecord record = submitter(true).anchor(HASH);

        String deterministicId = identifierDeriver.deriveDeterministic(HASH, signer.getAccountId());
        assertAll(
                () -> assertTrue(record.simulated()),
                () -> assertEquals(0L, record.ledgerSequence()),
                () -> assertEquals(HASH, record.hash()),
                () -> assertEquals(CredentialStatus.ACTIVE, record.status()),
                () -> assertNotEquals(deterministicId, record.identifier()),
                () -> assertTrue(StrKey.isValid(StrKey.VersionByte.CONTRACT, record.identifier())),
                () -> assertEquals(64, record.transactionHash().length()),
                () -> assertNull(ledger.getEntry(CredentialRecordCodec.dataKey(deterministicId)))
        );
    }

    @Test
    void fallbackAlsoCoversMissingAccount() throws Exception {
        ledger.setAccountExists(false);

        assertTrue(submitter(true).anchor(HASH).simulated());
    }
}
