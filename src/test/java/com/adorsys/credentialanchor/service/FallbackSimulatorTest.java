package com.adorsys.credentialanchor.service;

import com.adorsys.credentialanchor.exception.SubmissionException;
import com.adorsys.credentialanchor.model.AnchorRecord;
import com.adorsys.credentialanchor.model.CredentialStatus;
import com.adorsys.credentialanchor.util.Hashes;
import com.adorsys.credentialanchor.util.StrKey;
import nl.altindag.log.LogCaptor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasItem;
import static org.junit.jupiter.api.Assertions.*;

class FallbackSimulatorTest {

    private static final String HASH = "0d7df82c646dc671aad9150917aff4d6d047eb1cf76cc97c2a1543c6ef6e0767";
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private final LogCaptor logCaptor = LogCaptor.forClass(FallbackSimulator.class);
    private final MutableClock clock = new MutableClock(NOW);
    private final FallbackSimulator simulator = new FallbackSimulator(new IdentifierDeriver(clock), clock);

    @AfterEach
    void tearDown() {
        logCaptor.close();
    }

    @Test
    void simulatedRecordIsFlaggedAndNeverOnLedger() {
        AnchorRecord record = simulator.simulate(HASH, new SubmissionException("Horizon down", 503));

        assertAll(
                () -> assertTrue(record.simulated()),
                () -> assertEquals(0L, record.ledgerSequence()),
                () -> assertEquals(CredentialStatus.ACTIVE, record.status()),
                () -> assertEquals(HASH, record.hash()),
                () -> assertEquals(NOW, record.createdAt()),
                () -> assertTrue(StrKey.isValid(StrKey.VersionByte.CONTRACT, record.identifier())),
                () -> assertEquals(Hashes.sha256Hex(record.identifier() + HASH + NOW.toEpochMilli()),
                        record.transactionHash())
        );
    }

    @Test
    void identifierChangesWithTime() {
        String first = simulator.simulate(HASH, new SubmissionException("Horizon down", 503)).identifier();
        clock.advance(Duration.ofMillis(1));
        String second = simulator.simulate(HASH, new SubmissionException("Horizon down", 503)).identifier();

        assertNotEquals(first, second);
    }

    @Test
    void everySimulationIsLoggedAsWarning() {
        simulator.simulate(HASH, new SubmissionException("Horizon down", 503));

        assertThat(logCaptor.getWarnLogs(), hasItem(containsString("SIMULATED record")));
        assertThat(logCaptor.getWarnLogs(), hasItem(containsString("Horizon down")));
    }
}
