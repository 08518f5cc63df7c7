package com.adorsys.credentialanchor.service;

import com.adorsys.credentialanchor.model.AnchorRecord;
import com.adorsys.credentialanchor.model.CredentialStatus;
import com.adorsys.credentialanchor.util.Hashes;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Instant;

/**
 * Produces a record that looks like an anchored credential when the ledger write failed and
 * the operator allowed it. Nothing is written; the record is flagged {@code simulated}.
 */
public class FallbackSimulator {

    private static final Logger logger = Logger.getLogger(FallbackSimulator.class);

    private final IdentifierDeriver identifierDeriver;
    private final Clock clock;

    public FallbackSimulator(IdentifierDeriver identifierDeriver, Clock clock) {
        this.identifierDeriver = identifierDeriver;
        this.clock = clock;
    }

    public AnchorRecord simulate(String credentialHash, Exception cause) {
        Instant now = clock.instant();
        String identifier = identifierDeriver.deriveRandomized(credentialHash);
        String transactionHash = Hashes.sha256Hex(identifier + credentialHash + now.toEpochMilli());

        logger.warnf("Ledger write failed (%s: %s); returning SIMULATED record %s for hash %s",
                cause.getClass().getSimpleName(), cause.getMessage(), identifier, credentialHash);

        return new AnchorRecord(identifier, credentialHash, CredentialStatus.ACTIVE, transactionHash, 0L, now, true);
    }
}
