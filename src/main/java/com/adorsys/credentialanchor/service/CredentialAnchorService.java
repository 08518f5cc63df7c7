package com.adorsys.credentialanchor.service;

import com.adorsys.credentialanchor.client.HorizonLedgerClient;
import com.adorsys.credentialanchor.client.LedgerClient;
import com.adorsys.credentialanchor.config.LedgerConfig;
import com.adorsys.credentialanchor.exception.ConfigurationException;
import com.adorsys.credentialanchor.exception.CredentialAnchorException;
import com.adorsys.credentialanchor.ledger.LedgerKeyPair;
import com.adorsys.credentialanchor.model.AnchorRecord;
import com.adorsys.credentialanchor.model.CreateCredentialRequest;
import com.adorsys.credentialanchor.model.CredentialInfo;
import com.adorsys.credentialanchor.model.CredentialStatus;
import com.adorsys.credentialanchor.model.StatusUpdateResult;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.jboss.logging.Logger;

import java.io.Closeable;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;

/**
 * Entry point for anchoring, reading and updating credentials. One instance is built when the
 * provider starts and shared by all requests.
 */
public class CredentialAnchorService implements Closeable {

    private static final Logger logger = Logger.getLogger(CredentialAnchorService.class);

    private final LedgerConfig config;
    private final LedgerKeyPair signer;
    private final LedgerClient ledgerClient;
    private final CircuitBreaker circuitBreaker;
    private final CloseableHttpClient httpClient;

    private final CanonicalHasher hasher;
    private final AnchorSubmitter anchorSubmitter;
    private final StatusUpdater statusUpdater;
    private final CredentialReader credentialReader;

    public CredentialAnchorService(LedgerConfig config, LedgerKeyPair signer, LedgerClient ledgerClient, Clock clock) {
        this(config, signer, ledgerClient, null, null, clock);
    }

    CredentialAnchorService(LedgerConfig config, LedgerKeyPair signer, LedgerClient ledgerClient,
                            CircuitBreaker circuitBreaker, CloseableHttpClient httpClient, Clock clock) {
        this.config = config;
        this.signer = signer;
        this.ledgerClient = ledgerClient;
        this.circuitBreaker = circuitBreaker;
        this.httpClient = httpClient;

        CredentialRecordCodec codec = new CredentialRecordCodec();
        IdentifierDeriver identifierDeriver = new IdentifierDeriver(clock);
        LedgerAccountValidator accountValidator = new LedgerAccountValidator(ledgerClient, config);
        // one load plus one submit per slot
        SignerSubmissionQueue submissionQueue = new SignerSubmissionQueue(config.isSerializeSubmissions(),
                config.getSubmissionTimeout().multipliedBy(2));

        this.hasher = new CanonicalHasher();
        this.credentialReader = new CredentialReader(ledgerClient, codec, signer);
        this.anchorSubmitter = new AnchorSubmitter(ledgerClient, accountValidator, identifierDeriver, codec,
                submissionQueue, new FallbackSimulator(identifierDeriver, clock), signer, config, clock);
        this.statusUpdater = new StatusUpdater(ledgerClient, accountValidator, credentialReader, codec,
                submissionQueue, signer, config, clock);
    }

    /**
     * Validates the configuration and builds the service against the configured Horizon endpoint.
     *
     * @throws ConfigurationException if the secret, network or endpoint settings are invalid
     */
    public static CredentialAnchorService create(LedgerConfig config) throws ConfigurationException {
        LedgerKeyPair signer = LedgerAccountValidator.validateConfiguration(config);

        CloseableHttpClient httpClient = LedgerHttpClientFactory.create(config);
        CircuitBreaker circuitBreaker = new CircuitBreaker("horizon",
                config.getCircuitBreakerFailureThreshold(),
                Duration.ofSeconds(config.getCircuitBreakerCooldownSeconds()));
        LedgerClient ledgerClient = new HorizonLedgerClient(config.getHorizonUrl(), httpClient, circuitBreaker);

        logger.infof("Credential anchor service ready: network=%s, signer=%s, simulatedFallback=%s",
                config.getNetwork(), signer.getAccountId(), config.isAllowSimulatedFallback());
        if (config.isAllowSimulatedFallback()) {
            logger.warn("Simulated fallback is enabled: failed ledger writes will be answered with SIMULATED records");
        }
        return new CredentialAnchorService(config, signer, ledgerClient, circuitBreaker, httpClient, Clock.systemUTC());
    }

    /**
     * Hashes the request data and anchors it. Metadata is logged but not part of the hash.
     *
     * @throws IllegalArgumentException if the request carries no data
     */
    public AnchorRecord createCredential(CreateCredentialRequest request) throws CredentialAnchorException {
        if (request == null || !request.hasData()) {
            throw new IllegalArgumentException("Credential data is required");
        }
        Map<String, Object> metadata = request.getMetadata();
        if (metadata != null && !metadata.isEmpty()) {
            logger.debugf("Credential metadata keys (not hashed): %s", metadata.keySet());
        }

        String hash = hasher.hash(request.getData());
        AnchorRecord record = anchorSubmitter.anchor(hash);
        if (record.simulated()) {
            logger.warnf("Credential %s was NOT written to the ledger (simulated record)", record.identifier());
        } else {
            logger.infof("Credential anchored: identifier=%s, transaction=%s, ledger=%d",
                    record.identifier(), record.transactionHash(), record.ledgerSequence());
        }
        return record;
    }

    public CredentialInfo getCredential(String identifier) throws CredentialAnchorException {
        requireIdentifier(identifier);
        return credentialReader.getCredential(identifier);
    }

    public StatusUpdateResult updateStatus(String identifier, CredentialStatus status) throws CredentialAnchorException {
        requireIdentifier(identifier);
        if (status == null) {
            throw new IllegalArgumentException("Status is required");
        }
        StatusUpdateResult result = statusUpdater.updateStatus(identifier, status);
        logger.infof("Credential %s is now %s (transaction %s)",
                identifier, status.getValue(), result.transactionHash());
        return result;
    }

    public boolean checkHealth() {
        return ledgerClient.checkHealth();
    }

    /**
     * @return the breaker state, or null when the ledger client runs without one
     */
    public CircuitBreaker.State getCircuitBreakerState() {
        return circuitBreaker != null ? circuitBreaker.getState() : null;
    }

    public String getSignerAccountId() {
        return signer.getAccountId();
    }

    public LedgerConfig getConfig() {
        return config;
    }

    private static void requireIdentifier(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("Credential identifier is required");
        }
    }

    @Override
    public void close() throws IOException {
        if (httpClient != null) {
            logger.debug("Closing ledger HTTP client");
            httpClient.close();
        }
    }
}
