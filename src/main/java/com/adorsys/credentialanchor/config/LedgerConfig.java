package com.adorsys.credentialanchor.config;

import com.adorsys.credentialanchor.exception.ConfigurationException;
import org.keycloak.Config;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Process-wide configuration of the credential anchor provider, read once from the provider's
 * SPI scope when Keycloak initializes the factory. Immutable.
 *
 * <p>Values come from {@code keycloak.conf}, CLI options or environment variables, e.g.
 * {@code KC_SPI_REALM_RESTAPI_EXTENSION_CREDENTIAL_ANCHOR_SECRET_KEY}.
 */
public final class LedgerConfig {

    // Configuration keys
    public static final String ENABLED = "enabled";
    public static final String NETWORK = "network";
    public static final String NETWORK_PASSPHRASE = "network-passphrase";
    public static final String HORIZON_URL = "horizon-url";
    public static final String SECRET_KEY = "secret-key";
    public static final String MINIMUM_BALANCE = "minimum-balance";
    public static final String BASE_FEE = "base-fee";
    public static final String SUBMISSION_TIMEOUT_SECONDS = "submission-timeout-seconds";
    public static final String CONNECT_TIMEOUT_MILLIS = "connect-timeout-millis";
    public static final String ALLOW_SIMULATED_FALLBACK = "allow-simulated-fallback";
    public static final String SERIALIZE_SUBMISSIONS = "serialize-submissions";
    public static final String REQUIRE_AUTHENTICATION = "require-authentication";
    public static final String CIRCUIT_BREAKER_FAILURE_THRESHOLD = "circuit-breaker-failure-threshold";
    public static final String CIRCUIT_BREAKER_COOLDOWN_SECONDS = "circuit-breaker-cooldown-seconds";

    // Default values
    private static final boolean DEFAULT_ENABLED = true;
    private static final String DEFAULT_NETWORK = LedgerNetwork.TESTNET.getId();
    private static final String DEFAULT_MINIMUM_BALANCE = "10";
    private static final int DEFAULT_BASE_FEE = 100;
    private static final int DEFAULT_SUBMISSION_TIMEOUT_SECONDS = 30;
    private static final int DEFAULT_CONNECT_TIMEOUT_MILLIS = 5000;
    private static final boolean DEFAULT_ALLOW_SIMULATED_FALLBACK = false;
    private static final boolean DEFAULT_SERIALIZE_SUBMISSIONS = true;
    private static final boolean DEFAULT_REQUIRE_AUTHENTICATION = true;
    private static final int DEFAULT_FAILURE_THRESHOLD = 5;
    private static final int DEFAULT_COOLDOWN_SECONDS = 30;

    private final boolean enabled;
    private final String network;
    private final String networkPassphrase;
    private final String horizonUrl;
    private final String secretKey;
    private final BigDecimal minimumBalance;
    private final long baseFee;
    private final Duration submissionTimeout;
    private final Duration connectTimeout;
    private final boolean allowSimulatedFallback;
    private final boolean serializeSubmissions;
    private final boolean requireAuthentication;
    private final int circuitBreakerFailureThreshold;
    private final int circuitBreakerCooldownSeconds;

    private LedgerConfig(Builder builder) {
        LedgerNetwork knownNetwork = LedgerNetwork.fromId(builder.network);
        this.enabled = builder.enabled;
        this.network = builder.network;
        this.networkPassphrase = isBlank(builder.networkPassphrase) && knownNetwork != null
                ? knownNetwork.getPassphrase() : builder.networkPassphrase;
        this.horizonUrl = isBlank(builder.horizonUrl) && knownNetwork != null
                ? knownNetwork.getDefaultHorizonUrl() : builder.horizonUrl;
        this.secretKey = builder.secretKey;
        this.minimumBalance = builder.minimumBalance;
        this.baseFee = builder.baseFee;
        this.submissionTimeout = builder.submissionTimeout;
        this.connectTimeout = builder.connectTimeout;
        this.allowSimulatedFallback = builder.allowSimulatedFallback;
        this.serializeSubmissions = builder.serializeSubmissions;
        this.requireAuthentication = builder.requireAuthentication;
        this.circuitBreakerFailureThreshold = builder.circuitBreakerFailureThreshold;
        this.circuitBreakerCooldownSeconds = builder.circuitBreakerCooldownSeconds;
    }

    /**
     * Reads the configuration from the provider's SPI scope, falling back to defaults for
     * absent keys. Ranges and network consistency are validated by {@code LedgerAccountValidator}.
     *
     * @throws ConfigurationException if a numeric key is not a number
     */
    public static LedgerConfig fromScope(Config.Scope scope) throws ConfigurationException {
        return builder()
                .enabled(scope.getBoolean(ENABLED, DEFAULT_ENABLED))
                .network(scope.get(NETWORK, DEFAULT_NETWORK))
                .networkPassphrase(scope.get(NETWORK_PASSPHRASE))
                .horizonUrl(scope.get(HORIZON_URL))
                .secretKey(scope.get(SECRET_KEY))
                .minimumBalance(readBalance(scope))
                .baseFee(readInt(scope, BASE_FEE, DEFAULT_BASE_FEE))
                .submissionTimeout(Duration.ofSeconds(readInt(scope, SUBMISSION_TIMEOUT_SECONDS,
                        DEFAULT_SUBMISSION_TIMEOUT_SECONDS)))
                .connectTimeout(Duration.ofMillis(readInt(scope, CONNECT_TIMEOUT_MILLIS, DEFAULT_CONNECT_TIMEOUT_MILLIS)))
                .allowSimulatedFallback(scope.getBoolean(ALLOW_SIMULATED_FALLBACK, DEFAULT_ALLOW_SIMULATED_FALLBACK))
                .serializeSubmissions(scope.getBoolean(SERIALIZE_SUBMISSIONS, DEFAULT_SERIALIZE_SUBMISSIONS))
                .requireAuthentication(scope.getBoolean(REQUIRE_AUTHENTICATION, DEFAULT_REQUIRE_AUTHENTICATION))
                .circuitBreakerFailureThreshold(readInt(scope, CIRCUIT_BREAKER_FAILURE_THRESHOLD,
                        DEFAULT_FAILURE_THRESHOLD))
                .circuitBreakerCooldownSeconds(readInt(scope, CIRCUIT_BREAKER_COOLDOWN_SECONDS,
                        DEFAULT_COOLDOWN_SECONDS))
                .build();
    }

    private static int readInt(Config.Scope scope, String key, int defaultValue) throws ConfigurationException {
        String value = scope.get(key);
        if (isBlank(value)) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid value for " + key + ": " + value, e);
        }
    }

    private static BigDecimal readBalance(Config.Scope scope) throws ConfigurationException {
        String value = scope.get(MINIMUM_BALANCE);
        if (isBlank(value)) {
            return new BigDecimal(DEFAULT_MINIMUM_BALANCE);
        }
        try {
            return new BigDecimal(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid value for " + MINIMUM_BALANCE + ": " + value, e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Checks if the provider should serve requests.
     *
     * @return true if enabled, false otherwise
     */
    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Gets the declared network id ({@code mainnet} or {@code testnet}).
     */
    public String getNetwork() {
        return network;
    }

    public String getNetworkPassphrase() {
        return networkPassphrase;
    }

    /**
     * Gets the Horizon endpoint URL.
     *
     * @return the endpoint, the network's public Horizon when none is configured
     */
    public String getHorizonUrl() {
        return horizonUrl;
    }

    public String getSecretKey() {
        return secretKey;
    }

    /**
     * Gets the balance in XLM below which account validation reports a warning.
     */
    public BigDecimal getMinimumBalance() {
        return minimumBalance;
    }

    /**
     * Gets the fee per operation in stroops.
     */
    public long getBaseFee() {
        return baseFee;
    }

    /**
     * Gets the response timeout used for each ledger call and as the transaction time bound.
     */
    public Duration getSubmissionTimeout() {
        return submissionTimeout;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    /**
     * Checks if a failed create may be answered with a simulated record.
     */
    public boolean isAllowSimulatedFallback() {
        return allowSimulatedFallback;
    }

    public boolean isSerializeSubmissions() {
        return serializeSubmissions;
    }

    public boolean isRequireAuthentication() {
        return requireAuthentication;
    }

    public int getCircuitBreakerFailureThreshold() {
        return circuitBreakerFailureThreshold;
    }

    public int getCircuitBreakerCooldownSeconds() {
        return circuitBreakerCooldownSeconds;
    }

    @Override
    public String toString() {
        return "LedgerConfig{enabled=" + enabled + ", network='" + network + "', horizonUrl='" + horizonUrl
                + "', minimumBalance=" + minimumBalance + ", baseFee=" + baseFee
                + ", submissionTimeout=" + submissionTimeout + ", allowSimulatedFallback=" + allowSimulatedFallback
                + ", serializeSubmissions=" + serializeSubmissions + "}";
    }

    public static final class Builder {
        private boolean enabled = DEFAULT_ENABLED;
        private String network = DEFAULT_NETWORK;
        private String networkPassphrase;
        private String horizonUrl;
        private String secretKey;
        private BigDecimal minimumBalance = new BigDecimal(DEFAULT_MINIMUM_BALANCE);
        private long baseFee = DEFAULT_BASE_FEE;
        private Duration submissionTimeout = Duration.ofSeconds(DEFAULT_SUBMISSION_TIMEOUT_SECONDS);
        private Duration connectTimeout = Duration.ofMillis(DEFAULT_CONNECT_TIMEOUT_MILLIS);
        private boolean allowSimulatedFallback = DEFAULT_ALLOW_SIMULATED_FALLBACK;
        private boolean serializeSubmissions = DEFAULT_SERIALIZE_SUBMISSIONS;
        private boolean requireAuthentication = DEFAULT_REQUIRE_AUTHENTICATION;
        private int circuitBreakerFailureThreshold = DEFAULT_FAILURE_THRESHOLD;
        private int circuitBreakerCooldownSeconds = DEFAULT_COOLDOWN_SECONDS;

        private Builder() {
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder network(String network) {
            this.network = network;
            return this;
        }

        public Builder networkPassphrase(String networkPassphrase) {
            this.networkPassphrase = networkPassphrase;
            return this;
        }

        public Builder horizonUrl(String horizonUrl) {
            this.horizonUrl = horizonUrl;
            return this;
        }

        public Builder secretKey(String secretKey) {
            this.secretKey = secretKey;
            return this;
        }

        public Builder minimumBalance(BigDecimal minimumBalance) {
            this.minimumBalance = minimumBalance;
            return this;
        }

        public Builder baseFee(long baseFee) {
            this.baseFee = baseFee;
            return this;
        }

        public Builder submissionTimeout(Duration submissionTimeout) {
            this.submissionTimeout = submissionTimeout;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder allowSimulatedFallback(boolean allowSimulatedFallback) {
            this.allowSimulatedFallback = allowSimulatedFallback;
            return this;
        }

        public Builder serializeSubmissions(boolean serializeSubmissions) {
            this.serializeSubmissions = serializeSubmissions;
            return this;
        }

        public Builder requireAuthentication(boolean requireAuthentication) {
            this.requireAuthentication = requireAuthentication;
            return this;
        }

        public Builder circuitBreakerFailureThreshold(int circuitBreakerFailureThreshold) {
            this.circuitBreakerFailureThreshold = circuitBreakerFailureThreshold;
            return this;
        }

        public Builder circuitBreakerCooldownSeconds(int circuitBreakerCooldownSeconds) {
            this.circuitBreakerCooldownSeconds = circuitBreakerCooldownSeconds;
            return this;
        }

        public LedgerConfig build() {
            return new LedgerConfig(this);
        }
    }
}
