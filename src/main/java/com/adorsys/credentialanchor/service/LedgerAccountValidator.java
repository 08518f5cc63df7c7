package com.adorsys.credentialanchor.service;

import com.adorsys.credentialanchor.client.LedgerClient;
import com.adorsys.credentialanchor.config.LedgerConfig;
import com.adorsys.credentialanchor.config.LedgerNetwork;
import com.adorsys.credentialanchor.exception.AccountException;
import com.adorsys.credentialanchor.exception.ConfigurationException;
import com.adorsys.credentialanchor.exception.SubmissionException;
import com.adorsys.credentialanchor.ledger.AccountState;
import com.adorsys.credentialanchor.ledger.LedgerKeyPair;
import org.jboss.logging.Logger;

import java.math.BigDecimal;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Checks the signing identity and the network settings, and that the signer account exists
 * and is funded.
 */
public class LedgerAccountValidator {

    private static final Logger logger = Logger.getLogger(LedgerAccountValidator.class);

    private static final String MAINNET_HORIZON_HOST = "horizon.stellar.org";

    private final LedgerClient ledgerClient;
    private final BigDecimal minimumBalance;

    public LedgerAccountValidator(LedgerClient ledgerClient, LedgerConfig config) {
        this.ledgerClient = ledgerClient;
        this.minimumBalance = config.getMinimumBalance();
    }

    /**
     * Parses the signer secret.
     *
     * @throws ConfigurationException if the secret is missing or not a valid ed25519 seed
     */
    public static LedgerKeyPair validateSecretKey(String secretKey) throws ConfigurationException {
        if (secretKey == null || secretKey.isBlank()) {
            throw new ConfigurationException("Secret key is required");
        }
        if (!secretKey.startsWith("S")) {
            throw new ConfigurationException("Secret key must start with \"S\"");
        }
        try {
            return LedgerKeyPair.fromSecretSeed(secretKey);
        } catch (IllegalArgumentException e) {
            // the cause message never contains the secret itself
            throw new ConfigurationException("Invalid secret key format: " + e.getMessage(), e);
        }
    }

    /**
     * Checks that the network id is known, the endpoint is an absolute http(s) URL, and that both
     * (and the passphrase, when set) describe the same network.
     *
     * @throws ConfigurationException listing every problem found
     */
    public static void validateNetworkConfiguration(String network, String horizonUrl, String passphrase)
            throws ConfigurationException {
        List<String> errors = new ArrayList<>();

        LedgerNetwork knownNetwork = LedgerNetwork.fromId(network);
        if (knownNetwork == null) {
            errors.add("Network must be either \"mainnet\" or \"testnet\", got: " + network);
        }

        String host = null;
        try {
            URI uri = new URI(horizonUrl == null ? "" : horizonUrl.trim());
            String scheme = uri.getScheme();
            if (!uri.isAbsolute() || uri.getHost() == null
                    || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
                errors.add("Invalid Horizon URL format: " + horizonUrl);
            } else {
                host = uri.getHost().toLowerCase(Locale.ROOT);
            }
        } catch (URISyntaxException e) {
            errors.add("Invalid Horizon URL format: " + horizonUrl);
        }

        if (knownNetwork != null && host != null) {
            if (knownNetwork == LedgerNetwork.MAINNET && host.contains("testnet")) {
                errors.add("Network set to mainnet but using testnet Horizon URL");
            } else if (knownNetwork == LedgerNetwork.TESTNET && host.equals(MAINNET_HORIZON_HOST)) {
                errors.add("Network set to testnet but using mainnet Horizon URL");
            }
        }

        if (knownNetwork != null && passphrase != null && !passphrase.isBlank()
                && !knownNetwork.getPassphrase().equals(passphrase)) {
            errors.add("Network passphrase does not match the " + knownNetwork.getId() + " network");
        }

        if (!errors.isEmpty()) {
            throw new ConfigurationException(String.join("; ", errors));
        }
    }

    /**
     * Validates the static part of the configuration. Called once when the provider starts.
     *
     * @return the signer key pair
     */
    public static LedgerKeyPair validateConfiguration(LedgerConfig config) throws ConfigurationException {
        validateNetworkConfiguration(config.getNetwork(), config.getHorizonUrl(), config.getNetworkPassphrase());
        validateLimits(config);
        return validateSecretKey(config.getSecretKey());
    }

    /**
     * Checks the numeric settings before they reach the HTTP client and the circuit breaker.
     *
     * @throws ConfigurationException listing every value out of range
     */
    public static void validateLimits(LedgerConfig config) throws ConfigurationException {
        List<String> errors = new ArrayList<>();
        if (config.getBaseFee() <= 0) {
            errors.add("Base fee must be positive, got: " + config.getBaseFee());
        }
        if (config.getMinimumBalance() == null || config.getMinimumBalance().signum() < 0) {
            errors.add("Minimum balance must not be negative, got: " + config.getMinimumBalance());
        }
        if (isNotPositive(config.getSubmissionTimeout())) {
            errors.add("Submission timeout must be positive, got: " + config.getSubmissionTimeout());
        }
        if (isNotPositive(config.getConnectTimeout())) {
            errors.add("Connect timeout must be positive, got: " + config.getConnectTimeout());
        }
        if (config.getCircuitBreakerFailureThreshold() < 1) {
            errors.add("Circuit breaker failure threshold must be at least 1, got: "
                    + config.getCircuitBreakerFailureThreshold());
        }
        if (config.getCircuitBreakerCooldownSeconds() <= 0) {
            errors.add("Circuit breaker cooldown must be positive, got: " + config.getCircuitBreakerCooldownSeconds());
        }
        if (!errors.isEmpty()) {
            throw new ConfigurationException(String.join("; ", errors));
        }
    }

    private static boolean isNotPositive(Duration duration) {
        return duration == null || duration.isZero() || duration.isNegative();
    }

    /**
     * Loads the signer account. A balance below the configured minimum is reported as a warning.
     *
     * @throws AccountException if the account does not exist
     * @throws SubmissionException if the ledger cannot be reached
     */
    public AccountValidationResult validateAccount(LedgerKeyPair signer) throws AccountException, SubmissionException {
        AccountState account = ledgerClient.loadAccount(signer.getAccountId());
        List<String> warnings = new ArrayList<>();

        BigDecimal balance = account.getNativeBalance();
        if (balance.compareTo(minimumBalance) < 0) {
            String warning = String.format("Account balance (%s XLM) is below recommended minimum (%s XLM)",
                    balance.toPlainString(), minimumBalance.toPlainString());
            logger.warnf("Account %s: %s", signer.getAccountId(), warning);
            warnings.add(warning);
        }

        logger.debugf("Account %s validated, XLM balance: %s", signer.getAccountId(), balance.toPlainString());
        return new AccountValidationResult(account, warnings);
    }
}
