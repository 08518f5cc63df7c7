package com.adorsys.credentialanchor.resource;

import com.adorsys.credentialanchor.config.LedgerConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.keycloak.Config;
import org.keycloak.models.KeycloakSession;
import org.keycloak.services.resource.RealmResourceProvider;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;

class CredentialAnchorResourceProviderFactoryTest {

    private static final String SECRET = "SAAQEAYEAUDAOCAJBIFQYDIOB4IBCEQTCQKRMFYYDENBWHA5DYPSBF5K";

    private CredentialAnchorResourceProviderFactory factory;
    private Map<String, String> values;

    @BeforeEach
    void setUp() {
        factory = new CredentialAnchorResourceProviderFactory();
        values = new HashMap<>();
    }

    @AfterEach
    void tearDown() {
        factory.close();
    }

    private Config.Scope scope() {
        Config.Scope scope = mock(Config.Scope.class);
        lenient().when(scope.get(anyString())).thenAnswer(inv -> values.get((String) inv.getArgument(0)));
        lenient().when(scope.get(anyString(), any())).thenAnswer(inv -> {
            String value = values.get((String) inv.getArgument(0));
            return value != null ? (Object) value : inv.getArgument(1);
        });
        lenient().when(scope.getBoolean(anyString(), any())).thenAnswer(inv -> {
            String value = values.get((String) inv.getArgument(0));
            return value != null ? (Object) Boolean.valueOf(value) : inv.getArgument(1);
        });
        return scope;
    }

    @Test
    void providerId() {
        assertEquals("credential-anchor", factory.getId());
    }

    @Test
    void validConfigurationBuildsService() {
        values.put(LedgerConfig.SECRET_KEY, SECRET);

        factory.init(scope());

        assertNotNull(factory.getService());
        assertNull(factory.getUnavailableReason());
        RealmResourceProvider provider = factory.create(mock(KeycloakSession.class));
        assertInstanceOf(CredentialAnchorResource.class, provider.getResource());
    }

    @Test
    void misconfigurationIsReportedNotThrown() {
        values.put(LedgerConfig.SECRET_KEY, "SBROKEN");

        assertDoesNotThrow(() -> factory.init(scope()));

        assertNull(factory.getService());
        assertTrue(factory.getUnavailableReason().startsWith("Credential anchor is misconfigured"));
    }

    @Test
    void networkMismatchIsReported() {
        values.put(LedgerConfig.SECRET_KEY, SECRET);
        values.put(LedgerConfig.NETWORK, "mainnet");
        values.put(LedgerConfig.HORIZON_URL, "https://horizon-testnet.stellar.org");

        factory.init(scope());

        assertNull(factory.getService());
        assertTrue(factory.getUnavailableReason().contains("testnet Horizon URL"));
    }

    @Test
    void nonNumericFeeIsReportedNotThrown() {
        values.put(LedgerConfig.SECRET_KEY, SECRET);
        values.put(LedgerConfig.BASE_FEE, "abc");

        assertDoesNotThrow(() -> factory.init(scope()));

        assertNull(factory.getService());
        assertEquals("Credential anchor is misconfigured: Invalid value for base-fee: abc",
                factory.getUnavailableReason());
        assertNotNull(factory.create(mock(KeycloakSession.class)).getResource());
    }

    @Test
    void zeroFailureThresholdIsReportedNotThrown() {
        values.put(LedgerConfig.SECRET_KEY, SECRET);
        values.put(LedgerConfig.CIRCUIT_BREAKER_FAILURE_THRESHOLD, "0");

        assertDoesNotThrow(() -> factory.init(scope()));

        assertNull(factory.getService());
        assertTrue(factory.getUnavailableReason().contains("failure threshold must be at least 1"));
    }

    @Test
    void malformedMinimumBalanceIsReported() {
        values.put(LedgerConfig.SECRET_KEY, SECRET);
        values.put(LedgerConfig.MINIMUM_BALANCE, "ten");

        factory.init(scope());

        assertNull(factory.getService());
        assertTrue(factory.getUnavailableReason().contains("minimum-balance"));
    }

    @Test
    void nonPositiveTimeoutsAreReported() {
        values.put(LedgerConfig.SECRET_KEY, SECRET);
        values.put(LedgerConfig.SUBMISSION_TIMEOUT_SECONDS, "0");
        values.put(LedgerConfig.CONNECT_TIMEOUT_MILLIS, "-1");

        factory.init(scope());

        assertNull(factory.getService());
        assertTrue(factory.getUnavailableReason().contains("Submission timeout must be positive"));
        assertTrue(factory.getUnavailableReason().contains("Connect timeout must be positive"));
    }

    @Test
    void disabledProviderBuildsNothing() {
        values.put(LedgerConfig.ENABLED, "false");
        values.put(LedgerConfig.SECRET_KEY, SECRET);

        factory.init(scope());

        assertNull(factory.getService());
        assertEquals("Credential anchoring is disabled", factory.getUnavailableReason());
    }
}
