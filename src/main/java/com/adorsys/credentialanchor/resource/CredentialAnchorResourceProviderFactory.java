package com.adorsys.credentialanchor.resource;

import com.adorsys.credentialanchor.config.LedgerConfig;
import com.adorsys.credentialanchor.exception.ConfigurationException;
import com.adorsys.credentialanchor.service.CredentialAnchorService;
import org.jboss.logging.Logger;
import org.keycloak.Config;
import org.keycloak.models.KeycloakSession;
import org.keycloak.models.KeycloakSessionFactory;
import org.keycloak.services.resource.RealmResourceProvider;
import org.keycloak.services.resource.RealmResourceProviderFactory;

import java.io.IOException;

/**
 * Registers the credential anchor REST resource and builds the shared service once, from the
 * provider's SPI configuration. A configuration error does not stop Keycloak: it is logged and
 * every request is answered with 503 and the reason.
 */
public class CredentialAnchorResourceProviderFactory implements RealmResourceProviderFactory {

    private static final Logger logger = Logger.getLogger(CredentialAnchorResourceProviderFactory.class);

    public static final String PROVIDER_ID = "credential-anchor";

    private LedgerConfig config;
    private CredentialAnchorService service;
    private String unavailableReason;

    @Override
    public String getId() {
        return PROVIDER_ID;
    }

    @Override
    public RealmResourceProvider create(KeycloakSession session) {
        return new CredentialAnchorResourceProvider(session, service,
                config == null || config.isRequireAuthentication(), unavailableReason);
    }

    @Override
    public void init(Config.Scope scope) {
        try {
            config = LedgerConfig.fromScope(scope);
            logger.infof("Initializing credential anchor provider with %s", config);

            if (!config.isEnabled()) {
                unavailableReason = "Credential anchoring is disabled";
                logger.info(unavailableReason);
                return;
            }

            service = CredentialAnchorService.create(config);
        } catch (ConfigurationException e) {
            unavailableReason = "Credential anchor is misconfigured: " + e.getMessage();
            logger.errorf("%s. Requests will be answered with 503 until the configuration is fixed.",
                    unavailableReason);
        }
    }

    @Override
    public void postInit(KeycloakSessionFactory factory) {
        // No post-initialization needed
    }

    @Override
    public void close() {
        logger.info("Closing CredentialAnchorResourceProviderFactory");
        if (service != null) {
            try {
                service.close();
            } catch (IOException e) {
                logger.warn("Error closing ledger HTTP client", e);
            }
            service = null;
        }
    }

    CredentialAnchorService getService() {
        return service;
    }

    String getUnavailableReason() {
        return unavailableReason;
    }
}
