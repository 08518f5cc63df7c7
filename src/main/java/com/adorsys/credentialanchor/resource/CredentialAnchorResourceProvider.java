package com.adorsys.credentialanchor.resource;

import com.adorsys.credentialanchor.service.CredentialAnchorService;
import org.keycloak.models.KeycloakSession;
import org.keycloak.services.resource.RealmResourceProvider;

public class CredentialAnchorResourceProvider implements RealmResourceProvider {

    private final KeycloakSession session;
    private final CredentialAnchorService service;
    private final boolean requireAuthentication;
    private final String unavailableReason;

    public CredentialAnchorResourceProvider(KeycloakSession session, CredentialAnchorService service,
                                            boolean requireAuthentication, String unavailableReason) {
        this.session = session;
        this.service = service;
        this.requireAuthentication = requireAuthentication;
        this.unavailableReason = unavailableReason;
    }

    @Override
    public Object getResource() {
        return new CredentialAnchorResource(session, service, requireAuthentication, unavailableReason);
    }

    @Override
    public void close() {
        // The service is shared and closed by the factory
    }
}
