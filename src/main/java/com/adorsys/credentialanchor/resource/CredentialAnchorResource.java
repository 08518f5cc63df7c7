package com.adorsys.credentialanchor.resource;

import com.adorsys.credentialanchor.exception.AccountException;
import com.adorsys.credentialanchor.exception.ConfigurationException;
import com.adorsys.credentialanchor.exception.CredentialAnchorException;
import com.adorsys.credentialanchor.exception.CredentialNotFoundException;
import com.adorsys.credentialanchor.exception.CredentialParseException;
import com.adorsys.credentialanchor.exception.SubmissionException;
import com.adorsys.credentialanchor.model.AnchorRecord;
import com.adorsys.credentialanchor.model.CreateCredentialRequest;
import com.adorsys.credentialanchor.model.CredentialInfo;
import com.adorsys.credentialanchor.model.CredentialStatus;
import com.adorsys.credentialanchor.model.OperationResponse;
import com.adorsys.credentialanchor.model.UpdateStatusRequest;
import com.adorsys.credentialanchor.service.CircuitBreaker;
import com.adorsys.credentialanchor.service.CredentialAnchorService;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.PATCH;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;
import org.keycloak.models.KeycloakSession;
import org.keycloak.services.managers.AppAuthManager;
import org.keycloak.services.managers.AuthenticationManager;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST endpoints under {@code /realms/{realm}/credential-anchor}.
 */
public class CredentialAnchorResource {

    private static final Logger logger = Logger.getLogger(CredentialAnchorResource.class);

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final KeycloakSession session;
    private final CredentialAnchorService service;
    private final boolean requireAuthentication;
    private final String unavailableReason;

    /**
     * @param service           the shared service, null if the provider could not start
     * @param unavailableReason why the service is missing, answered with 503
     */
    public CredentialAnchorResource(KeycloakSession session, CredentialAnchorService service,
                                    boolean requireAuthentication, String unavailableReason) {
        this.session = session;
        this.service = service;
        this.requireAuthentication = requireAuthentication;
        this.unavailableReason = unavailableReason;
    }

    @POST
    @Path("credentials")
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    public Response createCredential(CreateCredentialRequest request) {
        Response rejected = checkAccess();
        if (rejected != null) {
            return rejected;
        }
        if (request == null || !request.hasData()) {
            logger.warn("Create request without credential data");
            return createErrorResponse(Response.Status.BAD_REQUEST, "Invalid request", "Credential data is required");
        }

        try {
            AnchorRecord record = service.createCredential(request);
            return Response.status(Response.Status.CREATED)
                    .entity(objectMapper.valueToTree(record))
                    .type(MediaType.APPLICATION_JSON)
                    .build();
        } catch (CredentialAnchorException e) {
            return mapException("Failed to create credential", e);
        } catch (IllegalArgumentException e) {
            return createErrorResponse(Response.Status.BAD_REQUEST, "Invalid request", e.getMessage());
        }
    }

    @GET
    @Path("credentials/{identifier}")
    @Produces(MediaType.APPLICATION_JSON)
    public Response getCredential(@PathParam("identifier") String identifier) {
        Response rejected = checkAccess();
        if (rejected != null) {
            return rejected;
        }

        try {
            CredentialInfo info = service.getCredential(identifier);
            return Response.ok(objectMapper.valueToTree(info)).type(MediaType.APPLICATION_JSON).build();
        } catch (CredentialAnchorException e) {
            return mapException("Failed to read credential", e);
        } catch (IllegalArgumentException e) {
            return createErrorResponse(Response.Status.BAD_REQUEST, "Invalid request", e.getMessage());
        }
    }

    @PATCH
    @Path("credentials/{identifier}/status")
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    public Response updateStatus(@PathParam("identifier") String identifier, UpdateStatusRequest request) {
        Response rejected = checkAccess();
        if (rejected != null) {
            return rejected;
        }

        CredentialStatus status;
        try {
            status = CredentialStatus.fromValue(request != null ? request.getStatus() : null);
        } catch (IllegalArgumentException e) {
            return createErrorResponse(Response.Status.BAD_REQUEST, "Invalid status",
                    "Status must be one of: " + String.join(", ", CredentialStatus.validValues()));
        }

        try {
            service.updateStatus(identifier, status);
            return Response.ok(OperationResponse.success("Credential status updated to " + status.getValue()))
                    .type(MediaType.APPLICATION_JSON)
                    .build();
        } catch (CredentialAnchorException e) {
            return mapException("Failed to update credential status", e);
        } catch (IllegalArgumentException e) {
            return createErrorResponse(Response.Status.BAD_REQUEST, "Invalid request", e.getMessage());
        }
    }

    @GET
    @Path("health")
    @Produces(MediaType.APPLICATION_JSON)
    public Response health() {
        Map<String, Object> body = new LinkedHashMap<>();
        if (service == null) {
            body.put("status", "DOWN");
            body.put("reason", unavailableReason);
            return Response.status(Response.Status.SERVICE_UNAVAILABLE).entity(body).type(MediaType.APPLICATION_JSON).build();
        }

        boolean ledgerReachable = service.checkHealth();
        CircuitBreaker.State breakerState = service.getCircuitBreakerState();
        body.put("status", ledgerReachable ? "UP" : "DOWN");
        body.put("network", service.getConfig().getNetwork());
        body.put("horizonUrl", service.getConfig().getHorizonUrl());
        body.put("ledgerReachable", ledgerReachable);
        if (breakerState != null) {
            body.put("circuitBreaker", breakerState.name());
        }
        Response.Status status = ledgerReachable ? Response.Status.OK : Response.Status.SERVICE_UNAVAILABLE;
        return Response.status(status).entity(body).type(MediaType.APPLICATION_JSON).build();
    }

    /**
     * Authenticates the bearer token of the current request against the realm.
     * Made protected for testability.
     */
    protected boolean isAuthenticated() {
        AuthenticationManager.AuthResult auth = new AppAuthManager.BearerTokenAuthenticator(session).authenticate();
        return auth != null;
    }

    private Response checkAccess() {
        if (service == null) {
            logger.debugf("Credential anchor unavailable: %s", unavailableReason);
            return createErrorResponse(Response.Status.SERVICE_UNAVAILABLE, "Service unavailable", unavailableReason);
        }
        if (requireAuthentication && !isAuthenticated()) {
            return createErrorResponse(Response.Status.UNAUTHORIZED, "Unauthorized", "A valid bearer token is required");
        }
        return null;
    }

    private Response mapException(String action, CredentialAnchorException e) {
        if (e instanceof CredentialNotFoundException) {
            logger.debugf("%s: %s", action, e.getMessage());
            return createErrorResponse(Response.Status.NOT_FOUND, "Credential not found", e.getMessage());
        }
        if (e instanceof SubmissionException submission
                && submission.getCause() instanceof CircuitBreaker.CircuitBreakerOpenException) {
            logger.warnf("%s: %s", action, e.getMessage());
            return createErrorResponse(Response.Status.SERVICE_UNAVAILABLE, "Ledger unavailable", e.getMessage());
        }
        // ledger failures were already logged with their details by the service
        if (e instanceof SubmissionException submission) {
            logger.debugf("%s: %s (resultCode=%s)", action, e.getMessage(), submission.getTransactionResultCode());
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("message", e.getMessage());
            if (submission.getTransactionResultCode() != null) {
                details.put("transactionResultCode", submission.getTransactionResultCode());
                details.put("operationResultCodes", submission.getOperationResultCodes());
            }
            return createErrorResponse(Response.Status.BAD_GATEWAY, "Ledger submission failed", details);
        }
        if (e instanceof AccountException) {
            logger.debugf("%s: %s", action, e.getMessage());
            return createErrorResponse(Response.Status.BAD_GATEWAY, "Signer account unavailable", e.getMessage());
        }
        if (e instanceof CredentialParseException || e instanceof ConfigurationException) {
            logger.errorf(e, "%s", action);
            return createErrorResponse(Response.Status.INTERNAL_SERVER_ERROR, action, e.getMessage());
        }
        logger.errorf(e, "%s due to unexpected error", action);
        return createErrorResponse(Response.Status.INTERNAL_SERVER_ERROR, action, e.getMessage());
    }

    private Response createErrorResponse(Response.Status status, String error, Object details) {
        return Response.status(status)
                .entity(OperationResponse.error(error, details))
                .type(MediaType.APPLICATION_JSON)
                .build();
    }
}
