package com.adorsys.credentialanchor.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Envelope returned by the REST resource for acknowledgements and errors.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OperationResponse {

    @JsonProperty("success")
    private boolean success;

    @JsonProperty("message")
    private String message;

    @JsonProperty("error")
    private String error;

    @JsonProperty("details")
    private Object details;

    public OperationResponse() {
        // Default constructor for JSON serialization
    }

    public OperationResponse(boolean success, String message, String error, Object details) {
        this.success = success;
        this.message = message;
        this.error = error;
        this.details = details;
    }

    public static OperationResponse success(String message) {
        return new OperationResponse(true, message, null, null);
    }

    public static OperationResponse error(String error, Object details) {
        return new OperationResponse(false, null, error, details);
    }

    public boolean isSuccess() {
        return success;
    }

    public void setSuccess(boolean success) {
        this.success = success;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }

    public Object getDetails() {
        return details;
    }

    public void setDetails(Object details) {
        this.details = details;
    }
}
