package com.adorsys.credentialanchor.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * Request body for anchoring a new credential. Only {@code data} is hashed; {@code metadata}
 * is informational.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CreateCredentialRequest {

    @JsonProperty("data")
    private JsonNode data;

    @JsonProperty("metadata")
    private Map<String, Object> metadata;

    public CreateCredentialRequest() {
        // Default constructor for JSON deserialization
    }

    public CreateCredentialRequest(JsonNode data, Map<String, Object> metadata) {
        this.data = data;
        this.metadata = metadata;
    }

    public JsonNode getData() {
        return data;
    }

    public void setData(JsonNode data) {
        this.data = data;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public void setMetadata(Map<String, Object> metadata) {
        this.metadata = metadata;
    }

    public boolean hasData() {
        return data != null && !data.isNull() && !data.isMissingNode();
    }
}
