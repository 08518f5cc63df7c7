package com.adorsys.credentialanchor.service;

import com.adorsys.credentialanchor.util.Hashes;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Hashes credential payloads: SHA-256 over compact JSON with object keys sorted at every depth.
 * Array element order is significant.
 */
public class CanonicalHasher {

    private final ObjectMapper objectMapper;

    public CanonicalHasher() {
        this(new ObjectMapper());
    }

    public CanonicalHasher(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @param payload any JSON value; absent payloads are rejected before reaching here
     * @return lowercase hex SHA-256 digest
     */
    public String hash(JsonNode payload) {
        return Hashes.sha256Hex(canonicalJson(payload));
    }

    public String canonicalJson(JsonNode payload) {
        try {
            return objectMapper.writeValueAsString(canonicalize(payload));
        } catch (JsonProcessingException e) {
            // a tree built from JsonNodes always serializes
            throw new IllegalStateException("Unable to serialize credential payload", e);
        }
    }

    static JsonNode canonicalize(JsonNode node) {
        if (node == null) {
            return JsonNodeFactory.instance.nullNode();
        }
        if (node.isObject()) {
            List<String> names = new ArrayList<>();
            Iterator<String> fieldNames = node.fieldNames();
            fieldNames.forEachRemaining(names::add);
            names.sort(null);

            ObjectNode sorted = JsonNodeFactory.instance.objectNode();
            for (String name : names) {
                sorted.set(name, canonicalize(node.get(name)));
            }
            return sorted;
        }
        if (node.isArray()) {
            ArrayNode array = JsonNodeFactory.instance.arrayNode();
            node.forEach(element -> array.add(canonicalize(element)));
            return array;
        }
        return node;
    }
}
