package com.notegraph.core.service.graph.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.notegraph.core.service.graph.model.EdgeAttributes;
import com.notegraph.core.service.graph.model.EdgeType;
import com.notegraph.core.service.graph.model.NodeAttributes;
import com.notegraph.core.service.graph.model.NodeType;
import lombok.extern.slf4j.Slf4j;

/**
 * Converts node and edge attribute variants to and from their stored JSON form.
 */
@Slf4j
public class AttributeCodec {

    private final ObjectMapper objectMapper;

    public AttributeCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public String encode(NodeAttributes attributes) {
        return write(attributes);
    }

    public String encode(EdgeAttributes attributes) {
        return write(attributes);
    }

    public NodeAttributes decodeNode(NodeType type, String json) {
        if (isBlank(json)) {
            return NodeAttributes.emptyFor(type);
        }
        return read(json, NodeAttributes.variantFor(type));
    }

    public EdgeAttributes decodeEdge(EdgeType type, String json) {
        if (isBlank(json)) {
            return EdgeAttributes.emptyFor(type);
        }
        return read(json, EdgeAttributes.variantFor(type));
    }

    // ==================== Helper Methods ====================

    private String write(Object attributes) {
        try {
            return objectMapper.writeValueAsString(attributes);
        } catch (JsonProcessingException e) {
            throw handleCodecError("encode", e);
        }
    }

    private <T> T read(String json, Class<T> variant) {
        try {
            return objectMapper.readValue(json, variant);
        } catch (JsonProcessingException e) {
            throw handleCodecError("decode", e);
        }
    }

    private static boolean isBlank(String json) {
        return json == null || json.isBlank() || "null".equals(json);
    }

    private IllegalArgumentException handleCodecError(String operation, JsonProcessingException e) {
        log.error("Failed to {} graph attributes", operation, e);
        return new IllegalArgumentException("Failed to " + operation + " attributes: " + e.getOriginalMessage(), e);
    }
}
