package com.causalflow.tracemodel;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * JSON export and import for {@link TraceChain}.
 *
 * <p>Wire shape per node: {@code {id, parent_id, layer, module, action, data, timestamp}} with the
 * layer as its short code; per chain: {@code {root_id, nodes[], created_at}}. Instants are ISO 8601
 * strings via {@code JavaTimeModule}.
 */
public final class ChainSerializer {

    private static final ObjectMapper MAPPER = createMapper();

    private ChainSerializer() {
        // utility class
    }

    private static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
    }

    /**
     * Serializes a chain to a JSON string.
     *
     * @throws ChainSerializationException if serialization fails
     */
    public static String serialize(TraceChain chain) {
        try {
            return MAPPER.writeValueAsString(ChainJson.from(chain));
        } catch (JsonProcessingException e) {
            throw new ChainSerializationException("Failed to serialize chain: " + chain.rootId(), e);
        }
    }

    /**
     * Reads a chain back from JSON. The result is not validated; a malformed tree round-trips as is.
     *
     * @throws ChainSerializationException if the JSON is malformed, names an unknown layer or holds
     *                                     a null node entry
     */
    public static TraceChain deserialize(String json) {
        try {
            ChainJson chain = MAPPER.readValue(json, ChainJson.class);
            if (chain == null) {
                throw new IllegalArgumentException("JSON is null");
            }
            return chain.toChain();
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ChainSerializationException("Failed to deserialize chain", e);
        }
    }

    /** Safely deserializes, returning empty on failure. */
    public static Optional<TraceChain> tryDeserialize(String json) {
        try {
            return Optional.of(deserialize(json));
        } catch (RuntimeException e) {
            return Optional.empty();
        }
    }

    /** Returns the shared ObjectMapper. */
    public static ObjectMapper objectMapper() {
        return MAPPER;
    }

    record NodeJson(
            @JsonProperty("id") String id,
            @JsonProperty("parent_id") String parentId,
            @JsonProperty("layer") String layer,
            @JsonProperty("module") String module,
            @JsonProperty("action") String action,
            @JsonProperty("data") Map<String, Object> data,
            @JsonProperty("timestamp") Instant timestamp) {

        static NodeJson from(TraceNode node) {
            return new NodeJson(node.id(), node.parentId(), node.layer().code(),
                    node.module(), node.action(), node.data(), node.timestamp());
        }

        TraceNode toNode() {
            return new TraceNode(id, parentId, Layer.fromCode(layer), module, action, data, timestamp);
        }
    }

    record ChainJson(
            @JsonProperty("root_id") String rootId,
            @JsonProperty("nodes") List<NodeJson> nodes,
            @JsonProperty("created_at") Instant createdAt) {

        static ChainJson from(TraceChain chain) {
            List<NodeJson> nodes = new ArrayList<>();
            for (TraceNode node : chain.nodes()) {
                nodes.add(NodeJson.from(node));
            }
            return new ChainJson(chain.rootId(), nodes, chain.createdAt());
        }

        TraceChain toChain() {
            List<TraceNode> converted = new ArrayList<>();
            if (nodes != null) {
                for (NodeJson node : nodes) {
                    if (node == null) {
                        throw new IllegalArgumentException("Null node entry in chain " + rootId);
                    }
                    converted.add(node.toNode());
                }
            }
            return new TraceChain(rootId, createdAt, converted);
        }
    }

    /**
     * Exception thrown when chain serialization or deserialization fails.
     */
    public static class ChainSerializationException extends RuntimeException {
        public ChainSerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
