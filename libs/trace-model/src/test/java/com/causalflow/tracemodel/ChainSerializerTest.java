package com.causalflow.tracemodel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ChainSerializer")
class ChainSerializerTest {

    private static final Instant T0 = Instant.parse("2026-03-01T12:00:00Z");

    private TraceChain sampleChain() {
        TraceChain chain = TraceChain.rootedAt(
                new TraceNode("root", null, Layer.BIOLOGY, "sensor", "init", Map.of("k", "v"), T0));
        chain.attach(new TraceNode("child", "root", Layer.MEMORY, "store", "write", null, T0.plusMillis(250))
                .sealed("ok", T0.plusSeconds(1)));
        return chain;
    }

    @Nested
    @DisplayName("serialize")
    class Serialize {

        @Test
        @DisplayName("uses snake_case keys, layer codes and ISO-8601 instants")
        void wireShape() throws Exception {
            JsonNode json = ChainSerializer.objectMapper().readTree(ChainSerializer.serialize(sampleChain()));

            assertThat(json.get("root_id").asText()).isEqualTo("root");
            assertThat(json.get("created_at").asText()).isEqualTo("2026-03-01T12:00:00Z");

            JsonNode root = json.get("nodes").get(0);
            assertThat(root.get("parent_id").isNull()).isTrue();
            assertThat(root.get("layer").asText()).isEqualTo("L1");
            assertThat(root.get("data").get("k").asText()).isEqualTo("v");

            JsonNode child = json.get("nodes").get(1);
            assertThat(child.get("parent_id").asText()).isEqualTo("root");
            assertThat(child.get("timestamp").asText()).isEqualTo("2026-03-01T12:00:00.250Z");
            assertThat(child.get("data").get("finished_at").asText()).isEqualTo("2026-03-01T12:00:01Z");
        }

        @Test
        @DisplayName("writes data values without bean properties as empty objects")
        void propertylessValues() throws Exception {
            TraceChain chain = TraceChain.rootedAt(
                    new TraceNode("root", null, Layer.BIOLOGY, "m", "a", Map.of("handle", new Object()), T0));

            JsonNode json = ChainSerializer.objectMapper().readTree(ChainSerializer.serialize(chain));

            assertThat(json.get("nodes").get(0).get("data").get("handle").isObject()).isTrue();
        }
    }

    @Nested
    @DisplayName("deserialize")
    class Deserialize {

        @Test
        @DisplayName("reads back structure, layers and timestamps")
        void readsBack() {
            TraceChain restored = ChainSerializer.deserialize(ChainSerializer.serialize(sampleChain()));

            assertThat(restored.rootId()).isEqualTo("root");
            assertThat(restored.createdAt()).isEqualTo(T0);
            assertThat(restored.nodes()).extracting(TraceNode::id).containsExactly("root", "child");
            assertThat(restored.getNode("child").orElseThrow().layer()).isEqualTo(Layer.MEMORY);
            assertThat(restored.getNode("child").orElseThrow().timestamp()).isEqualTo(T0.plusMillis(250));
        }

        @Test
        @DisplayName("keeps malformed trees as they are")
        void keepsMalformed() {
            String json = """
                    {"root_id":"r","created_at":"2026-03-01T12:00:00Z","nodes":[
                      {"id":"x","parent_id":"ghost","layer":"L3","module":"m","action":"a",
                       "data":{},"timestamp":"2026-03-01T12:00:00Z"}]}
                    """;

            TraceChain chain = ChainSerializer.deserialize(json);

            assertThat(chain.root()).isEmpty();
            assertThat(chain.getNode("x")).map(TraceNode::parentId).contains("ghost");
        }

        @Test
        @DisplayName("fails on an unknown layer code")
        void unknownLayer() {
            String json = """
                    {"root_id":"r","created_at":"2026-03-01T12:00:00Z","nodes":[
                      {"id":"r","parent_id":null,"layer":"L9","module":"m","action":"a",
                       "data":{},"timestamp":"2026-03-01T12:00:00Z"}]}
                    """;

            assertThatThrownBy(() -> ChainSerializer.deserialize(json))
                    .isInstanceOf(ChainSerializer.ChainSerializationException.class);
        }

        @Test
        @DisplayName("tryDeserialize returns empty on malformed JSON")
        void tryDeserialize() {
            assertThat(ChainSerializer.tryDeserialize("{not json")).isEmpty();
            assertThat(ChainSerializer.tryDeserialize(ChainSerializer.serialize(
                    new TraceChain("r", T0, List.of())))).isPresent();
        }

        @Test
        @DisplayName("null node entries are rejected, and tryDeserialize returns empty")
        void nullNodeEntry() {
            String json = """
                    {"root_id":"r","created_at":"2026-03-01T12:00:00Z","nodes":[null]}
                    """;

            assertThatThrownBy(() -> ChainSerializer.deserialize(json))
                    .isInstanceOf(ChainSerializer.ChainSerializationException.class);
            assertThat(ChainSerializer.tryDeserialize(json)).isEmpty();
        }

        @Test
        @DisplayName("tryDeserialize returns empty for a JSON null document")
        void nullDocument() {
            assertThat(ChainSerializer.tryDeserialize("null")).isEmpty();
        }
    }
}
