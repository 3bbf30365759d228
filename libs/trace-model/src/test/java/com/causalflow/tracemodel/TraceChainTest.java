package com.causalflow.tracemodel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("TraceChain")
class TraceChainTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private static TraceNode node(String id, String parentId, Layer layer, long offsetMs) {
        return new TraceNode(id, parentId, layer, "mod", "act-" + id, null, T0.plusMillis(offsetMs));
    }

    private TraceChain chain;

    @BeforeEach
    void setUp() {
        // root -> a -> c ; root -> b
        chain = TraceChain.rootedAt(node("root", null, Layer.BIOLOGY, 0));
        chain.attach(node("a", "root", Layer.MEMORY, 10));
        chain.attach(node("b", "root", Layer.MEMORY, 5));
        chain.attach(node("c", "a", Layer.EXECUTION, 40));
    }

    @Nested
    @DisplayName("structure")
    class Structure {

        @Test
        @DisplayName("rootedAt takes root id and created_at from the root node")
        void rootedAt() {
            assertThat(chain.rootId()).isEqualTo("root");
            assertThat(chain.createdAt()).isEqualTo(T0);
            assertThat(chain.root()).map(TraceNode::id).contains("root");
        }

        @Test
        @DisplayName("keeps attach order rather than timestamp order")
        void attachOrder() {
            assertThat(chain.nodes()).extracting(TraceNode::id).containsExactly("root", "a", "b", "c");
        }

        @Test
        @DisplayName("rejects a duplicate id")
        void rejectsDuplicate() {
            assertThatThrownBy(() -> chain.attach(node("a", "root", Layer.MEMORY, 50)))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("a");
        }

        @Test
        @DisplayName("replace swaps a node in place")
        void replaceInPlace() {
            chain.replace(chain.getNode("b").orElseThrow().withData("k", "v"));

            assertThat(chain.nodes()).extracting(TraceNode::id).containsExactly("root", "a", "b", "c");
            assertThat(chain.getNode("b").orElseThrow().data()).containsEntry("k", "v");
        }

        @Test
        @DisplayName("replace of an unknown node fails")
        void replaceUnknown() {
            assertThatThrownBy(() -> chain.replace(node("zz", "root", Layer.MEMORY, 1)))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("nodes() is a snapshot")
        void snapshot() {
            List<TraceNode> before = chain.nodes();
            chain.attach(node("d", "c", Layer.EXECUTION, 50));

            assertThat(before).hasSize(4);
            assertThat(chain.size()).isEqualTo(5);
        }
    }

    @Nested
    @DisplayName("queries")
    class Queries {

        @Test
        @DisplayName("getNode finds by id and is empty for unknown or null ids")
        void getNode() {
            assertThat(chain.getNode("c")).isPresent();
            assertThat(chain.getNode("missing")).isEmpty();
            assertThat(chain.getNode(null)).isEmpty();
        }

        @Test
        @DisplayName("getChildren returns direct children only")
        void getChildren() {
            assertThat(chain.getChildren("root")).extracting(TraceNode::id).containsExactly("a", "b");
            assertThat(chain.getChildren("c")).isEmpty();
        }

        @Test
        @DisplayName("getLayerNodes filters by layer")
        void getLayerNodes() {
            assertThat(chain.getLayerNodes(Layer.MEMORY)).extracting(TraceNode::id).containsExactly("a", "b");
            assertThat(chain.getLayerNodes(Layer.PRESENCE)).isEmpty();
        }

        @Test
        @DisplayName("getExecutionTime spans min to max timestamp across all nodes")
        void executionTime() {
            assertThat(chain.getExecutionTime()).isEqualTo(Duration.ofMillis(40));
        }

        @Test
        @DisplayName("getExecutionTime is zero for an empty chain")
        void executionTimeEmpty() {
            assertThat(new TraceChain("x", T0, List.of()).getExecutionTime()).isEqualTo(Duration.ZERO);
        }
    }

    @Nested
    @DisplayName("getPathToRoot")
    class PathToRoot {

        @Test
        @DisplayName("returns root-first path")
        void rootFirst() {
            assertThat(chain.getPathToRoot("c")).extracting(TraceNode::id).containsExactly("root", "a", "c");
            assertThat(chain.getPathToRoot("root")).extracting(TraceNode::id).containsExactly("root");
        }

        @Test
        @DisplayName("is empty for an unknown id")
        void unknownId() {
            assertThat(chain.getPathToRoot("nope")).isEmpty();
        }

        @Test
        @DisplayName("stops at a broken link")
        void brokenLink() {
            TraceChain broken = new TraceChain("r", T0, List.of(
                    node("r", null, Layer.BIOLOGY, 0),
                    node("x", "ghost", Layer.MEMORY, 1),
                    node("y", "x", Layer.MEMORY, 2)));

            assertThat(broken.getPathToRoot("y")).extracting(TraceNode::id).containsExactly("x", "y");
        }

        @Test
        @DisplayName("terminates on a cyclic parent graph")
        void cycle() {
            TraceChain cyclic = new TraceChain("r", T0, List.of(
                    node("r", null, Layer.BIOLOGY, 0),
                    node("p", "q", Layer.MEMORY, 1),
                    node("q", "p", Layer.MEMORY, 2)));

            assertThat(cyclic.getPathToRoot("p")).extracting(TraceNode::id).containsExactly("q", "p");
        }
    }
}
