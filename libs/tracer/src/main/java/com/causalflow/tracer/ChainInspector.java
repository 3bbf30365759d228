package com.causalflow.tracer;

import com.causalflow.tracemodel.ChainSerializer;
import com.causalflow.tracemodel.Layer;
import com.causalflow.tracemodel.TraceChain;
import com.causalflow.tracemodel.TraceNode;
import com.causalflow.validation.ChainStatistics;
import com.causalflow.validation.ChainValidator;
import com.causalflow.validation.CoverageResult;
import com.causalflow.validation.ValidationResult;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Read-mostly facade over a {@link CausalTracer} for inspection endpoints and tooling.
 * <p>
 * Every lookup accepts the id of any node in a chain, not only the root. This is a POJO with no
 * transport attached; an HTTP or CLI layer maps its methods one to one.
 */
public class ChainInspector {

    private final CausalTracer tracer;

    public ChainInspector(CausalTracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    /**
     * Lists stored chains, newest {@code created_at} first.
     *
     * @param page zero-based page index
     * @param size page size, at least 1
     */
    public ChainPage listChains(int page, int size) {
        if (page < 0) {
            throw new IllegalArgumentException("page must be >= 0");
        }
        if (size <= 0) {
            throw new IllegalArgumentException("size must be positive");
        }
        List<TraceChain> all = new ArrayList<>(tracer.getAllChains());
        all.sort(Comparator.comparing(TraceChain::createdAt).reversed());
        int from = (int) Math.min((long) page * size, all.size());
        int to = Math.min(from + size, all.size());
        return new ChainPage(all.subList(from, to), page, size, all.size());
    }

    public Optional<TraceChain> findChain(String anyId) {
        return tracer.getChain(anyId);
    }

    public Optional<ValidationResult> validate(String anyId) {
        return findChain(anyId).map(ChainValidator::validateChain);
    }

    public Optional<CoverageResult> coverage(String anyId, Collection<Layer> requiredLayers) {
        return findChain(anyId).map(chain -> ChainValidator.validateLayerCoverage(chain, requiredLayers));
    }

    public Optional<ChainStatistics> statistics(String anyId) {
        return findChain(anyId).map(ChainValidator::getChainStatistics);
    }

    /** Nodes of {@code layer} in the chain containing {@code anyId}; empty if no such chain. */
    public List<TraceNode> nodesByLayer(String anyId, Layer layer) {
        return findChain(anyId).map(chain -> chain.getLayerNodes(layer)).orElse(List.of());
    }

    /** Root-first path to {@code nodeId} within its chain; empty if the node is not stored. */
    public List<TraceNode> pathToRoot(String nodeId) {
        return findChain(nodeId).map(chain -> chain.getPathToRoot(nodeId)).orElse(List.of());
    }

    /** The chain containing {@code anyId} as JSON. */
    public Optional<String> exportJson(String anyId) {
        return findChain(anyId).map(ChainSerializer::serialize);
    }

    public void setEnabled(boolean enabled) {
        if (enabled) {
            tracer.enable();
        } else {
            tracer.disable();
        }
    }

    public boolean isEnabled() {
        return tracer.isEnabled();
    }

    /**
     * Drops all stored chains.
     *
     * @return the number of chains dropped
     */
    public int clearAll() {
        return tracer.clearChains();
    }
}
