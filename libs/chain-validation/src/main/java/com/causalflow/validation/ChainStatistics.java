package com.causalflow.validation;

import com.causalflow.tracemodel.Layer;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate figures for one chain.
 *
 * @param totalNodes    number of nodes in the chain
 * @param layerCounts   node count per layer, all six layers present (zero when unused)
 * @param executionTime earliest to latest node timestamp
 * @param rootId        the chain's root id
 * @param createdAt     the chain's creation instant
 * @param layersPresent layers with at least one node, in rank order
 */
public record ChainStatistics(
        int totalNodes,
        Map<Layer, Integer> layerCounts,
        Duration executionTime,
        String rootId,
        Instant createdAt,
        List<Layer> layersPresent) {

    public ChainStatistics {
        layerCounts = Collections.unmodifiableMap(new EnumMap<>(layerCounts));
        layersPresent = List.copyOf(layersPresent);
    }
}
