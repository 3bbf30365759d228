package com.causalflow.validation;

import com.causalflow.tracemodel.Layer;
import com.causalflow.tracemodel.TraceChain;
import com.causalflow.tracemodel.TraceNode;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Integrity checks over a {@link TraceChain}.
 *
 * <p>Every method is side-effect free and never throws: problems come back as data. Hard errors
 * (broken links, root problems, time running backwards, duplicate ids) make a chain invalid;
 * backward layer flow is only a warning.
 */
public final class ChainValidator {

    private ChainValidator() {
        // utility class
    }

    /**
     * Validates completeness, root integrity, timestamp monotonicity and layer ordering.
     *
     * @param chain the chain to check; {@code null} or empty chains are invalid
     * @return all errors and warnings found
     */
    public static ValidationResult validateChain(TraceChain chain) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (chain == null || chain.isEmpty()) {
            errors.add("Chain has no nodes");
            return ValidationResult.of(errors, warnings);
        }

        List<TraceNode> nodes = chain.nodes();
        Map<String, TraceNode> byId = new LinkedHashMap<>();
        for (TraceNode node : nodes) {
            if (byId.putIfAbsent(node.id(), node) != null) {
                errors.add("Duplicate node id: " + node.id());
            }
        }

        checkLinks(nodes, byId, errors);
        checkRoot(chain, nodes, byId, errors);
        checkTimestamps(nodes, byId, errors);
        checkLayerSequence(chain, nodes, byId, warnings);

        return ValidationResult.of(errors, warnings);
    }

    /**
     * Checks that each required layer has at least one node in the chain.
     *
     * @param chain          the chain to check; a {@code null} chain covers nothing
     * @param requiredLayers layers that must be present; {@code null} requires nothing and
     *                       {@code null} entries are reported as errors
     */
    public static CoverageResult validateLayerCoverage(TraceChain chain, Collection<Layer> requiredLayers) {
        Set<Layer> present = presentLayers(chain);
        List<String> errors = new ArrayList<>();
        if (requiredLayers == null) {
            return new CoverageResult(true, errors);
        }
        for (Layer layer : requiredLayers) {
            if (layer == null) {
                errors.add("Required layer is null");
            } else if (!present.contains(layer)) {
                errors.add("Missing required layer: " + layer.code() + " (" + layer.displayName() + ")");
            }
        }
        return new CoverageResult(errors.isEmpty(), errors);
    }

    /**
     * Computes node totals, per-layer counts (zero-filled), execution time and present layers. A
     * {@code null} chain yields all-zero figures.
     */
    public static ChainStatistics getChainStatistics(TraceChain chain) {
        Map<Layer, Integer> counts = new EnumMap<>(Layer.class);
        for (Layer layer : Layer.values()) {
            counts.put(layer, 0);
        }
        List<Layer> present = new ArrayList<>();
        if (chain == null) {
            return new ChainStatistics(0, counts, Duration.ZERO, null, null, present);
        }
        List<TraceNode> nodes = chain.nodes();
        for (TraceNode node : nodes) {
            counts.merge(node.layer(), 1, Integer::sum);
        }
        for (Layer layer : Layer.values()) {
            if (counts.get(layer) > 0) {
                present.add(layer);
            }
        }
        return new ChainStatistics(nodes.size(), counts, chain.getExecutionTime(),
                chain.rootId(), chain.createdAt(), present);
    }

    private static void checkLinks(List<TraceNode> nodes, Map<String, TraceNode> byId, List<String> errors) {
        for (TraceNode node : nodes) {
            if (node.parentId() != null && !byId.containsKey(node.parentId())) {
                errors.add("Broken link: node " + node.id() + " references missing parent " + node.parentId());
            }
        }
    }

    private static void checkRoot(TraceChain chain, List<TraceNode> nodes, Map<String, TraceNode> byId,
                                  List<String> errors) {
        TraceNode root = chain.rootId() == null ? null : byId.get(chain.rootId());
        if (root == null) {
            errors.add("Root node not found: " + chain.rootId());
        } else if (root.parentId() != null) {
            errors.add("Root node " + root.id() + " has a parent: " + root.parentId());
        }
        for (TraceNode node : nodes) {
            if (!node.id().equals(chain.rootId()) && node.parentId() == null) {
                errors.add("Orphaned node: " + node.id() + " has no parent but is not the root");
            }
        }
    }

    private static void checkTimestamps(List<TraceNode> nodes, Map<String, TraceNode> byId, List<String> errors) {
        for (TraceNode node : nodes) {
            TraceNode parent = node.parentId() == null ? null : byId.get(node.parentId());
            if (parent != null && node.timestamp().isBefore(parent.timestamp())) {
                errors.add("Timestamp violation: node " + node.id() + " (" + node.timestamp()
                        + ") precedes its parent " + parent.id() + " (" + parent.timestamp() + ")");
            }
        }
    }

    // Pre-order DFS from the root; the visited set truncates cycles.
    private static void checkLayerSequence(TraceChain chain, List<TraceNode> nodes, Map<String, TraceNode> byId,
                                           List<String> warnings) {
        TraceNode root = chain.rootId() == null ? null : byId.get(chain.rootId());
        if (root == null) {
            return;
        }
        Map<String, List<TraceNode>> children = new HashMap<>();
        for (TraceNode node : nodes) {
            if (node.parentId() != null) {
                children.computeIfAbsent(node.parentId(), k -> new ArrayList<>()).add(node);
            }
        }

        List<TraceNode> visitOrder = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        Deque<TraceNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            TraceNode node = stack.pop();
            if (!visited.add(node.id())) {
                continue;
            }
            visitOrder.add(node);
            List<TraceNode> kids = children.getOrDefault(node.id(), List.of());
            for (int i = kids.size() - 1; i >= 0; i--) {
                stack.push(kids.get(i));
            }
        }

        for (int i = 1; i < visitOrder.size(); i++) {
            TraceNode previous = visitOrder.get(i - 1);
            TraceNode current = visitOrder.get(i);
            if (current.layer().rank() < previous.layer().rank()) {
                warnings.add("Backward flow: " + previous.layer().code() + " -> " + current.layer().code()
                        + " at node " + current.id());
            }
        }
    }

    private static Set<Layer> presentLayers(TraceChain chain) {
        Set<Layer> present = new HashSet<>();
        if (chain != null) {
            for (TraceNode node : chain.nodes()) {
                present.add(node.layer());
            }
        }
        return present;
    }
}
