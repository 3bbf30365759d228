package com.causalflow.tracemodel;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A tree of {@link TraceNode}s sharing one root.
 *
 * <p>Nodes are kept in the order they were attached, which is not necessarily timestamp order.
 * The chain itself enforces nothing about tree shape: a chain built from arbitrary nodes (for
 * example one read back from JSON) may be malformed, and the validator reports that as data.
 *
 * <p>Readers can iterate concurrently with the tracer appending; {@link #nodes()} returns a
 * snapshot.
 */
public final class TraceChain {

    /** Upper bound on any parent walk, whatever the chain size. */
    public static final int MAX_PATH_DEPTH = 10_000;

    private final String rootId;
    private final Instant createdAt;
    private final List<TraceNode> nodes = new CopyOnWriteArrayList<>();
    private final Map<String, Integer> positions = new ConcurrentHashMap<>();

    /**
     * Creates a chain over the given nodes, in order.
     *
     * @param rootId    id of the node expected to have no parent
     * @param createdAt creation instant, normally the root's timestamp
     * @param nodes     initial nodes (may be empty)
     */
    public TraceChain(String rootId, Instant createdAt, List<TraceNode> nodes) {
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt must not be null");
        }
        this.rootId = rootId;
        this.createdAt = createdAt;
        for (TraceNode node : nodes) {
            positions.putIfAbsent(node.id(), this.nodes.size());
            this.nodes.add(node);
        }
    }

    /** Starts a new chain anchored on {@code root}. */
    public static TraceChain rootedAt(TraceNode root) {
        return new TraceChain(root.id(), root.timestamp(), List.of(root));
    }

    public String rootId() {
        return rootId;
    }

    public Instant createdAt() {
        return createdAt;
    }

    /** Snapshot of all nodes in attach order. */
    public List<TraceNode> nodes() {
        return List.copyOf(nodes);
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public boolean contains(String id) {
        return id != null && positions.containsKey(id);
    }

    /**
     * Appends a node.
     *
     * @throws IllegalArgumentException if a node with the same id is already present
     */
    public synchronized void attach(TraceNode node) {
        if (positions.containsKey(node.id())) {
            throw new IllegalArgumentException("Node already attached: " + node.id());
        }
        positions.put(node.id(), nodes.size());
        nodes.add(node);
    }

    /**
     * Swaps in a new version of an attached node, keeping its position.
     *
     * @throws IllegalArgumentException if no node with that id is attached
     */
    public synchronized void replace(TraceNode node) {
        Integer position = positions.get(node.id());
        if (position == null) {
            throw new IllegalArgumentException("Node not attached: " + node.id());
        }
        nodes.set(position, node);
    }

    public Optional<TraceNode> getNode(String id) {
        if (id == null) {
            return Optional.empty();
        }
        Integer position = positions.get(id);
        return position == null ? Optional.empty() : Optional.of(nodes.get(position));
    }

    /** The node named by {@link #rootId()}, if present. */
    public Optional<TraceNode> root() {
        return getNode(rootId);
    }

    /** Nodes whose parent is {@code parentId}, in attach order. */
    public List<TraceNode> getChildren(String parentId) {
        List<TraceNode> children = new ArrayList<>();
        for (TraceNode node : nodes) {
            if (parentId != null && parentId.equals(node.parentId())) {
                children.add(node);
            }
        }
        return children;
    }

    /** Nodes attributed to {@code layer}, in attach order. */
    public List<TraceNode> getLayerNodes(Layer layer) {
        List<TraceNode> matches = new ArrayList<>();
        for (TraceNode node : nodes) {
            if (node.layer() == layer) {
                matches.add(node);
            }
        }
        return matches;
    }

    /**
     * Walks parent links from {@code id} upwards and returns the path ordered root first.
     *
     * <p>The walk stops at a node without a parent, at a parent that is not in this chain, on a
     * revisited node, or after {@link #MAX_PATH_DEPTH} steps. Returns an empty list if {@code id}
     * is not in the chain.
     */
    public List<TraceNode> getPathToRoot(String id) {
        List<TraceNode> path = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        Optional<TraceNode> current = getNode(id);
        while (current.isPresent() && path.size() < MAX_PATH_DEPTH) {
            TraceNode node = current.get();
            if (!visited.add(node.id())) {
                break;
            }
            path.add(node);
            current = getNode(node.parentId());
        }
        Collections.reverse(path);
        return path;
    }

    /**
     * Span between the earliest and the latest node timestamp in the chain. This covers every
     * node, not only the root; {@link Duration#ZERO} for an empty chain.
     */
    public Duration getExecutionTime() {
        Instant min = null;
        Instant max = null;
        for (TraceNode node : nodes) {
            Instant ts = node.timestamp();
            if (min == null || ts.isBefore(min)) {
                min = ts;
            }
            if (max == null || ts.isAfter(max)) {
                max = ts;
            }
        }
        return min == null ? Duration.ZERO : Duration.between(min, max);
    }

    @Override
    public String toString() {
        return "TraceChain{rootId='" + rootId + "', nodes=" + nodes.size() + ", createdAt=" + createdAt + '}';
    }
}
