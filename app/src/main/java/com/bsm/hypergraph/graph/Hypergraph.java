package com.bsm.hypergraph.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable incidence-matrix hypergraph snapshot.
 * The incidence map is a dictionary of sets: node uid to the uids of the
 * hyperedges containing it. Every node has an entry, possibly empty.
 */
public final class Hypergraph {

    private static final Hypergraph EMPTY = new Hypergraph(List.of(), List.of(), Map.of(), false);

    private final List<Entity> nodes;
    private final List<Hyperedge> edges;
    private final Map<String, Set<String>> incidence;
    private final GraphStats stats;
    private final boolean transposed;

    private final Map<String, Entity> nodeIndex;
    private final Map<String, Hyperedge> edgeIndex;

    Hypergraph(List<Entity> nodes, List<Hyperedge> edges, Map<String, Set<String>> incidence, boolean transposed) {
        this.nodes = List.copyOf(nodes);
        this.edges = List.copyOf(edges);
        this.transposed = transposed;

        Map<String, Set<String>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Set<String>> entry : incidence.entrySet()) {
            copy.put(entry.getKey(), Collections.unmodifiableSet(new LinkedHashSet<>(entry.getValue())));
        }
        this.incidence = Collections.unmodifiableMap(copy);

        Map<String, Entity> ni = new LinkedHashMap<>();
        this.nodes.forEach(n -> ni.put(n.uid(), n));
        this.nodeIndex = Collections.unmodifiableMap(ni);

        Map<String, Hyperedge> ei = new LinkedHashMap<>();
        this.edges.forEach(e -> ei.put(e.uid(), e));
        this.edgeIndex = Collections.unmodifiableMap(ei);

        this.stats = GraphStats.compute(this.nodes, this.edges, this.incidence);
    }

    public static Hypergraph empty() {
        return EMPTY;
    }

    public List<Entity> nodes() {
        return nodes;
    }

    public List<Hyperedge> edges() {
        return edges;
    }

    public Map<String, Set<String>> incidence() {
        return incidence;
    }

    public GraphStats stats() {
        return stats;
    }

    public boolean isTransposed() {
        return transposed;
    }

    public boolean isEmpty() {
        return nodes.isEmpty() && edges.isEmpty();
    }

    public Entity node(String uid) {
        return nodeIndex.get(uid);
    }

    public Hyperedge edge(String uid) {
        return edgeIndex.get(uid);
    }

    public boolean hasNode(String uid) {
        return nodeIndex.containsKey(uid);
    }

    /**
     * Hyperedges containing the node; empty for unknown uids.
     */
    public Set<String> edgesOf(String uid) {
        return incidence.getOrDefault(uid, Set.of());
    }

    /**
     * Every other member of every hyperedge containing the node, first-seen order.
     */
    public Set<String> neighborSet(String uid) {
        Set<String> neighbors = new LinkedHashSet<>();
        for (String edgeUid : edgesOf(uid)) {
            Hyperedge edge = edgeIndex.get(edgeUid);
            if (edge == null)
                continue;
            for (String member : edge.elements()) {
                if (!member.equals(uid)) {
                    neighbors.add(member);
                }
            }
        }
        return neighbors;
    }

    public int degree(String uid) {
        return edgesOf(uid).size();
    }

    public int maxDegree() {
        return stats.maxDegree();
    }

    /**
     * Name of a node, falling back to its uid.
     */
    public String nameOf(String uid) {
        Entity node = nodeIndex.get(uid);
        return node != null ? node.name() : uid;
    }

    /**
     * CI node uids in node order.
     */
    public List<String> ciUids() {
        return nodes.stream()
                .filter(Entity::isCi)
                .map(Entity::uid)
                .toList();
    }
}
