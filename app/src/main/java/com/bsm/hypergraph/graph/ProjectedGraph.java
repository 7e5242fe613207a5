package com.bsm.hypergraph.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Weighted pairwise projection of a hypergraph onto its CI nodes.
 * The weight of (u, v) is the number of hyperedges both belong to.
 */
public final class ProjectedGraph {

    private final List<String> nodes;
    private final Map<String, Map<String, Integer>> adjacency;

    private ProjectedGraph(List<String> nodes, Map<String, Map<String, Integer>> adjacency) {
        this.nodes = nodes;
        this.adjacency = adjacency;
    }

    public static ProjectedGraph of(Hypergraph graph) {
        List<String> ciUids = graph.ciUids();
        Set<String> ciSet = new LinkedHashSet<>(ciUids);

        Map<String, Map<String, Integer>> adjacency = new LinkedHashMap<>();
        ciUids.forEach(uid -> adjacency.put(uid, new LinkedHashMap<>()));

        for (Hyperedge edge : graph.edges()) {
            List<String> members = edge.elements().stream().filter(ciSet::contains).toList();
            for (int a = 0; a < members.size(); a++) {
                for (int b = a + 1; b < members.size(); b++) {
                    String u = members.get(a);
                    String v = members.get(b);
                    adjacency.get(u).merge(v, 1, Integer::sum);
                    adjacency.get(v).merge(u, 1, Integer::sum);
                }
            }
        }

        Map<String, Map<String, Integer>> frozen = new LinkedHashMap<>();
        adjacency.forEach((uid, row) -> frozen.put(uid, Collections.unmodifiableMap(row)));
        return new ProjectedGraph(ciUids, Collections.unmodifiableMap(frozen));
    }

    /**
     * CI uids in hypergraph node order.
     */
    public List<String> nodes() {
        return nodes;
    }

    public int size() {
        return nodes.size();
    }

    /**
     * Weighted neighbors of a node, in first-seen order.
     */
    public Map<String, Integer> row(String uid) {
        return adjacency.getOrDefault(uid, Map.of());
    }

    public int weight(String u, String v) {
        return row(u).getOrDefault(v, 0);
    }

    /**
     * Weighted degree.
     */
    public double strength(String uid) {
        double s = 0;
        for (int w : row(uid).values()) {
            s += w;
        }
        return s;
    }

    /**
     * Sum of all row weights, so each undirected edge counts twice.
     */
    public double doubledTotalWeight() {
        double total = 0;
        for (String uid : nodes) {
            total += strength(uid);
        }
        return total;
    }
}
