package com.bsm.hypergraph.centrality;

/**
 * A highly central node with the measure that dominates its importance.
 */
public record CriticalNode(
        String uid,
        String name,
        String type,
        double composite,
        double degree,
        double betweenness,
        double eigenvector,
        String reason) {

    public static final String REASON_BRIDGE = "bridge: lies on many shortest paths between CIs";
    public static final String REASON_HUB = "hub: participates in many change requests";
    public static final String REASON_INFLUENCE = "connected to important nodes: high influence via neighbors";
    public static final String REASON_GENERAL = "general importance";
}
