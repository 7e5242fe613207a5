package com.bsm.hypergraph.graph;

import com.bsm.hypergraph.core.Scores;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Summary statistics of a hypergraph, always derived from its structure.
 */
public record GraphStats(
        int totalNodes,
        int totalEdges,

        /** Incidence count / (nodes x edges) */
        double density,

        double avgDegree,
        int maxDegree,
        int minDegree,
        double avgEdgeSize,
        int maxEdgeSize,
        int minEdgeSize) {

    static GraphStats compute(List<Entity> nodes, List<Hyperedge> edges, Map<String, Set<String>> incidence) {
        int totalNodes = nodes.size();
        int totalEdges = edges.size();

        long incidenceCount = 0;
        int maxDegree = 0;
        int minDegree = Integer.MAX_VALUE;
        for (Set<String> memberOf : incidence.values()) {
            int deg = memberOf.size();
            incidenceCount += deg;
            maxDegree = Math.max(maxDegree, deg);
            minDegree = Math.min(minDegree, deg);
        }

        long maxPossible = (long) totalNodes * totalEdges;
        double density = maxPossible > 0 ? (double) incidenceCount / maxPossible : 0;
        double avgDegree = totalNodes > 0 ? (double) incidenceCount / totalNodes : 0;

        long edgeSizeSum = 0;
        int maxEdgeSize = 0;
        int minEdgeSize = Integer.MAX_VALUE;
        for (Hyperedge edge : edges) {
            int size = edge.size();
            edgeSizeSum += size;
            maxEdgeSize = Math.max(maxEdgeSize, size);
            minEdgeSize = Math.min(minEdgeSize, size);
        }
        double avgEdgeSize = totalEdges > 0 ? (double) edgeSizeSum / totalEdges : 0;

        return new GraphStats(
                totalNodes,
                totalEdges,
                Scores.round(density, 4),
                Scores.round(avgDegree, 2),
                maxDegree,
                minDegree == Integer.MAX_VALUE ? 0 : minDegree,
                Scores.round(avgEdgeSize, 2),
                maxEdgeSize,
                minEdgeSize == Integer.MAX_VALUE ? 0 : minEdgeSize);
    }
}
