package com.bsm.hypergraph.centrality;

import java.util.Map;

/**
 * The four centrality measures, each a node uid to score map normalized to [0, 1].
 */
public record CentralityScores(
        Map<String, Double> degree,
        Map<String, Double> betweenness,
        Map<String, Double> eigenvector,
        Map<String, Double> composite) {

    public static CentralityScores empty() {
        return new CentralityScores(Map.of(), Map.of(), Map.of(), Map.of());
    }
}
