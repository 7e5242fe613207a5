package com.bsm.hypergraph.prediction;

/**
 * CI pair not yet changed together, scored by Adamic-Adar.
 */
public record LinkPrediction(String a, String b, String nameA, String nameB, double score) {
}
