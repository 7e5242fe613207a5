package com.bsm.hypergraph.incident;

/**
 * Incidents on the source CI followed by incidents on the target CI.
 */
public record FaultPropagation(String source, String target, int count, double avgLagHours) {
}
