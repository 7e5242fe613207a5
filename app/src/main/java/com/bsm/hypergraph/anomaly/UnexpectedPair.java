package com.bsm.hypergraph.anomaly;

/**
 * CI pair co-changed far more often than the frequencies of their classes predict.
 */
public record UnexpectedPair(
        String a,
        String b,
        String nameA,
        String nameB,
        String classA,
        String classB,

        /** Hyperedges containing both CIs */
        int actual,

        /** Count expected under class independence */
        double expected,

        double ratio) {
}
