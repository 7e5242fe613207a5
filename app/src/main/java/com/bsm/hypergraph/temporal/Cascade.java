package com.bsm.hypergraph.temporal;

/**
 * Time-lagged change pattern between two CIs.
 */
public record Cascade(
        /** Lexicographically smaller CI uid */
        String source,

        String target,

        /** Directed occurrences in both directions */
        int count,

        double avgLagDays,

        Direction direction) {
}
