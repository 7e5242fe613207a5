package com.bsm.hypergraph.cooccurrence;

/**
 * Multi-signal co-occurrence of two CIs.
 */
public record WeightedPair(
        /** Lexicographically smaller CI uid */
        String a,

        String b,

        int rawCount,

        /** Sum of risk multipliers over shared changes */
        double riskWeighted,

        /** Sum of exponentially decayed ages over shared changes */
        double recencyWeighted,

        /** Distinct assignment groups the pair was changed under */
        int diversity,

        double jaccard,

        /** Weighted blend of the five normalized signals, in [0,1] */
        double composite) {
}
