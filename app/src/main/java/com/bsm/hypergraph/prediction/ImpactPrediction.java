package com.bsm.hypergraph.prediction;

/**
 * Likelihood that a CI is affected when the target CI changes.
 */
public record ImpactPrediction(
        String ci,
        String name,

        /** Weighted blend of the four signals, in [0,1] */
        double probability,

        /** Strongest contributing signal */
        String reason) {

    public static final String REASON_COOCCURRENCE = "frequently co-occurs in change requests";
    public static final String REASON_CASCADE = "temporal cascade pattern detected";
    public static final String REASON_SERVICE = "shared business service membership";
    public static final String REASON_PROXIMITY = "network proximity";
}
