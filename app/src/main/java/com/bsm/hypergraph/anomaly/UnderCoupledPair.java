package com.bsm.hypergraph.anomaly;

/**
 * CIs under the same business service that never appear in one change.
 */
public record UnderCoupledPair(
        String a,
        String b,
        String nameA,
        String nameB,
        String sharedService,
        String reason) {

    public static final String REASON = "share business service but never appear in the same change";
}
