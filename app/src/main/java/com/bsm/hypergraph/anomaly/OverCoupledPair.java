package com.bsm.hypergraph.anomaly;

public record OverCoupledPair(
        String a,
        String b,
        String nameA,
        String nameB,
        double jaccard,
        int sharedChanges) {
}
