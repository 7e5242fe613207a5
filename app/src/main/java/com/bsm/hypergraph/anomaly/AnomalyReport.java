package com.bsm.hypergraph.anomaly;

import java.util.List;

public record AnomalyReport(
        List<UnexpectedPair> unexpectedPairs,
        List<Orphan> orphans,
        List<OverCoupledPair> overCoupled,
        List<UnderCoupledPair> underCoupled) {

    public AnomalyReport {
        unexpectedPairs = List.copyOf(unexpectedPairs);
        orphans = List.copyOf(orphans);
        overCoupled = List.copyOf(overCoupled);
        underCoupled = List.copyOf(underCoupled);
    }

    public static AnomalyReport empty() {
        return new AnomalyReport(List.of(), List.of(), List.of(), List.of());
    }

    public int total() {
        return unexpectedPairs.size() + orphans.size() + overCoupled.size() + underCoupled.size();
    }
}
