package com.bsm.hypergraph.anomaly;

/**
 * CI referenced by at most one change.
 */
public record Orphan(String uid, String name, int degree, String reason) {

    public static final String REASON_UNREFERENCED = "no changes reference this CI";
    public static final String REASON_SINGLE = "only 1 change references this CI";
}
