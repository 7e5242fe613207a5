package com.bsm.hypergraph.community;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Outcome of a community detection run.
 */
public record CommunityResult(
        /** CI uid to community id */
        Map<String, Integer> membership,

        /** Community id to member uids, ascending by id */
        Map<Integer, List<String>> communities,

        /** Newman modularity Q of the final partition */
        double modularity,

        /** Largest community first */
        List<CommunitySummary> summary) {

    public CommunityResult {
        membership = Collections.unmodifiableMap(new LinkedHashMap<>(membership));
        communities = Collections.unmodifiableMap(new TreeMap<>(communities));
        summary = List.copyOf(summary);
    }

    public static CommunityResult empty() {
        return new CommunityResult(Map.of(), Map.of(), 0, List.of());
    }

    public int count() {
        return communities.size();
    }
}
