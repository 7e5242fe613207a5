package com.bsm.hypergraph.centrality;

/**
 * Source of candidate (source, target) index pairs for sampled betweenness.
 * Implementations must be deterministic so repeated runs agree.
 */
public interface IndexSequence {

    /**
     * Source index for the given attempt, in {@code [0, size)}.
     */
    int source(int attempt, int size);

    /**
     * Target index for the given attempt, in {@code [0, size)}.
     */
    int target(int attempt, int size);
}
