package com.bsm.hypergraph.centrality;

/**
 * Default pair sequence: {@code s = (k*7 + 13) mod n}, {@code t = (k*11 + 23) mod n}.
 */
public class IndexMixingSequence implements IndexSequence {

    @Override
    public int source(int attempt, int size) {
        return (int) (((long) attempt * 7 + 13) % size);
    }

    @Override
    public int target(int attempt, int size) {
        return (int) (((long) attempt * 11 + 23) % size);
    }
}
