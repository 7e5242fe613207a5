package com.bsm.hypergraph.graph;

import java.util.List;

/**
 * Two nodes and the hyperedges they share. {@code a} sorts before {@code b}.
 */
public record CooccurrencePair(String a, String b, int count, List<String> sharedEdges) {

    public CooccurrencePair {
        sharedEdges = List.copyOf(sharedEdges);
    }
}
