package com.bsm.hypergraph.temporal;

/**
 * Which way a cascade between a source and target CI runs.
 */
public enum Direction {
    SOURCE_TO_TARGET("A→B"),
    TARGET_TO_SOURCE("B→A"),
    BIDIRECTIONAL("bidirectional");

    private final String label;

    Direction(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    static Direction of(int forward, int backward) {
        if (forward > 0 && backward > 0)
            return BIDIRECTIONAL;
        return forward > 0 ? SOURCE_TO_TARGET : TARGET_TO_SOURCE;
    }

    @Override
    public String toString() {
        return label;
    }
}
