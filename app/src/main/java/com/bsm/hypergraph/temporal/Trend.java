package com.bsm.hypergraph.temporal;

public enum Trend {
    INCREASING("increasing"),
    DECREASING("decreasing"),
    STABLE("stable");

    private final String label;

    Trend(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
