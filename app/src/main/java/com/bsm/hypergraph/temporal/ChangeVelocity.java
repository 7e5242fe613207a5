package com.bsm.hypergraph.temporal;

import java.util.List;

/**
 * Weekly change counts of one CI.
 */
public record ChangeVelocity(
        List<Integer> weeks,
        double avg,
        int max,
        Trend trend) {

    public ChangeVelocity {
        weeks = List.copyOf(weeks);
    }
}
