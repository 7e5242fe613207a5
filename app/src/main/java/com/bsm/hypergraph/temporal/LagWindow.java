package com.bsm.hypergraph.temporal;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Counts "event on A, then event on B within the window" occurrences.
 * Timestamps of 0 mean unknown and never take part.
 */
public final class LagWindow {

    /**
     * Occurrences of one directed pair and their summed lag in millis.
     */
    public record Tally(int count, long totalLag) {

        public double avgLag() {
            return count > 0 ? (double) totalLag / count : 0;
        }
    }

    private LagWindow() {
    }

    /**
     * All directed pairs with at least one lag in {@code (0, windowMs]}, keyed
     * source then target, in timeline order.
     */
    public static Map<String, Map<String, Tally>> directed(Map<String, List<Long>> timeline, long windowMs) {
        Map<String, Map<String, Tally>> result = new LinkedHashMap<>();
        for (Map.Entry<String, List<Long>> a : timeline.entrySet()) {
            for (Map.Entry<String, List<Long>> b : timeline.entrySet()) {
                if (a.getKey().equals(b.getKey()))
                    continue;
                Tally tally = tally(a.getValue(), b.getValue(), windowMs);
                if (tally.count() > 0) {
                    result.computeIfAbsent(a.getKey(), k -> new LinkedHashMap<>()).put(b.getKey(), tally);
                }
            }
        }
        return result;
    }

    public static Tally tally(List<Long> leading, List<Long> following, long windowMs) {
        int count = 0;
        long totalLag = 0;
        for (long tA : leading) {
            if (tA == 0)
                continue;
            for (long tB : following) {
                if (tB == 0)
                    continue;
                long lag = tB - tA;
                if (lag > 0 && lag <= windowMs) {
                    count++;
                    totalLag += lag;
                }
            }
        }
        return new Tally(count, totalLag);
    }
}
