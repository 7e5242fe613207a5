package com.bsm.hypergraph.temporal;

import com.bsm.hypergraph.core.AnalyticsConfig;
import com.bsm.hypergraph.core.Scores;
import com.bsm.hypergraph.graph.ChangeHistory;
import com.bsm.hypergraph.graph.ChangeHistory.ChangeEntry;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Time-lagged cascades between CIs and per-CI weekly change velocity.
 */
public class TemporalAnalyzer {

    private static final long WEEK_MS = 7 * Scores.DAY_MS;

    private final AnalyticsConfig config;

    public TemporalAnalyzer(AnalyticsConfig config) {
        this.config = config;
    }

    public List<Cascade> temporalCascades(ChangeHistory history) {
        return temporalCascades(history, config.getCascadeWindowDays());
    }

    /**
     * Counts, for every ordered CI pair, changes on the first followed by
     * changes on the second within {@code windowDays}, then merges both
     * directions per unordered pair.
     */
    public List<Cascade> temporalCascades(ChangeHistory history, int windowDays) {
        if (history == null || history.isEmpty()) {
            return List.of();
        }
        long windowMs = (windowDays > 0 ? windowDays : config.getCascadeWindowDays()) * Scores.DAY_MS;

        Map<String, Map<String, LagWindow.Tally>> directed = LagWindow.directed(history.ciTimeline(), windowMs);

        // canonical pair -> [forward count, backward count, total lag]
        Map<String, long[]> merged = new LinkedHashMap<>();
        for (Map.Entry<String, Map<String, LagWindow.Tally>> from : directed.entrySet()) {
            String a = from.getKey();
            for (Map.Entry<String, LagWindow.Tally> to : from.getValue().entrySet()) {
                String b = to.getKey();
                LagWindow.Tally tally = to.getValue();
                long[] acc = merged.computeIfAbsent(Scores.pairKey(a, b), k -> new long[3]);
                acc[a.compareTo(b) < 0 ? 0 : 1] += tally.count();
                acc[2] += tally.totalLag();
            }
        }

        List<Cascade> results = new ArrayList<>();
        for (Map.Entry<String, long[]> e : merged.entrySet()) {
            long[] acc = e.getValue();
            int total = (int) (acc[0] + acc[1]);
            if (total == 0)
                continue;
            String[] pair = Scores.splitPairKey(e.getKey());
            double avgLagDays = (double) acc[2] / total / Scores.DAY_MS;
            results.add(new Cascade(pair[0], pair[1], total, Scores.round(avgLagDays, 2),
                    Direction.of((int) acc[0], (int) acc[1])));
        }

        results.sort((x, y) -> Integer.compare(y.count(), x.count()));
        int limit = Math.min(config.getCascadeLimit(), results.size());
        return List.copyOf(results.subList(0, Math.max(limit, 0)));
    }

    /**
     * Weekly change counts per CI across the observed time range. Only CIs with
     * at least two timestamped changes are reported.
     */
    public Map<String, ChangeVelocity> changeVelocity(ChangeHistory history) {
        if (history == null || history.isEmpty()) {
            return Map.of();
        }

        long minTime = Long.MAX_VALUE;
        long maxTime = 0;
        for (ChangeEntry entry : history.entries()) {
            long t = entry.createdAt();
            if (t > 0 && t < minTime)
                minTime = t;
            if (t > maxTime)
                maxTime = t;
        }
        if (minTime == Long.MAX_VALUE || maxTime == 0) {
            return Map.of();
        }

        int totalWeeks = (int) Math.max(1, (maxTime - minTime + WEEK_MS - 1) / WEEK_MS);

        Map<String, int[]> ciWeeks = new LinkedHashMap<>();
        for (ChangeEntry entry : history.entries()) {
            if (entry.createdAt() <= 0)
                continue;
            int week = (int) Math.min((entry.createdAt() - minTime) / WEEK_MS, totalWeeks - 1);
            for (String ci : entry.ciUids()) {
                ciWeeks.computeIfAbsent(ci, k -> new int[totalWeeks])[week]++;
            }
        }

        Map<String, ChangeVelocity> result = new LinkedHashMap<>();
        for (Map.Entry<String, int[]> e : ciWeeks.entrySet()) {
            int[] weeks = e.getValue();
            int total = Arrays.stream(weeks).sum();
            if (total < 2)
                continue;
            int max = Arrays.stream(weeks).max().orElse(0);
            double avg = (double) total / weeks.length;

            List<Integer> counts = new ArrayList<>(weeks.length);
            for (int w : weeks) {
                counts.add(w);
            }
            result.put(e.getKey(), new ChangeVelocity(counts, Scores.round(avg, 2), max, trend(weeks)));
        }
        return Collections.unmodifiableMap(result);
    }

    /**
     * Compares the mean of the second half of the weeks with the first half.
     */
    Trend trend(int[] weeks) {
        int half = weeks.length / 2;
        if (half == 0)
            return Trend.STABLE;

        double first = 0;
        double second = 0;
        for (int i = 0; i < weeks.length; i++) {
            if (i < half)
                first += weeks[i];
            else
                second += weeks[i];
        }
        first /= half;
        second /= weeks.length - half;

        double change = (second - first) / Math.max(first, 0.1);
        if (change > config.getTrendThreshold())
            return Trend.INCREASING;
        if (change < -config.getTrendThreshold())
            return Trend.DECREASING;
        return Trend.STABLE;
    }
}
