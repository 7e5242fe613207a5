package com.bsm.hypergraph.cooccurrence;

import com.bsm.hypergraph.core.AnalyticsConfig;
import com.bsm.hypergraph.core.Scores;
import com.bsm.hypergraph.graph.ChangeHistory;
import com.bsm.hypergraph.graph.ChangeHistory.ChangeEntry;
import com.bsm.hypergraph.graph.Hyperedge;
import com.bsm.hypergraph.graph.Hypergraph;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Scores CI pairs by raw count, change risk, recency, group diversity and
 * Jaccard overlap of their change sets.
 */
public class WeightedCooccurrenceAnalyzer {

    private static final double LN2 = Math.log(2);

    private final AnalyticsConfig config;

    public WeightedCooccurrenceAnalyzer(AnalyticsConfig config) {
        this.config = config;
    }

    private static final class Accumulator {
        final String a;
        final String b;
        int rawCount;
        double riskWeighted;
        double recencyWeighted;
        final Set<String> groups = new LinkedHashSet<>();

        Accumulator(String a, String b) {
            this.a = a;
            this.b = b;
        }
    }

    public List<WeightedPair> weightedCooccurrence(Hypergraph graph, ChangeHistory history) {
        return weightedCooccurrence(graph, history, config.getTopWeightedPairs());
    }

    public List<WeightedPair> weightedCooccurrence(Hypergraph graph, ChangeHistory history, int topN) {
        if (graph == null || graph.edges().isEmpty()) {
            return List.of();
        }
        ChangeHistory changes = history != null ? history : ChangeHistory.empty();

        Map<String, Long> timestamps = new LinkedHashMap<>();
        long now = 0;
        for (Hyperedge edge : graph.edges()) {
            long t = timestampOf(edge, changes);
            timestamps.put(edge.uid(), t);
            now = Math.max(now, t);
        }
        double halfLifeMs = (double) config.getHalfLifeDays() * Scores.DAY_MS;

        Set<String> ciSet = new LinkedHashSet<>(graph.ciUids());
        Map<String, Accumulator> pairs = new LinkedHashMap<>();

        for (Hyperedge edge : graph.edges()) {
            List<String> members = edge.elements().stream().filter(ciSet::contains).toList();
            if (members.size() < 2)
                continue;

            ChangeEntry change = changes.byNumber(edge.attribute(Hyperedge.NUMBER));
            double riskW = Scores.riskWeight(edge.attributeOr(Hyperedge.RISK, ChangeHistory.DEFAULT_RISK));
            long created = timestamps.get(edge.uid());
            long age = created > 0 ? now - created : 0;
            double recencyW = halfLifeMs > 0 ? Math.exp(-LN2 * age / halfLifeMs) : 1;
            String group = edge.attributeOr(Hyperedge.ASSIGNMENT_GROUP,
                    change != null ? change.assignmentGroup() : "");

            for (int i = 0; i < members.size(); i++) {
                for (int j = i + 1; j < members.size(); j++) {
                    String u = members.get(i);
                    String v = members.get(j);
                    Accumulator acc = pairs.computeIfAbsent(Scores.pairKey(u, v),
                            k -> u.compareTo(v) < 0 ? new Accumulator(u, v) : new Accumulator(v, u));
                    acc.rawCount++;
                    acc.riskWeighted += riskW;
                    acc.recencyWeighted += recencyW;
                    if (!group.isEmpty())
                        acc.groups.add(group);
                }
            }
        }
        if (pairs.isEmpty()) {
            return List.of();
        }

        List<WeightedPair> raw = new ArrayList<>();
        double maxRaw = 0, maxRisk = 0, maxRecency = 0, maxDiversity = 0, maxJaccard = 0;
        for (Accumulator acc : pairs.values()) {
            double jaccard = Scores.round(Scores.jaccard(graph.edgesOf(acc.a), graph.edgesOf(acc.b)), 4);
            WeightedPair pair = new WeightedPair(acc.a, acc.b, acc.rawCount,
                    Scores.round(acc.riskWeighted, 2),
                    Scores.round(acc.recencyWeighted, 2),
                    acc.groups.size(),
                    jaccard,
                    0);
            raw.add(pair);
            maxRaw = Math.max(maxRaw, pair.rawCount());
            maxRisk = Math.max(maxRisk, pair.riskWeighted());
            maxRecency = Math.max(maxRecency, pair.recencyWeighted());
            maxDiversity = Math.max(maxDiversity, pair.diversity());
            maxJaccard = Math.max(maxJaccard, pair.jaccard());
        }

        List<WeightedPair> results = new ArrayList<>(raw.size());
        for (WeightedPair p : raw) {
            double composite = config.getWeightRaw() * Scores.ratio(p.rawCount(), maxRaw)
                    + config.getWeightRisk() * Scores.ratio(p.riskWeighted(), maxRisk)
                    + config.getWeightRecency() * Scores.ratio(p.recencyWeighted(), maxRecency)
                    + config.getWeightDiversity() * Scores.ratio(p.diversity(), maxDiversity)
                    + config.getWeightJaccard() * Scores.ratio(p.jaccard(), maxJaccard);
            results.add(new WeightedPair(p.a(), p.b(), p.rawCount(), p.riskWeighted(), p.recencyWeighted(),
                    p.diversity(), p.jaccard(), Scores.round(composite, 4)));
        }

        results.sort((x, y) -> Double.compare(y.composite(), x.composite()));
        return List.copyOf(results.subList(0, Math.min(Math.max(topN, 0), results.size())));
    }

    private static long timestampOf(Hyperedge edge, ChangeHistory history) {
        ChangeEntry change = history.byNumber(edge.attribute(Hyperedge.NUMBER));
        if (change != null && change.createdAt() > 0)
            return change.createdAt();
        return Scores.parseTimestamp(edge.attribute(Hyperedge.CREATED_AT));
    }
}
