package com.bsm.hypergraph.prediction;

import com.bsm.hypergraph.core.AnalyticsConfig;
import com.bsm.hypergraph.core.Scores;
import com.bsm.hypergraph.graph.ChangeHistory;
import com.bsm.hypergraph.graph.EntityType;
import com.bsm.hypergraph.graph.Hyperedge;
import com.bsm.hypergraph.graph.Hypergraph;
import com.bsm.hypergraph.temporal.LagWindow;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Predicts which CIs are likely to be impacted when a given CI changes.
 *
 * Four signals per candidate CI: shared changes with the target, changes
 * following the target's within the cascade window, shared business
 * services, and Jaccard overlap of the two neighbor sets.
 */
public class ImpactPredictor {

    private final AnalyticsConfig config;

    public ImpactPredictor(AnalyticsConfig config) {
        this.config = config;
    }

    public List<ImpactPrediction> predictImpact(Hypergraph graph, ChangeHistory history, String targetUid) {
        if (graph == null || targetUid == null || !graph.hasNode(targetUid)) {
            return List.of();
        }

        List<String> ciUids = graph.ciUids();
        Set<String> ciSet = new LinkedHashSet<>(ciUids);

        Map<String, Integer> cooccur = cooccurrenceSignal(graph, ciSet, targetUid);
        Map<String, Integer> cascades = cascadeSignal(history, ciSet, targetUid);
        Map<String, Integer> services = serviceSignal(graph, ciSet, targetUid);

        Set<String> targetNeighbors = graph.neighborSet(targetUid);

        double maxCooccur = 0, maxCascade = 0, maxService = 0;
        for (String uid : ciUids) {
            maxCooccur = Math.max(maxCooccur, cooccur.getOrDefault(uid, 0));
            maxCascade = Math.max(maxCascade, cascades.getOrDefault(uid, 0));
            maxService = Math.max(maxService, services.getOrDefault(uid, 0));
        }

        List<ImpactPrediction> results = new ArrayList<>();
        for (String uid : ciUids) {
            if (uid.equals(targetUid))
                continue;

            double sCooccur = Scores.ratio(cooccur.getOrDefault(uid, 0), maxCooccur);
            double sCascade = Scores.ratio(cascades.getOrDefault(uid, 0), maxCascade);
            double sService = Scores.ratio(services.getOrDefault(uid, 0), maxService);
            double sProximity = graph.degree(uid) > 0
                    ? Scores.jaccard(graph.neighborSet(uid), targetNeighbors)
                    : 0;

            double probability = config.getWeightImpactCooccurrence() * sCooccur
                    + config.getWeightImpactCascade() * sCascade
                    + config.getWeightImpactService() * sService
                    + config.getWeightImpactProximity() * sProximity;
            if (probability == 0)
                continue;

            results.add(new ImpactPrediction(uid, graph.nameOf(uid), Scores.round(probability, 4),
                    reason(sCooccur, sCascade, sService, sProximity)));
        }

        results.sort((x, y) -> Double.compare(y.probability(), x.probability()));
        return List.copyOf(results);
    }

    private Map<String, Integer> cooccurrenceSignal(Hypergraph graph, Set<String> ciSet, String targetUid) {
        Map<String, Integer> counts = new HashMap<>();
        for (String edgeUid : graph.edgesOf(targetUid)) {
            Hyperedge edge = graph.edge(edgeUid);
            if (edge == null)
                continue;
            for (String member : edge.elements()) {
                if (!member.equals(targetUid) && ciSet.contains(member)) {
                    counts.merge(member, 1, Integer::sum);
                }
            }
        }
        return counts;
    }

    private Map<String, Integer> cascadeSignal(ChangeHistory history, Set<String> ciSet, String targetUid) {
        Map<String, Integer> counts = new HashMap<>();
        if (history == null || history.isEmpty())
            return counts;

        long windowMs = config.getCascadeWindowDays() * Scores.DAY_MS;
        Map<String, List<Long>> timeline = history.ciTimeline();
        List<Long> targetTimes = timeline.getOrDefault(targetUid, List.of());
        if (targetTimes.isEmpty())
            return counts;

        for (Map.Entry<String, List<Long>> other : timeline.entrySet()) {
            if (other.getKey().equals(targetUid) || !ciSet.contains(other.getKey()))
                continue;
            int count = LagWindow.tally(targetTimes, other.getValue(), windowMs).count();
            if (count > 0) {
                counts.put(other.getKey(), count);
            }
        }
        return counts;
    }

    private Map<String, Integer> serviceSignal(Hypergraph graph, Set<String> ciSet, String targetUid) {
        Set<String> targetServices = new LinkedHashSet<>();
        Map<String, Set<String>> ciServices = new LinkedHashMap<>();

        for (Hyperedge edge : graph.edges()) {
            String service = null;
            boolean hasTarget = false;
            List<String> others = new ArrayList<>();
            for (String uid : edge.elements()) {
                if (uid.equals(targetUid))
                    hasTarget = true;
                else if (ciSet.contains(uid))
                    others.add(uid);
                if (uid.startsWith(EntityType.SERVICE.prefix()))
                    service = uid;
            }
            if (service == null)
                continue;
            if (hasTarget)
                targetServices.add(service);
            for (String uid : others) {
                ciServices.computeIfAbsent(uid, k -> new LinkedHashSet<>()).add(service);
            }
        }

        Map<String, Integer> shared = new HashMap<>();
        for (Map.Entry<String, Set<String>> entry : ciServices.entrySet()) {
            int count = Scores.intersectionSize(entry.getValue(), targetServices);
            if (count > 0) {
                shared.put(entry.getKey(), count);
            }
        }
        return shared;
    }

    static String reason(double cooccur, double cascade, double service, double proximity) {
        double max = Math.max(Math.max(cooccur, cascade), Math.max(service, proximity));
        if (cooccur > 0 && cooccur == max)
            return ImpactPrediction.REASON_COOCCURRENCE;
        if (cascade > 0 && cascade == max)
            return ImpactPrediction.REASON_CASCADE;
        if (service > 0 && service == max)
            return ImpactPrediction.REASON_SERVICE;
        return ImpactPrediction.REASON_PROXIMITY;
    }
}
