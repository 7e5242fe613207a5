package com.bsm.hypergraph.anomaly;

import com.bsm.hypergraph.core.AnalyticsConfig;
import com.bsm.hypergraph.core.Scores;
import com.bsm.hypergraph.graph.Entity;
import com.bsm.hypergraph.graph.EntityType;
import com.bsm.hypergraph.graph.Hyperedge;
import com.bsm.hypergraph.graph.Hypergraph;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structural anomalies of the change graph: orphaned CIs, statistically
 * unexpected pairs, over-coupled pairs and under-coupled service members.
 */
public class AnomalyDetector {

    private final AnalyticsConfig config;

    public AnomalyDetector(AnalyticsConfig config) {
        this.config = config;
    }

    public AnomalyReport detectAnomalies(Hypergraph graph) {
        if (graph == null || graph.nodes().isEmpty()) {
            return AnomalyReport.empty();
        }

        List<String> ciUids = graph.ciUids();
        Set<String> ciSet = new LinkedHashSet<>(ciUids);

        // Class frequency counts each class once per hyperedge
        Map<String, Integer> classCount = new LinkedHashMap<>();
        Map<String, Integer> pairCount = new LinkedHashMap<>();
        for (Hyperedge edge : graph.edges()) {
            List<String> members = edge.elements().stream().filter(ciSet::contains).toList();
            Set<String> classes = new LinkedHashSet<>();
            members.forEach(uid -> classes.add(classOf(graph, uid)));
            classes.forEach(cls -> classCount.merge(cls, 1, Integer::sum));

            for (int i = 0; i < members.size(); i++) {
                for (int j = i + 1; j < members.size(); j++) {
                    pairCount.merge(Scores.pairKey(members.get(i), members.get(j)), 1, Integer::sum);
                }
            }
        }

        return new AnomalyReport(
                unexpectedPairs(graph, classCount, pairCount),
                orphans(graph, ciUids),
                overCoupled(graph, pairCount),
                underCoupled(graph, ciSet, pairCount));
    }

    List<Orphan> orphans(Hypergraph graph, List<String> ciUids) {
        List<Orphan> orphans = new ArrayList<>();
        for (String uid : ciUids) {
            int degree = graph.degree(uid);
            if (degree <= 1) {
                orphans.add(new Orphan(uid, graph.nameOf(uid), degree,
                        degree == 0 ? Orphan.REASON_UNREFERENCED : Orphan.REASON_SINGLE));
            }
        }
        return orphans;
    }

    List<UnexpectedPair> unexpectedPairs(Hypergraph graph, Map<String, Integer> classCount,
            Map<String, Integer> pairCount) {
        int totalEdges = graph.edges().size();
        double denominator = Math.max(totalEdges, 1);
        double threshold = config.getUnexpectedRatio();

        List<UnexpectedPair> result = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : pairCount.entrySet()) {
            String[] ab = Scores.splitPairKey(entry.getKey());
            String classA = classOf(graph, ab[0]);
            String classB = classOf(graph, ab[1]);
            double freqA = classCount.getOrDefault(classA, 0) / denominator;
            double freqB = classCount.getOrDefault(classB, 0) / denominator;
            double expected = freqA * freqB * totalEdges;
            int actual = entry.getValue();

            if (expected > 0 && actual > threshold * expected) {
                result.add(new UnexpectedPair(ab[0], ab[1], graph.nameOf(ab[0]), graph.nameOf(ab[1]),
                        classA, classB, actual,
                        Scores.round(expected, 2),
                        Scores.round(actual / expected, 2)));
            }
        }
        result.sort((x, y) -> Double.compare(y.ratio(), x.ratio()));
        return result;
    }

    List<OverCoupledPair> overCoupled(Hypergraph graph, Map<String, Integer> pairCount) {
        double threshold = config.getOvercouplingJaccard();

        List<OverCoupledPair> result = new ArrayList<>();
        for (String key : pairCount.keySet()) {
            String[] ab = Scores.splitPairKey(key);
            Set<String> edgesA = graph.edgesOf(ab[0]);
            Set<String> edgesB = graph.edgesOf(ab[1]);
            double jaccard = Scores.jaccard(edgesA, edgesB);
            if (jaccard > threshold) {
                result.add(new OverCoupledPair(ab[0], ab[1], graph.nameOf(ab[0]), graph.nameOf(ab[1]),
                        Scores.round(jaccard, 4), Scores.intersectionSize(edgesA, edgesB)));
            }
        }
        result.sort((x, y) -> Double.compare(y.jaccard(), x.jaccard()));
        return result;
    }

    List<UnderCoupledPair> underCoupled(Hypergraph graph, Set<String> ciSet, Map<String, Integer> pairCount) {
        // service uid -> CIs changed under it
        Map<String, Set<String>> serviceMembers = new LinkedHashMap<>();
        for (Hyperedge edge : graph.edges()) {
            String service = null;
            List<String> cis = new ArrayList<>();
            for (String uid : edge.elements()) {
                if (uid.startsWith(EntityType.SERVICE.prefix()))
                    service = uid;
                if (ciSet.contains(uid))
                    cis.add(uid);
            }
            if (service != null) {
                serviceMembers.computeIfAbsent(service, k -> new LinkedHashSet<>()).addAll(cis);
            }
        }

        List<UnderCoupledPair> result = new ArrayList<>();
        for (Map.Entry<String, Set<String>> entry : serviceMembers.entrySet()) {
            List<String> members = new ArrayList<>(entry.getValue());
            for (int i = 0; i < members.size(); i++) {
                for (int j = i + 1; j < members.size(); j++) {
                    String u = members.get(i);
                    String v = members.get(j);
                    if (!pairCount.containsKey(Scores.pairKey(u, v))) {
                        result.add(new UnderCoupledPair(u, v, graph.nameOf(u), graph.nameOf(v),
                                entry.getKey(), UnderCoupledPair.REASON));
                    }
                }
            }
        }
        return result;
    }

    private static String classOf(Hypergraph graph, String uid) {
        Entity node = graph.node(uid);
        return node != null ? node.classNameOrUnknown() : Entity.UNKNOWN_CLASS;
    }
}
