package com.bsm.hypergraph.community;

import com.bsm.hypergraph.core.AnalyticsConfig;
import com.bsm.hypergraph.core.Scores;
import com.bsm.hypergraph.graph.Entity;
import com.bsm.hypergraph.graph.Hyperedge;
import com.bsm.hypergraph.graph.Hypergraph;
import com.bsm.hypergraph.graph.ProjectedGraph;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Single-level Louvain modularity optimization on the CI projection.
 *
 * Every CI starts in its own community, numbered by its position in the node
 * list. Each pass visits the nodes in order and moves a node to the
 * neighboring community with the best strictly positive modularity gain,
 * lowest community id on ties. Runs until a pass moves nothing or the pass
 * limit is hit, so results are deterministic for a given graph.
 */
public class CommunityDetector {

    private final AnalyticsConfig config;

    public CommunityDetector(AnalyticsConfig config) {
        this.config = config;
    }

    public CommunityResult detectCommunities(Hypergraph graph) {
        if (graph == null) {
            return CommunityResult.empty();
        }
        ProjectedGraph projection = ProjectedGraph.of(graph);
        List<String> nodes = projection.nodes();
        int n = nodes.size();
        if (n == 0) {
            return CommunityResult.empty();
        }

        Map<String, Integer> community = new LinkedHashMap<>();
        for (int i = 0; i < n; i++) {
            community.put(nodes.get(i), i);
        }

        double m = projection.doubledTotalWeight() / 2;
        if (m == 0) {
            Map<Integer, List<String>> trivial = group(nodes, community);
            return new CommunityResult(community, trivial, 0, summarize(trivial, graph));
        }

        Map<String, Double> strength = new HashMap<>();
        Map<Integer, Double> totals = new HashMap<>();
        for (String uid : nodes) {
            double s = projection.strength(uid);
            strength.put(uid, s);
            totals.merge(community.get(uid), s, Double::sum);
        }

        boolean improved = true;
        int pass = 0;
        while (improved && pass < config.getMaxPasses()) {
            improved = false;
            pass++;

            for (String uid : nodes) {
                int current = community.get(uid);
                double ki = strength.get(uid);

                // Weight from this node into each neighboring community, ascending id
                Map<Integer, Double> neighborComs = new TreeMap<>();
                for (Map.Entry<String, Integer> cell : projection.row(uid).entrySet()) {
                    Integer nc = community.get(cell.getKey());
                    if (nc != null) {
                        neighborComs.merge(nc, (double) cell.getValue(), Double::sum);
                    }
                }

                double sigmaIn = neighborComs.getOrDefault(current, 0.0);
                double sigmaTot = totals.getOrDefault(current, 0.0) - ki;
                double removeGain = sigmaIn / m - (sigmaTot * ki) / (2 * m * m);

                int best = current;
                double bestGain = 0;
                for (Map.Entry<Integer, Double> candidate : neighborComs.entrySet()) {
                    int target = candidate.getKey();
                    if (target == current)
                        continue;
                    double sigmaTarget = totals.getOrDefault(target, 0.0);
                    double gain = candidate.getValue() / m - (sigmaTarget * ki) / (2 * m * m);
                    double deltaQ = gain - removeGain;
                    if (deltaQ > bestGain) {
                        bestGain = deltaQ;
                        best = target;
                    }
                }

                if (best != current && bestGain > 0) {
                    community.put(uid, best);
                    totals.merge(current, -ki, Double::sum);
                    totals.merge(best, ki, Double::sum);
                    improved = true;
                }
            }
        }

        Map<Integer, List<String>> communities = group(nodes, community);
        double q = modularity(projection, community, strength, m);
        return new CommunityResult(community, communities, Scores.round(q, 4), summarize(communities, graph));
    }

    /**
     * Q = (1/2m) * sum over same-community pairs of (A_ij - k_i k_j / 2m).
     */
    double modularity(ProjectedGraph projection, Map<String, Integer> community,
            Map<String, Double> strength, double m) {
        List<String> nodes = projection.nodes();
        double q = 0;
        for (String i : nodes) {
            for (String j : nodes) {
                if (!community.get(i).equals(community.get(j)))
                    continue;
                q += projection.weight(i, j) - strength.get(i) * strength.get(j) / (2 * m);
            }
        }
        return q / (2 * m);
    }

    private static Map<Integer, List<String>> group(List<String> nodes, Map<String, Integer> community) {
        Map<Integer, List<String>> groups = new TreeMap<>();
        for (String uid : nodes) {
            groups.computeIfAbsent(community.get(uid), k -> new ArrayList<>()).add(uid);
        }
        groups.replaceAll((k, v) -> List.copyOf(v));
        return groups;
    }

    List<CommunitySummary> summarize(Map<Integer, List<String>> communities, Hypergraph graph) {
        List<CommunitySummary> result = new ArrayList<>();
        for (Map.Entry<Integer, List<String>> entry : communities.entrySet()) {
            Map<String, Integer> classCounts = new LinkedHashMap<>();
            Map<String, Integer> serviceCounts = new LinkedHashMap<>();

            for (String uid : entry.getValue()) {
                Entity node = graph.node(uid);
                if (node == null)
                    continue;
                classCounts.merge(node.classNameOrUnknown(), 1, Integer::sum);
                for (String edgeUid : graph.edgesOf(uid)) {
                    Hyperedge edge = graph.edge(edgeUid);
                    String service = edge != null ? edge.attribute(Hyperedge.BUSINESS_SERVICE) : null;
                    if (service != null && !service.isBlank()) {
                        serviceCounts.merge(service, 1, Integer::sum);
                    }
                }
            }

            result.add(new CommunitySummary(entry.getKey(), entry.getValue().size(),
                    majority(classCounts), majority(serviceCounts)));
        }
        result.sort((a, b) -> Integer.compare(b.size(), a.size()));
        return result;
    }

    // First key reaching the highest count; "unknown" when empty
    private static String majority(Map<String, Integer> counts) {
        String best = Entity.UNKNOWN_CLASS;
        int max = 0;
        for (Map.Entry<String, Integer> e : counts.entrySet()) {
            if (e.getValue() > max) {
                max = e.getValue();
                best = e.getKey();
            }
        }
        return best;
    }
}
