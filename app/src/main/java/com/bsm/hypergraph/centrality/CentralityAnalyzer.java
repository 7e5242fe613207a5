package com.bsm.hypergraph.centrality;

import com.bsm.hypergraph.core.AnalyticsConfig;
import com.bsm.hypergraph.core.Scores;
import com.bsm.hypergraph.graph.Entity;
import com.bsm.hypergraph.graph.Hyperedge;
import com.bsm.hypergraph.graph.Hypergraph;
import com.bsm.hypergraph.graph.ProjectedGraph;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;

/**
 * Degree, sampled betweenness, eigenvector and composite centrality.
 */
public class CentralityAnalyzer {

    private final AnalyticsConfig config;
    private final IndexSequence sequence;

    public CentralityAnalyzer(AnalyticsConfig config) {
        this(config, new IndexMixingSequence());
    }

    public CentralityAnalyzer(AnalyticsConfig config, IndexSequence sequence) {
        this.config = config;
        this.sequence = sequence;
    }

    public CentralityScores centrality(Hypergraph graph) {
        if (graph == null || graph.nodes().isEmpty()) {
            return CentralityScores.empty();
        }

        Map<String, Double> degree = degreeCentrality(graph);
        Map<String, Double> betweenness = betweennessCentrality(graph);
        Map<String, Double> eigenvector = eigenvectorCentrality(graph);

        Map<String, Double> composite = new LinkedHashMap<>();
        for (String uid : degree.keySet()) {
            composite.put(uid,
                    config.getWeightDegree() * degree.getOrDefault(uid, 0.0)
                            + config.getWeightBetweenness() * betweenness.getOrDefault(uid, 0.0)
                            + config.getWeightEigenvector() * eigenvector.getOrDefault(uid, 0.0));
        }
        Scores.normalize(composite);

        return new CentralityScores(
                Collections.unmodifiableMap(degree),
                Collections.unmodifiableMap(betweenness),
                Collections.unmodifiableMap(eigenvector),
                Collections.unmodifiableMap(composite));
    }

    Map<String, Double> degreeCentrality(Hypergraph graph) {
        Map<String, Double> scores = new LinkedHashMap<>();
        int maxDegree = Math.max(graph.maxDegree(), 1);
        for (Entity node : graph.nodes()) {
            scores.put(node.uid(), (double) graph.degree(node.uid()) / maxDegree);
        }
        return scores;
    }

    /**
     * Approximate betweenness: BFS shortest paths between sampled CI pairs on
     * the co-membership graph, crediting every intermediate node.
     */
    Map<String, Double> betweennessCentrality(Hypergraph graph) {
        Map<String, Double> scores = new LinkedHashMap<>();
        graph.nodes().forEach(n -> scores.put(n.uid(), 0.0));

        List<String> ciUids = graph.ciUids();
        int n = ciUids.size();
        if (n < 2) {
            return scores;
        }

        Map<String, Set<String>> adjacency = coMembership(graph);

        long possiblePairs = (long) n * (n - 1) / 2;
        int sampleCount = (int) Math.min(config.getBetweennessSamples(), possiblePairs);
        int maxAttempts = sampleCount * 10;
        Set<Long> sampled = new HashSet<>();
        int processed = 0;
        int attempts = 0;

        while (processed < sampleCount && attempts < maxAttempts) {
            int si = sequence.source(attempts, n);
            int ti = sequence.target(attempts, n);
            attempts++;
            if (si == ti)
                continue;
            long pairId = (long) Math.min(si, ti) * n + Math.max(si, ti);
            if (!sampled.add(pairId))
                continue;
            processed++;

            List<String> path = shortestPath(adjacency, ciUids.get(si), ciUids.get(ti));
            for (int p = 1; p < path.size() - 1; p++) {
                scores.merge(path.get(p), 1.0, Double::sum);
            }
        }

        return Scores.normalize(scores);
    }

    private Map<String, Set<String>> coMembership(Hypergraph graph) {
        Map<String, Set<String>> adjacency = new LinkedHashMap<>();
        graph.nodes().forEach(node -> adjacency.put(node.uid(), new LinkedHashSet<>()));
        for (Hyperedge edge : graph.edges()) {
            List<String> members = edge.elements();
            for (int a = 0; a < members.size(); a++) {
                for (int b = a + 1; b < members.size(); b++) {
                    adjacency.computeIfAbsent(members.get(a), k -> new LinkedHashSet<>()).add(members.get(b));
                    adjacency.computeIfAbsent(members.get(b), k -> new LinkedHashSet<>()).add(members.get(a));
                }
            }
        }
        return adjacency;
    }

    /**
     * BFS path from source to target inclusive; empty when unreachable.
     */
    private List<String> shortestPath(Map<String, Set<String>> adjacency, String source, String target) {
        if (source.equals(target))
            return List.of(source);

        Queue<String> queue = new LinkedList<>();
        Map<String, String> parent = new HashMap<>();
        Set<String> visited = new HashSet<>();
        queue.add(source);
        visited.add(source);

        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String neighbor : adjacency.getOrDefault(current, Collections.emptySet())) {
                if (!visited.add(neighbor))
                    continue;
                parent.put(neighbor, current);
                if (neighbor.equals(target)) {
                    LinkedList<String> path = new LinkedList<>();
                    String node = target;
                    path.addFirst(node);
                    while (parent.containsKey(node)) {
                        node = parent.get(node);
                        path.addFirst(node);
                    }
                    return path;
                }
                queue.add(neighbor);
            }
        }
        return List.of();
    }

    /**
     * Power iteration on the CI projection, L2-normalized each round.
     */
    Map<String, Double> eigenvectorCentrality(Hypergraph graph) {
        Map<String, Double> scores = new LinkedHashMap<>();
        graph.nodes().forEach(node -> scores.put(node.uid(), 0.0));

        ProjectedGraph projection = ProjectedGraph.of(graph);
        List<String> nodes = projection.nodes();
        int n = nodes.size();
        if (n == 0) {
            return scores;
        }

        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < n; i++) {
            index.put(nodes.get(i), i);
        }

        double[] vec = new double[n];
        Arrays.fill(vec, 1.0 / n);

        for (int iter = 0; iter < config.getPowerIterations(); iter++) {
            double[] next = new double[n];
            for (int i = 0; i < n; i++) {
                for (Map.Entry<String, Integer> cell : projection.row(nodes.get(i)).entrySet()) {
                    Integer col = index.get(cell.getKey());
                    if (col != null) {
                        next[i] += cell.getValue() * vec[col];
                    }
                }
            }

            double norm = 0;
            for (double v : next) {
                norm += v * v;
            }
            norm = Math.sqrt(norm);
            if (norm > 0) {
                for (int i = 0; i < n; i++) {
                    next[i] /= norm;
                }
            }
            vec = next;
        }

        for (int i = 0; i < n; i++) {
            scores.put(nodes.get(i), Math.abs(vec[i]));
        }
        return Scores.normalize(scores);
    }

    public List<CriticalNode> criticalNodes(Hypergraph graph) {
        return criticalNodes(graph, config.getTopCriticalNodes());
    }

    /**
     * Top nodes by composite centrality, each with the dominant reason.
     */
    public List<CriticalNode> criticalNodes(Hypergraph graph, int topN) {
        if (graph == null || graph.nodes().isEmpty()) {
            return List.of();
        }

        CentralityScores cent = centrality(graph);
        List<CriticalNode> entries = new ArrayList<>();
        for (String uid : cent.composite().keySet()) {
            Entity node = graph.node(uid);
            double d = cent.degree().getOrDefault(uid, 0.0);
            double b = cent.betweenness().getOrDefault(uid, 0.0);
            double e = cent.eigenvector().getOrDefault(uid, 0.0);
            double c = cent.composite().getOrDefault(uid, 0.0);

            entries.add(new CriticalNode(
                    uid,
                    node != null ? node.name() : uid,
                    node != null ? node.type().id() : "unknown",
                    Scores.round(c, 4),
                    Scores.round(d, 4),
                    Scores.round(b, 4),
                    Scores.round(e, 4),
                    dominantReason(d, b, e)));
        }

        entries.sort((x, y) -> Double.compare(y.composite(), x.composite()));
        return List.copyOf(entries.subList(0, Math.min(Math.max(topN, 0), entries.size())));
    }

    static String dominantReason(double degree, double betweenness, double eigenvector) {
        double max = Math.max(degree, Math.max(betweenness, eigenvector));
        if (max <= 0)
            return CriticalNode.REASON_GENERAL;
        if (betweenness == max)
            return CriticalNode.REASON_BRIDGE;
        if (degree == max)
            return CriticalNode.REASON_HUB;
        return CriticalNode.REASON_INFLUENCE;
    }
}
