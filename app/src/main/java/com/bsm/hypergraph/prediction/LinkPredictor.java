package com.bsm.hypergraph.prediction;

import com.bsm.hypergraph.core.AnalyticsConfig;
import com.bsm.hypergraph.core.Scores;
import com.bsm.hypergraph.graph.Hypergraph;
import com.bsm.hypergraph.graph.ProjectedGraph;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Adamic-Adar link prediction on the CI projection. Only pairs that have
 * never been changed together are scored.
 */
public class LinkPredictor {

    private final AnalyticsConfig config;

    public LinkPredictor(AnalyticsConfig config) {
        this.config = config;
    }

    public List<LinkPrediction> linkPrediction(Hypergraph graph) {
        return linkPrediction(graph, config.getTopLinkPredictions());
    }

    public List<LinkPrediction> linkPrediction(Hypergraph graph, int topN) {
        if (graph == null) {
            return List.of();
        }
        ProjectedGraph projection = ProjectedGraph.of(graph);
        List<String> nodes = projection.nodes();
        int n = nodes.size();
        if (n < 2) {
            return List.of();
        }

        List<LinkPrediction> results = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            String u = nodes.get(i);
            Map<String, Integer> uRow = projection.row(u);
            for (int j = i + 1; j < n; j++) {
                String v = nodes.get(j);
                if (projection.weight(u, v) > 0)
                    continue;

                Map<String, Integer> vRow = projection.row(v);
                double score = 0;
                for (String w : uRow.keySet()) {
                    if (!vRow.containsKey(w))
                        continue;
                    // log(1) is 0, so degree-1 neighbors are skipped
                    int degree = projection.row(w).size();
                    if (degree > 1) {
                        score += 1 / Math.log(degree);
                    }
                }

                if (score > 0) {
                    results.add(new LinkPrediction(u, v, graph.nameOf(u), graph.nameOf(v),
                            Scores.round(score, 4)));
                }
            }
        }

        results.sort((x, y) -> Double.compare(y.score(), x.score()));
        return List.copyOf(results.subList(0, Math.min(Math.max(topN, 0), results.size())));
    }
}
