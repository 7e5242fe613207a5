package com.bsm.hypergraph.prediction;

import com.bsm.hypergraph.core.AnalyticsConfig;
import com.bsm.hypergraph.graph.Hypergraph;
import com.bsm.hypergraph.graph.ProjectedGraph;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.bsm.hypergraph.graph.GraphFixtures.change;
import static com.bsm.hypergraph.graph.GraphFixtures.ci;
import static com.bsm.hypergraph.graph.GraphFixtures.graph;
import static com.bsm.hypergraph.graph.GraphFixtures.rows;
import static org.junit.jupiter.api.Assertions.*;

class LinkPredictorTest {

    private final LinkPredictor predictor = new LinkPredictor(AnalyticsConfig.defaults());

    @Test
    void testPathPrediction() {
        Hypergraph path = graph(rows(
                change("C1", "2024-01-01", "A", "B"),
                change("C2", "2024-01-02", "B", "C")));

        List<LinkPrediction> predictions = predictor.linkPrediction(path);

        assertEquals(1, predictions.size());
        LinkPrediction p = predictions.get(0);
        assertEquals(ci("A"), p.a());
        assertEquals(ci("C"), p.b());
        assertEquals(1.4427, p.score(), "Single common neighbor of degree 2 scores 1 / ln 2");
    }

    @Test
    void testNeverPredictsExistingPairs() {
        Hypergraph graph = graph(rows(
                change("C1", "2024-01-01", "hub", "a", "b"),
                change("C2", "2024-01-02", "hub", "c"),
                change("C3", "2024-01-03", "hub", "d"),
                change("C4", "2024-01-04", "c", "e"),
                change("C5", "2024-01-05", "lonely")));
        ProjectedGraph projection = ProjectedGraph.of(graph);

        List<LinkPrediction> predictions = predictor.linkPrediction(graph);

        assertFalse(predictions.isEmpty());
        for (LinkPrediction p : predictions) {
            assertEquals(0, projection.weight(p.a(), p.b()), p.a() + " and " + p.b() + " already co-change");
            assertTrue(p.score() > 0);
            assertNotEquals(ci("lonely"), p.a());
            assertNotEquals(ci("lonely"), p.b());
        }
        for (int i = 1; i < predictions.size(); i++) {
            assertTrue(predictions.get(i - 1).score() >= predictions.get(i).score());
        }
        assertEquals(2, predictor.linkPrediction(graph, 2).size());
    }

    @Test
    void testSinglePairHasNoPredictions() {
        // A lone pair has no third CI to predict a link to
        Hypergraph graph = graph(rows(change("C1", "2024-01-01", "A", "B")));
        assertTrue(predictor.linkPrediction(graph).isEmpty());
        assertTrue(predictor.linkPrediction(Hypergraph.empty()).isEmpty());
    }
}
