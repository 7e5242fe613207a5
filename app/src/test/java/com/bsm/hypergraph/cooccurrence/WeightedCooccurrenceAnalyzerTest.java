package com.bsm.hypergraph.cooccurrence;

import com.bsm.hypergraph.core.AnalyticsConfig;
import com.bsm.hypergraph.core.ChangeRecord;
import com.bsm.hypergraph.graph.ChangeHistory;
import com.bsm.hypergraph.graph.Hypergraph;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.bsm.hypergraph.graph.GraphFixtures.change;
import static com.bsm.hypergraph.graph.GraphFixtures.changeWith;
import static com.bsm.hypergraph.graph.GraphFixtures.ci;
import static com.bsm.hypergraph.graph.GraphFixtures.graph;
import static com.bsm.hypergraph.graph.GraphFixtures.rows;
import static org.junit.jupiter.api.Assertions.*;

class WeightedCooccurrenceAnalyzerTest {

    private final WeightedCooccurrenceAnalyzer analyzer = new WeightedCooccurrenceAnalyzer(AnalyticsConfig.defaults());

    private List<ChangeRecord> records() {
        return rows(
                changeWith("C1", "2024-03-01T00:00:00Z", "High", "Normal", "G1", null, "A", "B"),
                changeWith("C2", "2024-01-31T00:00:00Z", "Low", "Normal", "G2", null, "A", "B"),
                changeWith("C3", "2024-03-01T00:00:00Z", "Low", "Normal", "G1", null, "A", "C"));
    }

    @Test
    void testWeightedComponents() {
        List<ChangeRecord> records = records();
        List<WeightedPair> pairs = analyzer.weightedCooccurrence(graph(records), ChangeHistory.from(records));

        assertEquals(2, pairs.size(), "Only CI pairs are scored");
        WeightedPair ab = pairs.get(0);
        assertEquals(ci("A"), ab.a());
        assertEquals(ci("B"), ab.b());
        assertEquals(2, ab.rawCount());
        assertEquals(4.0, ab.riskWeighted(), "High counts 3 and Low counts 1");
        assertEquals(1.5, ab.recencyWeighted(), "Change one half-life older counts half");
        assertEquals(2, ab.diversity());
        assertEquals(0.6667, ab.jaccard());
        assertEquals(1.0, ab.composite(), "Pair leading every component scores 1");

        WeightedPair ac = pairs.get(1);
        assertEquals(ci("C"), ac.b());
        assertEquals(1.0, ac.recencyWeighted());
        assertEquals(0.3333, ac.jaccard());
        assertEquals(0.4708, ac.composite());
    }

    @Test
    void testCompositeRange() {
        List<ChangeRecord> records = rows(records(),
                change("C4", "2023-06-01", "B", "C", "D"),
                change("C5", null, "D", "E"));
        List<WeightedPair> pairs = analyzer.weightedCooccurrence(graph(records), ChangeHistory.from(records));

        assertFalse(pairs.isEmpty());
        for (WeightedPair p : pairs) {
            assertTrue(p.composite() >= 0 && p.composite() <= 1, "Composite out of range: " + p.composite());
            assertTrue(p.a().compareTo(p.b()) < 0);
        }
        for (int i = 1; i < pairs.size(); i++) {
            assertTrue(pairs.get(i - 1).composite() >= pairs.get(i).composite());
        }
    }

    @Test
    void testNoTimestampsMeansNoDecay() {
        List<ChangeRecord> records = rows(
                change("C1", null, "A", "B"),
                change("C2", null, "A", "B"));
        WeightedPair ab = analyzer.weightedCooccurrence(graph(records), ChangeHistory.from(records)).get(0);
        assertEquals(2.0, ab.recencyWeighted());
        assertEquals(0, ab.diversity());
    }

    @Test
    void testTopNAndEmpty() {
        List<ChangeRecord> records = records();
        Hypergraph graph = graph(records);
        assertEquals(1, analyzer.weightedCooccurrence(graph, ChangeHistory.from(records), 1).size());
        assertTrue(analyzer.weightedCooccurrence(Hypergraph.empty(), ChangeHistory.empty()).isEmpty());
        assertFalse(analyzer.weightedCooccurrence(graph, null).isEmpty(), "Edge attributes suffice without history");
    }
}
