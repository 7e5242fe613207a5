package com.bsm.hypergraph.risk;

import com.bsm.hypergraph.core.ChangeRecord;
import com.bsm.hypergraph.core.IncidentRecord;
import com.bsm.hypergraph.graph.ChangeHistory;
import com.bsm.hypergraph.graph.Hypergraph;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.bsm.hypergraph.graph.GraphFixtures.changeWith;
import static com.bsm.hypergraph.graph.GraphFixtures.ci;
import static com.bsm.hypergraph.graph.GraphFixtures.graph;
import static com.bsm.hypergraph.graph.GraphFixtures.rows;
import static org.junit.jupiter.api.Assertions.*;

class RiskAnalyzerTest {

    private final RiskAnalyzer analyzer = new RiskAnalyzer();

    private final List<ChangeRecord> records = rows(
            changeWith("C1", "2024-01-01", "High", "Emergency", "Network", null, "A", "B"),
            changeWith("C2", "2024-01-02", "Low", "Standard", "Network", null, "A", "C"),
            changeWith("C3", "2024-01-03", "Low", "Standard", "Network", null, "A"));

    private final List<IncidentRecord> incidents = List.of(
            new IncidentRecord("INC1", 2, "A", null, null, null, "2024-01-04", null, null),
            new IncidentRecord("INC2", 2, "A", null, null, null, "2024-01-05", null, null),
            new IncidentRecord("INC3", 3, "B", null, null, null, "2024-01-05", null, null),
            new IncidentRecord("INC4", 3, "unknown-ci", null, null, null, "2024-01-05", null, null));

    @Test
    void testRiskHeatmap() {
        Hypergraph graph = graph(records);
        List<RiskScore> heatmap = analyzer.riskHeatmap(graph, ChangeHistory.from(records), incidents);

        assertEquals(3, heatmap.size(), "One score per CI, groups excluded");
        RiskScore top = heatmap.get(0);
        assertEquals(ci("A"), top.ci());
        assertEquals(83, top.riskScore());
        assertEquals(3, top.factors().changeFrequency());
        assertEquals(0.3333, top.factors().emergencyRatio());
        assertEquals(2, top.factors().incidentRate());
        assertEquals(2, top.factors().couplingDensity());

        RiskScore c = heatmap.get(2);
        assertEquals(ci("C"), c.ci());
        assertEquals(20, c.riskScore());
        assertEquals(0.0, c.factors().emergencyRatio());
    }

    @Test
    void testScoresInRange() {
        Hypergraph graph = graph(records);
        for (RiskScore score : analyzer.riskHeatmap(graph, ChangeHistory.from(records), incidents)) {
            assertTrue(score.riskScore() >= 0 && score.riskScore() <= 100, "Out of range: " + score);
        }
        for (RiskScore score : analyzer.riskHeatmap(graph, null, null)) {
            assertEquals(0, score.riskScore(), "No history and no incidents means no risk signal");
        }
    }

    @Test
    void testEmptyGraph() {
        assertTrue(analyzer.riskHeatmap(Hypergraph.empty(), ChangeHistory.empty(), List.of()).isEmpty());
        assertTrue(analyzer.riskHeatmap(null, null, null).isEmpty());
    }
}
