package com.bsm.hypergraph.report;

import com.bsm.hypergraph.core.AnalyticsConfig;
import com.bsm.hypergraph.core.AnalyticsRunner;
import com.bsm.hypergraph.graph.ChangeHistory;
import com.bsm.hypergraph.graph.Hypergraph;
import com.bsm.hypergraph.core.ChangeRecord;
import com.bsm.hypergraph.graph.HypergraphStore;
import com.bsm.hypergraph.risk.RiskFactors;
import com.bsm.hypergraph.risk.RiskScore;
import com.bsm.hypergraph.temporal.Cascade;
import com.bsm.hypergraph.temporal.ChangeVelocity;
import com.bsm.hypergraph.temporal.Direction;
import com.bsm.hypergraph.temporal.Trend;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.bsm.hypergraph.graph.GraphFixtures.changeWith;
import static com.bsm.hypergraph.graph.GraphFixtures.rows;
import static org.junit.jupiter.api.Assertions.*;

class JsonReportConverterTest {

    private final JsonReportConverter converter = new JsonReportConverter();

    @Test
    void testEscapeJson() {
        assertEquals("say \\\"hi\\\"", JsonReportConverter.escapeJson("say \"hi\""));
        assertEquals("a\\\\b", JsonReportConverter.escapeJson("a\\b"));
        assertEquals("line\\nbreak\\ttab", JsonReportConverter.escapeJson("line\nbreak\ttab"));
        assertEquals("\\u0001", JsonReportConverter.escapeJson("\u0001"));
        assertEquals("", JsonReportConverter.escapeJson(null));
    }

    @Test
    void testCascadeUsesDirectionLabel() {
        Cascade cascade = new Cascade("ci:a", "ci:b", 3, 1.5, Direction.SOURCE_TO_TARGET);

        assertEquals("{ \"source\": \"ci:a\", \"target\": \"ci:b\", \"count\": 3, \"avgLagDays\": 1.5, "
                + "\"direction\": \"A→B\" }", converter.cascadeToJson(cascade));
    }

    @Test
    void testVelocityAndNonFiniteNumbers() {
        ChangeVelocity velocity = new ChangeVelocity(List.of(1, 0, 3), Double.NaN, 3, Trend.INCREASING);

        assertEquals("{ \"weeks\": [1, 0, 3], \"avg\": null, \"max\": 3, \"trend\": \"increasing\" }",
                converter.velocityToJson(velocity));
        assertEquals("null", converter.number(Double.POSITIVE_INFINITY));
        assertEquals("0.25", converter.number(0.25));
    }

    @Test
    void testRiskScoreWithNestedFactors() {
        RiskScore score = new RiskScore("ci:db-01", "DB \"primary\"", 72, new RiskFactors(4, 0.5, 2, 3));

        assertEquals("{ \"ci\": \"ci:db-01\", \"name\": \"DB \\\"primary\\\"\", \"riskScore\": 72, "
                + "\"factors\": { \"changeFrequency\": 4, \"emergencyRatio\": 0.5, \"incidentRate\": 2, "
                + "\"couplingDensity\": 3 } }", converter.riskToJson(score));
        assertEquals("{ \"ci\": null, \"name\": null, \"riskScore\": 0, \"factors\": null }",
                converter.riskToJson(new RiskScore(null, null, 0, null)));
    }

    @Test
    void testFullReportSections() {
        List<ChangeRecord> records = rows(
                changeWith("CHG1", "2024-01-01T00:00:00Z", "High", "Normal", "Network", "Payments", "web-01", "db-01"),
                changeWith("CHG2", "2024-01-03T00:00:00Z", "Low", "Emergency", "Network", "Payments", "web-01",
                        "db-01"));
        Hypergraph graph = new HypergraphStore().build(records);
        AnalysisReport report = new AnalyticsRunner(AnalyticsConfig.defaults())
                .run(graph, ChangeHistory.from(records), List.of(), "db-01");

        String json = converter.convertToReportJson(report);

        assertTrue(json.startsWith("{ \"graphStats\": { \"totalNodes\": " + graph.stats().totalNodes()));
        assertTrue(json.contains("\"impactTarget\": \"ci:db-01\""));
        assertTrue(json.contains("\"cooccurrence\": [{ \"a\": \"ci:db-01\", \"b\": \"ci:web-01\", \"count\": 2"),
                "Pairs should render with their counts: " + json);
        assertTrue(json.contains("\"riskHeatmap\": [{ \"ci\": "));
        assertTrue(json.contains("\"serviceFingerprints\": {}"));
        assertTrue(json.endsWith(" }"));
    }

    @Test
    void testSelfDescribingReport() {
        AnalysisReport report = new AnalyticsRunner(AnalyticsConfig.defaults())
                .run(Hypergraph.empty(), ChangeHistory.empty(), List.of(), null);

        String json = converter.convertToSelfDescribingJson(report);

        assertTrue(json.startsWith("{ \"metadata\": {"));
        assertTrue(json.contains("\"tool\": \"" + JsonReportConverter.TOOL + "\""));
        assertTrue(json.contains("\"schema\": {"));
        assertTrue(json.contains("\"report\": { \"graphStats\": {"));
        assertTrue(json.contains("\"impactTarget\": null"));
        assertTrue(json.endsWith("}"));
    }
}
