package com.bsm.hypergraph.core;

import com.bsm.hypergraph.graph.ChangeHistory;
import com.bsm.hypergraph.graph.Hypergraph;
import com.bsm.hypergraph.graph.HypergraphStore;
import com.bsm.hypergraph.report.AnalysisReport;
import com.bsm.hypergraph.risk.RiskAnalyzer;
import com.bsm.hypergraph.risk.RiskScore;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static com.bsm.hypergraph.graph.GraphFixtures.changeWith;
import static com.bsm.hypergraph.graph.GraphFixtures.rows;
import static org.junit.jupiter.api.Assertions.*;

class AnalyticsRunnerTest {

    private final AnalyticsRunner runner = new AnalyticsRunner(AnalyticsConfig.defaults());
    private final HypergraphStore store = new HypergraphStore();

    private List<ChangeRecord> sampleRecords() {
        return rows(
                changeWith("CHG1", "2024-01-01T00:00:00Z", "High", "Normal", "Network", "Payments", "web-01", "db-01"),
                changeWith("CHG2", "2024-01-03T00:00:00Z", "Low", "Emergency", "Network", "Payments", "web-01", "db-01",
                        "cache-01"),
                changeWith("CHG3", "2024-01-10T00:00:00Z", "Medium", "Standard", "Storage", "Payments", "db-01", "san-01"),
                changeWith("CHG4", "2024-01-20T00:00:00Z", "Low", "Standard", "Storage", "Billing", "san-01"),
                changeWith("CHG5", "2024-02-01T00:00:00Z", "Critical", "Normal", "Network", "Billing", "web-01", "lb-01"));
    }

    private List<IncidentRecord> sampleIncidents() {
        return List.of(
                new IncidentRecord("INC1", 1, "web-01", null, "svc-pay", "Payments",
                        "2024-01-02T00:00:00Z", "2024-01-02T06:00:00Z", null),
                new IncidentRecord("INC2", 2, "db-01", null, "svc-pay", "Payments",
                        "2024-01-02T05:00:00Z", "2024-01-02T07:00:00Z", null),
                new IncidentRecord("INC3", 3, "web-01", null, null, null,
                        "2024-01-09T00:00:00Z", null, null));
    }

    @Test
    void testEmptyInputs() {
        AnalysisReport report = runner.run(null, null, null, null);

        assertEquals(0, report.graphStats().totalNodes());
        assertTrue(report.cooccurrence().isEmpty());
        assertTrue(report.criticalNodes().isEmpty());
        assertTrue(report.cascades().isEmpty());
        assertTrue(report.velocity().isEmpty());
        assertTrue(report.weightedPairs().isEmpty());
        assertEquals(0, report.anomalies().total());
        assertEquals(0, report.communities().count());
        assertTrue(report.linkPredictions().isEmpty());
        assertNull(report.impactTarget());
        assertTrue(report.impact().isEmpty());
        assertTrue(report.incidents().hotspots().isEmpty());
        assertTrue(report.riskHeatmap().isEmpty());
    }

    @Test
    void testFullRun() {
        List<ChangeRecord> records = sampleRecords();
        Hypergraph graph = store.build(records);

        AnalysisReport report = runner.run(graph, ChangeHistory.from(records), sampleIncidents(), "web-01");

        assertEquals(graph.stats(), report.graphStats());
        assertEquals(graph.edges().size(), report.transposedStats().totalNodes(),
                "Transposed graph should have one node per change");
        assertEquals("ci:web-01", report.impactTarget(), "Bare CI id should resolve to its uid");
        assertFalse(report.impact().isEmpty());
        assertFalse(report.criticalNodes().isEmpty());
        assertTrue(report.cooccurrence().stream().allMatch(p -> p.a().startsWith("ci:") && p.b().startsWith("ci:")),
                "Runner co-occurrence should only pair CIs");
        assertEquals(2, report.incidents().hotspots().get(0).incidentCount());
        assertEquals(graph.ciUids().size(), report.riskHeatmap().size());
    }

    @Test
    void testParallelRunMatchesSequential() throws InterruptedException {
        List<ChangeRecord> records = sampleRecords();
        Hypergraph graph = store.build(records);
        ChangeHistory history = ChangeHistory.from(records);

        AnalysisReport sequential = runner.run(graph, history, sampleIncidents(), "ci:db-01");

        ExecutorService pool = Executors.newFixedThreadPool(4);
        AnalysisReport parallel;
        try {
            parallel = runner.run(graph, history, sampleIncidents(), "ci:db-01", pool);
        } finally {
            pool.shutdown();
        }

        assertEquals(sequential, parallel, "Module results should not depend on scheduling");
    }

    @Test
    void testModuleFailureSurfacesOriginalException() throws InterruptedException {
        RiskAnalyzer failingRisk = new RiskAnalyzer() {
            @Override
            public List<RiskScore> riskHeatmap(Hypergraph graph, ChangeHistory history,
                    List<IncidentRecord> incidents) {
                throw new IllegalArgumentException("broken risk feed");
            }
        };
        AnalyticsRunner failing = new AnalyticsRunner(AnalyticsConfig.defaults(), failingRisk);
        List<ChangeRecord> records = sampleRecords();
        Hypergraph graph = store.build(records);

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                    () -> failing.run(graph, ChangeHistory.from(records), sampleIncidents(), null, pool),
                    "The module's own exception should come out, not a CompletionException");
            assertEquals("broken risk feed", e.getMessage());
        } finally {
            pool.shutdown();
        }
        assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));
    }

    @Test
    void testRejectedSubmissionPropagates() {
        Hypergraph graph = store.build(sampleRecords());
        ExecutorService pool = Executors.newSingleThreadExecutor();
        pool.shutdown();

        assertThrows(RejectedExecutionException.class,
                () -> runner.run(graph, ChangeHistory.empty(), List.of(), null, pool),
                "A pool that refuses work should fail the run");
    }

    @Test
    void testResolveTarget() {
        Hypergraph graph = store.build(sampleRecords());

        assertEquals("ci:web-01", AnalyticsRunner.resolveTarget(graph, "ci:web-01"));
        assertEquals("ci:web-01", AnalyticsRunner.resolveTarget(graph, " web-01 "));
        assertEquals("service:Payments", AnalyticsRunner.resolveTarget(graph, "service:Payments"));
        assertNull(AnalyticsRunner.resolveTarget(graph, "nope"));
        assertNull(AnalyticsRunner.resolveTarget(graph, ""));
        assertNull(AnalyticsRunner.resolveTarget(graph, null));
    }
}
