package com.bsm.hypergraph.anomaly;

import com.bsm.hypergraph.core.AnalyticsConfig;
import com.bsm.hypergraph.core.ChangeRecord;
import com.bsm.hypergraph.graph.Entity;
import com.bsm.hypergraph.graph.EntityType;
import com.bsm.hypergraph.graph.Hypergraph;
import com.bsm.hypergraph.graph.HypergraphStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static com.bsm.hypergraph.graph.GraphFixtures.changeWith;
import static com.bsm.hypergraph.graph.GraphFixtures.ci;
import static com.bsm.hypergraph.graph.GraphFixtures.graph;
import static com.bsm.hypergraph.graph.GraphFixtures.rows;
import static org.junit.jupiter.api.Assertions.*;

class AnomalyDetectorTest {

    @TempDir
    Path tempDir;

    private final AnomalyDetector detector = new AnomalyDetector(AnalyticsConfig.defaults());

    private static ChangeRecord row(String change, String ciId, String ciClass) {
        return ChangeRecord.ci(change, "2024-01-01", null, null, null, null, ciId, ciClass);
    }

    // A (db) and B (web) always change together; four load balancers change alone
    private List<ChangeRecord> coupledRecords() {
        List<ChangeRecord> records = new ArrayList<>();
        records.add(row("E1", "A", "db"));
        records.add(row("E1", "B", "web"));
        records.add(row("E2", "A", "db"));
        records.add(row("E2", "B", "web"));
        records.add(row("E3", "C", "lb"));
        records.add(row("E4", "D", "lb"));
        records.add(row("E5", "E", "lb"));
        records.add(row("E6", "F", "lb"));
        return records;
    }

    @Test
    void testUnexpectedPair() {
        AnomalyReport report = detector.detectAnomalies(graph(coupledRecords()));

        assertEquals(1, report.unexpectedPairs().size());
        UnexpectedPair pair = report.unexpectedPairs().get(0);
        assertEquals(ci("A"), pair.a());
        assertEquals("db", pair.classA());
        assertEquals("web", pair.classB());
        assertEquals(2, pair.actual());
        assertEquals(0.67, pair.expected(), "(2/6) * (2/6) * 6");
        assertEquals(3.0, pair.ratio());
    }

    @Test
    void testUnexpectedRatioIsConfigurable() throws IOException {
        Files.writeString(tempDir.resolve(AnalyticsConfig.FILE_NAME), """
                anomaly:
                  unexpected_ratio: 5
                """);
        AnomalyDetector strict = new AnomalyDetector(AnalyticsConfig.load(tempDir));

        assertTrue(strict.detectAnomalies(graph(coupledRecords())).unexpectedPairs().isEmpty(),
                "Ratio 3 should not pass a threshold of 5");
    }

    @Test
    void testOverCoupled() {
        AnomalyReport report = detector.detectAnomalies(graph(coupledRecords()));

        assertEquals(1, report.overCoupled().size());
        OverCoupledPair pair = report.overCoupled().get(0);
        assertEquals(1.0, pair.jaccard());
        assertEquals(2, pair.sharedChanges());
    }

    @Test
    void testOrphans() {
        List<Entity> catalog = new ArrayList<>();
        for (String id : List.of("A", "B", "C", "Idle")) {
            catalog.add(Entity.of(EntityType.CI, id, id + " box", null));
        }
        Hypergraph graph = new HypergraphStore().build(coupledRecords(), catalog);

        List<Orphan> orphans = detector.detectAnomalies(graph).orphans();

        assertEquals(2, orphans.size());
        assertEquals(ci("C"), orphans.get(0).uid());
        assertEquals(1, orphans.get(0).degree());
        assertEquals(Orphan.REASON_SINGLE, orphans.get(0).reason());
        assertEquals(ci("Idle"), orphans.get(1).uid());
        assertEquals(0, orphans.get(1).degree());
        assertEquals(Orphan.REASON_UNREFERENCED, orphans.get(1).reason());
        assertEquals("Idle box", orphans.get(1).name());
    }

    @Test
    void testUnderCoupled() {
        Hypergraph graph = graph(rows(
                changeWith("X1", "2024-01-01", "Low", "Standard", null, "Pay", "A"),
                changeWith("X2", "2024-01-02", "Low", "Standard", null, "Pay", "B"),
                changeWith("X3", "2024-01-03", "Low", "Standard", null, "Pay", "A", "C")));

        List<UnderCoupledPair> under = detector.detectAnomalies(graph).underCoupled();

        assertEquals(2, under.size(), "A-B and B-C never changed together, A-C did");
        UnderCoupledPair first = under.get(0);
        assertEquals(ci("A"), first.a());
        assertEquals(ci("B"), first.b());
        assertEquals("service:Pay", first.sharedService());
        assertEquals(UnderCoupledPair.REASON, first.reason());
    }

    @Test
    void testEmptyGraph() {
        assertEquals(0, detector.detectAnomalies(Hypergraph.empty()).total());
        assertEquals(0, detector.detectAnomalies(null).total());
    }
}
