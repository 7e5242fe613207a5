package com.bsm.hypergraph.incident;

import com.bsm.hypergraph.core.AnalyticsConfig;
import com.bsm.hypergraph.core.IncidentRecord;
import com.bsm.hypergraph.graph.Hypergraph;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.bsm.hypergraph.graph.GraphFixtures.change;
import static com.bsm.hypergraph.graph.GraphFixtures.ci;
import static com.bsm.hypergraph.graph.GraphFixtures.graph;
import static org.junit.jupiter.api.Assertions.*;

class IncidentCorrelatorTest {

    private final IncidentCorrelator correlator = new IncidentCorrelator(AnalyticsConfig.defaults());

    private static IncidentRecord incident(String number, Integer priority, String ci, String service,
            String createdAt, String resolvedAt) {
        return new IncidentRecord(number, priority, ci, null, service, null, createdAt, resolvedAt, null);
    }

    private final List<IncidentRecord> incidents = List.of(
            incident("INC1", 1, "web-01", "svc-pay", "2024-01-01T00:00:00Z", "2024-01-01T04:00:00Z"),
            incident("INC2", 2, "db-01", "svc-pay", "2024-01-01T02:00:00Z", null),
            incident("INC3", 3, "web-01", null, "2024-01-02T00:00:00Z", null),
            incident("INC4", null, "web-01", null, "2024-01-03T00:00:00Z", null));

    @Test
    void testFaultPropagation() {
        List<FaultPropagation> propagation = correlator.faultPropagation(incidents);

        assertEquals(2, propagation.size());
        FaultPropagation forward = propagation.get(0);
        assertEquals(ci("web-01"), forward.source());
        assertEquals(ci("db-01"), forward.target());
        assertEquals(1, forward.count());
        assertEquals(2.0, forward.avgLagHours());

        FaultPropagation backward = propagation.get(1);
        assertEquals(ci("db-01"), backward.source());
        assertEquals(22.0, backward.avgLagHours(), "46 hour lag falls outside the 24 hour window");
    }

    @Test
    void testHotspots() {
        Hypergraph graph = graph(change("C1", "2024-01-01", "web-01"));
        List<Hotspot> hotspots = correlator.hotspots(incidents, graph);

        assertEquals(2, hotspots.size());
        Hotspot web = hotspots.get(0);
        assertEquals(ci("web-01"), web.ci());
        assertEquals("web-01", web.name());
        assertEquals(3, web.incidentCount());
        assertEquals(2.67, web.avgPriority(), "Missing priority counts as 4");
        assertEquals(24.0, web.mtbfHours());

        Hotspot db = hotspots.get(1);
        assertEquals(0.0, db.mtbfHours(), "A single incident has no MTBF");
        assertEquals(ci("db-01"), db.name(), "Unknown CI without a name falls back to its uid");
    }

    @Test
    void testServiceFingerprints() {
        ServiceFingerprint pay = correlator.serviceFingerprints(incidents).get("service:svc-pay");

        assertEquals(List.of(ci("web-01"), ci("db-01")), pay.affectedCis());
        assertEquals(2, pay.incidentCount());
        assertEquals(4.0, pay.avgResolutionHours(), "Unresolved incidents are left out of the average");
        assertEquals(ServiceFingerprint.Pattern.CONCENTRATED, pay.pattern());
    }

    @Test
    void testServiceFingerprintsAreReadOnly() {
        Map<String, ServiceFingerprint> fingerprints = correlator.serviceFingerprints(incidents);

        assertThrows(UnsupportedOperationException.class,
                () -> fingerprints.put("service:svc-new", fingerprints.get("service:svc-pay")));
        assertThrows(UnsupportedOperationException.class, fingerprints::clear);
        assertEquals(1, fingerprints.size());
    }

    @Test
    void testDistributedPattern() {
        List<IncidentRecord> spread = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            spread.add(incident("INC" + i, 3, "ci-" + i, "svc-web", "2024-01-0" + (i + 1) + "T00:00:00Z", null));
        }
        ServiceFingerprint web = correlator.serviceFingerprints(spread).get("service:svc-web");

        assertEquals(ServiceFingerprint.Pattern.DISTRIBUTED, web.pattern());
        assertEquals("distributed", web.pattern().toString());
        assertEquals(0.0, web.avgResolutionHours());
    }

    @Test
    void testCorrelateEmpty() {
        IncidentCorrelationReport report = correlator.correlate(List.of(), Hypergraph.empty());
        assertTrue(report.faultPropagation().isEmpty());
        assertTrue(report.hotspots().isEmpty());
        assertTrue(report.serviceFingerprints().isEmpty());
        assertTrue(correlator.correlate(null, null).hotspots().isEmpty());
    }

    @Test
    void testCorrelate() {
        IncidentCorrelationReport report = correlator.correlate(incidents, null);
        assertEquals(2, report.faultPropagation().size());
        assertEquals(2, report.hotspots().size());
        assertEquals(1, report.serviceFingerprints().size());
    }
}
