package com.bsm.hypergraph.incident;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record IncidentCorrelationReport(
        List<FaultPropagation> faultPropagation,
        List<Hotspot> hotspots,

        /** Keyed by service uid */
        Map<String, ServiceFingerprint> serviceFingerprints) {

    public IncidentCorrelationReport {
        faultPropagation = List.copyOf(faultPropagation);
        hotspots = List.copyOf(hotspots);
        serviceFingerprints = Collections.unmodifiableMap(new LinkedHashMap<>(serviceFingerprints));
    }

    public static IncidentCorrelationReport empty() {
        return new IncidentCorrelationReport(List.of(), List.of(), Map.of());
    }
}
