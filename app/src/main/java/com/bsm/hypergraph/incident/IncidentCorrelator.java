package com.bsm.hypergraph.incident;

import com.bsm.hypergraph.core.AnalyticsConfig;
import com.bsm.hypergraph.core.IncidentRecord;
import com.bsm.hypergraph.core.Scores;
import com.bsm.hypergraph.graph.EntityType;
import com.bsm.hypergraph.graph.Hypergraph;
import com.bsm.hypergraph.temporal.LagWindow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Correlates the incident feed with the change graph: fault propagation
 * between CIs, incident hotspots and per-service fingerprints.
 */
public class IncidentCorrelator {

    private final AnalyticsConfig config;

    public IncidentCorrelator(AnalyticsConfig config) {
        this.config = config;
    }

    public IncidentCorrelationReport correlate(List<IncidentRecord> incidents, Hypergraph graph) {
        if (incidents == null || incidents.isEmpty()) {
            return IncidentCorrelationReport.empty();
        }
        Hypergraph g = graph != null ? graph : Hypergraph.empty();

        return new IncidentCorrelationReport(
                faultPropagation(incidents),
                hotspots(incidents, g),
                serviceFingerprints(incidents));
    }

    List<FaultPropagation> faultPropagation(List<IncidentRecord> incidents) {
        Map<String, List<Long>> timeline = new LinkedHashMap<>();
        for (IncidentRecord incident : incidents) {
            if (incident == null || !incident.hasAffectedCi())
                continue;
            timeline.computeIfAbsent(ciUid(incident), k -> new ArrayList<>())
                    .add(Scores.parseTimestamp(incident.createdAt()));
        }
        timeline.values().forEach(times -> times.sort(null));

        long windowMs = config.getPropagationWindowHours() * Scores.HOUR_MS;
        List<FaultPropagation> result = new ArrayList<>();
        LagWindow.directed(timeline, windowMs).forEach((source, targets) ->
                targets.forEach((target, tally) -> result.add(new FaultPropagation(source, target,
                        tally.count(), Scores.round(tally.avgLag() / Scores.HOUR_MS, 2)))));

        result.sort((a, b) -> Integer.compare(b.count(), a.count()));
        return result;
    }

    List<Hotspot> hotspots(List<IncidentRecord> incidents, Hypergraph graph) {
        Map<String, List<IncidentRecord>> byCi = new LinkedHashMap<>();
        for (IncidentRecord incident : incidents) {
            if (incident == null || !incident.hasAffectedCi())
                continue;
            byCi.computeIfAbsent(ciUid(incident), k -> new ArrayList<>()).add(incident);
        }

        List<Hotspot> result = new ArrayList<>();
        for (Map.Entry<String, List<IncidentRecord>> entry : byCi.entrySet()) {
            List<IncidentRecord> list = entry.getValue();
            int prioritySum = 0;
            List<Long> times = new ArrayList<>();
            for (IncidentRecord incident : list) {
                prioritySum += incident.priorityOrDefault();
                long t = Scores.parseTimestamp(incident.createdAt());
                if (t > 0)
                    times.add(t);
            }
            times.sort(null);

            double mtbfHours = 0;
            if (times.size() > 1) {
                // Sum of consecutive gaps of a sorted list is last minus first
                long span = times.get(times.size() - 1) - times.get(0);
                mtbfHours = (double) span / (times.size() - 1) / Scores.HOUR_MS;
            }

            String uid = entry.getKey();
            result.add(new Hotspot(uid, displayName(graph, uid, list.get(0)), list.size(),
                    Scores.round((double) prioritySum / list.size(), 2),
                    Scores.round(mtbfHours, 2)));
        }
        result.sort((a, b) -> Integer.compare(b.incidentCount(), a.incidentCount()));
        return result;
    }

    Map<String, ServiceFingerprint> serviceFingerprints(List<IncidentRecord> incidents) {
        Map<String, Set<String>> affected = new LinkedHashMap<>();
        Map<String, Integer> counts = new LinkedHashMap<>();
        Map<String, List<Long>> resolutions = new LinkedHashMap<>();

        for (IncidentRecord incident : incidents) {
            if (incident == null || !incident.hasBusinessService())
                continue;
            String service = EntityType.SERVICE.uid(incident.businessServiceId().trim());
            counts.merge(service, 1, Integer::sum);
            Set<String> cis = affected.computeIfAbsent(service, k -> new LinkedHashSet<>());
            List<Long> times = resolutions.computeIfAbsent(service, k -> new ArrayList<>());
            if (incident.hasAffectedCi()) {
                cis.add(ciUid(incident));
            }

            long created = Scores.parseTimestamp(incident.createdAt());
            long resolved = Scores.parseTimestamp(incident.resolvedAt());
            if (created > 0 && resolved > created) {
                times.add(resolved - created);
            }
        }

        Map<String, ServiceFingerprint> result = new LinkedHashMap<>();
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            String service = entry.getKey();
            Set<String> cis = affected.get(service);
            List<Long> times = resolutions.get(service);
            double avgHours = times.isEmpty()
                    ? 0
                    : times.stream().mapToLong(Long::longValue).average().orElse(0) / Scores.HOUR_MS;
            ServiceFingerprint.Pattern pattern = cis.size() <= config.getConcentratedMaxCis()
                    ? ServiceFingerprint.Pattern.CONCENTRATED
                    : ServiceFingerprint.Pattern.DISTRIBUTED;
            result.put(service, new ServiceFingerprint(new ArrayList<>(cis), entry.getValue(),
                    Scores.round(avgHours, 2), pattern));
        }
        return Collections.unmodifiableMap(result);
    }

    private static String ciUid(IncidentRecord incident) {
        return EntityType.CI.uid(incident.affectedCiId().trim());
    }

    private static String displayName(Hypergraph graph, String uid, IncidentRecord sample) {
        if (graph.hasNode(uid))
            return graph.nameOf(uid);
        String name = sample.affectedCiName();
        return name == null || name.isBlank() ? uid : name;
    }
}
