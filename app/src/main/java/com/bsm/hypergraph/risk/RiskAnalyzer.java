package com.bsm.hypergraph.risk;

import com.bsm.hypergraph.core.IncidentRecord;
import com.bsm.hypergraph.core.Scores;
import com.bsm.hypergraph.graph.ChangeHistory;
import com.bsm.hypergraph.graph.ChangeHistory.ChangeEntry;
import com.bsm.hypergraph.graph.EntityType;
import com.bsm.hypergraph.graph.Hypergraph;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Per-CI risk heatmap on a 0-100 scale.
 */
public class RiskAnalyzer {

    static final double WEIGHT_CHANGE_FREQUENCY = 0.3;
    static final double WEIGHT_EMERGENCY_RATIO = 0.25;
    static final double WEIGHT_INCIDENT_RATE = 0.25;
    static final double WEIGHT_COUPLING_DENSITY = 0.2;

    private static final class CiStats {
        int changes;
        int emergencies;
        final Set<String> coupled = new LinkedHashSet<>();
    }

    public List<RiskScore> riskHeatmap(Hypergraph graph, ChangeHistory history, List<IncidentRecord> incidents) {
        if (graph == null || graph.nodes().isEmpty()) {
            return List.of();
        }

        Map<String, CiStats> stats = new LinkedHashMap<>();
        graph.ciUids().forEach(uid -> stats.put(uid, new CiStats()));

        if (history != null) {
            for (ChangeEntry change : history.entries()) {
                List<String> cis = change.ciUids();
                for (String uid : cis) {
                    CiStats s = stats.get(uid);
                    if (s == null)
                        continue;
                    s.changes++;
                    if (change.isEmergency())
                        s.emergencies++;
                    for (String other : cis) {
                        if (!other.equals(uid))
                            s.coupled.add(other);
                    }
                }
            }
        }

        Map<String, Integer> incidentCounts = new HashMap<>();
        if (incidents != null) {
            for (IncidentRecord incident : incidents) {
                if (incident != null && incident.hasAffectedCi()) {
                    incidentCounts.merge(EntityType.CI.uid(incident.affectedCiId().trim()), 1, Integer::sum);
                }
            }
        }

        List<RiskFactors> factors = new ArrayList<>();
        double maxCf = 0, maxEr = 0, maxIr = 0, maxCd = 0;
        for (Map.Entry<String, CiStats> entry : stats.entrySet()) {
            CiStats s = entry.getValue();
            double emergencyRatio = s.changes > 0 ? (double) s.emergencies / s.changes : 0;
            RiskFactors f = new RiskFactors(s.changes, emergencyRatio,
                    incidentCounts.getOrDefault(entry.getKey(), 0), s.coupled.size());
            factors.add(f);
            maxCf = Math.max(maxCf, f.changeFrequency());
            maxEr = Math.max(maxEr, f.emergencyRatio());
            maxIr = Math.max(maxIr, f.incidentRate());
            maxCd = Math.max(maxCd, f.couplingDensity());
        }

        List<RiskScore> results = new ArrayList<>();
        int i = 0;
        for (String uid : stats.keySet()) {
            RiskFactors f = factors.get(i++);
            double weighted = WEIGHT_CHANGE_FREQUENCY * Scores.ratio(f.changeFrequency(), maxCf)
                    + WEIGHT_EMERGENCY_RATIO * Scores.ratio(f.emergencyRatio(), maxEr)
                    + WEIGHT_INCIDENT_RATE * Scores.ratio(f.incidentRate(), maxIr)
                    + WEIGHT_COUPLING_DENSITY * Scores.ratio(f.couplingDensity(), maxCd);
            RiskFactors rounded = new RiskFactors(f.changeFrequency(), Scores.round(f.emergencyRatio(), 4),
                    f.incidentRate(), f.couplingDensity());
            results.add(new RiskScore(uid, graph.nameOf(uid), (int) Math.round(weighted * 100), rounded));
        }

        results.sort((a, b) -> Integer.compare(b.riskScore(), a.riskScore()));
        return List.copyOf(results);
    }
}
