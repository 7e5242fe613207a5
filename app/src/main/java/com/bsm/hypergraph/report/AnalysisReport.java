package com.bsm.hypergraph.report;

import com.bsm.hypergraph.anomaly.AnomalyReport;
import com.bsm.hypergraph.centrality.CentralityScores;
import com.bsm.hypergraph.centrality.CriticalNode;
import com.bsm.hypergraph.community.CommunityResult;
import com.bsm.hypergraph.cooccurrence.WeightedPair;
import com.bsm.hypergraph.graph.CooccurrencePair;
import com.bsm.hypergraph.graph.GraphStats;
import com.bsm.hypergraph.incident.IncidentCorrelationReport;
import com.bsm.hypergraph.prediction.ImpactPrediction;
import com.bsm.hypergraph.prediction.LinkPrediction;
import com.bsm.hypergraph.risk.RiskScore;
import com.bsm.hypergraph.temporal.Cascade;
import com.bsm.hypergraph.temporal.ChangeVelocity;

import java.util.List;
import java.util.Map;

/**
 * Every analytics result for one graph snapshot.
 */
public record AnalysisReport(
        GraphStats graphStats,

        /** Stats of the transposed view: changes as nodes */
        GraphStats transposedStats,

        List<CooccurrencePair> cooccurrence,
        CentralityScores centrality,
        List<CriticalNode> criticalNodes,
        List<Cascade> cascades,
        Map<String, ChangeVelocity> velocity,
        List<WeightedPair> weightedPairs,
        AnomalyReport anomalies,
        CommunityResult communities,
        List<LinkPrediction> linkPredictions,

        /** CI whose impact was predicted; null when none was requested */
        String impactTarget,

        List<ImpactPrediction> impact,
        IncidentCorrelationReport incidents,
        List<RiskScore> riskHeatmap) {
}
