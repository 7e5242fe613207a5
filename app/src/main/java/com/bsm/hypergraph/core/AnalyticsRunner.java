package com.bsm.hypergraph.core;

import com.bsm.hypergraph.anomaly.AnomalyDetector;
import com.bsm.hypergraph.anomaly.AnomalyReport;
import com.bsm.hypergraph.centrality.CentralityAnalyzer;
import com.bsm.hypergraph.centrality.CentralityScores;
import com.bsm.hypergraph.centrality.CriticalNode;
import com.bsm.hypergraph.community.CommunityDetector;
import com.bsm.hypergraph.community.CommunityResult;
import com.bsm.hypergraph.cooccurrence.WeightedCooccurrenceAnalyzer;
import com.bsm.hypergraph.cooccurrence.WeightedPair;
import com.bsm.hypergraph.graph.ChangeHistory;
import com.bsm.hypergraph.graph.CooccurrencePair;
import com.bsm.hypergraph.graph.EntityType;
import com.bsm.hypergraph.graph.GraphStats;
import com.bsm.hypergraph.graph.Hypergraph;
import com.bsm.hypergraph.graph.HypergraphStore;
import com.bsm.hypergraph.incident.IncidentCorrelationReport;
import com.bsm.hypergraph.incident.IncidentCorrelator;
import com.bsm.hypergraph.prediction.ImpactPrediction;
import com.bsm.hypergraph.prediction.ImpactPredictor;
import com.bsm.hypergraph.prediction.LinkPrediction;
import com.bsm.hypergraph.prediction.LinkPredictor;
import com.bsm.hypergraph.report.AnalysisReport;
import com.bsm.hypergraph.risk.RiskAnalyzer;
import com.bsm.hypergraph.risk.RiskScore;
import com.bsm.hypergraph.temporal.Cascade;
import com.bsm.hypergraph.temporal.ChangeVelocity;
import com.bsm.hypergraph.temporal.TemporalAnalyzer;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Runs every analytics module over one graph snapshot and collects the results.
 *
 * The modules share nothing but the read-only graph, history and incident list,
 * so each can run as its own task on an executor.
 */
public class AnalyticsRunner {

    private final AnalyticsConfig config;
    private final HypergraphStore store = new HypergraphStore();
    private final CentralityAnalyzer centrality;
    private final TemporalAnalyzer temporal;
    private final WeightedCooccurrenceAnalyzer weighted;
    private final AnomalyDetector anomalies;
    private final CommunityDetector communities;
    private final ImpactPredictor impact;
    private final LinkPredictor links;
    private final IncidentCorrelator incidents;
    private final RiskAnalyzer risk;

    public AnalyticsRunner(AnalyticsConfig config) {
        this(config, new RiskAnalyzer());
    }

    AnalyticsRunner(AnalyticsConfig config, RiskAnalyzer risk) {
        this.config = config;
        this.risk = risk;
        this.centrality = new CentralityAnalyzer(config);
        this.temporal = new TemporalAnalyzer(config);
        this.weighted = new WeightedCooccurrenceAnalyzer(config);
        this.anomalies = new AnomalyDetector(config);
        this.communities = new CommunityDetector(config);
        this.impact = new ImpactPredictor(config);
        this.links = new LinkPredictor(config);
        this.incidents = new IncidentCorrelator(config);
    }

    /**
     * Run all modules on the calling thread.
     */
    public AnalysisReport run(Hypergraph graph, ChangeHistory history, List<IncidentRecord> incidentFeed,
            String impactTarget) {
        Executor direct = Runnable::run;
        return run(graph, history, incidentFeed, impactTarget, direct);
    }

    /**
     * Run each module as a separate task on the given executor, typically an
     * {@link java.util.concurrent.ExecutorService}, and wait for all of them.
     */
    public AnalysisReport run(Hypergraph graph, ChangeHistory history, List<IncidentRecord> incidentFeed,
            String impactTarget, Executor executor) {
        Hypergraph g = graph != null ? graph : Hypergraph.empty();
        ChangeHistory h = history != null ? history : ChangeHistory.empty();
        List<IncidentRecord> feed = incidentFeed != null ? incidentFeed : List.of();
        String target = resolveTarget(g, impactTarget);

        CompletableFuture<GraphStats> transposed = submit(executor, () -> store.transpose(g).stats());
        CompletableFuture<List<CooccurrencePair>> cooccurrence = submit(executor,
                () -> store.cooccurrence(g, EntityType.CI, config.getTopCooccurrence()));
        CompletableFuture<CentralityScores> scores = submit(executor, () -> centrality.centrality(g));
        CompletableFuture<List<CriticalNode>> critical = submit(executor, () -> centrality.criticalNodes(g));
        CompletableFuture<List<Cascade>> cascades = submit(executor, () -> temporal.temporalCascades(h));
        CompletableFuture<Map<String, ChangeVelocity>> velocity = submit(executor, () -> temporal.changeVelocity(h));
        CompletableFuture<List<WeightedPair>> pairs = submit(executor, () -> weighted.weightedCooccurrence(g, h));
        CompletableFuture<AnomalyReport> anomalyReport = submit(executor, () -> anomalies.detectAnomalies(g));
        CompletableFuture<CommunityResult> communityResult = submit(executor, () -> communities.detectCommunities(g));
        CompletableFuture<List<LinkPrediction>> linkPredictions = submit(executor, () -> links.linkPrediction(g));
        CompletableFuture<List<ImpactPrediction>> impactPredictions = submit(executor,
                () -> target == null ? List.<ImpactPrediction>of() : impact.predictImpact(g, h, target));
        CompletableFuture<IncidentCorrelationReport> incidentReport = submit(executor,
                () -> incidents.correlate(feed, g));
        CompletableFuture<List<RiskScore>> heatmap = submit(executor, () -> risk.riskHeatmap(g, h, feed));

        return new AnalysisReport(
                g.stats(),
                await(transposed),
                await(cooccurrence),
                await(scores),
                await(critical),
                await(cascades),
                await(velocity),
                await(pairs),
                await(anomalyReport),
                await(communityResult),
                await(linkPredictions),
                target,
                await(impactPredictions),
                await(incidentReport),
                await(heatmap));
    }

    /**
     * Accepts a full uid ("ci:web-01") or a bare CI id ("web-01"); null when
     * nothing matches.
     */
    static String resolveTarget(Hypergraph graph, String requested) {
        if (requested == null || requested.isBlank())
            return null;
        String s = requested.trim();
        if (graph.hasNode(s))
            return s;
        String asCi = EntityType.CI.uid(s);
        return graph.hasNode(asCi) ? asCi : null;
    }

    private static <T> CompletableFuture<T> submit(Executor executor, Supplier<T> task) {
        return CompletableFuture.supplyAsync(task, executor);
    }

    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException)
                throw (RuntimeException) cause;
            throw new IllegalStateException("Analytics task failed: " + cause.getMessage(), cause);
        }
    }
}
