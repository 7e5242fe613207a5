package com.bsm.hypergraph.report;

import com.bsm.hypergraph.anomaly.AnomalyReport;
import com.bsm.hypergraph.anomaly.Orphan;
import com.bsm.hypergraph.anomaly.OverCoupledPair;
import com.bsm.hypergraph.anomaly.UnderCoupledPair;
import com.bsm.hypergraph.anomaly.UnexpectedPair;
import com.bsm.hypergraph.centrality.CentralityScores;
import com.bsm.hypergraph.centrality.CriticalNode;
import com.bsm.hypergraph.community.CommunityResult;
import com.bsm.hypergraph.community.CommunitySummary;
import com.bsm.hypergraph.cooccurrence.WeightedPair;
import com.bsm.hypergraph.graph.CooccurrencePair;
import com.bsm.hypergraph.graph.GraphStats;
import com.bsm.hypergraph.incident.FaultPropagation;
import com.bsm.hypergraph.incident.Hotspot;
import com.bsm.hypergraph.incident.IncidentCorrelationReport;
import com.bsm.hypergraph.incident.ServiceFingerprint;
import com.bsm.hypergraph.prediction.ImpactPrediction;
import com.bsm.hypergraph.prediction.LinkPrediction;
import com.bsm.hypergraph.risk.RiskScore;
import com.bsm.hypergraph.temporal.Cascade;
import com.bsm.hypergraph.temporal.ChangeVelocity;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Converts an AnalysisReport to JSON text, one method per result type.
 * Non-finite numbers are written as null.
 */
public class JsonReportConverter {

    public static final String TOOL = "Change Hypergraph Analytics 1.0";

    /**
     * Wraps the report with metadata and a short field glossary for external tools.
     */
    public String convertToSelfDescribingJson(AnalysisReport report) {
        return String.format(
                "{ \"metadata\": { \"generatedAt\": \"%s\", \"tool\": \"%s\", \"description\": \"Change / CI hypergraph analytics report\" }, "
                        + "\"schema\": { "
                        + "\"criticalNodes\": \"Entities ranked by composite centrality (0.3 degree, 0.3 betweenness, 0.4 eigenvector), each in [0,1].\", "
                        + "\"cascades\": \"CI pairs whose changes follow each other within the cascade window. Direction A→B means source changes first.\", "
                        + "\"weightedPairs\": \"CI pairs scored by raw count, risk, recency, group diversity and Jaccard overlap.\", "
                        + "\"anomalies\": \"Orphaned CIs, unexpectedly frequent pairs, over-coupled and under-coupled pairs.\", "
                        + "\"communities\": \"Louvain partition of the CI projection with modularity Q.\", "
                        + "\"linkPredictions\": \"Adamic-Adar scores for CI pairs never changed together.\", "
                        + "\"riskHeatmap\": \"0-100 per-CI risk from change frequency, emergency ratio, incidents and coupling.\" "
                        + "}, \"report\": %s }",
                Instant.now().toString(), TOOL, convertToReportJson(report));
    }

    public String convertToReportJson(AnalysisReport r) {
        return String.format(
                "{ \"graphStats\": %s, \"transposedStats\": %s, \"cooccurrence\": %s, \"centrality\": %s, "
                        + "\"criticalNodes\": %s, \"cascades\": %s, \"velocity\": %s, \"weightedPairs\": %s, "
                        + "\"anomalies\": %s, \"communities\": %s, \"linkPredictions\": %s, \"impactTarget\": %s, "
                        + "\"impact\": %s, \"incidents\": %s, \"riskHeatmap\": %s }",
                statsToJson(r.graphStats()), statsToJson(r.transposedStats()),
                array(r.cooccurrence(), this::cooccurrenceToJson),
                centralityToJson(r.centrality()),
                array(r.criticalNodes(), this::criticalNodeToJson),
                array(r.cascades(), this::cascadeToJson),
                object(r.velocity(), this::velocityToJson),
                array(r.weightedPairs(), this::weightedPairToJson),
                anomaliesToJson(r.anomalies()),
                communitiesToJson(r.communities()),
                array(r.linkPredictions(), this::linkPredictionToJson),
                quote(r.impactTarget()),
                array(r.impact(), this::impactToJson),
                incidentsToJson(r.incidents()),
                array(r.riskHeatmap(), this::riskToJson));
    }

    String statsToJson(GraphStats s) {
        if (s == null)
            return "null";
        return String.format(
                "{ \"totalNodes\": %d, \"totalEdges\": %d, \"density\": %s, \"avgDegree\": %s, \"maxDegree\": %d, "
                        + "\"minDegree\": %d, \"avgEdgeSize\": %s, \"maxEdgeSize\": %d, \"minEdgeSize\": %d }",
                s.totalNodes(), s.totalEdges(), number(s.density()), number(s.avgDegree()), s.maxDegree(),
                s.minDegree(), number(s.avgEdgeSize()), s.maxEdgeSize(), s.minEdgeSize());
    }

    private String cooccurrenceToJson(CooccurrencePair p) {
        return String.format("{ \"a\": %s, \"b\": %s, \"count\": %d, \"sharedEdges\": %s }",
                quote(p.a()), quote(p.b()), p.count(), strings(p.sharedEdges()));
    }

    private String centralityToJson(CentralityScores c) {
        if (c == null)
            return "null";
        return String.format("{ \"degree\": %s, \"betweenness\": %s, \"eigenvector\": %s, \"composite\": %s }",
                object(c.degree(), this::score), object(c.betweenness(), this::score),
                object(c.eigenvector(), this::score), object(c.composite(), this::score));
    }

    private String criticalNodeToJson(CriticalNode n) {
        return String.format(
                "{ \"uid\": %s, \"name\": %s, \"type\": %s, \"composite\": %s, \"degree\": %s, "
                        + "\"betweenness\": %s, \"eigenvector\": %s, \"reason\": %s }",
                quote(n.uid()), quote(n.name()), quote(n.type()), number(n.composite()), number(n.degree()),
                number(n.betweenness()), number(n.eigenvector()), quote(n.reason()));
    }

    String cascadeToJson(Cascade c) {
        return String.format(
                "{ \"source\": %s, \"target\": %s, \"count\": %d, \"avgLagDays\": %s, \"direction\": %s }",
                quote(c.source()), quote(c.target()), c.count(), number(c.avgLagDays()),
                quote(c.direction() == null ? null : c.direction().label()));
    }

    String velocityToJson(ChangeVelocity v) {
        return String.format("{ \"weeks\": %s, \"avg\": %s, \"max\": %d, \"trend\": %s }",
                array(v.weeks(), String::valueOf), number(v.avg()), v.max(),
                quote(v.trend() == null ? null : v.trend().label()));
    }

    private String weightedPairToJson(WeightedPair p) {
        return String.format(
                "{ \"a\": %s, \"b\": %s, \"rawCount\": %d, \"riskWeighted\": %s, \"recencyWeighted\": %s, "
                        + "\"diversity\": %d, \"jaccard\": %s, \"composite\": %s }",
                quote(p.a()), quote(p.b()), p.rawCount(), number(p.riskWeighted()), number(p.recencyWeighted()),
                p.diversity(), number(p.jaccard()), number(p.composite()));
    }

    private String anomaliesToJson(AnomalyReport a) {
        if (a == null)
            return "null";
        return String.format(
                "{ \"unexpectedPairs\": %s, \"orphans\": %s, \"overCoupled\": %s, \"underCoupled\": %s }",
                array(a.unexpectedPairs(), this::unexpectedToJson), array(a.orphans(), this::orphanToJson),
                array(a.overCoupled(), this::overCoupledToJson), array(a.underCoupled(), this::underCoupledToJson));
    }

    private String unexpectedToJson(UnexpectedPair p) {
        return String.format(
                "{ \"a\": %s, \"b\": %s, \"nameA\": %s, \"nameB\": %s, \"classA\": %s, \"classB\": %s, "
                        + "\"actual\": %d, \"expected\": %s, \"ratio\": %s }",
                quote(p.a()), quote(p.b()), quote(p.nameA()), quote(p.nameB()), quote(p.classA()),
                quote(p.classB()), p.actual(), number(p.expected()), number(p.ratio()));
    }

    private String orphanToJson(Orphan o) {
        return String.format("{ \"uid\": %s, \"name\": %s, \"degree\": %d, \"reason\": %s }",
                quote(o.uid()), quote(o.name()), o.degree(), quote(o.reason()));
    }

    private String overCoupledToJson(OverCoupledPair p) {
        return String.format(
                "{ \"a\": %s, \"b\": %s, \"nameA\": %s, \"nameB\": %s, \"jaccard\": %s, \"sharedChanges\": %d }",
                quote(p.a()), quote(p.b()), quote(p.nameA()), quote(p.nameB()), number(p.jaccard()),
                p.sharedChanges());
    }

    private String underCoupledToJson(UnderCoupledPair p) {
        return String.format(
                "{ \"a\": %s, \"b\": %s, \"nameA\": %s, \"nameB\": %s, \"sharedService\": %s, \"reason\": %s }",
                quote(p.a()), quote(p.b()), quote(p.nameA()), quote(p.nameB()), quote(p.sharedService()),
                quote(p.reason()));
    }

    private String communitiesToJson(CommunityResult c) {
        if (c == null)
            return "null";
        return String.format("{ \"membership\": %s, \"communities\": %s, \"modularity\": %s, \"summary\": %s }",
                object(c.membership(), String::valueOf), object(c.communities(), this::strings),
                number(c.modularity()), array(c.summary(), this::summaryToJson));
    }

    private String summaryToJson(CommunitySummary s) {
        return String.format("{ \"id\": %d, \"size\": %d, \"dominantClass\": %s, \"dominantService\": %s }",
                s.id(), s.size(), quote(s.dominantClass()), quote(s.dominantService()));
    }

    private String linkPredictionToJson(LinkPrediction p) {
        return String.format("{ \"a\": %s, \"b\": %s, \"nameA\": %s, \"nameB\": %s, \"score\": %s }",
                quote(p.a()), quote(p.b()), quote(p.nameA()), quote(p.nameB()), number(p.score()));
    }

    private String impactToJson(ImpactPrediction p) {
        return String.format("{ \"ci\": %s, \"name\": %s, \"probability\": %s, \"reason\": %s }",
                quote(p.ci()), quote(p.name()), number(p.probability()), quote(p.reason()));
    }

    private String incidentsToJson(IncidentCorrelationReport i) {
        if (i == null)
            return "null";
        return String.format("{ \"faultPropagation\": %s, \"hotspots\": %s, \"serviceFingerprints\": %s }",
                array(i.faultPropagation(), this::faultToJson), array(i.hotspots(), this::hotspotToJson),
                object(i.serviceFingerprints(), this::fingerprintToJson));
    }

    private String faultToJson(FaultPropagation f) {
        return String.format("{ \"source\": %s, \"target\": %s, \"count\": %d, \"avgLagHours\": %s }",
                quote(f.source()), quote(f.target()), f.count(), number(f.avgLagHours()));
    }

    private String hotspotToJson(Hotspot h) {
        return String.format(
                "{ \"ci\": %s, \"name\": %s, \"incidentCount\": %d, \"avgPriority\": %s, \"mtbfHours\": %s }",
                quote(h.ci()), quote(h.name()), h.incidentCount(), number(h.avgPriority()), number(h.mtbfHours()));
    }

    private String fingerprintToJson(ServiceFingerprint f) {
        return String.format(
                "{ \"affectedCis\": %s, \"incidentCount\": %d, \"avgResolutionHours\": %s, \"pattern\": %s }",
                strings(f.affectedCis()), f.incidentCount(), number(f.avgResolutionHours()),
                quote(f.pattern() == null ? null : f.pattern().label()));
    }

    String riskToJson(RiskScore r) {
        String factors = r.factors() == null
                ? "null"
                : String.format(
                        "{ \"changeFrequency\": %d, \"emergencyRatio\": %s, \"incidentRate\": %d, \"couplingDensity\": %d }",
                        r.factors().changeFrequency(), number(r.factors().emergencyRatio()),
                        r.factors().incidentRate(), r.factors().couplingDensity());
        return String.format("{ \"ci\": %s, \"name\": %s, \"riskScore\": %d, \"factors\": %s }",
                quote(r.ci()), quote(r.name()), r.riskScore(), factors);
    }

    private static <T> String array(Collection<T> items, Function<T, String> toJson) {
        if (items == null)
            return "[]";
        return items.stream()
                .map(item -> item == null ? "null" : toJson.apply(item))
                .collect(Collectors.joining(", ", "[", "]"));
    }

    private static <K, V> String object(Map<K, V> map, Function<V, String> toJson) {
        if (map == null || map.isEmpty())
            return "{}";
        return map.entrySet().stream()
                .map(e -> "\"" + escapeJson(String.valueOf(e.getKey())) + "\": "
                        + (e.getValue() == null ? "null" : toJson.apply(e.getValue())))
                .collect(Collectors.joining(", ", "{ ", " }"));
    }

    private String strings(List<String> values) {
        return array(values, JsonReportConverter::quote);
    }

    String number(double d) {
        return Double.isFinite(d) ? String.valueOf(d) : "null";
    }

    private String score(Double d) {
        return number(d.doubleValue());
    }

    static String quote(String s) {
        return s == null ? "null" : "\"" + escapeJson(s) + "\"";
    }

    static String escapeJson(String s) {
        if (s == null)
            return "";
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20)
                        sb.append(String.format("\\u%04x", (int) c));
                    else
                        sb.append(c);
                }
            }
        }
        return sb.toString();
    }
}
