package com.bsm.hypergraph;

import com.bsm.hypergraph.centrality.CriticalNode;
import com.bsm.hypergraph.community.CommunitySummary;
import com.bsm.hypergraph.core.AnalyticsConfig;
import com.bsm.hypergraph.core.AnalyticsRunner;
import com.bsm.hypergraph.core.ChangeRecord;
import com.bsm.hypergraph.core.CsvRecordReader;
import com.bsm.hypergraph.core.IncidentRecord;
import com.bsm.hypergraph.graph.ChangeHistory;
import com.bsm.hypergraph.graph.Entity;
import com.bsm.hypergraph.graph.GraphStats;
import com.bsm.hypergraph.graph.Hypergraph;
import com.bsm.hypergraph.graph.HypergraphStore;
import com.bsm.hypergraph.prediction.ImpactPrediction;
import com.bsm.hypergraph.report.AnalysisReport;
import com.bsm.hypergraph.report.CsvReporter;
import com.bsm.hypergraph.report.JsonReportConverter;
import com.bsm.hypergraph.risk.RiskScore;
import com.bsm.hypergraph.temporal.Cascade;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Change Hypergraph Analytics - batch analysis of change request / CI data.
 *
 * Usage: java -jar app.jar --changes <csv> [--incidents <csv>] [--entities <csv>]
 * [--config <dir>] [--output <dir>] [--target <ci>] [--parallel]
 */
public class App {

    public static final String JSON_REPORT = "hypergraph-report.json";
    public static final String CRITICAL_NODES_CSV = "hypergraph-critical-nodes.csv";
    public static final String RISK_CSV = "hypergraph-risk.csv";

    public static void main(String[] args) {
        System.out.println("=== Change Hypergraph Analytics ===");

        CliArgs cliArgs = parseArgs(args);
        if (cliArgs == null) {
            printUsage();
            System.exit(1);
        }

        try {
            new App().run(cliArgs);
        } catch (IOException | RuntimeException e) {
            System.err.println("Error: " + describe(e));
            System.exit(1);
        }
    }

    private static void printUsage() {
        System.err.println("""
                Usage: java -jar app.jar --changes <csv> [options]

                Arguments:
                  --changes <csv>    Change / entity rows, one per pairing (required)
                  --incidents <csv>  Incident feed for correlation and risk (optional)
                  --entities <csv>   Entity catalog; restricts nodes to these entities (optional)
                  --config <dir>     Directory holding hypergraph.yaml (default: current directory)
                  --output <dir>     Output directory for reports (default: current directory)
                  --target <ci>      CI id or uid to predict change impact for (optional)
                  --parallel         Run the analytics modules concurrently
                """);
    }

    record CliArgs(
            Path changes,
            Path incidents,
            Path entities,
            Path configDir,
            Path outputDir,
            String target,
            boolean parallel) {
    }

    static CliArgs parseArgs(String[] args) {
        Path changes = null;
        Path incidents = null;
        Path entities = null;
        Path configDir = Path.of(".");
        Path outputDir = Path.of(".");
        String target = null;
        boolean parallel = false;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--changes" -> {
                    if (i + 1 < args.length)
                        changes = Path.of(args[++i]);
                }
                case "--incidents" -> {
                    if (i + 1 < args.length)
                        incidents = Path.of(args[++i]);
                }
                case "--entities" -> {
                    if (i + 1 < args.length)
                        entities = Path.of(args[++i]);
                }
                case "--config" -> {
                    if (i + 1 < args.length)
                        configDir = Path.of(args[++i]);
                }
                case "--output" -> {
                    if (i + 1 < args.length)
                        outputDir = Path.of(args[++i]);
                }
                case "--target" -> {
                    if (i + 1 < args.length)
                        target = args[++i];
                }
                case "--parallel" -> parallel = true;
                default -> System.err.println("Warning: ignoring unknown argument " + args[i]);
            }
        }

        if (changes == null) {
            return null;
        }
        return new CliArgs(changes, incidents, entities, configDir, outputDir, target, parallel);
    }

    void run(CliArgs args) throws IOException {
        AnalyticsConfig config = AnalyticsConfig.load(args.configDir());
        CsvRecordReader reader = new CsvRecordReader();

        // Phase 1: Load
        System.out.println("\n>>> PHASE 1: LOADING RECORDS <<<");
        List<ChangeRecord> records = reader.readChanges(args.changes());
        System.out.println("Read " + records.size() + " change rows from " + args.changes());

        List<IncidentRecord> incidents = List.of();
        if (args.incidents() != null) {
            incidents = reader.readIncidents(args.incidents());
            System.out.println("Read " + incidents.size() + " incidents from " + args.incidents());
        }

        List<Entity> catalog = null;
        if (args.entities() != null) {
            catalog = reader.readCatalog(args.entities());
            System.out.println("Read " + catalog.size() + " catalog entities from " + args.entities());
        }

        // Phase 2: Build
        System.out.println("\n>>> PHASE 2: BUILDING HYPERGRAPH <<<");
        HypergraphStore store = new HypergraphStore();
        Hypergraph graph = store.build(records, catalog);
        ChangeHistory history = ChangeHistory.from(records);
        printStats(graph.stats());

        // Phase 3: Analyze
        System.out.println("\n>>> PHASE 3: RUNNING ANALYTICS <<<");
        AnalyticsRunner runner = new AnalyticsRunner(config);
        long start = System.currentTimeMillis();
        AnalysisReport report;
        if (args.parallel()) {
            int threads = Math.max(2, Runtime.getRuntime().availableProcessors());
            ExecutorService pool = Executors.newFixedThreadPool(threads);
            try {
                System.out.println("Running modules on " + threads + " threads");
                report = runner.run(graph, history, incidents, args.target(), pool);
            } finally {
                pool.shutdown();
                awaitShutdown(pool);
            }
        } else {
            report = runner.run(graph, history, incidents, args.target());
        }
        System.out.printf("Analytics completed in %d ms%n", System.currentTimeMillis() - start);

        if (args.target() != null && report.impactTarget() == null) {
            System.err.println("Warning: impact target not found in graph: " + args.target());
        }

        printCriticalNodes(report.criticalNodes());

        // Phase 4: Reports
        System.out.println("\n>>> PHASE 4: GENERATING REPORTS <<<");
        Files.createDirectories(args.outputDir());
        Path jsonPath = args.outputDir().resolve(JSON_REPORT);
        Files.writeString(jsonPath, new JsonReportConverter().convertToSelfDescribingJson(report));
        System.out.println("JSON Report generated at: " + jsonPath.toAbsolutePath());

        CsvReporter csv = new CsvReporter();
        csv.generateCriticalNodes(report.criticalNodes(), args.outputDir().resolve(CRITICAL_NODES_CSV));
        csv.generateRiskHeatmap(report.riskHeatmap(), args.outputDir().resolve(RISK_CSV));

        printSummary(report);
    }

    private static void awaitShutdown(ExecutorService pool) {
        try {
            if (!pool.awaitTermination(30, TimeUnit.SECONDS)) {
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void printStats(GraphStats stats) {
        System.out.printf("Nodes: %d | Hyperedges: %d | Density: %.4f%n",
                stats.totalNodes(), stats.totalEdges(), stats.density());
        System.out.printf("Degree avg/max/min: %.2f / %d / %d%n",
                stats.avgDegree(), stats.maxDegree(), stats.minDegree());
        System.out.printf("Edge size avg/max/min: %.2f / %d / %d%n",
                stats.avgEdgeSize(), stats.maxEdgeSize(), stats.minEdgeSize());
    }

    private void printCriticalNodes(List<CriticalNode> nodes) {
        System.out.println("\n| %-40s | %-7s | %-9s | %-9s | %-9s | %-9s |".formatted(
                "Node", "Type", "Composite", "Degree", "Between", "Eigen"));
        System.out.println("|" + "-".repeat(42) + "|" + "-".repeat(9) + "|" + "-".repeat(11) + "|"
                + "-".repeat(11) + "|" + "-".repeat(11) + "|" + "-".repeat(11) + "|");
        for (CriticalNode n : nodes) {
            System.out.println("| %-40s | %-7s | %-9.4f | %-9.4f | %-9.4f | %-9.4f |".formatted(
                    truncate(n.name(), 40), n.type(), n.composite(), n.degree(), n.betweenness(), n.eigenvector()));
        }
    }

    private void printSummary(AnalysisReport report) {
        System.out.println("\n=== SUMMARY ===");
        System.out.printf("  %-25s: %d%n", "Cascades", report.cascades().size());
        System.out.printf("  %-25s: %d%n", "CIs with velocity", report.velocity().size());
        System.out.printf("  %-25s: %d%n", "Anomalies", report.anomalies().total());
        System.out.printf("  %-25s: %d (Q = %.4f)%n", "Communities",
                report.communities().count(), report.communities().modularity());
        System.out.printf("  %-25s: %d%n", "Link predictions", report.linkPredictions().size());
        System.out.printf("  %-25s: %d%n", "Incident hotspots", report.incidents().hotspots().size());

        if (!report.cascades().isEmpty()) {
            System.out.println("\nTop Cascades:");
            report.cascades().stream().limit(5).forEach((Cascade c) -> System.out.printf(
                    "  %s %s %s (%d times, avg %.2f days)%n",
                    c.source(), c.direction(), c.target(), c.count(), c.avgLagDays()));
        }

        if (!report.communities().summary().isEmpty()) {
            System.out.println("\nLargest Communities:");
            for (CommunitySummary s : report.communities().summary().stream().limit(5).toList()) {
                System.out.printf("  #%d: %d CIs, mostly %s, service %s%n",
                        s.id(), s.size(), s.dominantClass(), s.dominantService());
            }
        }

        List<RiskScore> topRisks = report.riskHeatmap().stream().limit(5).toList();
        if (!topRisks.isEmpty()) {
            System.out.println("\nTop 5 Risk CIs:");
            for (int i = 0; i < topRisks.size(); i++) {
                RiskScore r = topRisks.get(i);
                System.out.printf("  %d. %s (Risk: %d)%n", i + 1, truncate(r.name(), 40), r.riskScore());
            }
        }

        if (report.impactTarget() != null) {
            System.out.println("\nImpact of changing " + report.impactTarget() + ":");
            for (ImpactPrediction p : report.impact().stream().limit(10).toList()) {
                System.out.printf("  %-40s %.4f  %s%n", truncate(p.name(), 40), p.probability(), p.reason());
            }
        }
    }

    private static String truncate(String s, int len) {
        if (s == null)
            return "";
        if (s.length() <= len)
            return s;
        return "..." + s.substring(s.length() - (len - 3));
    }

    private static String describe(Exception e) {
        if (e instanceof NoSuchFileException)
            return "file not found: " + e.getMessage();
        return e.getMessage();
    }
}
