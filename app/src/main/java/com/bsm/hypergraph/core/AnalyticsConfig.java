package com.bsm.hypergraph.core;

import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Configuration for the hypergraph analytics.
 * Loaded from hypergraph.yaml in the given directory or uses the built-in defaults.
 */
public class AnalyticsConfig {

    public static final String FILE_NAME = "hypergraph.yaml";

    // Centrality
    private int betweennessSamples = 200;
    private int powerIterations = 20;
    private double weightDegree = 0.3;
    private double weightBetweenness = 0.3;
    private double weightEigenvector = 0.4;

    // Temporal
    private int cascadeWindowDays = 7;
    private int cascadeLimit = 30;
    private double trendThreshold = 0.25;

    // Weighted co-occurrence
    private int halfLifeDays = 30;
    private double weightRaw = 0.25;
    private double weightRisk = 0.25;
    private double weightRecency = 0.2;
    private double weightDiversity = 0.15;
    private double weightJaccard = 0.15;

    // Anomaly thresholds
    private double unexpectedRatio = 2.0;
    private double overcouplingJaccard = 0.5;

    // Community
    private int maxPasses = 50;

    // Impact prediction
    private double weightImpactCooccurrence = 0.35;
    private double weightImpactCascade = 0.25;
    private double weightImpactService = 0.2;
    private double weightImpactProximity = 0.2;

    // Incident correlation
    private int propagationWindowHours = 24;
    private int concentratedMaxCis = 3;

    // Result sizes
    private int topCriticalNodes = 10;
    private int topCooccurrence = 20;
    private int topWeightedPairs = 30;
    private int topLinkPredictions = 20;

    /**
     * Load configuration from YAML file or return defaults.
     */
    public static AnalyticsConfig load(Path directory) {
        AnalyticsConfig config = new AnalyticsConfig();
        Path configFile = directory.resolve(FILE_NAME);

        if (Files.exists(configFile)) {
            try (InputStream is = Files.newInputStream(configFile)) {
                Yaml yaml = new Yaml();
                Map<String, Object> data = yaml.load(is);
                if (data != null) {
                    config.parseYaml(data);
                }
                System.out.println("Loaded configuration from: " + configFile);
            } catch (IOException | RuntimeException e) {
                System.err.println("Warning: Could not read config file, using defaults: " + e.getMessage());
                return new AnalyticsConfig();
            }
        }
        return config;
    }

    public static AnalyticsConfig defaults() {
        return new AnalyticsConfig();
    }

    private void parseYaml(Map<String, Object> data) {
        Map<String, Object> centrality = section(data, "centrality");
        betweennessSamples = getInt(centrality, "betweenness_samples", betweennessSamples);
        powerIterations = getInt(centrality, "power_iterations", powerIterations);
        Map<String, Object> cw = section(centrality, "weights");
        weightDegree = getDouble(cw, "degree", weightDegree);
        weightBetweenness = getDouble(cw, "betweenness", weightBetweenness);
        weightEigenvector = getDouble(cw, "eigenvector", weightEigenvector);

        Map<String, Object> temporal = section(data, "temporal");
        cascadeWindowDays = getInt(temporal, "cascade_window_days", cascadeWindowDays);
        cascadeLimit = getInt(temporal, "cascade_limit", cascadeLimit);
        trendThreshold = getDouble(temporal, "trend_threshold", trendThreshold);

        Map<String, Object> cooccurrence = section(data, "cooccurrence");
        halfLifeDays = getInt(cooccurrence, "half_life_days", halfLifeDays);
        Map<String, Object> ow = section(cooccurrence, "weights");
        weightRaw = getDouble(ow, "raw", weightRaw);
        weightRisk = getDouble(ow, "risk", weightRisk);
        weightRecency = getDouble(ow, "recency", weightRecency);
        weightDiversity = getDouble(ow, "diversity", weightDiversity);
        weightJaccard = getDouble(ow, "jaccard", weightJaccard);

        Map<String, Object> anomaly = section(data, "anomaly");
        unexpectedRatio = getDouble(anomaly, "unexpected_ratio", unexpectedRatio);
        overcouplingJaccard = getDouble(anomaly, "overcoupling_jaccard", overcouplingJaccard);

        Map<String, Object> community = section(data, "community");
        maxPasses = getInt(community, "max_passes", maxPasses);

        Map<String, Object> pw = section(section(data, "prediction"), "weights");
        weightImpactCooccurrence = getDouble(pw, "cooccurrence", weightImpactCooccurrence);
        weightImpactCascade = getDouble(pw, "cascade", weightImpactCascade);
        weightImpactService = getDouble(pw, "service", weightImpactService);
        weightImpactProximity = getDouble(pw, "proximity", weightImpactProximity);

        Map<String, Object> incident = section(data, "incident");
        propagationWindowHours = getInt(incident, "propagation_window_hours", propagationWindowHours);
        concentratedMaxCis = getInt(incident, "concentrated_max_cis", concentratedMaxCis);

        Map<String, Object> topN = section(data, "top_n");
        topCriticalNodes = getInt(topN, "critical_nodes", topCriticalNodes);
        topCooccurrence = getInt(topN, "cooccurrence", topCooccurrence);
        topWeightedPairs = getInt(topN, "weighted_pairs", topWeightedPairs);
        topLinkPredictions = getInt(topN, "link_predictions", topLinkPredictions);
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> section(Map<String, Object> map, String key) {
        Object val = map.get(key);
        if (val instanceof Map)
            return (Map<String, Object>) val;
        return Map.of();
    }

    private int getInt(Map<String, Object> map, String key, int defaultVal) {
        Object val = map.get(key);
        if (val instanceof Number)
            return ((Number) val).intValue();
        return defaultVal;
    }

    private double getDouble(Map<String, Object> map, String key, double defaultVal) {
        Object val = map.get(key);
        if (val instanceof Number)
            return ((Number) val).doubleValue();
        return defaultVal;
    }

    // === Getters ===

    // Centrality
    public int getBetweennessSamples() {
        return betweennessSamples;
    }

    public int getPowerIterations() {
        return powerIterations;
    }

    public double getWeightDegree() {
        return weightDegree;
    }

    public double getWeightBetweenness() {
        return weightBetweenness;
    }

    public double getWeightEigenvector() {
        return weightEigenvector;
    }

    // Temporal
    public int getCascadeWindowDays() {
        return cascadeWindowDays;
    }

    public int getCascadeLimit() {
        return cascadeLimit;
    }

    public double getTrendThreshold() {
        return trendThreshold;
    }

    // Weighted co-occurrence
    public int getHalfLifeDays() {
        return halfLifeDays;
    }

    public double getWeightRaw() {
        return weightRaw;
    }

    public double getWeightRisk() {
        return weightRisk;
    }

    public double getWeightRecency() {
        return weightRecency;
    }

    public double getWeightDiversity() {
        return weightDiversity;
    }

    public double getWeightJaccard() {
        return weightJaccard;
    }

    // Anomaly
    public double getUnexpectedRatio() {
        return unexpectedRatio;
    }

    public double getOvercouplingJaccard() {
        return overcouplingJaccard;
    }

    // Community
    public int getMaxPasses() {
        return maxPasses;
    }

    // Impact prediction
    public double getWeightImpactCooccurrence() {
        return weightImpactCooccurrence;
    }

    public double getWeightImpactCascade() {
        return weightImpactCascade;
    }

    public double getWeightImpactService() {
        return weightImpactService;
    }

    public double getWeightImpactProximity() {
        return weightImpactProximity;
    }

    // Incident correlation
    public int getPropagationWindowHours() {
        return propagationWindowHours;
    }

    public int getConcentratedMaxCis() {
        return concentratedMaxCis;
    }

    // Result sizes
    public int getTopCriticalNodes() {
        return topCriticalNodes;
    }

    public int getTopCooccurrence() {
        return topCooccurrence;
    }

    public int getTopWeightedPairs() {
        return topWeightedPairs;
    }

    public int getTopLinkPredictions() {
        return topLinkPredictions;
    }
}
