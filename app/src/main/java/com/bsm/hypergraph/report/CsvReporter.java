package com.bsm.hypergraph.report;

import com.bsm.hypergraph.centrality.CriticalNode;
import com.bsm.hypergraph.risk.RiskScore;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

public class CsvReporter {

    public void generateCriticalNodes(List<CriticalNode> nodes, Path outputPath) throws IOException {
        StringBuilder csv = new StringBuilder();
        csv.append("Rank,UID,Name,Type,Composite,Degree,Betweenness,Eigenvector,Reason\n");

        int rank = 1;
        for (CriticalNode n : nodes) {
            csv.append(String.format(Locale.ROOT, "%d,%s,%s,%s,%.4f,%.4f,%.4f,%.4f,%s\n",
                    rank++,
                    escape(n.uid()),
                    escape(n.name()),
                    n.type(),
                    n.composite(),
                    n.degree(),
                    n.betweenness(),
                    n.eigenvector(),
                    escape(n.reason())));
        }

        Files.writeString(outputPath, csv.toString());
        System.out.println("CSV Report generated at: " + outputPath.toAbsolutePath());
    }

    public void generateRiskHeatmap(List<RiskScore> scores, Path outputPath) throws IOException {
        StringBuilder csv = new StringBuilder();
        csv.append("CI,Name,Risk Score,Change Frequency,Emergency Ratio,Incidents,Coupled CIs\n");

        for (RiskScore s : scores) {
            csv.append(String.format(Locale.ROOT, "%s,%s,%d,%d,%.4f,%d,%d\n",
                    escape(s.ci()),
                    escape(s.name()),
                    s.riskScore(),
                    s.factors().changeFrequency(),
                    s.factors().emergencyRatio(),
                    s.factors().incidentRate(),
                    s.factors().couplingDensity()));
        }

        Files.writeString(outputPath, csv.toString());
        System.out.println("CSV Report generated at: " + outputPath.toAbsolutePath());
    }

    static String escape(String s) {
        if (s == null)
            return "";
        if (s.contains(",") || s.contains("\"") || s.contains("\n")) {
            return "\"" + s.replace("\"", "\"\"") + "\"";
        }
        return s;
    }
}
