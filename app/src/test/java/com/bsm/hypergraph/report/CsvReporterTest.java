package com.bsm.hypergraph.report;

import com.bsm.hypergraph.centrality.CriticalNode;
import com.bsm.hypergraph.risk.RiskFactors;
import com.bsm.hypergraph.risk.RiskScore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CsvReporterTest {

    @TempDir
    Path tempDir;

    private final CsvReporter reporter = new CsvReporter();

    @Test
    void testCriticalNodesCsv() throws IOException {
        Path out = tempDir.resolve("critical.csv");
        List<CriticalNode> nodes = List.of(
                new CriticalNode("ci:web", "Web, primary", "ci", 1.0, 1.0, 0.5, 0.25, CriticalNode.REASON_HUB),
                new CriticalNode("ci:db", "DB", "ci", 0.5, 0.5, 0.0, 1.0, CriticalNode.REASON_INFLUENCE));

        reporter.generateCriticalNodes(nodes, out);

        List<String> lines = Files.readAllLines(out);
        assertEquals(3, lines.size());
        assertEquals("Rank,UID,Name,Type,Composite,Degree,Betweenness,Eigenvector,Reason", lines.get(0));
        assertTrue(lines.get(1).startsWith("1,ci:web,\"Web, primary\",ci,1.0000,1.0000,0.5000,0.2500,"),
                "Name with a comma should be quoted: " + lines.get(1));
        assertTrue(lines.get(2).startsWith("2,ci:db,DB,ci,0.5000"));
    }

    @Test
    void testRiskHeatmapCsv() throws IOException {
        Path out = tempDir.resolve("risk.csv");
        reporter.generateRiskHeatmap(List.of(
                new RiskScore("ci:web", "Web", 83, new RiskFactors(3, 0.3333, 2, 4))), out);

        List<String> lines = Files.readAllLines(out);
        assertEquals("CI,Name,Risk Score,Change Frequency,Emergency Ratio,Incidents,Coupled CIs", lines.get(0));
        assertEquals("ci:web,Web,83,3,0.3333,2,4", lines.get(1));
    }

    @Test
    void testEscape() {
        assertEquals("plain", CsvReporter.escape("plain"));
        assertEquals("\"a \"\"b\"\"\"", CsvReporter.escape("a \"b\""));
        assertEquals("", CsvReporter.escape(null));
    }
}
