package com.bsm.hypergraph.risk;

public record RiskScore(String ci, String name, int riskScore, RiskFactors factors) {
}
