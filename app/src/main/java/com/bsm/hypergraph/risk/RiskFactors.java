package com.bsm.hypergraph.risk;

/**
 * Raw inputs of a CI risk score, before normalization.
 */
public record RiskFactors(
        /** Changes touching the CI */
        int changeFrequency,

        /** Share of those changes that were emergencies */
        double emergencyRatio,

        /** Incidents raised against the CI */
        int incidentRate,

        /** Distinct CIs changed together with it */
        int couplingDensity) {
}
