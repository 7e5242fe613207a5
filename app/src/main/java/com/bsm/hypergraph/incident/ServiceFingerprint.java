package com.bsm.hypergraph.incident;

import java.util.List;

/**
 * Incident footprint of one business service.
 */
public record ServiceFingerprint(
        List<String> affectedCis,
        int incidentCount,
        double avgResolutionHours,
        Pattern pattern) {

    public enum Pattern {
        CONCENTRATED("concentrated"),
        DISTRIBUTED("distributed");

        private final String label;

        Pattern(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }

        @Override
        public String toString() {
            return label;
        }
    }

    public ServiceFingerprint {
        affectedCis = List.copyOf(affectedCis);
    }
}
