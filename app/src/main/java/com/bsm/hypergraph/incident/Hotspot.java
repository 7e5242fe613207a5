package com.bsm.hypergraph.incident;

public record Hotspot(
        String ci,
        String name,
        int incidentCount,
        double avgPriority,

        /** Mean time between failures; 0 with fewer than two dated incidents */
        double mtbfHours) {
}
