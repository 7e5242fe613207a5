package com.bsm.hypergraph.graph;

import com.bsm.hypergraph.core.ChangeRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * Builders for small change data sets used across the analytics tests.
 */
public final class GraphFixtures {

    private GraphFixtures() {
    }

    /**
     * One row per CI of a change with no group or service, so only CI nodes exist.
     */
    public static List<ChangeRecord> change(String number, String createdAt, String... ciIds) {
        List<ChangeRecord> rows = new ArrayList<>();
        for (String ci : ciIds) {
            rows.add(ChangeRecord.ci(number, createdAt, null, null, null, null, ci, null));
        }
        return rows;
    }

    public static List<ChangeRecord> changeWith(String number, String createdAt, String risk, String changeType,
            String group, String service, String... ciIds) {
        List<ChangeRecord> rows = new ArrayList<>();
        for (String ci : ciIds) {
            rows.add(ChangeRecord.ci(number, createdAt, risk, changeType, group, service, ci, null));
        }
        return rows;
    }

    @SafeVarargs
    public static List<ChangeRecord> rows(List<ChangeRecord>... changes) {
        List<ChangeRecord> all = new ArrayList<>();
        for (List<ChangeRecord> c : changes) {
            all.addAll(c);
        }
        return all;
    }

    public static Hypergraph graph(List<ChangeRecord> records) {
        return new HypergraphStore().build(records);
    }

    public static String ci(String id) {
        return EntityType.CI.uid(id);
    }
}
