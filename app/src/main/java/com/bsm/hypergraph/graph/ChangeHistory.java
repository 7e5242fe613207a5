package com.bsm.hypergraph.graph;

import com.bsm.hypergraph.core.ChangeRecord;
import com.bsm.hypergraph.core.Scores;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Timestamped view of the raw change records: one entry per change number,
 * sorted by creation time. Used wherever the analytics need time, risk or
 * change type rather than graph structure.
 */
public final class ChangeHistory {

    public static final String DEFAULT_RISK = "Low";
    public static final String DEFAULT_CHANGE_TYPE = "Standard";
    public static final String EMERGENCY = "Emergency";

    /**
     * One change request with its CI members.
     *
     * @param createdAt epoch millis, 0 when missing or unparseable
     */
    public record ChangeEntry(
            String number,
            long createdAt,
            String risk,
            String changeType,
            String assignmentGroup,
            String businessService,
            List<String> ciUids) {

        public ChangeEntry {
            ciUids = List.copyOf(ciUids);
        }

        public boolean isEmergency() {
            return EMERGENCY.equals(changeType);
        }
    }

    private static final ChangeHistory EMPTY = new ChangeHistory(List.of());

    private final List<ChangeEntry> entries;
    private final Map<String, ChangeEntry> byNumber;

    private ChangeHistory(List<ChangeEntry> entries) {
        this.entries = List.copyOf(entries);
        Map<String, ChangeEntry> index = new LinkedHashMap<>();
        this.entries.forEach(e -> index.put(e.number(), e));
        this.byNumber = index;
    }

    public static ChangeHistory empty() {
        return EMPTY;
    }

    public static ChangeHistory from(List<ChangeRecord> records) {
        if (records == null || records.isEmpty())
            return EMPTY;

        Map<String, ChangeRecord> first = new LinkedHashMap<>();
        Map<String, Set<String>> cis = new LinkedHashMap<>();
        for (ChangeRecord rec : records) {
            if (rec == null || ChangeRecord.isBlank(rec.changeNumber()))
                continue;
            String number = rec.changeNumber().trim();
            first.putIfAbsent(number, rec);
            Set<String> members = cis.computeIfAbsent(number, n -> new LinkedHashSet<>());
            if (EntityType.fromId(rec.entityType()) == EntityType.CI && !ChangeRecord.isBlank(rec.entityId())) {
                members.add(EntityType.CI.uid(rec.entityId().trim()));
            }
        }

        List<ChangeEntry> entries = new ArrayList<>();
        for (Map.Entry<String, ChangeRecord> e : first.entrySet()) {
            ChangeRecord rec = e.getValue();
            entries.add(new ChangeEntry(
                    e.getKey(),
                    Scores.parseTimestamp(rec.createdAt()),
                    orDefault(rec.risk(), DEFAULT_RISK),
                    orDefault(rec.changeType(), DEFAULT_CHANGE_TYPE),
                    orDefault(rec.assignmentGroup(), ""),
                    orDefault(rec.businessService(), ""),
                    new ArrayList<>(cis.get(e.getKey()))));
        }
        entries.sort(Comparator.comparingLong(ChangeEntry::createdAt));
        return new ChangeHistory(entries);
    }

    private static String orDefault(String value, String defaultValue) {
        return value == null || value.isBlank() ? defaultValue : value.trim();
    }

    public List<ChangeEntry> entries() {
        return entries;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public ChangeEntry byNumber(String number) {
        return number == null ? null : byNumber.get(number);
    }

    /**
     * Newest creation time, 0 when no entry has one.
     */
    public long latestTimestamp() {
        long latest = 0;
        for (ChangeEntry entry : entries) {
            latest = Math.max(latest, entry.createdAt());
        }
        return latest;
    }

    /**
     * CI uid to the creation times of its changes, ascending. Includes 0 sentinels.
     */
    public Map<String, List<Long>> ciTimeline() {
        Map<String, List<Long>> timeline = new LinkedHashMap<>();
        for (ChangeEntry entry : entries) {
            for (String ci : entry.ciUids()) {
                timeline.computeIfAbsent(ci, k -> new ArrayList<>()).add(entry.createdAt());
            }
        }
        return timeline;
    }
}
