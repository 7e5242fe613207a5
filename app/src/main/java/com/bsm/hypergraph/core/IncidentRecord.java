package com.bsm.hypergraph.core;

/**
 * One incident from the incident feed.
 */
public record IncidentRecord(
        String number,

        /** 1 (critical) to 4 (low); null when unknown */
        Integer priority,

        String affectedCiId,
        String affectedCiName,
        String businessServiceId,
        String businessServiceName,

        /** ISO-8601 timestamps */
        String createdAt,
        String resolvedAt,

        String assignmentGroup) {

    public static final int DEFAULT_PRIORITY = 4;

    public int priorityOrDefault() {
        return priority != null && priority > 0 ? priority : DEFAULT_PRIORITY;
    }

    public boolean hasAffectedCi() {
        return !ChangeRecord.isBlank(affectedCiId);
    }

    public boolean hasBusinessService() {
        return !ChangeRecord.isBlank(businessServiceId);
    }
}
