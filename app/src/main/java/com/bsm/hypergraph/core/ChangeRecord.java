package com.bsm.hypergraph.core;

/**
 * One change / entity pairing as delivered by the data source.
 * Rows sharing a change number form one hyperedge.
 */
public record ChangeRecord(
        /** Change request number, e.g. CHG0001234 */
        String changeNumber,

        /** ISO-8601 creation timestamp (may be null or malformed) */
        String createdAt,

        /** Critical, High, Medium, Low (null means Low) */
        String risk,

        /** Standard, Normal, Emergency */
        String changeType,

        String assignmentGroupId,
        String assignmentGroup,
        String businessServiceId,
        String businessService,

        /** Identifier of the referenced entity, without type prefix */
        String entityId,

        /** ci, group or service */
        String entityType,

        String entityName,

        /** CMDB class of the entity, e.g. cmdb_ci_linux_server */
        String entityClass) {

    /**
     * Convenience factory for the common case of a CI row.
     */
    public static ChangeRecord ci(String changeNumber, String createdAt, String risk, String changeType,
            String assignmentGroup, String businessService, String ciId, String ciClass) {
        return new ChangeRecord(changeNumber, createdAt, risk, changeType,
                null, assignmentGroup, null, businessService,
                ciId, "ci", ciId, ciClass);
    }

    public String groupKey() {
        return isBlank(assignmentGroupId) ? assignmentGroup : assignmentGroupId;
    }

    public String serviceKey() {
        return isBlank(businessServiceId) ? businessService : businessServiceId;
    }

    public static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
