package com.bsm.hypergraph.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Hyperedge: one change request and every entity it touches, or (in the
 * transposed view) one entity and every change that touched it.
 */
public record Hyperedge(
        String uid,

        /** Member node uids, ordered, no duplicates */
        List<String> elements,

        Map<String, String> attributes) {

    public static final String NUMBER = "number";
    public static final String RISK = "risk";
    public static final String CHANGE_TYPE = "changeType";
    public static final String ASSIGNMENT_GROUP = "assignmentGroup";
    public static final String BUSINESS_SERVICE = "businessService";
    public static final String CREATED_AT = "createdAt";

    // Carried by transposed hyperedges so the original entity can be restored
    public static final String TYPE = "type";
    public static final String NAME = "name";
    public static final String CLASS_NAME = "className";

    public Hyperedge {
        elements = List.copyOf(elements);
        attributes = attributes == null || attributes.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public String attribute(String key) {
        return attributes.get(key);
    }

    public String attributeOr(String key, String defaultValue) {
        String value = attributes.get(key);
        return value == null || value.isBlank() ? defaultValue : value;
    }

    public int size() {
        return elements.size();
    }
}
