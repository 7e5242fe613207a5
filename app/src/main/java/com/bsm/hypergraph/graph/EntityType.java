package com.bsm.hypergraph.graph;

/**
 * Kind of hypergraph node. The id doubles as the uid prefix.
 */
public enum EntityType {
    CI("ci"),
    GROUP("group"),
    SERVICE("service"),
    CHANGE("change");

    private final String id;

    EntityType(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public String prefix() {
        return id + ":";
    }

    public String uid(String key) {
        return prefix() + key;
    }

    /**
     * Resolve a type id case-insensitively; null when unknown.
     */
    public static EntityType fromId(String id) {
        if (id == null)
            return null;
        String lower = id.trim().toLowerCase();
        for (EntityType type : values()) {
            if (type.id.equals(lower))
                return type;
        }
        return null;
    }
}
