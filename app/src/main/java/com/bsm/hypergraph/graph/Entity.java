package com.bsm.hypergraph.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Hypergraph node: a CI, assignment group, business service, or (in the
 * transposed view) a change request.
 */
public record Entity(
        /** Type-prefixed unique id, e.g. ci:web-01 */
        String uid,

        EntityType type,

        String name,

        /** CMDB class for CIs, null otherwise */
        String className,

        /** Extra descriptive attributes */
        Map<String, String> attributes) {

    public static final String UNKNOWN_CLASS = "unknown";

    public Entity {
        attributes = attributes == null || attributes.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static Entity of(EntityType type, String key, String name, String className) {
        return new Entity(type.uid(key), type, name == null || name.isBlank() ? key : name, className, Map.of());
    }

    public boolean isCi() {
        return type == EntityType.CI;
    }

    public String classNameOrUnknown() {
        return className == null || className.isBlank() ? UNKNOWN_CLASS : className;
    }
}
