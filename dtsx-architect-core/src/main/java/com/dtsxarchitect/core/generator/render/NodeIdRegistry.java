package com.dtsxarchitect.core.generator.render;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Assigns flowchart node ids to display names for one diagram.
 *
 * <p>Ids are sanitized display names. When two different names sanitize to the same id,
 * the later one gets a {@code _2}, {@code _3}, ... suffix, so distinct names never share a
 * node. Ids depend only on registration order.
 */
public class NodeIdRegistry {

    private static final String ID_SANITIZATION_PATTERN = "[^A-Za-z0-9_]";
    private static final String EMPTY_ID = "node";

    private final Map<String, String> idsByName = new HashMap<>();
    private final Set<String> usedIds = new HashSet<>();

    /**
     * Sanitizes a display name: spaces, hyphens and dots become underscores and any other
     * character outside {@code [A-Za-z0-9_]} is dropped.
     *
     * @param name display name
     * @return sanitized id, {@value #EMPTY_ID} when nothing is left
     */
    public static String sanitize(String name) {
        if (name == null) {
            return EMPTY_ID;
        }
        String result = name.replace(' ', '_').replace('-', '_').replace('.', '_')
            .replaceAll(ID_SANITIZATION_PATTERN, "");
        return result.isEmpty() ? EMPTY_ID : result;
    }

    /**
     * Reserves an id for a subgraph title without binding the title as a node name.
     *
     * <p>Call this after the component names are registered so that components keep
     * their sanitized ids.
     *
     * @param title subgraph title
     * @return reserved id
     */
    public String reserve(String title) {
        String id = unique(sanitize(title));
        usedIds.add(id);
        return id;
    }

    /**
     * Returns the id of a display name, registering it on first use.
     *
     * @param name display name
     * @return node id
     */
    public String idFor(String name) {
        String existing = idsByName.get(name);
        if (existing != null) {
            return existing;
        }
        String id = unique(sanitize(name));
        usedIds.add(id);
        idsByName.put(name, id);
        return id;
    }

    private String unique(String base) {
        if (!usedIds.contains(base)) {
            return base;
        }
        int counter = 2;
        while (usedIds.contains(base + "_" + counter)) {
            counter++;
        }
        return base + "_" + counter;
    }
}
