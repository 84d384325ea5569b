package com.notegraph.core.service.graph.model;

import java.util.Arrays;

/**
 * Kinds of vertices in the vault relationship graph.
 *
 * The storage name is what ends up in the {@code type} column of a stored node row.
 */
public enum NodeType {

    DOCUMENT("document"),
    TAG("tag"),
    CATEGORY("category"),
    LINK("link"),
    RESOURCE("resource"),
    CONCEPT("concept"),
    PERSON("person"),
    PROJECT("project");

    private final String storageName;

    NodeType(String storageName) {
        this.storageName = storageName;
    }

    public String storageName() {
        return storageName;
    }

    /**
     * Resolves a stored type name back to the enum constant.
     *
     * @throws IllegalArgumentException if the name is unknown
     */
    public static NodeType fromStorageName(String storageName) {
        return Arrays.stream(values())
                .filter(type -> type.storageName.equals(storageName))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown node type: " + storageName));
    }
}
