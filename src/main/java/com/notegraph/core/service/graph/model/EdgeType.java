package com.notegraph.core.service.graph.model;

import java.util.Arrays;

/**
 * Relationship kinds between graph nodes.
 */
public enum EdgeType {

    /** Document references a wiki-link target. */
    REFERENCES("references"),
    /** Document carries a hashtag. */
    TAGGED("tagged"),
    /** Document belongs to a category. */
    CATEGORIZED("categorized"),
    CONTAINS("contains"),
    RELATED("related"),
    PART_OF("part_of"),
    DEPENDS_ON("depends_on"),
    SIMILAR("similar");

    private final String storageName;

    EdgeType(String storageName) {
        this.storageName = storageName;
    }

    public String storageName() {
        return storageName;
    }

    public static EdgeType fromStorageName(String storageName) {
        return Arrays.stream(values())
                .filter(type -> type.storageName.equals(storageName))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown edge type: " + storageName));
    }
}
