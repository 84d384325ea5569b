package com.notegraph.core.service.graph.model;

import java.util.Map;

/**
 * Variant-specific payload carried by a graph edge.
 */
public sealed interface EdgeAttributes permits
        EdgeAttributes.ReferenceAttributes,
        EdgeAttributes.TaggedAttributes,
        EdgeAttributes.ContainsAttributes,
        EdgeAttributes.GenericEdgeAttributes {

    static Class<? extends EdgeAttributes> variantFor(EdgeType type) {
        return switch (type) {
            case REFERENCES -> ReferenceAttributes.class;
            case TAGGED -> TaggedAttributes.class;
            case CONTAINS -> ContainsAttributes.class;
            case CATEGORIZED, RELATED, PART_OF, DEPENDS_ON, SIMILAR -> GenericEdgeAttributes.class;
        };
    }

    static EdgeAttributes emptyFor(EdgeType type) {
        return switch (type) {
            case REFERENCES -> new ReferenceAttributes(null);
            case TAGGED -> new TaggedAttributes(null);
            case CONTAINS -> new ContainsAttributes(null);
            case CATEGORIZED, RELATED, PART_OF, DEPENDS_ON, SIMILAR -> new GenericEdgeAttributes(Map.of());
        };
    }

    /** Context snippet where the reference appears. */
    record ReferenceAttributes(String context) implements EdgeAttributes {}

    record TaggedAttributes(Integer count) implements EdgeAttributes {}

    /** Position of the contained resource inside its container. */
    record ContainsAttributes(Integer position) implements EdgeAttributes {}

    record GenericEdgeAttributes(Map<String, Object> values) implements EdgeAttributes {

        public GenericEdgeAttributes {
            values = values == null ? Map.of() : Map.copyOf(values);
        }
    }
}
