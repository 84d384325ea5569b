package com.notegraph.core.service.graph.model;

import java.util.Map;

/**
 * Variant-specific payload carried by a graph node.
 *
 * Every node row stores its attributes as JSON; the node type decides which
 * variant the JSON is read back into.
 */
public sealed interface NodeAttributes permits
        NodeAttributes.DocumentAttributes,
        NodeAttributes.TagAttributes,
        NodeAttributes.CategoryAttributes,
        NodeAttributes.LinkAttributes,
        NodeAttributes.ResourceAttributes,
        NodeAttributes.GenericAttributes {

    /**
     * Returns the payload class used for the given node type.
     */
    static Class<? extends NodeAttributes> variantFor(NodeType type) {
        return switch (type) {
            case DOCUMENT -> DocumentAttributes.class;
            case TAG -> TagAttributes.class;
            case CATEGORY -> CategoryAttributes.class;
            case LINK -> LinkAttributes.class;
            case RESOURCE -> ResourceAttributes.class;
            case CONCEPT, PERSON, PROJECT -> GenericAttributes.class;
        };
    }

    /**
     * Returns an empty payload of the right variant for the given node type.
     */
    static NodeAttributes emptyFor(NodeType type) {
        return switch (type) {
            case DOCUMENT -> new DocumentAttributes(null, null);
            case TAG -> new TagAttributes(null);
            case CATEGORY -> new CategoryAttributes(null);
            case LINK -> new LinkAttributes(null, false);
            case RESOURCE -> new ResourceAttributes(null, null, null);
            case CONCEPT, PERSON, PROJECT -> new GenericAttributes(Map.of());
        };
    }

    record DocumentAttributes(String path, String docType) implements NodeAttributes {}

    record TagAttributes(String tagName) implements NodeAttributes {}

    record CategoryAttributes(String categoryName) implements NodeAttributes {}

    /**
     * Wiki-link target. {@code resolved} stays false: targets are never matched against documents.
     */
    record LinkAttributes(String target, boolean resolved) implements NodeAttributes {}

    record ResourceAttributes(String resourceType, String resourcePath, String resourceUrl)
            implements NodeAttributes {}

    record GenericAttributes(Map<String, Object> values) implements NodeAttributes {

        public GenericAttributes {
            values = values == null ? Map.of() : Map.copyOf(values);
        }
    }
}
