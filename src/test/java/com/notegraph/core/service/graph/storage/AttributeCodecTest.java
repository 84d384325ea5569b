package com.notegraph.core.service.graph.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.notegraph.core.service.graph.model.EdgeAttributes.ReferenceAttributes;
import com.notegraph.core.service.graph.model.EdgeAttributes.TaggedAttributes;
import com.notegraph.core.service.graph.model.EdgeType;
import com.notegraph.core.service.graph.model.NodeAttributes.GenericAttributes;
import com.notegraph.core.service.graph.model.NodeAttributes.ResourceAttributes;
import com.notegraph.core.service.graph.model.NodeAttributes.TagAttributes;
import com.notegraph.core.service.graph.model.NodeType;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AttributeCodecTest {

    private final AttributeCodec codec = new AttributeCodec(new ObjectMapper());

    @Test
    void nodeTypeSelectsTheAttributeVariant() {
        var json = codec.encode(new ResourceAttributes("image", "assets/a.png", null));

        assertThat(codec.decodeNode(NodeType.RESOURCE, json))
                .isEqualTo(new ResourceAttributes("image", "assets/a.png", null));
    }

    @Test
    void genericAttributesKeepArbitraryValues() {
        var json = codec.encode(new GenericAttributes(Map.of("role", "author")));

        assertThat(codec.decodeNode(NodeType.PERSON, json))
                .isEqualTo(new GenericAttributes(Map.of("role", "author")));
    }

    @Test
    void blankPayloadDecodesToEmptyVariant() {
        assertThat(codec.decodeNode(NodeType.TAG, "")).isEqualTo(new TagAttributes(null));
        assertThat(codec.decodeEdge(EdgeType.TAGGED, null)).isEqualTo(new TaggedAttributes(null));
    }

    @Test
    void unknownPropertiesAreIgnored() {
        assertThat(codec.decodeEdge(EdgeType.REFERENCES, "{\"context\":\"intro\",\"legacy\":1}"))
                .isEqualTo(new ReferenceAttributes("intro"));
    }

    @Test
    void malformedPayloadIsRejected() {
        assertThatThrownBy(() -> codec.decodeNode(NodeType.TAG, "{not json"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
