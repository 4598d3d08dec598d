package com.arbor.hierarchy.infrastructure.persistence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.arbor.hierarchy.domain.model.NodeMetadata;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("NodeMetadataCodec")
class NodeMetadataCodecTest {

    @Test
    @DisplayName("writes metadata as a JSON object")
    void writesJson() {
        String json = NodeMetadataCodec.toJson(NodeMetadata.of(Map.of("tags", List.of("x"))));

        assertThat(json).isEqualTo("{\"tags\":[\"x\"]}");
    }

    @Test
    @DisplayName("reads nested structures back")
    void readsNested() {
        NodeMetadata metadata = NodeMetadataCodec.fromJson("{\"address\":{\"city\":\"Lagos\"},\"floors\":3}");

        assertThat(metadata.get("floors")).isEqualTo(3);
        assertThat(metadata.get("address")).isEqualTo(Map.of("city", "Lagos"));
    }

    @Test
    @DisplayName("empty column reads as empty metadata")
    void emptyColumn() {
        assertThat(NodeMetadataCodec.fromJson("")).isSameAs(NodeMetadata.empty());
        assertThat(NodeMetadataCodec.fromJson("{}")).isSameAs(NodeMetadata.empty());
    }

    @Test
    @DisplayName("malformed JSON fails with a codec exception")
    void malformed() {
        assertThatThrownBy(() -> NodeMetadataCodec.fromJson("[1,2"))
                .isInstanceOf(NodeMetadataCodec.MetadataSerializationException.class);
    }
}
