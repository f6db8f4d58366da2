package io.watson.json.jackson;

import io.watson.json.spi.JsonCodec;
import io.watson.json.spi.JsonCodecs;
import io.watson.json.spi.JsonException;
import io.watson.json.spi.JsonNode;
import io.watson.json.spi.JsonNodeType;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JacksonJsonCodecTest {

    private final JsonCodec codec = new JacksonJsonCodec();

    @Test
    void reportsNodeTypes() throws Exception {
        JsonNode root = codec.readTree("{\"s\":\"x\",\"n\":3,\"b\":true,\"z\":null,\"o\":{},\"a\":[1]}");

        assertThat(root.type()).isEqualTo(JsonNodeType.OBJECT);
        assertThat(root.field("s").map(JsonNode::type)).contains(JsonNodeType.STRING);
        assertThat(root.field("n").map(JsonNode::type)).contains(JsonNodeType.NUMBER);
        assertThat(root.field("b").map(JsonNode::type)).contains(JsonNodeType.BOOLEAN);
        assertThat(root.field("z").map(JsonNode::type)).contains(JsonNodeType.NULL);
        assertThat(root.field("o").map(JsonNode::type)).contains(JsonNodeType.OBJECT);
        assertThat(root.field("a").map(JsonNode::type)).contains(JsonNodeType.ARRAY);
        assertThat(root.field("missing")).isEmpty();
    }

    @Test
    void fieldsKeepDocumentOrder() throws Exception {
        JsonNode root = codec.readTree("{\"b\":1,\"a\":2,\"c\":3}");

        assertThat(root.fields()).containsOnlyKeys("b", "a", "c");
        assertThat(root.fields().keySet()).containsExactly("b", "a", "c");
    }

    @Test
    void containerAccessorsAreEmptyForOtherTypes() throws Exception {
        JsonNode root = codec.readTree("[\"x\",\"y\"]");

        assertThat(root.elements()).extracting(n -> n.textValue().orElseThrow()).containsExactly("x", "y");
        assertThat(root.fields()).isEmpty();
        assertThat(root.field("x")).isEmpty();
        assertThat(root.elements().get(0).elements()).isEmpty();
    }

    @Test
    void scalarAccessorsMatchType() throws Exception {
        JsonNode root = codec.readTree("{\"t\":true,\"s\":\"true\",\"n\":1}");

        assertThat(root.field("t").flatMap(JsonNode::booleanValue)).contains(true);
        assertThat(root.field("s").flatMap(JsonNode::booleanValue)).isEmpty();
        assertThat(root.field("s").flatMap(JsonNode::textValue)).contains("true");
        assertThat(root.field("n").flatMap(JsonNode::textValue)).isEmpty();
    }

    @Test
    void toStringIsCompactJson() throws Exception {
        JsonNode root = codec.readTree("{ \"a\" : [ 1, 2 ] }");

        assertThat(root.field("a").orElseThrow().toString()).isEqualTo("[1,2]");
    }

    @Test
    void readsFromStream() throws Exception {
        byte[] body = "{\"hostname\":{\"value\":\"h\"}}".getBytes(StandardCharsets.UTF_8);

        JsonNode root = codec.readTree(new ByteArrayInputStream(body));

        assertThat(root.field("hostname").flatMap(h -> h.field("value")).flatMap(JsonNode::textValue)).contains("h");
    }

    @Test
    void rejectsMalformedJson() {
        assertThatThrownBy(() -> codec.readTree("{not json"))
                .isInstanceOf(JsonException.class);
    }

    @Test
    void rejectsTrailingContent() {
        assertThatThrownBy(() -> codec.readTree("{} {}"))
                .isInstanceOf(JsonException.class);
    }

    @Test
    void rejectsEmptyInput() {
        assertThatThrownBy(() -> codec.readTree(new ByteArrayInputStream(new byte[0])))
                .isInstanceOf(JsonException.class);
        assertThatThrownBy(() -> codec.readTree(""))
                .isInstanceOf(JsonException.class);
    }

    @Test
    void isDiscoverableThroughServiceLoader() {
        assertThat(JsonCodecs.load()).isInstanceOf(JacksonJsonCodec.class);
    }
}
