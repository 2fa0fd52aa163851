package io.objection.json.jackson;

import io.objection.json.spi.ArrayNode;
import io.objection.json.spi.JsonException;
import io.objection.json.spi.JsonNode;
import io.objection.json.spi.ObjectNode;
import io.objection.json.spi.TypeRef;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JacksonJsonCodecTest {

    private final JacksonJsonCodec codec = new JacksonJsonCodec();

    record Draft(String title, int revision) {}

    record Labelled(String label) {}

    @Test
    void readTreeExposesStructure() throws Exception {
        JsonNode node = codec.readTree("{\"sessionId\":\"s1\",\"events\":[{\"data\":1},{\"data\":null}]}");

        assertThat(node.isObject()).isTrue();
        assertThat(node.get("sessionId").asText()).isEqualTo("s1");
        assertThat(node.get("sessionId").isTextual()).isTrue();
        assertThat(node.get("events").isArray()).isTrue();
        assertThat(node.get("events").size()).isEqualTo(2);
        assertThat(node.get("events").get(0).get("data").asText()).isEqualTo("1");
        assertThat(node.get("events").get(1).get("data")).isNotNull();
        assertThat(node.get("events").get(1).get("data").isObject()).isFalse();
        assertThat(node.get("missing")).isNull();
    }

    @Test
    void readTreeFromBytesAndStringAgree() throws Exception {
        String json = "[\"a\",true]";

        JsonNode fromBytes = codec.readTree(json.getBytes(StandardCharsets.UTF_8));
        JsonNode fromString = codec.readTree(json);

        assertThat(fromBytes).isEqualTo(fromString);
        List<String> texts = new ArrayList<>();
        fromBytes.elements().forEachRemaining(element -> texts.add(element.asText()));
        assertThat(texts).containsExactly("a", "true");
    }

    @Test
    void readTreeRejectsInvalidOrEmptyInput() {
        assertThatThrownBy(() -> codec.readTree("{\"events\": ["))
                .isInstanceOf(JsonException.class);
        assertThatThrownBy(() -> codec.readTree(""))
                .isInstanceOf(JsonException.class)
                .hasMessageContaining("No content");
        assertThatThrownBy(() -> codec.readTree("{} {}"))
                .isInstanceOf(JsonException.class);
    }

    @Test
    void treeBuildersWriteExpectedJson() throws Exception {
        ObjectNode action = codec.createObjectNode();
        ObjectNode key = action.putObject("key");
        key.putArray("actionPath").add("root_error");
        key.put("debugSymbol", null);
        action.put("data", "boom");

        assertThat(codec.writeString(action))
                .isEqualTo("{\"key\":{\"actionPath\":[\"root_error\"],\"debugSymbol\":null},\"data\":\"boom\"}");
    }

    @Test
    void arrayAddAllKeepsOrder() throws Exception {
        ArrayNode array = codec.createArrayNode();
        array.add("first");
        array.addAll(List.of(codec.valueToTree(2), codec.valueToTree(Map.of("k", "v"))));
        array.add((JsonNode) null);

        assertThat(codec.writeString(array)).isEqualTo("[\"first\",2,{\"k\":\"v\"},null]");
        assertThat(new String(codec.writeBytes(array), StandardCharsets.UTF_8)).isEqualTo(codec.writeString(array));
    }

    @Test
    void valueToTreeAndBackToObject() throws Exception {
        JsonNode tree = codec.valueToTree(new Draft("hello", 3));

        assertThat(tree.isObject()).isTrue();
        assertThat(tree.get("title").asText()).isEqualTo("hello");
        assertThat(tree.toObject(Draft.class)).isEqualTo(new Draft("hello", 3));
    }

    @Test
    void valueToTreeMapsNullToNullNodeAndKeepsWrappedNodes() throws Exception {
        JsonNode tree = codec.readTree("{\"a\":1}");

        assertThat(codec.valueToTree(null)).isEqualTo(codec.readTree("null"));
        assertThat(codec.valueToTree(tree)).isSameAs(tree);
    }

    @Test
    void toObjectIgnoresUnknownPropertiesButReportsTypeErrors() throws Exception {
        JsonNode extra = codec.readTree("{\"title\":\"t\",\"revision\":1,\"unknown\":true}");
        assertThat(extra.toObject(Draft.class)).isEqualTo(new Draft("t", 1));

        JsonNode wrong = codec.readTree("{\"title\":\"t\",\"revision\":\"not a number\"}");
        assertThatThrownBy(() -> wrong.toObject(Draft.class))
                .isInstanceOf(JsonException.class)
                .hasMessageContaining("revision");
    }

    @Test
    void scalarsAreNotConvertedBetweenKinds() throws Exception {
        assertThatThrownBy(() -> codec.readTree("{\"label\":5}").toObject(Labelled.class))
                .isInstanceOf(JsonException.class);
        assertThatThrownBy(() -> codec.readTree("{\"label\":true}").toObject(Labelled.class))
                .isInstanceOf(JsonException.class);
        assertThatThrownBy(() -> codec.readTree("{\"label\":1.5}").toObject(Labelled.class))
                .isInstanceOf(JsonException.class);
        assertThatThrownBy(() -> codec.readTree("\"5\"").toObject(Integer.class))
                .isInstanceOf(JsonException.class);
        assertThatThrownBy(() -> codec.readTree("{\"title\":\"t\",\"revision\":\"2\"}").toObject(Draft.class))
                .isInstanceOf(JsonException.class);
        assertThatThrownBy(() -> codec.readTree("\"true\"").toObject(Boolean.class))
                .isInstanceOf(JsonException.class);

        assertThat(codec.readTree("{\"label\":null}").toObject(Labelled.class)).isEqualTo(new Labelled(null));
        assertThat(codec.readTree("5").toObject(Integer.class)).isEqualTo(5);
    }

    @Test
    void toObjectResolvesGenericTypes() throws Exception {
        JsonNode tree = codec.readTree("[{\"title\":\"a\",\"revision\":1},{\"title\":\"b\",\"revision\":2}]");

        List<Draft> drafts = tree.toObject(new TypeRef<List<Draft>>() {});

        assertThat(drafts).containsExactly(new Draft("a", 1), new Draft("b", 2));
        assertThatThrownBy(() -> codec.readTree("[1]").toObject(new TypeRef<List<Draft>>() {}))
                .isInstanceOf(JsonException.class);
    }
}
