package io.artifacttracker.json.jackson;

import io.artifacttracker.json.spi.JsonCodec;
import io.artifacttracker.json.spi.JsonException;
import io.artifacttracker.json.spi.JsonType;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JacksonJsonCodecTest {

    private final JacksonJsonCodec codec = new JacksonJsonCodec();

    record Item(Long objectID, String formattedID, String name, Instant creationDate) {}

    record Page<T>(List<T> results, int totalResultCount) {}

    @Test
    void readsUpperCamelCasePropertiesIgnoringUnknownOnes() throws Exception {
        byte[] json = ("{\"ObjectID\": 50137325678, \"FormattedID\": \"US1\", \"Name\": \"Story\","
                + " \"CreationDate\": \"2016-01-21T21:47:08.551Z\", \"_ref\": \"x\"}").getBytes(StandardCharsets.UTF_8);

        Item item = codec.readValue(json, Item.class);

        assertThat(item.objectID()).isEqualTo(50137325678L);
        assertThat(item.formattedID()).isEqualTo("US1");
        assertThat(item.creationDate()).isEqualTo(Instant.parse("2016-01-21T21:47:08.551Z"));
    }

    @Test
    void writesUpperCamelCaseAndOmitsNulls() throws Exception {
        String json = codec.writeString(Map.of("Defect", new Item(7L, null, "Broken", null)));

        assertThat(json)
                .startsWith("{\"Defect\":{")
                .contains("\"ObjectID\":7", "\"Name\":\"Broken\"")
                .doesNotContain("FormattedID", "CreationDate");
    }

    @Test
    void readsRuntimeComposedGenericType() throws Exception {
        byte[] json = "{\"Results\": [{\"Name\": \"a\"}, {\"Name\": \"b\"}], \"TotalResultCount\": 2}"
                .getBytes(StandardCharsets.UTF_8);

        Page<Item> page = codec.readValue(json, JsonType.<Page<Item>>parameterized(Page.class, Item.class));

        assertThat(page.totalResultCount()).isEqualTo(2);
        assertThat(page.results()).extracting(Item::name).containsExactly("a", "b");
    }

    @Test
    void readsAnonymousTypeToken() throws Exception {
        byte[] json = "[{\"Name\": \"a\"}]".getBytes(StandardCharsets.UTF_8);

        List<Item> items = codec.readValue(json, new JsonType<List<Item>>() {});

        assertThat(items).singleElement().extracting(Item::name).isEqualTo("a");
    }

    @Test
    void shapeMismatchIsReportedAsJsonException() {
        byte[] json = "{\"Results\": \"not-a-list\"}".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> codec.readValue(json, JsonType.parameterized(Page.class, Item.class)))
                .isInstanceOf(JsonException.class)
                .hasMessageContaining("Page");
    }

    @Test
    void nonJsonIsReportedAsJsonException() {
        assertThatThrownBy(() -> codec.readValue("<html>".getBytes(StandardCharsets.UTF_8), Item.class))
                .isInstanceOf(JsonException.class);
    }

    @Test
    void isDiscoverableThroughServiceLoader() {
        assertThat(ServiceLoader.load(JsonCodec.class).findFirst())
                .get()
                .isInstanceOf(JacksonJsonCodec.class);
    }
}
