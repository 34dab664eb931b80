package fr.lapetina.configstore.domain.provider;

import fr.lapetina.configstore.domain.model.Item;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ItemDecoderTest {

    private static byte[] bytes(String content) {
        return content.getBytes(StandardCharsets.UTF_8);
    }

    @Nested
    @DisplayName("YamlItemDecoder")
    class YamlTests {

        private final YamlItemDecoder decoder = new YamlItemDecoder();

        @Test
        @DisplayName("should decode a list of items")
        void shouldDecodeList() throws IOException {
            String yaml = "- key: db.host\n"
                    + "  value: localhost\n"
                    + "  priority: 10\n"
                    + "- key: db.port\n"
                    + "  value: 5432\n";

            assertThat(decoder.decode(bytes(yaml))).containsExactly(
                    Item.of("db.host", "localhost", 10),
                    Item.of("db.port", "5432", 0)
            );
        }

        @Test
        @DisplayName("should decode a flat mapping at priority 0")
        void shouldDecodeMapping() throws IOException {
            String yaml = "db.host: localhost\n"
                    + "debug: true\n";

            assertThat(decoder.decode(bytes(yaml))).containsExactly(
                    Item.of("db.host", "localhost", 0),
                    Item.of("debug", "true", 0)
            );
        }

        @Test
        @DisplayName("should treat an empty document as no items")
        void shouldDecodeEmptyDocument() throws IOException {
            assertThat(decoder.decode(bytes(""))).isEmpty();
        }

        @Test
        @DisplayName("should reject malformed YAML")
        void shouldRejectMalformedYaml() {
            assertThatThrownBy(() -> decoder.decode(bytes("- key: [unclosed")))
                    .isInstanceOf(IOException.class);
        }

        @Test
        @DisplayName("should reject a scalar root and non-mapping entries")
        void shouldRejectUnexpectedShapes() {
            assertThatThrownBy(() -> decoder.decode(bytes("just text")))
                    .isInstanceOf(IOException.class);
            assertThatThrownBy(() -> decoder.decode(bytes("- one\n- two\n")))
                    .isInstanceOf(IOException.class)
                    .hasMessageContaining("#0");
        }

        @Test
        @DisplayName("should reject an invalid priority")
        void shouldRejectInvalidPriority() {
            assertThatThrownBy(() -> decoder.decode(bytes("- key: a\n  value: b\n  priority: high\n")))
                    .isInstanceOf(IOException.class)
                    .hasMessageContaining("priority");
        }

        @Test
        @DisplayName("should keep dates and timestamps as ISO-8601 text")
        void shouldKeepTimestampsAsIsoText() throws IOException {
            String yaml = "- key: release\n"
                    + "  value: 2024-01-15\n"
                    + "  priority: 1\n"
                    + "- key: cutover\n"
                    + "  value: 2024-01-15T10:30:00Z\n";

            assertThat(decoder.decode(bytes(yaml))).containsExactly(
                    Item.of("release", "2024-01-15", 1),
                    Item.of("cutover", "2024-01-15T10:30:00Z", 0)
            );
            assertThat(decoder.decode(bytes("2024-01-15: launch\n")))
                    .containsExactly(Item.of("2024-01-15", "launch", 0));
        }

        @Test
        @DisplayName("should reject a fractional priority")
        void shouldRejectFractionalPriority() {
            assertThatThrownBy(() -> decoder.decode(bytes("- key: a\n  value: b\n  priority: 1.9\n")))
                    .isInstanceOf(IOException.class)
                    .hasMessageContaining("invalid priority");
        }

        @Test
        @DisplayName("should reject a priority out of range")
        void shouldRejectOutOfRangePriority() {
            assertThatThrownBy(() -> decoder.decode(bytes("- key: a\n  priority: 99999999999999999999\n")))
                    .isInstanceOf(IOException.class)
                    .hasMessageContaining("invalid priority");
        }

        @Test
        @DisplayName("should accept an integral float priority")
        void shouldAcceptIntegralFloatPriority() throws IOException {
            assertThat(decoder.decode(bytes("- key: a\n  value: b\n  priority: 2.0\n")))
                    .containsExactly(Item.of("a", "b", 2));
        }
    }

    @Nested
    @DisplayName("JsonItemDecoder")
    class JsonTests {

        private final JsonItemDecoder decoder = new JsonItemDecoder();

        @Test
        @DisplayName("should decode a list of items")
        void shouldDecodeList() throws IOException {
            String json = "[{\"key\":\"x\",\"value\":\"1\",\"priority\":10},{\"key\":\"y\"}]";

            assertThat(decoder.decode(bytes(json))).containsExactly(
                    Item.of("x", "1", 10),
                    Item.of("y", "", 0)
            );
        }

        @Test
        @DisplayName("should reject nested values in the mapping form")
        void shouldRejectNestedValues() {
            assertThatThrownBy(() -> decoder.decode(bytes("{\"db\":{\"host\":\"x\"}}")))
                    .isInstanceOf(IOException.class)
                    .hasMessageContaining("db");
        }

        @Test
        @DisplayName("should reject malformed JSON")
        void shouldRejectMalformedJson() {
            assertThatThrownBy(() -> decoder.decode(bytes("[{\"key\":")))
                    .isInstanceOf(IOException.class);
        }

        @Test
        @DisplayName("should treat blank content as no items")
        void shouldDecodeBlankContent() throws IOException {
            assertThat(decoder.decode(bytes(""))).isEmpty();
            assertThat(decoder.decode(bytes("  \n\t\n"))).isEmpty();
        }

        @Test
        @DisplayName("should reject a fractional priority")
        void shouldRejectFractionalPriority() {
            assertThatThrownBy(() -> decoder.decode(bytes("[{\"key\":\"a\",\"priority\":1.9}]")))
                    .isInstanceOf(IOException.class)
                    .hasMessageContaining("invalid priority");
        }
    }
}
