package eu.okaeri.docstore.pagination;

import eu.okaeri.docstore.schema.DocumentSchema;
import eu.okaeri.docstore.schema.FieldType;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Arrays;
import java.util.Base64;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CursorCodecTest {

    private static final DocumentSchema SCHEMA = DocumentSchema.builder()
        .field("count", FieldType.INTEGER)
        .field("createdAt", FieldType.TIMESTAMP)
        .nullableField("score", FieldType.FLOAT)
        .field("meta.active", FieldType.BOOLEAN)
        .build();

    private final CursorCodec codec = new CursorCodec();

    private static List<SortField> fields(String... sorting) {
        return SortSpecification.parse(SCHEMA, Arrays.asList(sorting)).getFields();
    }

    private static String token(String json) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(json.getBytes(StandardCharsets.UTF_8));
    }

    private static String json(String token) {
        return new String(Base64.getUrlDecoder().decode(token), StandardCharsets.UTF_8);
    }

    @Test
    void encodes_name_value_pairs_in_sort_order() {
        Map<String, Object> document = new HashMap<>();
        document.put("_id", "abc");
        document.put("count", 7);

        String token = this.codec.encode(document, fields("-count"));

        assertThat(token).doesNotContain("=", "+", "/");
        assertThat(json(token)).isEqualTo("[[\"count\",\"7\"],[\"id\",\"abc\"]]");
    }

    @Test
    void decodes_typed_values() {
        Map<String, Object> document = new HashMap<>();
        document.put("_id", "abc");
        document.put("createdAt", "2023-01-01T00:05:00.000000000Z");
        document.put("score", null);
        Map<String, Object> meta = new HashMap<>();
        meta.put("active", true);
        document.put("meta", meta);

        List<SortField> fields = fields("createdAt", "score", "meta.active");
        Cursor cursor = this.codec.decode(this.codec.encode(document, fields), fields);

        assertThat(cursor.size()).isEqualTo(4);
        assertThat(cursor.getValue(0)).isEqualTo(Instant.parse("2023-01-01T00:05:00Z"));
        assertThat(cursor.getValue(1)).isNull();
        assertThat(cursor.getValue(2)).isEqualTo(Boolean.TRUE);
        assertThat(cursor.getValue(3)).isEqualTo("abc");
        assertThat(cursor.getEntries().get(2).getName()).isEqualTo("meta.active");
    }

    @Test
    void decodes_null_token_as_first_page() {
        assertThat(this.codec.decode(null, fields())).isNull();
    }

    @Test
    void parses_integers_as_long() {
        Cursor cursor = this.codec.decode(token("[[\"count\",\"12\"],[\"id\",\"x\"]]"), fields("count"));
        assertThat(cursor.getValue(0)).isEqualTo(12L);
    }

    @Test
    void rejects_invalid_tokens() {
        List<SortField> fields = fields("count");

        assertThatThrownBy(() -> this.codec.decode("***", fields)).isInstanceOf(MalformedCursorException.class);
        assertThatThrownBy(() -> this.codec.decode(token("not json"), fields)).isInstanceOf(MalformedCursorException.class);
        assertThatThrownBy(() -> this.codec.decode(token("{\"count\": \"1\"}"), fields)).isInstanceOf(MalformedCursorException.class);
        assertThatThrownBy(() -> this.codec.decode(token("[[\"count\",\"1\"]]"), fields))
            .isInstanceOf(MalformedCursorException.class)
            .hasMessageContaining("field(s)");
        assertThatThrownBy(() -> this.codec.decode(token("[[\"count\",\"1\"],[\"id\"]]"), fields)).isInstanceOf(MalformedCursorException.class);
        assertThatThrownBy(() -> this.codec.decode(token("[[\"other\",\"1\"],[\"id\",\"x\"]]"), fields)).isInstanceOf(MalformedCursorException.class);
        assertThatThrownBy(() -> this.codec.decode(token("[[\"count\",1],[\"id\",\"x\"]]"), fields)).isInstanceOf(MalformedCursorException.class);
        assertThatThrownBy(() -> this.codec.decode(token("[[\"count\",\"one\"],[\"id\",\"x\"]]"), fields))
            .isInstanceOf(MalformedCursorException.class)
            .hasCauseInstanceOf(NumberFormatException.class);
    }

    @Test
    void rejects_null_for_non_nullable_fields() {
        List<SortField> fields = fields("count", "score");

        assertThat(this.codec.decode(token("[[\"count\",\"1\"],[\"score\",null],[\"id\",\"x\"]]"), fields).getValue(1)).isNull();
        assertThatThrownBy(() -> this.codec.decode(token("[[\"count\",null],[\"score\",null],[\"id\",\"x\"]]"), fields))
            .isInstanceOf(MalformedCursorException.class)
            .hasMessageContaining("'count'");
        assertThatThrownBy(() -> this.codec.decode(token("[[\"id\",null]]"), fields()))
            .isInstanceOf(MalformedCursorException.class)
            .hasMessageContaining("'id'");
    }
}
