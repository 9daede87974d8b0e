package eu.okaeri.docstore;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PersistencePathTest {

    @Test
    void parse_replaces_separator() {
        PersistencePath path = PersistencePath.parse("meta.score", ".");
        assertThat(path.getValue()).isEqualTo("meta:score");
        assertThat(path.toParts()).containsExactly("meta", "score");
        assertThat(path.toMongoPath()).isEqualTo("meta.score");
        assertThat(path.toSqlIdentifier()).isEqualTo("meta_score");
    }

    @Test
    void sub_joins_with_separator() {
        assertThat(PersistencePath.of("").sub("measurements").getValue()).isEqualTo("measurements");
        assertThat(PersistencePath.of("app").sub("measurements").getValue()).isEqualTo("app:measurements");
        assertThat(PersistencePath.of("app").sub(":measurements").getValue()).isEqualTo("app:measurements");
        assertThat(PersistencePath.of("app").sub(PersistencePath.of("a")).sub("b").toSqlIdentifier()).isEqualTo("app_a_b");
    }

    @Test
    void object_id_is_generated() {
        PersistencePath first = PersistencePath.objectId();
        PersistencePath second = PersistencePath.objectId();
        assertThat(first.getValue()).hasSize(24);
        assertThat(first.isObjectId()).isTrue();
        assertThat(first).isNotEqualTo(second);
        assertThat(PersistencePath.of("m01").isObjectId()).isFalse();
    }

    @Test
    void invalid_sql_identifier_is_rejected() {
        assertThatThrownBy(() -> PersistencePath.of("1-abc").toSqlIdentifier())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("1-abc");
    }
}
