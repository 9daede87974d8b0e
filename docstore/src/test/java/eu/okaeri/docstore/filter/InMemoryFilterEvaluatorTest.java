package eu.okaeri.docstore.filter;

import eu.okaeri.docstore.PersistenceEntity;
import eu.okaeri.docstore.PersistencePath;
import eu.okaeri.docstore.document.Document;
import eu.okaeri.docstore.document.DocumentSerializer;
import eu.okaeri.docstore.filter.condition.Condition;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static eu.okaeri.docstore.filter.predicate.SimplePredicate.eq;
import static eu.okaeri.docstore.filter.predicate.SimplePredicate.gt;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryFilterEvaluatorTest {

    private final DocumentSerializer serializer = new DocumentSerializer();
    private final InMemoryFilterEvaluator evaluator = new InMemoryFilterEvaluator(this.serializer);

    private static PersistenceEntity<Document> entity(String id, Object score, String label) {
        Document document = new Document();
        document.setPath(PersistencePath.of(id));
        document.set("score", score);
        document.set("meta", Collections.singletonMap("label", label));
        return new PersistenceEntity<>(document.getPath(), document);
    }

    private Stream<PersistenceEntity<Document>> entities() {
        return Stream.of(entity("a", 2, "x"), entity("b", null, "y"), entity("c", 1, "z"), entity("d", 3, null));
    }

    private List<String> ids(FindFilter filter) {
        return this.evaluator.applyFilter(this.entities(), filter)
            .map(entity -> entity.getPath().getValue())
            .collect(Collectors.toList());
    }

    @Test
    void orders_nulls_last_in_both_directions() {
        assertThat(this.ids(FindFilter.builder().orderBy(OrderBy.asc("score")).build())).containsExactly("c", "a", "d", "b");
        assertThat(this.ids(FindFilter.builder().orderBy(OrderBy.desc("score")).build())).containsExactly("d", "a", "c", "b");
    }

    @Test
    void identifier_is_visible_to_conditions_and_ordering() {
        FindFilter filter = FindFilter.builder()
            .where(Condition.on(Document.ID_FIELD, gt("a")))
            .orderBy(OrderBy.desc(Document.ID_FIELD))
            .skip(1)
            .limit(2)
            .build();
        assertThat(this.ids(filter)).containsExactly("c", "b");
    }

    @Test
    void nested_conditions_are_evaluated() {
        Condition condition = Condition.or(
            Condition.on("meta.label", eq("y")),
            Condition.and(Condition.on("score", gt(1)), Condition.on("meta.label", eq("x")))
        );
        assertThat(this.ids(FindFilter.builder().where(condition).orderBy(OrderBy.asc(Document.ID_FIELD)).build())).containsExactly("a", "b");
    }

    @Test
    @SuppressWarnings("unchecked")
    void projection_keeps_only_selected_paths() {
        FindFilter filter = FindFilter.builder()
            .where(Condition.on(Document.ID_FIELD, eq("a")))
            .projection(new HashSet<>(Arrays.asList("meta.label", Document.ID_FIELD)))
            .build();

        Document document = this.evaluator.applyFilter(this.entities(), filter).findFirst().orElseThrow(IllegalStateException::new).getValue();

        assertThat(document.getId()).isEqualTo("a");
        assertThat(document.getProperties()).containsOnlyKeys("meta");
        assertThat((Map<String, Object>) document.get("meta")).containsEntry("label", "x");
    }

    @Test
    void predicate_without_path_is_rejected() {
        Condition condition = Condition.and(gt(1));
        assertThatThrownBy(() -> this.evaluator.evaluateCondition(condition, this.entities().findFirst().get().getValue()))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
