package eu.okaeri.docstore.repository;

import eu.okaeri.docstore.PersistenceCollection;
import eu.okaeri.docstore.PersistencePath;
import eu.okaeri.docstore.document.InMemoryPersistence;
import eu.okaeri.docstore.entity.Measurement;
import eu.okaeri.docstore.entity.MeasurementMeta;
import eu.okaeri.docstore.entity.Measurements;
import eu.okaeri.docstore.filter.condition.Condition;
import eu.okaeri.docstore.pagination.InvalidPaginationStrategyException;
import eu.okaeri.docstore.pagination.PaginatedResponse;
import eu.okaeri.docstore.pagination.PaginationParams;
import eu.okaeri.docstore.pagination.PaginationStrategy;
import eu.okaeri.docstore.pagination.PaginatorRegistry;
import eu.okaeri.docstore.pagination.CursorPaginator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static eu.okaeri.docstore.filter.predicate.SimplePredicate.eq;
import static eu.okaeri.docstore.filter.predicate.SimplePredicate.gte;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DefaultDocumentRepositoryTest {

    private InMemoryPersistence persistence;
    private PersistenceCollection collection;
    private DefaultDocumentRepository<Measurement> repository;

    @BeforeEach
    void setup() {
        this.persistence = new InMemoryPersistence();
        this.collection = PersistenceCollection.of("measurements");
        this.persistence.registerCollection(this.collection);
        this.repository = new DefaultDocumentRepository<>(this.persistence, this.collection, Measurement.class, Measurements.SCHEMA);
        Measurements.create().forEach(this.repository::add);
    }

    private static Measurement measurement(int anotherId) {
        Measurement measurement = new Measurement();
        measurement.setAnotherId(anotherId);
        measurement.setCreatedAt(Measurements.minute(1));
        measurement.setIntNumber(1);
        measurement.setFloatNumber(1);
        measurement.setActive(true);
        return measurement;
    }

    @Nested
    class Reading {

        @Test
        void test_repository_count() {
            assertThat(DefaultDocumentRepositoryTest.this.repository.count()).isEqualTo(10);
        }

        @Test
        void test_repository_get() {
            Measurement measurement = DefaultDocumentRepositoryTest.this.repository.get(Measurements.id(3));
            assertThat(measurement.getAnotherId()).isEqualTo(3);
            assertThat(measurement.getCreatedAt()).isEqualTo(Measurements.minute(3));
            assertThat(measurement.isActive()).isTrue();
            assertThat(measurement.getId()).isEqualTo("m03");
            assertThat(measurement.getCollection()).isEqualTo(DefaultDocumentRepositoryTest.this.collection);
            assertThat(measurement).isEqualTo(Measurements.create().get(2));
        }

        @Test
        void test_repository_get_missing() {
            assertThatThrownBy(() -> DefaultDocumentRepositoryTest.this.repository.get("missing"))
                .isInstanceOf(EntityNotFoundException.class)
                .hasMessageContaining("missing");
            assertThat(DefaultDocumentRepositoryTest.this.repository.find("missing")).isEmpty();
        }

        @Test
        void test_repository_get_projected() {
            Measurement measurement = DefaultDocumentRepositoryTest.this.repository.get(PersistencePath.of("m07"), Arrays.asList("intNumber", "bonus"));
            assertThat(measurement.getId()).isEqualTo("m07");
            assertThat(measurement.getIntNumber()).isEqualTo(2);
            assertThat(measurement.getBonus()).isEqualTo(1);
            assertThat(measurement.getAnotherId()).isZero();
            assertThat(measurement.getCreatedAt()).isNull();
        }

        @Test
        void test_repository_exists() {
            assertThat(DefaultDocumentRepositoryTest.this.repository.exists("m01")).isTrue();
            assertThat(DefaultDocumentRepositoryTest.this.repository.exists("m99", false)).isFalse();
            assertThatThrownBy(() -> DefaultDocumentRepositoryTest.this.repository.exists("m99", true))
                .isInstanceOf(EntityNotFoundException.class);
        }

        @Test
        void test_repository_find_one() {
            assertThat(DefaultDocumentRepositoryTest.this.repository.findOne(Condition.on("anotherId", eq(8))))
                .get()
                .extracting(Measurement::getId)
                .isEqualTo("m08");
            assertThat(DefaultDocumentRepositoryTest.this.repository.findOne(Condition.on("anotherId", eq(80)))).isEmpty();
        }
    }

    @Nested
    class Listing {

        @Test
        void test_list_projection_keeps_sort_fields() {
            PaginatedResponse<Measurement> page = DefaultDocumentRepositoryTest.this.repository.list(
                PaginationParams.first(3), Collections.singletonList("active"), Collections.singletonList("-intNumber"), (Condition) null);

            assertThat(page.getItems()).extracting(Measurement::getId).containsExactly("m10", "m05", "m09");
            assertThat(page.getItems()).extracting(Measurement::getIntNumber).containsExactly(5, 5, 4);
            assertThat(page.getItems()).extracting(Measurement::getAnotherId).containsOnly(0);

            PaginatedResponse<Measurement> next = DefaultDocumentRepositoryTest.this.repository.list(
                PaginationParams.builder().limit(3).next(page.getNext()).build(), Collections.singletonList("active"), Collections.singletonList("-intNumber"), (Condition) null);
            assertThat(next.getItems()).extracting(Measurement::getId).containsExactly("m04", "m08", "m03");
            assertThat(next.getIndex()).isEqualTo(3L);
        }

        @Test
        void test_list_with_nested_projection() {
            Measurement measurement = DefaultDocumentRepositoryTest.this.repository.get("m01");
            measurement.setMeta(new MeasurementMeta("first", 3));
            DefaultDocumentRepositoryTest.this.repository.update(measurement);

            PaginatedResponse<Measurement> page = DefaultDocumentRepositoryTest.this.repository.list(
                PaginationParams.first(1), Collections.singletonList("meta.score"), null, (Condition) null);

            Measurement item = page.getItems().get(0);
            assertThat(item.getMeta().getScore()).isEqualTo(3);
            assertThat(item.getMeta().getLabel()).isNull();
        }

        @Test
        void test_list_with_condition_and_relay() {
            PaginationParams params = PaginationParams.builder().strategy(PaginationStrategy.RELAY).limit(2).build();
            PaginatedResponse<Measurement> page = DefaultDocumentRepositoryTest.this.repository.list(
                params, null, Collections.singletonList("createdAt"), Condition.on("intNumber", gte(4)));

            assertThat(page.getItems()).extracting(Measurement::getId).containsExactly("m04", "m09");
            assertThat(page.getCursors()).hasSize(2);
            assertThat(page.getTotal()).isEqualTo(4);
        }

        @Test
        void test_list_with_unknown_projection() {
            assertThatThrownBy(() -> DefaultDocumentRepositoryTest.this.repository.list(
                PaginationParams.first(1), Collections.singletonList("missing"), null, (Condition) null))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void test_list_with_unregistered_strategy() {
            DefaultDocumentRepository<Measurement> cursorOnly = new DefaultDocumentRepository<>(
                DefaultDocumentRepositoryTest.this.persistence, DefaultDocumentRepositoryTest.this.collection, Measurement.class, Measurements.SCHEMA,
                PaginatorRegistry.of(Collections.singletonMap(PaginationStrategy.CURSOR, new CursorPaginator())));
            PaginationParams params = PaginationParams.builder().strategy(PaginationStrategy.RELAY).build();

            assertThatThrownBy(() -> cursorOnly.list(params, null, null, (Condition) null))
                .isInstanceOf(InvalidPaginationStrategyException.class);
        }

        @Test
        void test_list_async() throws Exception {
            ExecutorService executor = Executors.newFixedThreadPool(2);
            try {
                PaginatedResponse<Measurement> page = DefaultDocumentRepositoryTest.this.repository
                    .listAsync(PaginationParams.first(4), null, null, null, executor)
                    .get(5, TimeUnit.SECONDS);
                assertThat(page.getItems()).extracting(Measurement::getId).containsExactly("m01", "m02", "m03", "m04");
            } finally {
                executor.shutdownNow();
            }
        }
    }

    @Nested
    class Writing {

        @Test
        void test_repository_add_generates_object_id() {
            Measurement measurement = DefaultDocumentRepositoryTest.this.repository.add(measurement(11));
            assertThat(measurement.getPath()).isNotNull();
            assertThat(measurement.getPath().isObjectId()).isTrue();
            assertThat(DefaultDocumentRepositoryTest.this.repository.get(measurement.getId()).getAnotherId()).isEqualTo(11);
        }

        @Test
        void test_repository_add_existing() {
            Measurement existing = Measurements.create().get(0);
            assertThatThrownBy(() -> DefaultDocumentRepositoryTest.this.repository.add(existing))
                .isInstanceOf(EntityAlreadyExistsException.class)
                .hasMessageContaining("m01");
        }

        @Test
        void test_repository_update() {
            DefaultDocumentRepositoryTest.this.repository.update("m02", measurement -> measurement.setBonus(42));
            assertThat(DefaultDocumentRepositoryTest.this.repository.get("m02").getBonus()).isEqualTo(42);

            Measurement unsaved = measurement(12);
            unsaved.setPath(PersistencePath.of("m12"));
            assertThatThrownBy(() -> DefaultDocumentRepositoryTest.this.repository.update(unsaved))
                .isInstanceOf(EntityNotFoundException.class);
            assertThat(DefaultDocumentRepositoryTest.this.repository.exists("m12")).isFalse();
        }

        @Test
        void test_repository_delete() {
            Measurement measurement = DefaultDocumentRepositoryTest.this.repository.get("m01");
            assertThat(DefaultDocumentRepositoryTest.this.repository.delete(measurement)).isTrue();
            assertThat(DefaultDocumentRepositoryTest.this.repository.deleteById("m02")).isTrue();
            assertThat(DefaultDocumentRepositoryTest.this.repository.deleteById("m02")).isFalse();
            assertThat(DefaultDocumentRepositoryTest.this.repository.count()).isEqualTo(8);
        }

        @Test
        void test_stored_state_is_detached() {
            Measurement measurement = DefaultDocumentRepositoryTest.this.repository.get("m01");
            measurement.setIntNumber(100);
            assertThat(DefaultDocumentRepositoryTest.this.repository.get("m01").getIntNumber()).isEqualTo(1);
        }
    }

    @Nested
    class Bulk {

        @Test
        void test_bulk_create() {
            List<Measurement> measurements = IntStream.range(0, 10)
                .mapToObj(i -> measurement(1))
                .collect(Collectors.toList());

            BulkResponse response = DefaultDocumentRepositoryTest.this.repository.bulkCreate(measurements);

            assertThat(response.isHasErrors()).isFalse();
            assertThat(response.getItems()).hasSize(10).allMatch(item -> item.getStatus() == BulkItemStatus.OK);
            assertThat(response.getItems()).allMatch(item -> PersistencePath.of(item.getId()).isObjectId());
            assertThat(DefaultDocumentRepositoryTest.this.repository.count()).isEqualTo(20);
        }

        @Test
        void test_bulk_create_with_duplicates() {
            PersistencePath path = PersistencePath.objectId();
            List<Measurement> measurements = new ArrayList<>();
            for (int i = 0; i < 10; i++) {
                Measurement measurement = measurement(1);
                measurement.setPath(path);
                measurements.add(measurement);
            }

            BulkResponse response = DefaultDocumentRepositoryTest.this.repository.bulkCreate(measurements);

            assertThat(response.isHasErrors()).isTrue();
            assertThat(response.getItems().get(0).getStatus()).isEqualTo(BulkItemStatus.OK);
            assertThat(response.getItems().get(0).getId()).isEqualTo(path.getValue());
            assertThat(response.getItems().subList(1, 10)).allMatch(item -> item.isError() && (item.getDetail() != null));
        }

        @Test
        void test_bulk_create_with_existing() {
            Measurement existing = Measurements.create().get(4);
            Measurement fresh = measurement(11);

            BulkResponse response = DefaultDocumentRepositoryTest.this.repository.bulkCreate(Arrays.asList(existing, fresh));

            assertThat(response.getItems()).extracting(BulkItem::getStatus).containsExactly(BulkItemStatus.ERROR, BulkItemStatus.OK);
            assertThat(response.getItems().get(0).getId()).isEqualTo("m05");
        }

        @Test
        void test_bulk_update() {
            Measurement existing = DefaultDocumentRepositoryTest.this.repository.get("m01");
            existing.setIntNumber(50);
            Measurement missing = measurement(13);
            missing.setPath(PersistencePath.of("m13"));

            BulkResponse response = DefaultDocumentRepositoryTest.this.repository.bulkUpdate(Arrays.asList(existing, missing), false);
            assertThat(response.getItems()).extracting(BulkItem::getStatus).containsExactly(BulkItemStatus.OK, BulkItemStatus.ERROR);
            assertThat(DefaultDocumentRepositoryTest.this.repository.get("m01").getIntNumber()).isEqualTo(50);
            assertThat(DefaultDocumentRepositoryTest.this.repository.exists("m13")).isFalse();

            BulkResponse upserted = DefaultDocumentRepositoryTest.this.repository.bulkUpdate(Collections.singletonList(missing), true);
            assertThat(upserted.isHasErrors()).isFalse();
            assertThat(DefaultDocumentRepositoryTest.this.repository.exists("m13")).isTrue();
        }

        @Test
        void test_bulk_delete() {
            long deleted = DefaultDocumentRepositoryTest.this.repository.bulkDelete(Arrays.asList("m01", PersistencePath.of("m02"), "m99"));
            assertThat(deleted).isEqualTo(2);
            assertThat(DefaultDocumentRepositoryTest.this.repository.count()).isEqualTo(8);
        }

        @Test
        void test_bulk_upsert() {
            Measurement existing = DefaultDocumentRepositoryTest.this.repository.get("m03");
            existing.setBonus(7);
            Measurement missing = measurement(14);
            missing.setPath(PersistencePath.of("m14"));

            BulkResponse response = DefaultDocumentRepositoryTest.this.repository.bulkUpsert(Arrays.asList(existing, missing), measurement -> {
                measurement.setBonus(-1);
                return measurement;
            });

            assertThat(response.isHasErrors()).isFalse();
            assertThat(DefaultDocumentRepositoryTest.this.repository.get("m03").getBonus()).isEqualTo(7);
            assertThat(DefaultDocumentRepositoryTest.this.repository.get("m14").getBonus()).isEqualTo(-1);
        }
    }
}
