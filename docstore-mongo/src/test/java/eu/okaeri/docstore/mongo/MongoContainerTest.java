package eu.okaeri.docstore.mongo;

import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import eu.okaeri.docstore.PersistencePath;
import eu.okaeri.docstore.filter.condition.Condition;
import eu.okaeri.docstore.mongo.entity.Sample;
import eu.okaeri.docstore.mongo.entity.Samples;
import eu.okaeri.docstore.pagination.PaginatedResponse;
import eu.okaeri.docstore.pagination.PaginationParams;
import eu.okaeri.docstore.repository.BulkItem;
import eu.okaeri.docstore.repository.BulkItemStatus;
import eu.okaeri.docstore.repository.BulkResponse;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the shared repository tests against a real MongoDB, plus the cases relying on
 * aggregation and unordered bulk inserts.
 */
@Testcontainers(disabledWithoutDocker = true)
public class MongoContainerTest extends AbstractMongoRepositoryTest {

    @Container
    private static final MongoDBContainer MONGO = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    @Override
    protected MongoClient createClient() {
        return MongoClients.create(MONGO.getConnectionString());
    }

    @Test
    public void test_walk_nullable_nulls_last() {
        assertThat(this.walk(1, Collections.singletonList("weight"), null, false))
            .containsExactly("s04", "s02", "s06", "s01", "s03", "s05");
        assertThat(this.walk(2, Collections.singletonList("-weight"), null, false))
            .containsExactly("s06", "s02", "s04", "s05", "s03", "s01");
    }

    @Test
    public void test_nullable_page_index() {
        PaginatedResponse<Sample> first = this.repository.list(PaginationParams.first(4), null, Collections.singletonList("weight"), (Condition) null);
        assertThat(first.getItems()).extracting(Sample::getId).containsExactly("s04", "s02", "s06", "s01");

        PaginatedResponse<Sample> second = this.repository.list(PaginationParams.builder().limit(4).next(first.getNext()).build(),
            null, Collections.singletonList("weight"), (Condition) null);
        assertThat(second.getItems()).extracting(Sample::getId).containsExactly("s03", "s05");
        assertThat(second.getIndex()).isEqualTo(4L);
        assertThat(second.hasNext()).isFalse();
    }

    @Test
    public void test_nullable_projection_hides_ranks() {
        PaginatedResponse<Sample> page = this.repository.list(PaginationParams.first(6), null, Collections.singletonList("weight"), (Condition) null);
        assertThat(page.getItems()).allMatch(sample -> sample.getProperties().isEmpty());
    }

    @Test
    public void test_bulk_create_with_existing() {
        Sample existing = Samples.create().get(1);
        Sample fresh = new Sample();
        fresh.setPath(PersistencePath.of("s07"));
        fresh.setName("golf");

        BulkResponse response = this.repository.bulkCreate(Arrays.asList(existing, fresh));

        assertThat(response.isHasErrors()).isTrue();
        assertThat(response.getItems()).extracting(BulkItem::getStatus).containsExactly(BulkItemStatus.ERROR, BulkItemStatus.OK);
        assertThat(this.repository.exists("s07")).isTrue();
    }
}
