package eu.okaeri.docstore.mongo;

import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import eu.okaeri.docstore.PersistenceCollection;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MongoPersistenceBuilderTest {

    @Test
    void build_throws_when_client_missing() {
        assertThatThrownBy(() -> MongoPersistence.builder()
            .basePath("myapp")
            .databaseName("testdb")
            .build())
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("client");
    }

    @Test
    void build_throws_when_databaseName_missing() {
        MongoClient mockClient = mock(MongoClient.class);

        assertThatThrownBy(() -> MongoPersistence.builder()
            .basePath("myapp")
            .client(mockClient)
            .build())
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("databaseName");
    }

    @Test
    @SuppressWarnings("unchecked")
    void build_pings_and_drops_indexes_on_register() {
        MongoClient mockClient = mock(MongoClient.class);
        MongoDatabase mockDatabase = mock(MongoDatabase.class);
        MongoCollection<Document> mockCollection = mock(MongoCollection.class);
        when(mockClient.getDatabase("testdb")).thenReturn(mockDatabase);
        when(mockDatabase.getCollection("myapp_measurements")).thenReturn(mockCollection);

        MongoPersistence persistence = MongoPersistence.builder()
            .basePath("myapp")
            .client(mockClient)
            .databaseName("testdb")
            .build();
        assertThat(persistence.getDatabase()).isSameAs(mockDatabase);
        verify(mockDatabase).runCommand(any(Bson.class));

        persistence.registerCollection(PersistenceCollection.of("measurements").dropIndexes(true));
        persistence.registerCollection(PersistenceCollection.of("measurements").dropIndexes(true));
        verify(mockCollection).dropIndexes();
    }

    @Test
    @SuppressWarnings("unchecked")
    void register_keeps_indexes_by_default() {
        MongoClient mockClient = mock(MongoClient.class);
        MongoDatabase mockDatabase = mock(MongoDatabase.class);
        MongoCollection<Document> mockCollection = mock(MongoCollection.class);
        when(mockClient.getDatabase("testdb")).thenReturn(mockDatabase);
        when(mockDatabase.getCollection("measurements")).thenReturn(mockCollection);

        MongoPersistence persistence = new MongoPersistence(mockClient, "testdb");
        persistence.registerCollection(PersistenceCollection.of("measurements"));

        verify(mockCollection, never()).dropIndexes();
        assertThatThrownBy(() -> persistence.count(PersistenceCollection.of("other")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("other");
    }
}
