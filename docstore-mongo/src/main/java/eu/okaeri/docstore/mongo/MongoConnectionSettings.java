package eu.okaeri.docstore.mongo;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import lombok.Builder;
import lombok.Data;
import lombok.NonNull;
import lombok.Singular;

import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Connection parameters for {@link MongoPersistence}.
 * When {@code database} is not set, the database of the connection string is used.
 */
@Data
@Builder
public class MongoConnectionSettings {

    private final @NonNull String connectionString;
    private final String database;
    @Builder.Default
    private final long serverSelectionTimeoutMs = 5000;
    private final boolean dropIndexes;
    @Builder.Default
    private final boolean logStarted = true;
    private final boolean logSucceeded;
    @Builder.Default
    private final boolean logFailed = true;
    @Singular
    private final Set<String> commandNames;

    public String resolveDatabase() {
        if (this.database != null) {
            return this.database;
        }
        String fromUri = new ConnectionString(this.connectionString).getDatabase();
        if (fromUri == null) {
            throw new IllegalStateException("database is required, none set and none in the connection string");
        }
        return fromUri;
    }

    public MongoClientSettings toClientSettings() {
        return MongoClientSettings.builder()
            .applyConnectionString(new ConnectionString(this.connectionString))
            .applyToClusterSettings(cluster -> cluster.serverSelectionTimeout(this.serverSelectionTimeoutMs, TimeUnit.MILLISECONDS))
            .addCommandListener(new MongoCommandLogger(this.logStarted, this.logSucceeded, this.logFailed, this.commandNames))
            .build();
    }
}
