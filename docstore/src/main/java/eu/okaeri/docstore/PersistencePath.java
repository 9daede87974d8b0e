package eu.okaeri.docstore;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.NonNull;
import lombok.ToString;
import org.bson.types.ObjectId;

import java.util.Arrays;
import java.util.List;
import java.util.UUID;

@Getter
@ToString
@EqualsAndHashCode
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PROTECTED)
public class PersistencePath {

    public static final String SEPARATOR = ":";
    private String value;

    public static PersistencePath of(@NonNull UUID uuid) {
        return new PersistencePath(String.valueOf(uuid));
    }

    public static PersistencePath of(@NonNull String path) {
        return new PersistencePath(path);
    }

    public static PersistencePath parse(@NonNull String source, @NonNull String separator) {
        return new PersistencePath(source.replace(separator, SEPARATOR));
    }

    /**
     * Creates a path holding a freshly generated 24 character hex object id.
     */
    public static PersistencePath objectId() {
        return new PersistencePath(new ObjectId().toHexString());
    }

    public PersistencePath sub(@NonNull PersistencePath sub) {
        if (this.value.isEmpty()) {
            return of(sub.value);
        }
        return this.sub(sub.value);
    }

    public PersistencePath sub(@NonNull String sub) {

        boolean startsWithSeparator = sub.startsWith(SEPARATOR);
        if (this.value.isEmpty()) {
            return of(startsWithSeparator ? sub.substring(1) : sub);
        }

        String separator = startsWithSeparator ? "" : SEPARATOR;
        return this.append(separator + sub);
    }

    public PersistencePath append(@NonNull String element) {
        return of(this.value + element);
    }

    public String toSqlIdentifier() {
        String identifier = this.value.replace(SEPARATOR, "_");
        if (!identifier.matches("^[a-zA-Z_][a-zA-Z0-9_]*$")) {
            throw new IllegalArgumentException("identifier '" + identifier + "' cannot be used as sql identifier");
        }
        return identifier;
    }

    public String toMongoPath() {
        return this.value.replace(SEPARATOR, ".");
    }

    public List<String> toParts() {
        return Arrays.asList(this.value.split(SEPARATOR));
    }

    public boolean isObjectId() {
        return ObjectId.isValid(this.value);
    }
}
