package eu.okaeri.docstore.schema;

import eu.okaeri.docstore.PersistencePath;
import eu.okaeri.docstore.document.Document;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Declared fields of a document type, by dotted name (e.g. {@code meta.score}).
 * <p>
 * Every schema has the identifier field {@value #ID}, which maps to the document path.
 */
@ToString
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public class DocumentSchema {

    public static final String ID = "id";

    private final Map<String, SchemaField> fields;
    @Getter
    private final SchemaField identifier;

    public static Builder builder() {
        return new Builder();
    }

    public Optional<SchemaField> getField(@NonNull String name) {
        return Optional.ofNullable(this.fields.get(name));
    }

    public Collection<SchemaField> getFields() {
        return Collections.unmodifiableCollection(this.fields.values());
    }

    public static class Builder {

        private final Map<String, SchemaField> fields = new LinkedHashMap<>();

        public Builder field(@NonNull String name, @NonNull FieldType type) {
            return this.add(name, type, false);
        }

        public Builder nullableField(@NonNull String name, @NonNull FieldType type) {
            return this.add(name, type, true);
        }

        private Builder add(String name, FieldType type, boolean nullable) {
            if (ID.equals(name) || name.isEmpty() || name.startsWith(".") || name.endsWith(".")) {
                throw new IllegalArgumentException("invalid field name: '" + name + "'");
            }
            if (type == FieldType.IDENTIFIER) {
                throw new IllegalArgumentException("field " + name + " cannot be declared as identifier, use '" + ID + "'");
            }
            this.fields.put(name, new SchemaField(name, PersistencePath.parse(name, "."), type, nullable, false));
            return this;
        }

        public DocumentSchema build() {
            SchemaField identifier = new SchemaField(ID, PersistencePath.of(Document.ID_FIELD), FieldType.IDENTIFIER, false, true);
            Map<String, SchemaField> all = new LinkedHashMap<>();
            all.put(ID, identifier);
            all.putAll(this.fields);
            return new DocumentSchema(all, identifier);
        }
    }
}
