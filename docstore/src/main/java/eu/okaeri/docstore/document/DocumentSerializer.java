package eu.okaeri.docstore.document;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import eu.okaeri.docstore.PersistenceCollection;
import eu.okaeri.docstore.PersistencePath;
import lombok.Getter;
import lombok.NonNull;

import java.io.IOException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Utility for serializing/deserializing Documents.
 * Shared by all backends to ensure consistent document handling.
 * <p>
 * Instants are stored as fixed width UTC strings, so lexical and chronological order match
 * in every backend.
 */
public class DocumentSerializer {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<LinkedHashMap<String, Object>>() {
    };
    private static final DateTimeFormatter INSTANT_FORMAT = DateTimeFormatter
        .ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSSSSSSSS'Z'")
        .withZone(ZoneOffset.UTC);

    @Getter
    private final ObjectMapper mapper;

    public DocumentSerializer() {
        this(new ObjectMapper());
    }

    /**
     * Create with a custom mapper, e.g. with additional modules registered.
     * The mapper is copied before the document specific configuration is applied.
     */
    public DocumentSerializer(@NonNull ObjectMapper mapper) {
        SimpleModule module = new SimpleModule("okaeri-docstore");
        module.addSerializer(Instant.class, new InstantSerializer());
        module.addDeserializer(Instant.class, new InstantDeserializer());

        this.mapper = mapper.copy()
            .registerModule(module)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public static String formatInstant(@NonNull Instant instant) {
        return INSTANT_FORMAT.format(instant);
    }

    public static Instant parseInstant(@NonNull String text) {
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException exception) {
            throw new IllegalArgumentException("invalid instant: " + text, exception);
        }
    }

    /**
     * Converts the document into a plain nested map of storage values.
     * The document path is not part of the result.
     */
    public Map<String, Object> toMap(@NonNull Document document) {
        return this.mapper.convertValue(document, MAP_TYPE);
    }

    /**
     * Same as {@link #toMap(Document)} with the path exposed as {@value Document#ID_FIELD}.
     */
    public Map<String, Object> toFieldMap(@NonNull Document document) {
        Map<String, Object> map = this.toMap(document);
        if (document.getPath() != null) {
            map.put(Document.ID_FIELD, document.getPath().getValue());
        }
        return map;
    }

    public <T extends Document> T fromMap(@NonNull Map<String, ?> data, @NonNull Class<T> type) {
        return this.mapper.convertValue(data, type);
    }

    public <T extends Document> T fromMap(@NonNull Map<String, ?> data, @NonNull Class<T> type,
                                          PersistenceCollection collection, PersistencePath path) {
        T document = this.fromMap(data, type);
        this.setupDocument(document, collection, path);
        return document;
    }

    /**
     * Convert a document to another document type, keeping its path and collection.
     * Returns the same instance when it already is of the requested type.
     */
    public <T extends Document> T into(@NonNull Document document, @NonNull Class<T> type) {
        if (type.isInstance(document)) {
            return type.cast(document);
        }
        return this.fromMap(this.toMap(document), type, document.getCollection(), document.getPath());
    }

    public String serialize(@NonNull Document document) {
        try {
            return this.mapper.writeValueAsString(document);
        } catch (JsonProcessingException exception) {
            throw new IllegalArgumentException("cannot serialize " + document, exception);
        }
    }

    public Document deserialize(PersistenceCollection collection, PersistencePath path, @NonNull String json) {
        try {
            Document document = this.mapper.readValue(json, Document.class);
            this.setupDocument(document, collection, path);
            return document;
        } catch (JsonProcessingException exception) {
            throw new IllegalArgumentException("cannot deserialize document " + path, exception);
        }
    }

    public void setupDocument(@NonNull Document document, PersistenceCollection collection, PersistencePath path) {
        document.setCollection(collection);
        document.setPath(path);
    }

    private static class InstantSerializer extends StdSerializer<Instant> {

        InstantSerializer() {
            super(Instant.class);
        }

        @Override
        public void serialize(Instant value, JsonGenerator generator, SerializerProvider provider) throws IOException {
            generator.writeString(formatInstant(value));
        }
    }

    private static class InstantDeserializer extends StdDeserializer<Instant> {

        InstantDeserializer() {
            super(Instant.class);
        }

        @Override
        public Instant deserialize(JsonParser parser, DeserializationContext context) throws IOException {
            String text = parser.getValueAsString();
            if (text == null) {
                return (Instant) context.handleUnexpectedToken(Instant.class, parser);
            }
            try {
                return Instant.parse(text);
            } catch (DateTimeParseException exception) {
                return (Instant) context.handleWeirdStringValue(Instant.class, text, exception.getMessage());
            }
        }
    }
}
