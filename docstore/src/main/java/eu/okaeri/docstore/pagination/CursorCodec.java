package eu.okaeri.docstore.pagination;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import lombok.NonNull;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;

import static eu.okaeri.docstore.document.DocumentValueUtils.extractValue;

/**
 * Encodes cursors as URL-safe base64 (no padding) of a JSON array of {@code [name, value]}
 * pairs, values in their textual {@link eu.okaeri.docstore.schema.FieldType} form.
 */
public class CursorCodec {

    private final ObjectMapper mapper;

    public CursorCodec() {
        this(new ObjectMapper());
    }

    public CursorCodec(@NonNull ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * @param document document map, with the identifier exposed as {@code _id}
     * @param fields   active sort fields
     */
    public String encode(@NonNull Map<String, Object> document, @NonNull List<SortField> fields) {
        ArrayNode root = this.mapper.createArrayNode();
        for (SortField field : fields) {
            Object value = extractValue(document, field.getPath().toParts());
            root.addArray()
                .add(field.getName())
                .add(field.getType().format(value));
        }
        try {
            byte[] json = this.mapper.writeValueAsBytes(root);
            return Base64.getUrlEncoder().withoutPadding().encodeToString(json);
        } catch (JsonProcessingException exception) {
            throw new IllegalStateException("cannot encode cursor", exception);
        }
    }

    /**
     * @return null for a null token (first page)
     * @throws MalformedCursorException if the token is not a cursor of the given fields
     */
    public Cursor decode(String token, @NonNull List<SortField> fields) {
        if (token == null) {
            return null;
        }

        JsonNode root;
        try {
            byte[] json = Base64.getUrlDecoder().decode(token.trim());
            root = this.mapper.readTree(new String(json, StandardCharsets.UTF_8));
        } catch (IllegalArgumentException | JsonProcessingException exception) {
            throw new MalformedCursorException("cursor is not a valid token", exception);
        }

        if ((root == null) || !root.isArray()) {
            throw new MalformedCursorException("cursor is not a list of fields");
        }
        if (root.size() != fields.size()) {
            throw new MalformedCursorException("cursor has " + root.size() + " field(s), sorting expects " + fields.size());
        }

        List<Cursor.Entry> entries = new ArrayList<>(fields.size());
        for (int i = 0; i < fields.size(); i++) {
            SortField field = fields.get(i);
            JsonNode pair = root.get(i);

            if (!pair.isArray() || (pair.size() != 2) || !pair.get(0).isTextual()) {
                throw new MalformedCursorException("cursor field #" + i + " is not a [name, value] pair");
            }
            String name = pair.get(0).asText();
            if (!field.getName().equals(name)) {
                throw new MalformedCursorException("cursor field '" + name + "' does not match sort field '" + field.getName() + "'");
            }

            JsonNode value = pair.get(1);
            if (value.isNull()) {
                if (!field.isNullable()) {
                    throw new MalformedCursorException("cursor value of '" + name + "' cannot be null");
                }
                entries.add(new Cursor.Entry(name, null));
                continue;
            }
            if (!value.isTextual()) {
                throw new MalformedCursorException("cursor value of '" + name + "' is not a string");
            }
            try {
                entries.add(new Cursor.Entry(name, field.getType().parse(value.asText())));
            } catch (IllegalArgumentException exception) {
                throw new MalformedCursorException("cursor value of '" + name + "' is not a valid " + field.getType(), exception);
            }
        }

        return new Cursor(entries);
    }
}
