package eu.okaeri.docstore.schema;

import eu.okaeri.docstore.filter.condition.Condition;
import eu.okaeri.docstore.filter.predicate.Predicate;
import lombok.AccessLevel;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static eu.okaeri.docstore.filter.predicate.SimplePredicate.eq;
import static eu.okaeri.docstore.filter.predicate.SimplePredicate.isNull;

/**
 * Equality filter over the fields of a schema, every field optional.
 * <p>
 * Nested fields are exposed flat, {@code meta.score} becomes {@code meta__score}, so they can
 * be bound from query parameters.
 */
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public class FilterModel {

    public static final String ALIAS_SEPARATOR = "__";

    private final DocumentSchema schema;
    private final Map<String, SchemaField> aliases;

    public static FilterModel of(@NonNull DocumentSchema schema) {
        Map<String, SchemaField> aliases = new LinkedHashMap<>();
        for (SchemaField field : schema.getFields()) {
            aliases.put(alias(field.getName()), field);
        }
        return new FilterModel(schema, aliases);
    }

    public static String alias(@NonNull String name) {
        return name.replace(".", ALIAS_SEPARATOR);
    }

    public Set<String> getAliases() {
        return Collections.unmodifiableSet(this.aliases.keySet());
    }

    /**
     * Converts raw parameters into typed values keyed by field name.
     * Unknown names and blank values are ignored.
     *
     * @throws IllegalArgumentException if a value cannot be converted to its field type
     */
    public Map<String, Object> bind(@NonNull Map<String, String> parameters) {
        Map<String, Object> values = new LinkedHashMap<>();
        parameters.forEach((name, raw) -> {
            SchemaField field = this.aliases.get(name);
            if ((field == null) || (raw == null) || raw.trim().isEmpty()) {
                return;
            }
            try {
                values.put(field.getName(), field.getType().parse(raw));
            } catch (IllegalArgumentException exception) {
                throw new IllegalArgumentException("invalid value for " + name + ": " + exception.getMessage(), exception);
            }
        });
        return values;
    }

    /**
     * AND of equality conditions, null value meaning the field is null.
     *
     * @return null when there is nothing to filter on
     * @throws IllegalArgumentException if a name is not declared in the schema
     */
    public Condition toCondition(@NonNull Map<String, ?> values) {
        if (values.isEmpty()) {
            return null;
        }
        List<Condition> conditions = new ArrayList<>();
        values.forEach((name, value) -> {
            SchemaField field = this.schema.getField(name)
                .orElseThrow(() -> new IllegalArgumentException("unknown filter field: " + name));
            Predicate predicate = (value == null) ? isNull() : eq((Object) value);
            conditions.add(Condition.on(field.getPath(), predicate));
        });
        return Condition.and(conditions);
    }
}
