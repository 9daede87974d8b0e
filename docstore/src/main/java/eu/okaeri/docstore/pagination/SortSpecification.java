package eu.okaeri.docstore.pagination;

import eu.okaeri.docstore.filter.OrderBy;
import eu.okaeri.docstore.filter.OrderDirection;
import eu.okaeri.docstore.schema.DocumentSchema;
import eu.okaeri.docstore.schema.SchemaField;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Ordered sort fields defining a total order over documents.
 * <p>
 * The last field is always unique per document: when no identifier was requested, the
 * identifier is appended with the direction of the last requested field.
 */
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public class SortSpecification {

    @Getter
    private final List<SortField> fields;

    /**
     * Parses sort expressions: {@code field}, {@code +field}, {@code field:asc} are ascending,
     * {@code -field} and {@code field:desc} are descending.
     *
     * @throws UnknownSortFieldException if a field is not declared in the schema
     */
    public static SortSpecification parse(@NonNull DocumentSchema schema, List<String> expressions) {
        List<SortField> fields = new ArrayList<>();
        if (expressions != null) {
            for (String expression : expressions) {
                fields.add(parseField(schema, expression));
            }
        }
        return of(schema, fields);
    }

    /**
     * Creates a specification from already resolved fields, appending the schema identifier
     * when missing.
     */
    public static SortSpecification of(@NonNull DocumentSchema schema, @NonNull List<SortField> fields) {
        List<SortField> resolved = new ArrayList<>();
        for (SortField field : fields) {
            resolved.add(field);
            if (field.isIdentifier()) {
                // anything after a unique field can never break a tie
                return new SortSpecification(Collections.unmodifiableList(resolved));
            }
        }
        OrderDirection direction = resolved.isEmpty() ? OrderDirection.ASC : resolved.get(resolved.size() - 1).getDirection();
        resolved.add(SortField.of(schema.getIdentifier(), direction));
        return new SortSpecification(Collections.unmodifiableList(resolved));
    }

    private static SortField parseField(DocumentSchema schema, String expression) {
        String name = (expression == null) ? "" : expression.trim();
        OrderDirection direction = OrderDirection.ASC;

        if (name.startsWith("-")) {
            direction = OrderDirection.DESC;
            name = name.substring(1);
        } else if (name.startsWith("+")) {
            name = name.substring(1);
        } else {
            int colon = name.lastIndexOf(':');
            if (colon >= 0) {
                String suffix = name.substring(colon + 1).toLowerCase(Locale.ROOT);
                if ("desc".equals(suffix)) {
                    direction = OrderDirection.DESC;
                } else if (!"asc".equals(suffix)) {
                    throw new UnknownSortFieldException("invalid sort direction in '" + expression + "'");
                }
                name = name.substring(0, colon);
            }
        }

        String fieldName = name;
        SchemaField field = schema.getField(fieldName)
            .orElseThrow(() -> new UnknownSortFieldException("unknown sort field: '" + fieldName + "'"));
        return SortField.of(field, direction);
    }

    /**
     * Same fields with every direction flipped.
     */
    public SortSpecification inverted() {
        return new SortSpecification(Collections.unmodifiableList(this.fields.stream()
            .map(SortField::inverted)
            .collect(Collectors.toList())));
    }

    public List<OrderBy> toOrderBy() {
        return this.fields.stream()
            .map(SortField::toOrderBy)
            .collect(Collectors.toList());
    }

    public List<String> getNames() {
        return this.fields.stream()
            .map(SortField::getName)
            .collect(Collectors.toList());
    }
}
