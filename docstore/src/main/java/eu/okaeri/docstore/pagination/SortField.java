package eu.okaeri.docstore.pagination;

import eu.okaeri.docstore.PersistencePath;
import eu.okaeri.docstore.filter.OrderBy;
import eu.okaeri.docstore.filter.OrderDirection;
import eu.okaeri.docstore.schema.FieldType;
import eu.okaeri.docstore.schema.SchemaField;
import lombok.Data;
import lombok.NonNull;

@Data
public class SortField {

    private final String name;
    private final PersistencePath path;
    private final OrderDirection direction;
    private final FieldType type;
    private final boolean nullable;
    private final boolean identifier;

    public static SortField of(@NonNull SchemaField field, @NonNull OrderDirection direction) {
        return new SortField(field.getName(), field.getPath(), direction, field.getType(), field.isNullable(), field.isIdentifier());
    }

    public SortField inverted() {
        return new SortField(this.name, this.path, this.direction.invert(), this.type, this.nullable, this.identifier);
    }

    public OrderBy toOrderBy() {
        return OrderBy.of(this.path, this.direction, this.nullable);
    }
}
