package eu.okaeri.docstore.schema;

import eu.okaeri.docstore.PersistencePath;
import lombok.Data;

@Data
public class SchemaField {

    private final String name;
    private final PersistencePath path;
    private final FieldType type;
    private final boolean nullable;
    private final boolean identifier;
}
