package eu.okaeri.docstore.document;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import eu.okaeri.docstore.PersistenceCollection;
import eu.okaeri.docstore.PersistencePath;
import lombok.Getter;
import lombok.NonNull;
import lombok.Setter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base class of stored entities.
 * <p>
 * Declared fields of subclasses are mapped by the {@link DocumentSerializer}. Properties
 * without a matching field are kept in a side map, so generic and projected documents
 * never lose data when converted between types.
 */
@ToString
public class Document {

    /**
     * Reserved field name exposing the document path to conditions, ordering and projections.
     */
    public static final String ID_FIELD = "_id";

    private @JsonIgnore @Getter @Setter PersistencePath path;
    private @JsonIgnore @Getter @Setter PersistenceCollection collection;
    private final @JsonIgnore Map<String, Object> properties = new LinkedHashMap<>();

    @JsonAnyGetter
    public Map<String, Object> getProperties() {
        return Collections.unmodifiableMap(this.properties);
    }

    @JsonAnySetter
    public void set(@NonNull String key, Object value) {
        this.properties.put(key, value);
    }

    public Object get(@NonNull String key) {
        return this.properties.get(key);
    }

    @JsonIgnore
    public String getId() {
        return (this.path == null) ? null : this.path.getValue();
    }
}
