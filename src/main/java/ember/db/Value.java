package ember.db;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A typed value held by one key. Exactly one variant per {@link DataType}; callers that need
 * a particular variant go through {@link #asString()} or {@link #asList()}, which refuse
 * the other one instead of converting it.
 *
 * <p>The Jackson annotations give the snapshot format: {@code {"type": "string", "value": ...}}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = StringValue.class, name = "string"),
        @JsonSubTypes.Type(value = ListValue.class, name = "list")
})
public abstract class Value {

    public abstract DataType type();

    public abstract Value copy();

    public StringValue asString() {
        throw new WrongTypeException(DataType.STRING, type());
    }

    public ListValue asList() {
        throw new WrongTypeException(DataType.LIST, type());
    }
}
