package ember.db;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

public final class StringValue extends Value {
    @JsonProperty("value")
    private final String text;

    @JsonCreator
    public StringValue(@JsonProperty("value") String text) {
        this.text = Objects.requireNonNull(text, "text");
    }

    public String text() {
        return text;
    }

    @Override
    public DataType type() {
        return DataType.STRING;
    }

    @Override
    public StringValue asString() {
        return this;
    }

    @Override
    public Value copy() {
        return this; // Immutable
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StringValue)) return false;
        return text.equals(((StringValue) o).text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    @Override
    public String toString() {
        return "StringValue(" + text + ")";
    }
}
