package ember.db;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class ListValue extends Value {
    @JsonProperty("value")
    private final List<String> items;

    public ListValue() {
        this.items = new ArrayList<>();
    }

    @JsonCreator
    public ListValue(@JsonProperty("value") List<String> items) {
        this.items = items == null ? new ArrayList<>() : new ArrayList<>(items);
    }

    @Override
    public DataType type() {
        return DataType.LIST;
    }

    @Override
    public ListValue asList() {
        return this;
    }

    /**
     * Inserts all values at the head as one block, so they keep their argument order:
     * pushing {@code a b} onto {@code [c]} gives {@code [a, b, c]}.
     */
    public int pushFront(List<String> values) {
        items.addAll(0, values);
        return items.size();
    }

    public int pushBack(List<String> values) {
        items.addAll(values);
        return items.size();
    }

    public String popFront() {
        return items.isEmpty() ? null : items.remove(0);
    }

    public String popBack() {
        return items.isEmpty() ? null : items.remove(items.size() - 1);
    }

    /**
     * Elements from {@code start} to {@code end}, both inclusive, taken as a slice up to
     * {@code end + 1}. Negative bounds count from the tail and are clamped to the list.
     * The exclusive bound is what gets clamped, so an {@code end} of -1 selects nothing.
     */
    public List<String> range(long start, long end) {
        long len = items.size();
        long from = start < 0 ? Math.max(len + start, 0) : Math.min(start, len);
        long endExclusive = end + 1;
        long to = endExclusive < 0 ? Math.max(len + endExclusive, 0) : Math.min(endExclusive, len);
        if (to <= from) return Collections.emptyList();
        return new ArrayList<>(items.subList((int) from, (int) to));
    }

    public int size() {
        return items.size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return items.isEmpty();
    }

    public List<String> items() {
        return Collections.unmodifiableList(items);
    }

    @Override
    public Value copy() {
        return new ListValue(items);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ListValue)) return false;
        return items.equals(((ListValue) o).items);
    }

    @Override
    public int hashCode() {
        return items.hashCode();
    }

    @Override
    public String toString() {
        return "ListValue" + items;
    }
}
