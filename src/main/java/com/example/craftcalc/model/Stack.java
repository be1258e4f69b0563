package com.example.craftcalc.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/** Some number of a single item. */
public final class Stack {
    private final String item;
    private final long count;

    @JsonCreator
    public Stack(@JsonProperty("item") String item, @JsonProperty("count") long count) {
        if (item == null) throw new IllegalArgumentException("Stack item must not be null");
        if (count < 0) throw new IllegalArgumentException("Stack count must not be negative: " + count);
        this.item = item;
        this.count = count;
    }

    public String getItem() { return item; }
    public long getCount() { return count; }

    /** Returns this stack with its count multiplied by {@code factor}; overflow throws. */
    public Stack times(long factor) {
        return new Stack(item, Math.multiplyExact(count, factor));
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Stack)) return false;
        Stack other = (Stack) o;
        return count == other.count && item.equals(other.item);
    }

    @Override public int hashCode() { return Objects.hash(item, count); }

    @Override public String toString() { return item + " (" + count + ")"; }
}
