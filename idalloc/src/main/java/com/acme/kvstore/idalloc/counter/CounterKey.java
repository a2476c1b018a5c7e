package com.acme.kvstore.idalloc.counter;

import java.util.Objects;

/**
 * Store key naming the counter behind one ID class.
 *
 * <p>The empty key is the {@link #INVALID} sentinel: it never addresses a
 * counter and marks an allocator as temporarily unable to reserve blocks.
 */
public record CounterKey(String name) {
    public static final CounterKey INVALID = new CounterKey("");

    public CounterKey {
        Objects.requireNonNull(name, "name");
    }

    public static CounterKey of(String name) {
        return new CounterKey(name);
    }

    public boolean isValid() {
        return !name.isEmpty();
    }

    @Override
    public String toString() {
        return isValid() ? name : "<invalid>";
    }
}
