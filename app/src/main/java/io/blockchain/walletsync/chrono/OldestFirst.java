package io.blockchain.walletsync.chrono;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Non-empty sequence ordered from the oldest element to the newest one.
 */
public final class OldestFirst<T> {
    private final List<T> items;

    private OldestFirst(List<T> items) {
        if (items == null || items.isEmpty()) {
            throw new IllegalArgumentException("window must not be empty");
        }
        this.items = List.copyOf(items);
    }

    public static <T> OldestFirst<T> of(List<T> items) {
        return new OldestFirst<>(items);
    }

    @SafeVarargs
    public static <T> OldestFirst<T> of(T... items) {
        return new OldestFirst<>(List.of(items));
    }

    public List<T> items() { return items; }
    public int size() { return items.size(); }
    public T oldest() { return items.get(0); }
    public T newest() { return items.get(items.size() - 1); }

    public NewestFirst<T> toNewestFirst() {
        List<T> reversed = new ArrayList<>(items);
        Collections.reverse(reversed);
        return NewestFirst.of(reversed);
    }

    @Override public String toString() {
        return "OldestFirst" + items;
    }
}
