package io.blockchain.walletsync.chrono;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Non-empty sequence ordered from the newest element to the oldest one.
 */
public final class NewestFirst<T> {
    private final List<T> items;

    private NewestFirst(List<T> items) {
        if (items == null || items.isEmpty()) {
            throw new IllegalArgumentException("window must not be empty");
        }
        this.items = List.copyOf(items);
    }

    public static <T> NewestFirst<T> of(List<T> items) {
        return new NewestFirst<>(items);
    }

    @SafeVarargs
    public static <T> NewestFirst<T> of(T... items) {
        return new NewestFirst<>(List.of(items));
    }

    public List<T> items() { return items; }
    public int size() { return items.size(); }
    public T newest() { return items.get(0); }
    public T oldest() { return items.get(items.size() - 1); }

    public OldestFirst<T> toOldestFirst() {
        List<T> reversed = new ArrayList<>(items);
        Collections.reverse(reversed);
        return OldestFirst.of(reversed);
    }

    @Override public String toString() {
        return "NewestFirst" + items;
    }
}
