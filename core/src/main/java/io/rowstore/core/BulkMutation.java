// file: core/src/main/java/io/rowstore/core/BulkMutation.java
package io.rowstore.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An ordered batch of single-row mutations. An entry's position in the batch
 * is its original index, the index reported by {@link FailedMutation}.
 */
public final class BulkMutation {

    private final List<SingleRowMutation> entries = new ArrayList<>();

    public BulkMutation() {
    }

    public BulkMutation(List<SingleRowMutation> entries) {
        entries.forEach(this::add);
    }

    public static BulkMutation of(SingleRowMutation... entries) {
        return new BulkMutation(List.of(entries));
    }

    public BulkMutation add(SingleRowMutation entry) {
        entries.add(Objects.requireNonNull(entry, "entry"));
        return this;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public SingleRowMutation get(int index) {
        return entries.get(index);
    }

    public List<SingleRowMutation> entries() {
        return Collections.unmodifiableList(entries);
    }
}
