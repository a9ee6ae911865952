package org.maccas.catalog;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.List;
import java.util.NoSuchElementException;

/**
 * Source-id to row-index translation for one catalogue snapshot.
 *
 * <p>Immutable and safe for concurrent reads.</p>
 */
final class CatalogIdIndex {

    // String -> row (forward lookup)
    private final Object2IntOpenHashMap<String> forward;
    // row -> String (reverse lookup)
    private final String[] reverse;

    /**
     * Builds the index over catalogue rows in order.
     *
     * @throws IllegalArgumentException when an id is null or repeated.
     */
    CatalogIdIndex(List<SourceRecord> records) {
        int size = records.size();
        this.forward = new Object2IntOpenHashMap<>(size);
        this.forward.defaultReturnValue(-1);
        this.reverse = new String[size];

        for (int row = 0; row < size; row++) {
            String id = records.get(row).id();
            if (id == null) {
                throw new IllegalArgumentException("Source id cannot be null (row " + row + ")");
            }
            int previous = forward.put(id, row);
            if (previous != -1) {
                throw new IllegalArgumentException(
                        "Duplicate source id '" + id + "' at rows " + previous + " and " + row);
            }
            reverse[row] = id;
        }
        this.forward.trim();
    }

    /**
     * Row of {@code id}, or -1 when absent.
     */
    int indexOf(String id) {
        return forward.getInt(id);
    }

    /**
     * Row of {@code id}.
     *
     * @throws NoSuchElementException when absent.
     */
    int requireIndex(String id) {
        int row = forward.getInt(id);
        if (row == -1) {
            throw new NoSuchElementException("Source id not found: " + id);
        }
        return row;
    }

    String idAt(int row) {
        try {
            return reverse[row];
        } catch (ArrayIndexOutOfBoundsException e) {
            throw new IndexOutOfBoundsException("Row out of bounds: " + row);
        }
    }

    boolean contains(String id) {
        return forward.containsKey(id);
    }

    int size() {
        return reverse.length;
    }
}
