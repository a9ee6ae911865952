package org.maccas.catalog;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Immutable ordered snapshot of source records, unique by id.
 *
 * <p>Every transformation returns a new snapshot; the receiver is never modified.
 * Row order is preserved by all filtering operations.</p>
 */
public final class Catalog implements Iterable<SourceRecord> {
    private static final Catalog EMPTY = new Catalog(List.of());

    private final List<SourceRecord> records;
    private final CatalogIdIndex idIndex;

    private Catalog(List<SourceRecord> records) {
        this.records = records;
        this.idIndex = new CatalogIdIndex(records);
    }

    /**
     * Creates a catalogue from records in the given order.
     *
     * @throws IllegalArgumentException when ids are missing or repeated.
     */
    public static Catalog of(Collection<SourceRecord> records) {
        Objects.requireNonNull(records, "records");
        List<SourceRecord> copy = new ArrayList<>(records.size());
        for (SourceRecord record : records) {
            copy.add(Objects.requireNonNull(record, "record"));
        }
        return new Catalog(Collections.unmodifiableList(copy));
    }

    public static Catalog of(SourceRecord... records) {
        return of(List.of(records));
    }

    public static Catalog empty() {
        return EMPTY;
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public SourceRecord get(int row) {
        return records.get(row);
    }

    /**
     * Record with the given id.
     *
     * @throws java.util.NoSuchElementException when absent.
     */
    public SourceRecord byId(String id) {
        return records.get(idIndex.requireIndex(id));
    }

    /**
     * Row of {@code id}, or -1.
     */
    public int indexOf(String id) {
        return idIndex.indexOf(id);
    }

    public boolean contains(String id) {
        return idIndex.contains(id);
    }

    public String idAt(int row) {
        return idIndex.idAt(row);
    }

    /**
     * Unmodifiable view of the rows.
     */
    public List<SourceRecord> records() {
        return records;
    }

    public Catalog filter(Predicate<SourceRecord> keep) {
        List<SourceRecord> kept = new ArrayList<>();
        for (SourceRecord record : records) {
            if (keep.test(record)) {
                kept.add(record);
            }
        }
        return kept.size() == records.size() ? this : new Catalog(Collections.unmodifiableList(kept));
    }

    /**
     * Snapshot without the given ids. Unknown ids are ignored.
     */
    public Catalog without(Set<String> ids) {
        if (ids.isEmpty()) {
            return this;
        }
        return filter(record -> !ids.contains(record.id()));
    }

    public Catalog map(UnaryOperator<SourceRecord> mapper) {
        List<SourceRecord> mapped = new ArrayList<>(records.size());
        for (SourceRecord record : records) {
            mapped.add(Objects.requireNonNull(mapper.apply(record), "mapped record"));
        }
        return new Catalog(Collections.unmodifiableList(mapped));
    }

    @Override
    public Iterator<SourceRecord> iterator() {
        return records.iterator();
    }

    @Override
    public String toString() {
        return "Catalog[size=" + records.size() + "]";
    }
}
