package org.maccas.catalog;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Target catalogue held as two index-aligned views.
 *
 * <p>{@link #original()} keeps the image positions as measured. {@link #adjusted()} carries the
 * positions corrected by the current offset field. Both views contain the same ids in the same
 * row order at all times; every operation returns a new aligned pair.</p>
 */
public final class TargetCatalog {
    private final Catalog original;
    private final Catalog adjusted;

    private TargetCatalog(Catalog original, Catalog adjusted) {
        this.original = original;
        this.adjusted = adjusted;
    }

    /**
     * Pairs two views after checking row alignment.
     *
     * @throws IllegalArgumentException when sizes or per-row ids differ.
     */
    public static TargetCatalog of(Catalog original, Catalog adjusted) {
        Objects.requireNonNull(original, "original");
        Objects.requireNonNull(adjusted, "adjusted");
        if (original.size() != adjusted.size()) {
            throw new IllegalArgumentException(
                    "Original and adjusted views differ in size: " + original.size() + " vs " + adjusted.size());
        }
        for (int row = 0; row < original.size(); row++) {
            if (!original.idAt(row).equals(adjusted.idAt(row))) {
                throw new IllegalArgumentException("Views are not index-aligned at row " + row
                        + ": " + original.idAt(row) + " vs " + adjusted.idAt(row));
            }
        }
        return new TargetCatalog(original, adjusted);
    }

    /**
     * Target catalogue with no positional correction applied yet.
     */
    public static TargetCatalog unwarped(Catalog catalog) {
        return new TargetCatalog(catalog, catalog);
    }

    public Catalog original() {
        return original;
    }

    public Catalog adjusted() {
        return adjusted;
    }

    public int size() {
        return original.size();
    }

    public boolean isEmpty() {
        return original.isEmpty();
    }

    /**
     * Replaces the adjusted positions row by row.
     *
     * @param adjustedRa corrected right ascension per row, degrees.
     * @param adjustedDec corrected declination per row, degrees.
     */
    public TargetCatalog withAdjustedPositions(double[] adjustedRa, double[] adjustedDec) {
        if (adjustedRa.length != size() || adjustedDec.length != size()) {
            throw new IllegalArgumentException("Adjusted position arrays must have " + size() + " rows");
        }
        List<SourceRecord> moved = new ArrayList<>(size());
        for (int row = 0; row < size(); row++) {
            moved.add(original.get(row).withPosition(adjustedRa[row], adjustedDec[row]));
        }
        return new TargetCatalog(original, Catalog.of(moved));
    }

    /**
     * Drops the given ids from both views.
     */
    public TargetCatalog without(Set<String> ids) {
        if (ids.isEmpty()) {
            return this;
        }
        return new TargetCatalog(original.without(ids), adjusted.without(ids));
    }

    /**
     * Keeps rows whose original record passes {@code keep}, in both views.
     */
    public TargetCatalog filterByOriginal(Predicate<SourceRecord> keep) {
        Catalog keptOriginal = original.filter(keep);
        if (keptOriginal == original) {
            return this;
        }
        return new TargetCatalog(keptOriginal, adjusted.filter(record -> keptOriginal.contains(record.id())));
    }

    @Override
    public String toString() {
        return "TargetCatalog[size=" + size() + "]";
    }
}
