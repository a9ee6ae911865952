package org.maccas.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable in-memory table of named numeric and text columns, all of one row count.
 *
 * <p>This is the exchange format with external table readers and writers.</p>
 */
public final class ColumnTable {
    private final int rowCount;
    private final Map<String, double[]> numericColumns;
    private final Map<String, String[]> textColumns;

    private ColumnTable(int rowCount, Map<String, double[]> numericColumns, Map<String, String[]> textColumns) {
        this.rowCount = rowCount;
        this.numericColumns = numericColumns;
        this.textColumns = textColumns;
    }

    public static Builder builder(int rowCount) {
        return new Builder(rowCount);
    }

    public int rowCount() {
        return rowCount;
    }

    public boolean hasColumn(String name) {
        return numericColumns.containsKey(name) || textColumns.containsKey(name);
    }

    public boolean hasNumericColumn(String name) {
        return numericColumns.containsKey(name);
    }

    public boolean hasTextColumn(String name) {
        return textColumns.containsKey(name);
    }

    /**
     * Copy of a numeric column.
     *
     * @throws NoSuchElementException when absent.
     */
    public double[] numeric(String name) {
        double[] column = numericColumns.get(name);
        if (column == null) {
            throw new NoSuchElementException("No numeric column '" + name + "'");
        }
        return column.clone();
    }

    /**
     * Copy of a text column.
     *
     * @throws NoSuchElementException when absent.
     */
    public String[] text(String name) {
        String[] column = textColumns.get(name);
        if (column == null) {
            throw new NoSuchElementException("No text column '" + name + "'");
        }
        return column.clone();
    }

    /**
     * Column names in insertion order, numeric before text.
     */
    public Set<String> columnNames() {
        Set<String> names = new LinkedHashSet<>(numericColumns.keySet());
        names.addAll(textColumns.keySet());
        return Collections.unmodifiableSet(names);
    }

    @Override
    public String toString() {
        return "ColumnTable[rows=" + rowCount + ", columns=" + columnNames() + "]";
    }

    /**
     * Accumulates columns; every column must match the declared row count.
     */
    public static final class Builder {
        private final int rowCount;
        private final Map<String, double[]> numericColumns = new LinkedHashMap<>();
        private final Map<String, String[]> textColumns = new LinkedHashMap<>();

        private Builder(int rowCount) {
            if (rowCount < 0) {
                throw new IllegalArgumentException("rowCount must be >= 0");
            }
            this.rowCount = rowCount;
        }

        public Builder numeric(String name, double[] values) {
            requireFreshName(name);
            if (values.length != rowCount) {
                throw new IllegalArgumentException(
                        "Column '" + name + "' has " + values.length + " rows, expected " + rowCount);
            }
            numericColumns.put(name, values.clone());
            return this;
        }

        public Builder text(String name, String[] values) {
            requireFreshName(name);
            if (values.length != rowCount) {
                throw new IllegalArgumentException(
                        "Column '" + name + "' has " + values.length + " rows, expected " + rowCount);
            }
            textColumns.put(name, values.clone());
            return this;
        }

        public ColumnTable build() {
            return new ColumnTable(
                    rowCount,
                    Collections.unmodifiableMap(new LinkedHashMap<>(numericColumns)),
                    Collections.unmodifiableMap(new LinkedHashMap<>(textColumns)));
        }

        private void requireFreshName(String name) {
            Objects.requireNonNull(name, "name");
            if (numericColumns.containsKey(name) || textColumns.containsKey(name)) {
                throw new IllegalArgumentException("Duplicate column '" + name + "'");
            }
        }
    }
}
