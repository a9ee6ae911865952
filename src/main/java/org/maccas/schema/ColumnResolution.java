package org.maccas.schema;

import java.util.List;

/**
 * Tagged outcome of a column lookup.
 *
 * @param kind how the values were obtained.
 * @param logicalName name that was asked for.
 * @param sourceColumns table columns the values came from; empty when missing.
 * @param values resolved values, zero-filled when missing.
 */
public record ColumnResolution(Kind kind, String logicalName, List<String> sourceColumns, double[] values) {

    /**
     * Resolution kinds.
     */
    public enum Kind {
        FOUND,
        INTERPOLATED,
        MISSING
    }

    public boolean isMissing() {
        return kind == Kind.MISSING;
    }
}
