package org.maccas.schema;

import lombok.Builder;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.maccas.core.CrossMatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered-fallback lookup of logical columns in catalogue tables.
 *
 * <p>Lookup order: the plain name, then each frequency-tagged spelling from
 * {@link FrequencyNaming#taggedNames}. With a single reference frequency the first tagged column
 * found is used as is. With a frequency pair both tagged columns must exist, and values are
 * linearly interpolated to the target frequency; error columns propagate as
 * {@code sqrt((e1 * wLow)^2 + (e2 * wHigh)^2)} with the same weights.</p>
 */
@Getter
@Accessors(fluent = true)
public final class ColumnResolver {
    private static final Logger logger = LoggerFactory.getLogger(ColumnResolver.class);

    private final FrequencyNaming naming;
    private final String singleFrequency;
    private final String minFrequency;
    private final String maxFrequency;
    private final double targetFrequency;

    /**
     * @param naming tag placement; {@code NONE} disables tagged lookups.
     * @param singleFrequency tag of the only reference frequency, or {@code null}.
     * @param minFrequency lower tag of an interpolation pair, or {@code null}.
     * @param maxFrequency upper tag of an interpolation pair, or {@code null}.
     * @param targetFrequency frequency to interpolate to; must lie inside the pair.
     */
    @Builder
    public ColumnResolver(
            FrequencyNaming naming,
            String singleFrequency,
            String minFrequency,
            String maxFrequency,
            double targetFrequency
    ) {
        this.naming = naming == null ? FrequencyNaming.NONE : naming;
        this.singleFrequency = singleFrequency;
        this.minFrequency = minFrequency;
        this.maxFrequency = maxFrequency;
        this.targetFrequency = targetFrequency;

        if (this.naming != FrequencyNaming.NONE) {
            boolean hasPair = minFrequency != null && maxFrequency != null;
            if (singleFrequency == null && !hasPair) {
                throw new IllegalArgumentException(
                        "Frequency-tagged naming needs a single frequency or a min/max frequency pair");
            }
            if (singleFrequency == null) {
                double low = parseFrequency(minFrequency);
                double high = parseFrequency(maxFrequency);
                if (!(high > low)) {
                    throw new IllegalArgumentException(
                            "maxFrequency must be greater than minFrequency: " + minFrequency + " / " + maxFrequency);
                }
                if (targetFrequency < low || targetFrequency > high) {
                    throw new IllegalArgumentException("targetFrequency " + targetFrequency
                            + " lies outside [" + minFrequency + ", " + maxFrequency + "]");
                }
            }
        }
    }

    /**
     * Resolver for catalogues with plain, untagged column names.
     */
    public static ColumnResolver plain() {
        return ColumnResolver.builder().naming(FrequencyNaming.NONE).build();
    }

    /**
     * Resolves a numeric column.
     *
     * @param column catalogue column name before tagging.
     * @param table table to search.
     * @param requirement what to do when nothing matches.
     * @param errorColumn true when the column holds uncertainties of interpolated data.
     * @throws CrossMatchException when a required column cannot be found.
     */
    public ColumnResolution resolve(ColumnTable table, String column, ColumnRequirement requirement, boolean errorColumn) {
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(column, "column");
        List<String> attempted = new ArrayList<>();

        attempted.add(column);
        if (table.hasNumericColumn(column)) {
            return new ColumnResolution(ColumnResolution.Kind.FOUND, column, List.of(column), table.numeric(column));
        }

        if (naming != FrequencyNaming.NONE) {
            if (singleFrequency != null) {
                for (String tagged : naming.taggedNames(column, singleFrequency)) {
                    attempted.add(tagged);
                    if (table.hasNumericColumn(tagged)) {
                        return new ColumnResolution(
                                ColumnResolution.Kind.FOUND, column, List.of(tagged), table.numeric(tagged));
                    }
                }
            } else {
                List<String> lows = naming.taggedNames(column, minFrequency);
                List<String> highs = naming.taggedNames(column, maxFrequency);
                for (int i = 0; i < lows.size(); i++) {
                    String low = lows.get(i);
                    String high = highs.get(i);
                    attempted.add(low + "+" + high);
                    if (table.hasNumericColumn(low) && table.hasNumericColumn(high)) {
                        double[] values = interpolate(table.numeric(low), table.numeric(high), errorColumn);
                        return new ColumnResolution(ColumnResolution.Kind.INTERPOLATED, column, List.of(low, high), values);
                    }
                }
            }
        }

        if (requirement == ColumnRequirement.OPTIONAL) {
            logger.warn("No data found for the {} column. Margin of error will now be tighter and probability "
                    + "of matches will be lower.", column);
            return new ColumnResolution(ColumnResolution.Kind.MISSING, column, List.of(), new double[table.rowCount()]);
        }
        logger.error("Could not find column {}. Please edit the catalogue format to reflect the column names", attempted);
        throw new CrossMatchException(CrossMatchException.REASON_REQUIRED_COLUMN_MISSING,
                "Required column '" + column + "' not found; tried " + attempted);
    }

    /**
     * Resolves a text column (source names). Text columns are never interpolated or optional.
     *
     * @throws CrossMatchException when the column cannot be found.
     */
    public String[] resolveText(ColumnTable table, String column) {
        List<String> attempted = new ArrayList<>();
        attempted.add(column);
        if (table.hasTextColumn(column)) {
            return table.text(column);
        }
        if (naming != FrequencyNaming.NONE) {
            String tag = singleFrequency != null ? singleFrequency : minFrequency;
            for (String tagged : naming.taggedNames(column, tag)) {
                attempted.add(tagged);
                if (table.hasTextColumn(tagged)) {
                    return table.text(tagged);
                }
            }
        }
        throw new CrossMatchException(CrossMatchException.REASON_REQUIRED_COLUMN_MISSING,
                "Required text column '" + column + "' not found; tried " + attempted);
    }

    private double[] interpolate(double[] low, double[] high, boolean errorColumn) {
        double fLow = parseFrequency(minFrequency);
        double fHigh = parseFrequency(maxFrequency);
        double span = fHigh - fLow;
        double lowWeight = (fHigh - targetFrequency) / span;
        double highWeight = (targetFrequency - fLow) / span;

        double[] values = new double[low.length];
        for (int i = 0; i < values.length; i++) {
            if (errorColumn) {
                double a = low[i] * lowWeight;
                double b = high[i] * highWeight;
                values[i] = Math.sqrt(a * a + b * b);
            } else {
                values[i] = low[i] * lowWeight + high[i] * highWeight;
            }
        }
        return values;
    }

    private static double parseFrequency(String tag) {
        try {
            return Double.parseDouble(tag);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Frequency tag '" + tag + "' is not numeric", e);
        }
    }
}
