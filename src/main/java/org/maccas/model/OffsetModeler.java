package org.maccas.model;

import lombok.experimental.UtilityClass;
import org.maccas.catalog.Catalog;
import org.maccas.catalog.SourceRecord;
import org.maccas.catalog.TargetCatalog;
import org.maccas.core.CrossMatchException;
import org.maccas.spatial.SkyGeometry;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Fits and applies the systematic positional warp.
 *
 * <p>Offsets are measured as image position minus reference position and modelled over the
 * image positions. Corrections are always applied to the original image positions, never to
 * positions adjusted by an earlier field.</p>
 */
@UtilityClass
public class OffsetModeler {

    /**
     * Fits independent RA and Dec offset surfaces.
     *
     * @throws CrossMatchException with {@code CM_INSUFFICIENT_MODEL_POINTS} below two samples.
     */
    public static OffsetField fit(List<OffsetSample> samples, double smoothing) {
        Objects.requireNonNull(samples, "samples");
        int n = samples.size();
        if (n < 2) {
            throw new CrossMatchException(CrossMatchException.REASON_INSUFFICIENT_MODEL_POINTS,
                    "Cannot create offset model with " + n + " match(es). Consider relaxing the match "
                            + "confidence thresholds or check that column units are correct");
        }
        double[] ra = new double[n];
        double[] dec = new double[n];
        double[] dRa = new double[n];
        double[] dDec = new double[n];
        for (int i = 0; i < n; i++) {
            OffsetSample sample = samples.get(i);
            OffsetVector offset = sample.offset();
            ra[i] = sample.targetRa();
            dec[i] = sample.targetDec();
            dRa[i] = offset.dRa();
            dDec[i] = offset.dDec();
        }
        return new OffsetField(
                LinearRbfSurface.fit(ra, dec, dRa, smoothing),
                LinearRbfSurface.fit(ra, dec, dDec, smoothing),
                n);
    }

    /**
     * Predicts every sample's offset from a field fitted to all the other samples, using one
     * factorization per axis instead of one fit per held-out sample.
     *
     * @return predictions in sample order.
     * @throws CrossMatchException with {@code CM_INSUFFICIENT_MODEL_POINTS} below three samples.
     */
    public static List<OffsetVector> leaveOneOut(List<OffsetSample> samples, double smoothing) {
        Objects.requireNonNull(samples, "samples");
        int n = samples.size();
        double[] ra = new double[n];
        double[] dec = new double[n];
        double[] dRa = new double[n];
        double[] dDec = new double[n];
        for (int i = 0; i < n; i++) {
            OffsetSample sample = samples.get(i);
            OffsetVector offset = sample.offset();
            ra[i] = sample.targetRa();
            dec[i] = sample.targetDec();
            dRa[i] = offset.dRa();
            dDec[i] = offset.dDec();
        }
        double[][] predicted = LinearRbfSurface.leaveOneOut(ra, dec, new double[][]{dRa, dDec}, smoothing);
        List<OffsetVector> result = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            result.add(new OffsetVector(predicted[0][i], predicted[1][i]));
        }
        return result;
    }

    /**
     * Returns the target catalogue with adjusted positions
     * {@code original - field(original)} on every row. Adjusted RA is brought back into {@code [0, 360)}.
     */
    public static TargetCatalog apply(OffsetField field, TargetCatalog target) {
        Catalog original = target.original();
        double[] adjustedRa = new double[original.size()];
        double[] adjustedDec = new double[original.size()];
        for (int row = 0; row < original.size(); row++) {
            SourceRecord source = original.get(row);
            OffsetVector predicted = field.predict(source.ra(), source.dec());
            adjustedRa[row] = SkyGeometry.normalizeRaDegrees(source.ra() - predicted.dRa());
            adjustedDec[row] = source.dec() - predicted.dDec();
        }
        return target.withAdjustedPositions(adjustedRa, adjustedDec);
    }
}
