package org.maccas.spatial;

import lombok.experimental.UtilityClass;
import org.maccas.catalog.Catalog;
import org.maccas.catalog.SourceRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Bounding-box reduction of the reference catalogue to the target footprint.
 *
 * <p>The box is the target catalogue's RA/Dec extent grown on every side by
 * {@code bufferFactor * (max source half-size + max PSF half-width)}. The RA extent is the
 * smallest {@link RaArc} covering the targets, so a footprint across RA 0 stays one box. This is
 * a performance filter: true matches are kept as long as real offsets stay inside the buffer.</p>
 */
@UtilityClass
public class SpatialPrefilter {
    private static final Logger logger = LoggerFactory.getLogger(SpatialPrefilter.class);

    /**
     * Returns the reference rows strictly inside the buffered target box, in original order.
     */
    public static Catalog filter(Catalog target, Catalog reference, double bufferFactor) {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(reference, "reference");
        if (target.isEmpty()) {
            logger.info("Target catalogue is empty; nothing to keep from the reference catalogue");
            return Catalog.empty();
        }

        double[] targetRa = new double[target.size()];
        double minDec = Double.POSITIVE_INFINITY;
        double maxDec = Double.NEGATIVE_INFINITY;
        int row = 0;
        for (SourceRecord source : target) {
            targetRa[row++] = source.ra();
            minDec = Math.min(minDec, source.dec());
            maxDec = Math.max(maxDec, source.dec());
        }
        RaArc arc = RaArc.covering(targetRa);

        double edge = bufferFactor * edgeAllowanceDegrees(target);
        double lowRa = -edge;
        double highRa = arc.extentDeg() + edge;
        boolean cutRa = highRa - lowRa < 360.0d;
        double lowDec = minDec - edge;
        double highDec = maxDec + edge;

        Catalog filtered = reference.filter(source -> {
            if (!(source.dec() > lowDec && source.dec() < highDec)) {
                return false;
            }
            if (!cutRa) {
                return true;
            }
            double raOffset = arc.offsetDegrees(source.ra());
            return raOffset > lowRa && raOffset < highRa;
        });
        logger.info("The filtered reference catalogue has {} entries", filtered.size());
        return filtered;
    }

    /**
     * Largest source half-size plus largest PSF half-width in the catalogue, in degrees.
     */
    public static double edgeAllowanceDegrees(Catalog catalog) {
        double maxSize = 0.0d;
        double maxPsf = 0.0d;
        for (SourceRecord source : catalog) {
            maxSize = Math.max(maxSize, Math.max(source.a(), source.b()));
            maxPsf = Math.max(maxPsf, Math.max(source.psfA(), source.psfB()));
        }
        return maxSize / SourceRecord.ARCSEC_PER_DEGREE + maxPsf / SourceRecord.ARCSEC_PER_DEGREE;
    }
}
