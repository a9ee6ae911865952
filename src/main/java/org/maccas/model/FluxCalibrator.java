package org.maccas.model;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import lombok.experimental.UtilityClass;
import org.maccas.catalog.Catalog;
import org.maccas.catalog.SourceRecord;
import org.maccas.core.CrossMatchException;
import org.maccas.core.MatchingConfig;
import org.maccas.spatial.SkyIndex;
import org.maccas.spatial.SkyMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Smooth spatial flux-scale correction between target and reference catalogues.
 *
 * <p>Only high-SNR target sources take part. Each is paired with its nearest reference source
 * when that source lies within the tight calibration radius, and the target/reference peak flux
 * ratio is fitted with a {@link PolynomialSplineSurface}.</p>
 */
@UtilityClass
public class FluxCalibrator {
    private static final Logger logger = LoggerFactory.getLogger(FluxCalibrator.class);

    /**
     * Builds the flux-ratio surface.
     *
     * @throws CrossMatchException when the calibration sample is too small for the configured degree.
     */
    public static SkySurface fit(Catalog rawTarget, Catalog filteredReference, MatchingConfig config) {
        Objects.requireNonNull(rawTarget, "rawTarget");
        Objects.requireNonNull(filteredReference, "filteredReference");
        Objects.requireNonNull(config, "config");

        Catalog bright = rawTarget.filter(source -> source.signalToNoise() >= config.getCalibrationSnrFloor());
        SkyIndex index = SkyIndex.build(filteredReference);
        double radius = config.calibrationMatchRadiusDegrees();

        DoubleArrayList ra = new DoubleArrayList();
        DoubleArrayList dec = new DoubleArrayList();
        DoubleArrayList ratio = new DoubleArrayList();
        for (SourceRecord source : bright) {
            SkyMatch nearest = index.nearest(source.ra(), source.dec());
            if (nearest == null || nearest.separationDegrees() > radius) {
                continue;
            }
            double referenceFlux = filteredReference.get(nearest.row()).peakFlux();
            if (referenceFlux == 0.0d || !Double.isFinite(referenceFlux)) {
                continue;
            }
            ra.add(source.ra());
            dec.add(source.dec());
            ratio.add(source.peakFlux() / referenceFlux);
        }

        logger.info("Flux calibration sample: {} of {} high-SNR target sources matched within {} arcsec",
                ratio.size(), bright.size(), config.getCalibrationMatchRadiusArcsec());
        int required = PolynomialSplineSurface.requiredSamples(config.getFluxModelDegree());
        if (ratio.size() < required) {
            logger.error("Flux calibration needs {} matches for degree {}, found {}",
                    required, config.getFluxModelDegree(), ratio.size());
        }
        return PolynomialSplineSurface.fit(
                ra.toDoubleArray(), dec.toDoubleArray(), ratio.toDoubleArray(), config.getFluxModelDegree());
    }

    /**
     * Divides every target flux and flux error by the surface value at its position.
     *
     * @throws CrossMatchException when the surface is not strictly positive at some source.
     */
    public static Catalog apply(SkySurface surface, Catalog target) {
        return target.map(source -> {
            double factor = surface.evaluate(source.ra(), source.dec());
            if (!(factor > 0.0d) || !Double.isFinite(factor)) {
                throw new CrossMatchException(CrossMatchException.REASON_MODEL_FIT_FAILED,
                        "Flux correction factor " + factor + " at source '" + source.id()
                                + "' is not a positive finite number");
            }
            return source.withFluxDividedBy(factor);
        });
    }
}
