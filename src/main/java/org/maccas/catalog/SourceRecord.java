package org.maccas.catalog;

import lombok.Builder;
import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Immutable catalogue source.
 *
 * <p>Units: {@code ra}, {@code dec}, {@code errRa} and {@code errDec} are degrees;
 * {@code a}, {@code b}, {@code psfA} and {@code psfB} are arcseconds; {@code pa} is degrees.
 * Fluxes and {@code localRms} share the catalogue's flux unit.</p>
 *
 * <p>Catalogue membership is not part of the record. A record is a target or reference source
 * only by virtue of the {@link Catalog} that holds it.</p>
 */
@Value
@Builder(toBuilder = true)
@Accessors(fluent = true)
public class SourceRecord {
    public static final double ARCSEC_PER_DEGREE = 3600.0d;

    String id;
    double ra;
    double dec;
    double errRa;
    double errDec;
    double a;
    double b;
    double pa;
    double localRms;
    double peakFlux;
    double errPeakFlux;
    double psfA;
    double psfB;

    /**
     * Larger of the two positional uncertainties, in degrees.
     */
    public double positionError() {
        return Math.max(errRa, errDec);
    }

    /**
     * PSF major half-width converted to degrees.
     */
    public double resolutionDegrees() {
        return psfA / ARCSEC_PER_DEGREE;
    }

    /**
     * Peak flux over local noise. Infinite when noise is zero and flux positive.
     */
    public double signalToNoise() {
        return peakFlux / localRms;
    }

    /**
     * Returns a copy at a new sky position, every other attribute untouched.
     */
    public SourceRecord withPosition(double newRa, double newDec) {
        return toBuilder().ra(newRa).dec(newDec).build();
    }

    /**
     * Returns a copy with peak flux and flux error divided by {@code factor}.
     */
    public SourceRecord withFluxDividedBy(double factor) {
        return toBuilder()
                .peakFlux(peakFlux / factor)
                .errPeakFlux(errPeakFlux / factor)
                .build();
    }
}
