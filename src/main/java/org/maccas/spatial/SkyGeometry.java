package org.maccas.spatial;

import lombok.experimental.UtilityClass;

/**
 * Numeric helpers for spherical sky geometry. Angles are degrees unless a name says otherwise.
 *
 * <p>{@link #separationDegrees}, {@link #normalizeDeltaRaDegrees} and the private clamp are the
 * standard haversine helpers, in the same form used for great-circle distances on the globe with
 * RA standing in for longitude. The chord conversions serve the unit-vector {@link SkyIndex}.</p>
 */
@UtilityClass
public class SkyGeometry {

    /**
     * Great-circle separation in degrees using the haversine formulation.
     */
    public static double separationDegrees(double ra1Deg, double dec1Deg, double ra2Deg, double dec2Deg) {
        double dec1Rad = Math.toRadians(dec1Deg);
        double dec2Rad = Math.toRadians(dec2Deg);
        double deltaDecRad = Math.toRadians(dec2Deg - dec1Deg);
        double deltaRaRad = Math.toRadians(normalizeDeltaRaDegrees(ra2Deg - ra1Deg));

        double sinHalfDec = Math.sin(deltaDecRad * 0.5d);
        double sinHalfRa = Math.sin(deltaRaRad * 0.5d);

        double h = sinHalfDec * sinHalfDec
                + Math.cos(dec1Rad) * Math.cos(dec2Rad) * sinHalfRa * sinHalfRa;
        double c = 2.0d * Math.asin(Math.sqrt(clamp(h, 0.0d, 1.0d)));
        return Math.toDegrees(c);
    }

    /**
     * Normalizes a right-ascension difference into {@code (-180, 180]}.
     */
    public static double normalizeDeltaRaDegrees(double deltaRaDeg) {
        double normalized = ((deltaRaDeg + 540.0d) % 360.0d) - 180.0d;
        if (normalized == -180.0d) {
            return 180.0d;
        }
        return normalized;
    }

    /**
     * Normalizes a right ascension into {@code [0, 360)}.
     */
    public static double normalizeRaDegrees(double raDeg) {
        if (raDeg >= 0.0d && raDeg < 360.0d) {
            return raDeg;
        }
        double normalized = ((raDeg % 360.0d) + 360.0d) % 360.0d;
        // a tiny negative input rounds up to exactly 360
        if (normalized >= 360.0d) {
            return 0.0d;
        }
        return normalized;
    }

    /**
     * Writes the unit vector of (ra, dec) into {@code out[offset..offset+2]}.
     */
    static void unitVector(double raDeg, double decDeg, double[] out, int offset) {
        double raRad = Math.toRadians(raDeg);
        double decRad = Math.toRadians(decDeg);
        double cosDec = Math.cos(decRad);
        out[offset] = cosDec * Math.cos(raRad);
        out[offset + 1] = cosDec * Math.sin(raRad);
        out[offset + 2] = Math.sin(decRad);
    }

    /**
     * Squared straight-line distance between two unit vectors separated by {@code angleDeg}.
     */
    static double chordSquaredForAngle(double angleDeg) {
        double clamped = clamp(angleDeg, 0.0d, 180.0d);
        double chord = 2.0d * Math.sin(Math.toRadians(clamped) * 0.5d);
        return chord * chord;
    }

    /**
     * Angle in degrees subtended by a chord of the given squared length.
     */
    static double angleForChordSquared(double chordSquared) {
        double halfChord = Math.sqrt(Math.max(0.0d, chordSquared)) * 0.5d;
        return Math.toDegrees(2.0d * Math.asin(clamp(halfChord, 0.0d, 1.0d)));
    }

    private static double clamp(double value, double min, double max) {
        if (value < min) {
            return min;
        }
        if (value > max) {
            return max;
        }
        return value;
    }
}
