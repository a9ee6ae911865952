package org.maccas.spatial;

import it.unimi.dsi.fastutil.doubles.DoubleArrays;

/**
 * Smallest arc of right ascension covering a set of positions.
 *
 * <p>The arc runs forward from {@code startDeg} for {@code extentDeg} degrees and may cross
 * RA 0. Positions outside it are measured to whichever arc end is nearer across the uncovered gap,
 * so offsets stay continuous for fields that straddle the wrap.</p>
 *
 * @param startDeg  arc start in {@code [0, 360)}.
 * @param extentDeg arc length in {@code [0, 360)}.
 */
public record RaArc(double startDeg, double extentDeg) {

    /**
     * Covers the given right ascensions by the complement of the widest gap between them.
     *
     * @throws IllegalArgumentException when {@code raDeg} is empty.
     */
    public static RaArc covering(double[] raDeg) {
        if (raDeg.length == 0) {
            throw new IllegalArgumentException("cannot cover an empty set of right ascensions");
        }
        double[] sorted = new double[raDeg.length];
        for (int i = 0; i < raDeg.length; i++) {
            sorted[i] = SkyGeometry.normalizeRaDegrees(raDeg[i]);
        }
        DoubleArrays.quickSort(sorted);

        int last = sorted.length - 1;
        // gap across RA 0, from the largest value round to the smallest
        double widestGap = sorted[0] + 360.0d - sorted[last];
        double start = sorted[0];
        for (int i = 1; i < sorted.length; i++) {
            double gap = sorted[i] - sorted[i - 1];
            if (gap > widestGap) {
                widestGap = gap;
                start = sorted[i];
            }
        }
        return new RaArc(start, 360.0d - widestGap);
    }

    /**
     * Signed RA offset of {@code raDeg} from the arc start. Inside the arc this is in
     * {@code [0, extentDeg]}; beyond the start it is negative.
     */
    public double offsetDegrees(double raDeg) {
        double forward = SkyGeometry.normalizeRaDegrees(raDeg - startDeg);
        double split = extentDeg + (360.0d - extentDeg) * 0.5d;
        return forward > split ? forward - 360.0d : forward;
    }
}
