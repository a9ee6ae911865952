package org.maccas.model;

/**
 * Positional offset (target minus reference) in degrees.
 */
public record OffsetVector(double dRa, double dDec) {

    public double magnitude() {
        return Math.hypot(dRa, dDec);
    }

    /**
     * Direction of the vector, degrees counter-clockwise from +RA.
     */
    public double angleDegrees() {
        return Math.toDegrees(Math.atan2(dDec, dRa));
    }

    /**
     * Unsigned angle between the two directions, in {@code [0, 180]}.
     */
    public double angleBetweenDegrees(OffsetVector other) {
        double difference = Math.abs(angleDegrees() - other.angleDegrees()) % 360.0d;
        return difference > 180.0d ? 360.0d - difference : difference;
    }
}
