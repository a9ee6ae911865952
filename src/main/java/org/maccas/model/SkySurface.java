package org.maccas.model;

/**
 * Smooth scalar function over sky position (degrees).
 */
@FunctionalInterface
public interface SkySurface {

    /**
     * Evaluates the surface at (ra, dec).
     */
    double evaluate(double ra, double dec);
}
