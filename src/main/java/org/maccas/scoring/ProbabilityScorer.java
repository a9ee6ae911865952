package org.maccas.scoring;

import lombok.experimental.UtilityClass;
import org.maccas.catalog.SourceRecord;
import org.maccas.spatial.CandidateSet;
import org.maccas.spatial.SkyGeometry;

/**
 * Unnormalized Gaussian likelihoods that a reference candidate is the true counterpart of a target.
 *
 * <p>Both scores have the form {@code exp(-error^2 / (2 * budget^2))}. A zero budget collapses the
 * Gaussian to an indicator: 1 for a zero error, 0 otherwise. Target records must carry the
 * offset-adjusted position, not the image position.</p>
 */
@UtilityClass
public class ProbabilityScorer {

    /**
     * Combined positional error budget in degrees:
     * {@code sqrt(refRes^2 + refPosErr^2 + tarRes^2 + tarPosErr^2)}.
     */
    public static double positionErrorBudget(SourceRecord reference, SourceRecord target) {
        double referenceResolution = reference.resolutionDegrees();
        double referencePositionError = reference.positionError();
        double targetResolution = target.resolutionDegrees();
        double targetPositionError = target.positionError();
        return Math.sqrt(referenceResolution * referenceResolution
                + referencePositionError * referencePositionError
                + targetResolution * targetResolution
                + targetPositionError * targetPositionError);
    }

    /**
     * Combined flux error budget: quadrature sum of both local noise levels and flux errors.
     */
    public static double fluxErrorBudget(SourceRecord reference, SourceRecord target) {
        return Math.sqrt(reference.localRms() * reference.localRms()
                + target.localRms() * target.localRms()
                + target.errPeakFlux() * target.errPeakFlux()
                + reference.errPeakFlux() * reference.errPeakFlux());
    }

    public static double positionProbability(SourceRecord reference, SourceRecord target) {
        double separation = SkyGeometry.separationDegrees(
                reference.ra(), reference.dec(), target.ra(), target.dec());
        return gaussian(separation, positionErrorBudget(reference, target));
    }

    public static double fluxProbability(SourceRecord reference, SourceRecord target) {
        return gaussian(reference.peakFlux() - target.peakFlux(), fluxErrorBudget(reference, target));
    }

    /**
     * Position likelihood for every candidate, aligned with the candidate order.
     */
    public static double[] positionProbabilities(CandidateSet candidates) {
        double[] probabilities = new double[candidates.size()];
        SourceRecord target = candidates.target();
        for (int i = 0; i < probabilities.length; i++) {
            probabilities[i] = gaussian(
                    candidates.separationDegrees(i),
                    positionErrorBudget(candidates.candidate(i), target));
        }
        return probabilities;
    }

    /**
     * Flux likelihood for every candidate, aligned with the candidate order.
     */
    public static double[] fluxProbabilities(CandidateSet candidates) {
        double[] probabilities = new double[candidates.size()];
        SourceRecord target = candidates.target();
        for (int i = 0; i < probabilities.length; i++) {
            probabilities[i] = fluxProbability(candidates.candidate(i), target);
        }
        return probabilities;
    }

    static double gaussian(double error, double budget) {
        if (budget == 0.0d) {
            return error == 0.0d ? 1.0d : 0.0d;
        }
        return Math.exp(-(error * error) / (2.0d * budget * budget));
    }
}
