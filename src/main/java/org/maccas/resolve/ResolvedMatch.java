package org.maccas.resolve;

import org.maccas.catalog.SourceRecord;

/**
 * Accepted best candidate for one target source.
 *
 * @param target target record as scored (offset-adjusted position).
 * @param reference chosen reference record.
 * @param positionProbability positional likelihood of the chosen candidate.
 * @param fluxProbability flux likelihood, 1.0 when flux matching is off.
 * @param combinedProbability raw combined score used for the decision.
 * @param normalizedProbability share of the combined score among surviving candidates;
 *                              {@code NaN} when only one candidate survived.
 * @param candidateCount surviving candidates at decision time.
 */
public record ResolvedMatch(
        SourceRecord target,
        SourceRecord reference,
        double positionProbability,
        double fluxProbability,
        double combinedProbability,
        double normalizedProbability,
        int candidateCount
) {
    public String targetId() {
        return target.id();
    }

    public String referenceId() {
        return reference.id();
    }
}
