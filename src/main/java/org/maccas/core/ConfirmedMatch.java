package org.maccas.core;

import lombok.Builder;
import lombok.Value;
import lombok.experimental.Accessors;
import org.maccas.catalog.SourceRecord;
import org.maccas.model.OffsetSample;
import org.maccas.outlier.RejectionReason;
import org.maccas.resolve.ResolvedMatch;

/**
 * One target/reference association produced by the engine.
 *
 * <p>{@code target} carries the original image position. Rejected matches keep their scores
 * for inspection and name the rule that rejected them.</p>
 */
@Value
@Builder(toBuilder = true)
@Accessors(fluent = true)
public class ConfirmedMatch {
    SourceRecord target;
    SourceRecord reference;
    double positionProbability;
    double fluxProbability;
    double combinedProbability;
    /**
     * {@code NaN} when the target had a single surviving candidate.
     */
    double normalizedProbability;
    int candidateCount;
    int round;
    @Builder.Default
    MatchStatus status = MatchStatus.ACCEPTED;
    RejectionReason rejectionReason;

    /**
     * Accepted match built from a resolver decision.
     *
     * @param originalTarget the target record at its original image position.
     */
    public static ConfirmedMatch accepted(ResolvedMatch resolved, SourceRecord originalTarget, int round) {
        if (!resolved.targetId().equals(originalTarget.id())) {
            throw new IllegalArgumentException("Resolved target " + resolved.targetId()
                    + " does not match original record " + originalTarget.id());
        }
        return ConfirmedMatch.builder()
                .target(originalTarget)
                .reference(resolved.reference())
                .positionProbability(resolved.positionProbability())
                .fluxProbability(resolved.fluxProbability())
                .combinedProbability(resolved.combinedProbability())
                .normalizedProbability(resolved.normalizedProbability())
                .candidateCount(resolved.candidateCount())
                .round(round)
                .build();
    }

    public String targetId() {
        return target.id();
    }

    public String referenceId() {
        return reference.id();
    }

    public boolean isAccepted() {
        return status == MatchStatus.ACCEPTED;
    }

    /**
     * Copy moved to the rejected set.
     */
    public ConfirmedMatch rejected(RejectionReason reason) {
        return toBuilder().status(MatchStatus.REJECTED).rejectionReason(reason).build();
    }

    public OffsetSample offsetSample() {
        return new OffsetSample(target.ra(), target.dec(), reference.ra(), reference.dec());
    }
}
