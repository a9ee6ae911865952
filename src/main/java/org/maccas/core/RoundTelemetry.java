package org.maccas.core;

/**
 * Per-pass progress snapshot published to {@link MatchProgressListener}.
 */
public record RoundTelemetry(
        EngineState state,
        int round,
        int confirmedCount,
        int newMatches,
        int rejectedMatches,
        int remainingTargets,
        int remainingReferences
) {
}
