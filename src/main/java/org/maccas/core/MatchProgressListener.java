package org.maccas.core;

import org.maccas.model.OffsetField;
import org.maccas.model.OffsetSample;
import org.maccas.model.SkySurface;

import java.util.List;

/**
 * Observer of a running match. All callbacks run on the engine thread.
 */
public interface MatchProgressListener {
    MatchProgressListener NONE = new MatchProgressListener() {
    };

    /**
     * Called after every pass, including the initial and final ones.
     */
    default void onRound(RoundTelemetry telemetry) {
    }

    /**
     * Diagnostic hook: the offset field fitted at the start of a round and its samples.
     * Only called when diagnostic plotting is enabled.
     */
    default void onOffsetField(int round, OffsetField field, List<OffsetSample> samples) {
    }

    /**
     * Diagnostic hook: the fitted flux correction surface. Only called when diagnostic plotting is enabled.
     */
    default void onFluxSurface(SkySurface surface) {
    }
}
