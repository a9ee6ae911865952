package org.maccas.model;

import org.maccas.spatial.SkyGeometry;

/**
 * One confirmed pair used to fit the offset field: target image position and reference position.
 * The RA offset is taken the short way round, so a pair straddling RA 0 gives a small offset.
 */
public record OffsetSample(double targetRa, double targetDec, double referenceRa, double referenceDec) {

    public OffsetVector offset() {
        return new OffsetVector(SkyGeometry.normalizeDeltaRaDegrees(targetRa - referenceRa), targetDec - referenceDec);
    }
}
