package org.maccas.spatial;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * Immutable nearest-neighbour result of a {@link SkyIndex} query.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public final class SkyMatch {
    private final int row;
    private final double separationDegrees;
}
