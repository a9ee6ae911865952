package org.maccas.io;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * Tables produced by a converged run, with their conventional base file names.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public enum OutputTable {
    CROSS_MATCHED("cross_matched_table"),
    LEFTOVER_REFERENCE("leftover_reference_catalogue"),
    /**
     * Unmatched target sources at their original image positions.
     */
    LEFTOVER_TARGET("leftover_target_catalogue"),
    /**
     * Unmatched target sources at their offset-corrected positions.
     */
    LEFTOVER_UNWARPED_TARGET("leftover_unwarped_target_catalogue"),
    REJECTED_MATCHES("rejected_matches_table");

    private final String baseName;
}
