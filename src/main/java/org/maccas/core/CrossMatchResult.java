package org.maccas.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.experimental.Accessors;
import org.maccas.catalog.Catalog;
import org.maccas.catalog.TargetCatalog;

import java.util.List;

/**
 * Output of a converged run.
 */
@Value
@Builder
@Accessors(fluent = true)
public class CrossMatchResult {
    @Singular
    List<ConfirmedMatch> confirmedMatches;
    @Singular
    List<ConfirmedMatch> rejectedMatches;
    /**
     * Never-matched target sources, original and offset-adjusted views.
     */
    TargetCatalog leftoverTarget;
    Catalog leftoverReference;
    int targetSourceCount;
    int filteredReferenceCount;
    @Singular("round")
    List<RoundTelemetry> rounds;

    public int matchedTargetCount() {
        return confirmedMatches.size();
    }
}
