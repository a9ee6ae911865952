package org.maccas.resolve;

import org.maccas.catalog.Catalog;
import org.maccas.catalog.SourceRecord;
import org.maccas.core.MatchingConfig;
import org.maccas.scoring.ProbabilityScorer;
import org.maccas.spatial.CandidateSearch;
import org.maccas.spatial.CandidateSet;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.maccas.testutil.CatalogFixtureFactory.source;

@DisplayName("Match Resolver Tests")
class MatchResolverTest {

    private static final SourceRecord TARGET = source("t", 10.0, 0.0, 1.0);

    private static CandidateSet candidates(SourceRecord target, Object... pairs) {
        SourceRecord[] records = new SourceRecord[pairs.length / 2];
        double[] separations = new double[pairs.length / 2];
        for (int i = 0; i < records.length; i++) {
            records[i] = (SourceRecord) pairs[2 * i];
            separations[i] = (Double) pairs[2 * i + 1];
        }
        return new CandidateSet(target, List.of(records), separations);
    }

    private static MatchingConfig thresholds(double multiple, double single) {
        return MatchingConfig.builder()
                .multipleMatchConfidence(multiple)
                .singleMatchConfidence(single)
                .build();
    }

    // =====================================================================
    // SINGLE TARGET
    // =====================================================================

    @Test
    @DisplayName("Single candidate: accepted exactly at the threshold, refused just below it")
    void testSingleThresholdBoundary() {
        CandidateSet set = candidates(TARGET, source("r", 10.0, 0.0, 1.0), 0.002);
        double raw = ProbabilityScorer.positionProbabilities(set)[0];

        Optional<ResolvedMatch> accepted = MatchResolver.resolve(set, thresholds(0.8, raw), false);
        Optional<ResolvedMatch> refused = MatchResolver.resolve(set, thresholds(0.8, Math.nextUp(raw)), false);

        assertTrue(accepted.isPresent());
        assertEquals(raw, accepted.get().combinedProbability());
        assertTrue(Double.isNaN(accepted.get().normalizedProbability()));
        assertEquals(1, accepted.get().candidateCount());
        assertTrue(refused.isEmpty());
    }

    @Test
    @DisplayName("Multiple candidates: best normalized share accepted at the threshold, refused just below")
    void testMultipleThresholdBoundary() {
        CandidateSet set = candidates(TARGET,
                source("near", 10.0, 0.001, 1.0), 0.001,
                source("far", 10.0, 0.004, 1.0), 0.004);
        double[] raw = ProbabilityScorer.positionProbabilities(set);
        double normalized = raw[0] / (raw[0] + raw[1]);

        Optional<ResolvedMatch> accepted = MatchResolver.resolve(set, thresholds(normalized, 0.8), false);
        Optional<ResolvedMatch> refused = MatchResolver.resolve(set, thresholds(Math.nextUp(normalized), 0.8), false);

        assertTrue(accepted.isPresent());
        assertEquals("near", accepted.get().referenceId());
        assertEquals(normalized, accepted.get().normalizedProbability());
        assertEquals(2, accepted.get().candidateCount());
        assertTrue(refused.isEmpty());
    }

    @Test
    @DisplayName("Flux-inconsistent candidate at equal separation never wins")
    void testFluxBreaksPositionalTie() {
        Catalog reference = Catalog.of(
                source("consistent", 10.0, 0.001, 1.0),
                source("bright", 10.0, -0.001, 5.0));
        CandidateSet set = new CandidateSearch(reference, 600.0 / 3600.0).candidatesFor(TARGET);

        List<ResolvedMatch> matches = MatchResolver.resolveAll(List.of(set), Set.of(), thresholds(0.9, 0.9), false);

        assertTrue(matches.size() <= 1);
        matches.forEach(match -> assertEquals("consistent", match.referenceId()));
        assertEquals(1, matches.size());
    }

    @Test
    @DisplayName("Scores rounding to zero are discarded before normalization outside the final pass")
    void testRoundingDrop() {
        CandidateSet set = candidates(TARGET,
                source("exact", 10.0, 0.0, 1.0), 0.0,
                source("distant", 10.0, 0.02, 1.0), 0.02);

        ResolvedMatch thresholded = MatchResolver.resolve(set, MatchingConfig.defaults(), false).orElseThrow();
        ResolvedMatch relaxed = MatchResolver.resolve(set, MatchingConfig.defaults(), true).orElseThrow();

        assertEquals("exact", thresholded.referenceId());
        assertEquals(1, thresholded.candidateCount());
        assertTrue(Double.isNaN(thresholded.normalizedProbability()));
        assertEquals(2, relaxed.candidateCount());
        assertTrue(relaxed.normalizedProbability() < 1.0);
    }

    @Test
    @DisplayName("Rounding helper is half-even at two decimals")
    void testRoundToHundredths() {
        assertEquals(0.0, MatchResolver.roundToHundredths(0.004));
        assertEquals(0.01, MatchResolver.roundToHundredths(0.006));
        assertEquals(0.12, MatchResolver.roundToHundredths(0.123));
    }

    @Test
    @DisplayName("Final pass: the best candidate is taken regardless of thresholds")
    void testFinalPassAlwaysAccepts() {
        CandidateSet ambiguous = candidates(TARGET,
                source("a", 10.0, 0.001, 1.0), 0.001,
                source("b", 10.0, -0.0011, 1.0), 0.0011);
        MatchingConfig strict = thresholds(1.0, 1.0);

        assertTrue(MatchResolver.resolve(ambiguous, strict, false).isEmpty());
        assertEquals("a", MatchResolver.resolve(ambiguous, strict, true).orElseThrow().referenceId());
    }

    @Test
    @DisplayName("Final pass: all-zero scores fall back to the nearest candidate")
    void testFinalPassZeroScores() {
        CandidateSet hopeless = candidates(TARGET,
                source("far", 10.0, 0.166, 1.0), 0.166,
                source("nearer", 10.0, 0.165, 1.0), 0.165);

        assertTrue(MatchResolver.resolve(hopeless, MatchingConfig.defaults(), false).isEmpty());
        ResolvedMatch match = MatchResolver.resolve(hopeless, MatchingConfig.defaults(), true).orElseThrow();
        assertEquals("nearer", match.referenceId());
        assertTrue(Double.isNaN(match.normalizedProbability()));
    }

    @Test
    @DisplayName("Flux matching off: flux likelihood reported as 1")
    void testFluxMatchingOff() {
        CandidateSet set = candidates(TARGET, source("bright", 10.0, 0.0, 50.0), 0.0);
        MatchingConfig config = MatchingConfig.builder().fluxMatching(false).build();

        ResolvedMatch match = MatchResolver.resolve(set, config, false).orElseThrow();

        assertEquals(1.0, match.fluxProbability());
        assertEquals(1.0, match.combinedProbability());
        assertTrue(MatchResolver.resolve(set, MatchingConfig.defaults(), false).isEmpty());
    }

    @Test
    @DisplayName("Edge Case: no candidates")
    void testNoCandidates() {
        assertTrue(MatchResolver.resolve(CandidateSet.empty(TARGET), MatchingConfig.defaults(), true).isEmpty());
    }

    // =====================================================================
    // WHOLE PASS
    // =====================================================================

    @Test
    @DisplayName("Pass: stronger claim wins a contested reference and the loser is re-resolved")
    void testContestedReference() {
        SourceRecord shared = source("shared", 10.0, 0.0, 1.0);
        SourceRecord spare = source("spare", 10.0, 0.0025, 1.0);
        SourceRecord strong = source("strong", 10.0, 0.0, 1.0);
        SourceRecord weak = source("weak", 10.0, 0.001, 1.0);

        List<CandidateSet> sets = List.of(
                candidates(weak, shared, 0.001, spare, 0.0015),
                candidates(strong, shared, 0.0));

        List<ResolvedMatch> matches = MatchResolver.resolveAll(sets, Set.of(), thresholds(0.5, 0.8), false);

        assertEquals(2, matches.size());
        assertEquals("strong", matches.get(0).targetId());
        assertEquals("shared", matches.get(0).referenceId());
        assertEquals("weak", matches.get(1).targetId());
        assertEquals("spare", matches.get(1).referenceId());
        assertEquals(1, matches.get(1).candidateCount());
    }

    @Test
    @DisplayName("Pass: a reference is never claimed twice, even in the final pass")
    void testNoDoubleClaim() {
        SourceRecord only = source("only", 10.0, 0.0, 1.0);
        List<CandidateSet> sets = List.of(
                candidates(source("t1", 10.0, 0.0, 1.0), only, 0.0),
                candidates(source("t2", 10.0, 0.0, 1.0), only, 0.0));

        List<ResolvedMatch> matches = MatchResolver.resolveAll(sets, Set.of(), MatchingConfig.defaults(), true);

        assertEquals(1, matches.size());
        assertEquals("t1", matches.get(0).targetId());
    }

    @Test
    @DisplayName("Pass: references taken before the pass are excluded")
    void testExcludedReferences() {
        SourceRecord only = source("only", 10.0, 0.0, 1.0);
        List<CandidateSet> sets = List.of(candidates(TARGET, only, 0.0));

        assertTrue(MatchResolver.resolveAll(sets, Set.of("only"), MatchingConfig.defaults(), true).isEmpty());
    }
}
