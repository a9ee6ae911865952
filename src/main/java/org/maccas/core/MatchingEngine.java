package org.maccas.core;

import lombok.Builder;
import org.maccas.catalog.Catalog;
import org.maccas.catalog.SourceRecord;
import org.maccas.catalog.TargetCatalog;
import org.maccas.model.FluxCalibrator;
import org.maccas.model.OffsetField;
import org.maccas.model.OffsetModeler;
import org.maccas.model.OffsetSample;
import org.maccas.model.SkySurface;
import org.maccas.outlier.OutlierRejector;
import org.maccas.resolve.MatchResolver;
import org.maccas.resolve.ResolvedMatch;
import org.maccas.spatial.CandidateSearch;
import org.maccas.spatial.SpatialPrefilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.SplittableRandom;

/**
 * Iterative cross-match orchestration entry point.
 *
 * <p>Execution flow:</p>
 * <ul>
 * <li>INIT: reduce the reference catalogue to the target footprint, optionally calibrate target
 * fluxes, then run one thresholded pass (optionally SNR-cut) on image positions. Fewer than two
 * matches aborts the run.</li>
 * <li>MATCHING: each round fits the offset field from every confirmed match, corrects all remaining
 * target positions, resolves the remaining sources and screens the round's new matches for
 * outliers. A round with no net new matches ends the loop.</li>
 * <li>FINAL: one relaxed pass that gives every remaining target its best candidate, with no
 * outlier screening.</li>
 * <li>CONVERGED: results are returned with the leftover catalogues.</li>
 * </ul>
 *
 * <p>An engine instance is single-threaded; each {@link #run} owns its catalogue snapshots.</p>
 */
public final class MatchingEngine {
    private static final Logger logger = LoggerFactory.getLogger(MatchingEngine.class);

    private final MatchingConfig config;
    private final MatchProgressListener listener;
    private final SplittableRandom random;

    /**
     * Creates an engine.
     *
     * @param config matching configuration; validated here.
     * @param listener optional progress observer.
     * @param random optional source for the outlier evaluation order. When absent every run draws
     *               from a fresh generator seeded with {@link MatchingConfig#getRandomSeed()}.
     */
    @Builder
    public MatchingEngine(MatchingConfig config, MatchProgressListener listener, SplittableRandom random) {
        this.config = Objects.requireNonNull(config, "config").validate();
        this.listener = listener == null ? MatchProgressListener.NONE : listener;
        this.random = random;
    }

    public MatchingConfig config() {
        return config;
    }

    /**
     * Runs the full state machine over raw target and reference catalogues.
     *
     * @throws CrossMatchException on any fatal condition; no partial result is returned.
     */
    public CrossMatchResult run(Catalog rawTarget, Catalog rawReference) {
        Objects.requireNonNull(rawTarget, "rawTarget");
        Objects.requireNonNull(rawReference, "rawReference");
        SplittableRandom shuffleSource = random != null ? random : new SplittableRandom(config.getRandomSeed());

        // INIT
        Catalog reference = SpatialPrefilter.filter(rawTarget, rawReference, config.getPrefilterBufferFactor());
        Catalog target = rawTarget;
        if (config.isFluxCalibration()) {
            SkySurface fluxSurface = FluxCalibrator.fit(rawTarget, reference, config);
            if (config.isDiagnosticPlotting()) {
                listener.onFluxSurface(fluxSurface);
            }
            target = FluxCalibrator.apply(fluxSurface, rawTarget);
        }

        TargetCatalog targetPool = TargetCatalog.unwarped(target);
        Catalog referencePool = reference;
        List<ConfirmedMatch> confirmed = new ArrayList<>();
        List<ConfirmedMatch> rejected = new ArrayList<>();
        List<RoundTelemetry> telemetry = new ArrayList<>();

        int round = 1;
        logger.info("Run {}", round);
        TargetCatalog initialTargets = targetPool;
        if (config.hasInitialSnrFloor()) {
            double floor = config.getInitialSnrFloor();
            initialTargets = targetPool.filterByOriginal(source -> source.signalToNoise() >= floor);
        }
        List<ConfirmedMatch> initial = matchPass(initialTargets, referencePool, false, round);
        confirmed.addAll(initial);
        targetPool = targetPool.without(targetIds(initial));
        referencePool = referencePool.without(referenceIds(initial));
        publish(telemetry, EngineState.INIT, round, confirmed.size(), initial.size(), 0, targetPool, referencePool);

        if (confirmed.size() < 2) {
            logger.error("Cannot create model with {} match(es). Consider relaxing the match confidence "
                    + "thresholds or check that column units are correct", confirmed.size());
            throw new CrossMatchException(CrossMatchException.REASON_INSUFFICIENT_INITIAL_MATCHES,
                    "Initial pass produced " + confirmed.size() + " match(es); at least 2 are needed to model offsets");
        }

        // MATCHING
        boolean improved = true;
        while (improved && !targetPool.isEmpty() && !referencePool.isEmpty()) {
            if (round > config.getMaxRounds()) {
                logger.warn("Stopping after {} matching rounds without convergence", config.getMaxRounds());
                break;
            }
            round++;
            logger.info("Run {}", round);
            logger.info("Number of cross matches so far: {}", confirmed.size());
            int startCount = confirmed.size();

            targetPool = adjustPositions(confirmed, targetPool, round);
            List<ConfirmedMatch> fresh = matchPass(targetPool, referencePool, false, round);
            List<ConfirmedMatch> kept = fresh;
            List<ConfirmedMatch> dropped = List.of();
            if (config.isOutlierRejection() && !fresh.isEmpty()) {
                OutlierRejector.Screening screening = OutlierRejector.screen(fresh, confirmed, config, shuffleSource);
                kept = screening.kept();
                dropped = screening.rejected();
            }

            confirmed.addAll(kept);
            rejected.addAll(dropped);
            targetPool = targetPool.without(targetIds(kept));
            referencePool = referencePool.without(referenceIds(kept));
            publish(telemetry, EngineState.MATCHING, round, confirmed.size(), kept.size(), dropped.size(),
                    targetPool, referencePool);

            improved = confirmed.size() != startCount;
        }

        // FINAL
        round++;
        logger.info("Returning most likely match to remaining {} unmatched sources", targetPool.size());
        List<ConfirmedMatch> lastChance = matchPass(targetPool, referencePool, true, round);
        confirmed.addAll(lastChance);
        targetPool = targetPool.without(targetIds(lastChance));
        referencePool = referencePool.without(referenceIds(lastChance));
        publish(telemetry, EngineState.FINAL, round, confirmed.size(), lastChance.size(), 0, targetPool, referencePool);

        // CONVERGED
        logger.info("Matched {} out of {} sources in target catalogue", confirmed.size(), target.size());
        publish(telemetry, EngineState.CONVERGED, round, confirmed.size(), 0, 0, targetPool, referencePool);
        return CrossMatchResult.builder()
                .confirmedMatches(confirmed)
                .rejectedMatches(rejected)
                .leftoverTarget(targetPool)
                .leftoverReference(referencePool)
                .targetSourceCount(target.size())
                .filteredReferenceCount(reference.size())
                .rounds(telemetry)
                .build();
    }

    /**
     * One candidate-search and resolution pass over frozen inputs.
     *
     * <p>Candidates are searched around the adjusted positions. Returned matches carry the original
     * target records and never share a reference source.</p>
     */
    public List<ConfirmedMatch> matchPass(TargetCatalog targets, Catalog reference, boolean finalRun, int round) {
        if (!finalRun) {
            logger.info("Initialising match of {} target sources", targets.size());
        }
        if (targets.isEmpty() || reference.isEmpty()) {
            return List.of();
        }
        CandidateSearch search = new CandidateSearch(reference, config.coarseSearchRadiusDegrees());
        List<ResolvedMatch> resolved = MatchResolver.resolveAll(
                search.candidatesFor(targets.adjusted()), Collections.emptySet(), config, finalRun);

        List<ConfirmedMatch> matches = new ArrayList<>(resolved.size());
        for (ResolvedMatch match : resolved) {
            SourceRecord original = targets.original().byId(match.targetId());
            matches.add(ConfirmedMatch.accepted(match, original, round));
        }
        return matches;
    }

    private TargetCatalog adjustPositions(List<ConfirmedMatch> confirmed, TargetCatalog targetPool, int round) {
        List<OffsetSample> samples = new ArrayList<>(confirmed.size());
        for (ConfirmedMatch match : confirmed) {
            samples.add(match.offsetSample());
        }
        OffsetField field = OffsetModeler.fit(samples, config.getRbfSmoothing());
        if (config.isDiagnosticPlotting()) {
            listener.onOffsetField(round, field, Collections.unmodifiableList(samples));
        }
        return OffsetModeler.apply(field, targetPool);
    }

    private void publish(
            List<RoundTelemetry> telemetry,
            EngineState state,
            int round,
            int confirmedCount,
            int newMatches,
            int rejectedMatches,
            TargetCatalog targetPool,
            Catalog referencePool
    ) {
        RoundTelemetry snapshot = new RoundTelemetry(
                state,
                round,
                confirmedCount,
                newMatches,
                rejectedMatches,
                targetPool.size(),
                referencePool.size());
        telemetry.add(snapshot);
        listener.onRound(snapshot);
    }

    private static Set<String> targetIds(List<ConfirmedMatch> matches) {
        Set<String> ids = new HashSet<>(matches.size() * 2);
        for (ConfirmedMatch match : matches) {
            ids.add(match.targetId());
        }
        return ids;
    }

    private static Set<String> referenceIds(List<ConfirmedMatch> matches) {
        Set<String> ids = new HashSet<>(matches.size() * 2);
        for (ConfirmedMatch match : matches) {
            ids.add(match.referenceId());
        }
        return ids;
    }
}
