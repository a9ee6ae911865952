package org.maccas.resolve;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import lombok.experimental.UtilityClass;
import org.maccas.core.MatchingConfig;
import org.maccas.scoring.ProbabilityScorer;
import org.maccas.spatial.CandidateSet;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Picks the most probable reference candidate per target source.
 *
 * <p>Decision rule per target:</p>
 * <ul>
 * <li>Combined score is position likelihood, times flux likelihood when flux matching is on.</li>
 * <li>Outside the final pass, scores rounding to 0.00 at two decimals are discarded before
 * normalization.</li>
 * <li>Two or more survivors: the best normalized share must reach
 * {@code multipleMatchConfidence}.</li>
 * <li>One survivor: its raw score must reach {@code singleMatchConfidence}.</li>
 * <li>Final pass: every candidate is eligible and the best one is always taken.</li>
 * </ul>
 */
@UtilityClass
public class MatchResolver {

    /**
     * Resolves a single target against its candidates.
     *
     * @return the accepted match, or empty when no candidate qualifies.
     */
    public static Optional<ResolvedMatch> resolve(CandidateSet candidates, MatchingConfig config, boolean finalRun) {
        Objects.requireNonNull(candidates, "candidates");
        Objects.requireNonNull(config, "config");
        if (candidates.isEmpty()) {
            return Optional.empty();
        }

        double[] positionProbabilities = ProbabilityScorer.positionProbabilities(candidates);
        double[] fluxProbabilities;
        if (config.isFluxMatching()) {
            fluxProbabilities = ProbabilityScorer.fluxProbabilities(candidates);
        } else {
            fluxProbabilities = new double[candidates.size()];
            Arrays.fill(fluxProbabilities, 1.0d);
        }

        double[] combined = new double[candidates.size()];
        IntArrayList survivors = new IntArrayList(candidates.size());
        for (int i = 0; i < combined.length; i++) {
            combined[i] = config.isFluxMatching()
                    ? positionProbabilities[i] * fluxProbabilities[i]
                    : positionProbabilities[i];
            if (finalRun || roundToHundredths(combined[i]) != 0.0d) {
                survivors.add(i);
            }
        }

        if (survivors.isEmpty()) {
            return Optional.empty();
        }

        if (survivors.size() == 1) {
            int only = survivors.getInt(0);
            if (!finalRun && combined[only] < config.getSingleMatchConfidence()) {
                return Optional.empty();
            }
            return Optional.of(new ResolvedMatch(
                    candidates.target(),
                    candidates.candidate(only),
                    positionProbabilities[only],
                    fluxProbabilities[only],
                    combined[only],
                    Double.NaN,
                    1));
        }

        double total = 0.0d;
        for (int i = 0; i < survivors.size(); i++) {
            total += combined[survivors.getInt(i)];
        }

        int best = survivors.getInt(0);
        for (int i = 1; i < survivors.size(); i++) {
            int challenger = survivors.getInt(i);
            if (combined[challenger] > combined[best]
                    || (combined[challenger] == combined[best]
                    && candidates.separationDegrees(challenger) < candidates.separationDegrees(best))) {
                best = challenger;
            }
        }

        double normalized = total > 0.0d ? combined[best] / total : Double.NaN;
        if (!finalRun && !(normalized >= config.getMultipleMatchConfidence())) {
            return Optional.empty();
        }
        return Optional.of(new ResolvedMatch(
                candidates.target(),
                candidates.candidate(best),
                positionProbabilities[best],
                fluxProbabilities[best],
                combined[best],
                normalized,
                survivors.size()));
    }

    /**
     * Resolves a whole pass so that no reference source is claimed twice.
     *
     * <p>Proposals are accepted in descending combined probability (ties by input order). A target
     * that loses its reference to a stronger claim is re-resolved against the candidates still
     * unclaimed, until a sweep accepts nothing.</p>
     *
     * @param candidateSets one set per target, in target order.
     * @param excludedReferenceIds reference ids already taken before this pass.
     * @return accepted matches in acceptance order.
     */
    public static List<ResolvedMatch> resolveAll(
            List<CandidateSet> candidateSets,
            Set<String> excludedReferenceIds,
            MatchingConfig config,
            boolean finalRun
    ) {
        Objects.requireNonNull(candidateSets, "candidateSets");
        Set<String> claimed = new HashSet<>(excludedReferenceIds);
        List<ResolvedMatch> accepted = new ArrayList<>();

        List<Integer> pending = new ArrayList<>(candidateSets.size());
        for (int i = 0; i < candidateSets.size(); i++) {
            if (!candidateSets.get(i).isEmpty()) {
                pending.add(i);
            }
        }

        while (!pending.isEmpty()) {
            List<Proposal> proposals = new ArrayList<>(pending.size());
            for (int order : pending) {
                resolve(candidateSets.get(order).without(claimed), config, finalRun)
                        .ifPresent(match -> proposals.add(new Proposal(order, match)));
            }
            if (proposals.isEmpty()) {
                break;
            }

            proposals.sort(Comparator
                    .comparingDouble((Proposal proposal) -> proposal.match().combinedProbability())
                    .reversed()
                    .thenComparingInt(Proposal::order));

            List<Integer> contested = new ArrayList<>();
            for (Proposal proposal : proposals) {
                if (claimed.add(proposal.match().referenceId())) {
                    accepted.add(proposal.match());
                } else {
                    contested.add(proposal.order());
                }
            }
            contested.sort(Integer::compare);
            pending = contested;
        }
        return accepted;
    }

    /**
     * Rounds half-to-even at two decimals.
     */
    static double roundToHundredths(double value) {
        return Math.rint(value * 100.0d) / 100.0d;
    }

    private record Proposal(int order, ResolvedMatch match) {
    }
}
