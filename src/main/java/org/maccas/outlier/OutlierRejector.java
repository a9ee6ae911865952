package org.maccas.outlier;

import lombok.experimental.UtilityClass;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import org.maccas.core.ConfirmedMatch;
import org.maccas.core.MatchingConfig;
import org.maccas.model.OffsetField;
import org.maccas.model.OffsetModeler;
import org.maccas.model.OffsetSample;
import org.maccas.model.OffsetVector;
import org.maccas.scoring.ProbabilityScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SplittableRandom;

/**
 * Rejects matches whose offset disagrees with the field fitted from every other match.
 *
 * <p>A match is rejected when either rule fires:</p>
 * <ol>
 * <li>its offset direction differs from the prediction by more than the angle threshold while the
 * predicted magnitude is smaller than the observed one;</li>
 * <li>its offset magnitude exceeds the predicted magnitude plus the pair's positional error budget.</li>
 * </ol>
 * <p>The direction rule is asymmetric: a large direction change with a predicted magnitude at least
 * as large as the observed one does not reject.</p>
 */
@UtilityClass
public class OutlierRejector {
    private static final Logger logger = LoggerFactory.getLogger(OutlierRejector.class);

    /**
     * Evaluates {@code match} against a field fitted from {@code others}.
     * Fewer than two others leaves nothing to fit, and the match is kept.
     */
    public static OutlierVerdict evaluate(ConfirmedMatch match, List<ConfirmedMatch> others, MatchingConfig config) {
        if (others.size() < 2) {
            return judge(match, null, config);
        }

        List<OffsetSample> samples = new ArrayList<>(others.size());
        for (ConfirmedMatch other : others) {
            samples.add(other.offsetSample());
        }
        OffsetField field = OffsetModeler.fit(samples, config.getRbfSmoothing());
        OffsetVector predicted = field.predict(match.target().ra(), match.target().dec());
        return judge(match, predicted, config);
    }

    private static OutlierVerdict judge(ConfirmedMatch match, OffsetVector predicted, MatchingConfig config) {
        OffsetVector observed = match.offsetSample().offset();
        double errorBudget = ProbabilityScorer.positionErrorBudget(match.reference(), match.target());
        if (predicted == null) {
            return new OutlierVerdict(null, observed, null, errorBudget);
        }
        double observedMagnitude = observed.magnitude();
        double predictedMagnitude = predicted.magnitude();
        RejectionReason reason = null;
        if (observed.angleBetweenDegrees(predicted) > config.getOutlierAngleThresholdDegrees()
                && predictedMagnitude < observedMagnitude) {
            reason = RejectionReason.DIRECTION_DISAGREES;
        } else if (observedMagnitude > predictedMagnitude + errorBudget) {
            reason = RejectionReason.MAGNITUDE_EXCEEDS;
        }
        return new OutlierVerdict(reason, observed, predicted, errorBudget);
    }

    /**
     * Screens the matches accepted this round, leave-one-out against every other confirmed match.
     *
     * <p>Evaluation order is a shuffle drawn from {@code random}. A match rejected earlier in the
     * sweep no longer contributes to later fits. Each verdict matches {@link #evaluate} against the
     * surviving matches, but the held-out predictions for the whole set come from one factorization,
     * redone only after a rejection.</p>
     *
     * @param roundMatches matches accepted in the current round.
     * @param priorMatches matches confirmed in earlier rounds; never rejected here.
     * @return kept matches in their original order, plus rejected copies in evaluation order.
     */
    public static Screening screen(
            List<ConfirmedMatch> roundMatches,
            List<ConfirmedMatch> priorMatches,
            MatchingConfig config,
            SplittableRandom random
    ) {
        Objects.requireNonNull(random, "random");
        Map<String, ConfirmedMatch> current = new LinkedHashMap<>();
        for (ConfirmedMatch prior : priorMatches) {
            current.put(prior.targetId(), prior);
        }
        for (ConfirmedMatch match : roundMatches) {
            current.put(match.targetId(), match);
        }

        List<ConfirmedMatch> order = new ArrayList<>(roundMatches);
        shuffle(order, random);

        List<ConfirmedMatch> rejected = new ArrayList<>();
        HeldOutPredictions heldOut = null;
        for (ConfirmedMatch match : order) {
            OffsetVector predicted = null;
            if (current.size() > 2) {
                if (heldOut == null) {
                    heldOut = HeldOutPredictions.of(current.values(), config.getRbfSmoothing());
                }
                predicted = heldOut.forTarget(match.targetId());
            }
            OutlierVerdict verdict = judge(match, predicted, config);
            if (verdict.rejected()) {
                logger.debug("Rejected match {} -> {} ({}): observed {} predicted {}",
                        match.targetId(), match.referenceId(), verdict.reason(),
                        verdict.observed(), verdict.predicted());
                rejected.add(match.rejected(verdict.reason()));
                current.remove(match.targetId());
                // the remaining matches now fit without this one
                heldOut = null;
            }
        }

        List<ConfirmedMatch> kept = new ArrayList<>(roundMatches.size());
        for (ConfirmedMatch match : roundMatches) {
            if (current.containsKey(match.targetId())) {
                kept.add(match);
            }
        }
        return new Screening(Collections.unmodifiableList(kept), Collections.unmodifiableList(rejected));
    }

    // Fisher-Yates
    private static <T> void shuffle(List<T> items, SplittableRandom random) {
        for (int i = items.size() - 1; i > 0; i--) {
            Collections.swap(items, i, random.nextInt(i + 1));
        }
    }

    private record HeldOutPredictions(Object2IntOpenHashMap<String> rows, List<OffsetVector> predictions) {

        static HeldOutPredictions of(Collection<ConfirmedMatch> matches, double smoothing) {
            Object2IntOpenHashMap<String> rows = new Object2IntOpenHashMap<>(matches.size());
            rows.defaultReturnValue(-1);
            List<OffsetSample> samples = new ArrayList<>(matches.size());
            for (ConfirmedMatch match : matches) {
                rows.put(match.targetId(), samples.size());
                samples.add(match.offsetSample());
            }
            return new HeldOutPredictions(rows, OffsetModeler.leaveOneOut(samples, smoothing));
        }

        OffsetVector forTarget(String targetId) {
            int row = rows.getInt(targetId);
            if (row < 0) {
                throw new IllegalStateException("No held-out prediction for target " + targetId);
            }
            return predictions.get(row);
        }
    }

    /**
     * Result of one screening sweep.
     */
    public record Screening(List<ConfirmedMatch> kept, List<ConfirmedMatch> rejected) {
    }
}
