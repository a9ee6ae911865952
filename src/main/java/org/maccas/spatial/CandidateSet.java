package org.maccas.spatial;

import org.maccas.catalog.SourceRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Reference sources within the coarse search radius of one target source.
 *
 * <p>Candidates are in ascending reference-row order; {@link #separationDegrees(int)} is
 * aligned with {@link #candidate(int)}.</p>
 */
public final class CandidateSet {
    private final SourceRecord target;
    private final List<SourceRecord> candidates;
    private final double[] separationsDegrees;

    public CandidateSet(SourceRecord target, List<SourceRecord> candidates, double[] separationsDegrees) {
        this.target = Objects.requireNonNull(target, "target");
        Objects.requireNonNull(candidates, "candidates");
        Objects.requireNonNull(separationsDegrees, "separationsDegrees");
        if (candidates.size() != separationsDegrees.length) {
            throw new IllegalArgumentException("candidates and separations must have equal length");
        }
        this.candidates = Collections.unmodifiableList(new ArrayList<>(candidates));
        this.separationsDegrees = separationsDegrees.clone();
    }

    public static CandidateSet empty(SourceRecord target) {
        return new CandidateSet(target, List.of(), new double[0]);
    }

    public SourceRecord target() {
        return target;
    }

    public int size() {
        return candidates.size();
    }

    public boolean isEmpty() {
        return candidates.isEmpty();
    }

    public SourceRecord candidate(int i) {
        return candidates.get(i);
    }

    public double separationDegrees(int i) {
        return separationsDegrees[i];
    }

    public List<SourceRecord> candidates() {
        return candidates;
    }

    /**
     * Copy without candidates whose id is in {@code excludedIds}.
     */
    public CandidateSet without(Set<String> excludedIds) {
        if (excludedIds.isEmpty()) {
            return this;
        }
        List<SourceRecord> kept = new ArrayList<>(candidates.size());
        double[] keptSeparations = new double[candidates.size()];
        for (int i = 0; i < candidates.size(); i++) {
            SourceRecord candidate = candidates.get(i);
            if (!excludedIds.contains(candidate.id())) {
                keptSeparations[kept.size()] = separationsDegrees[i];
                kept.add(candidate);
            }
        }
        if (kept.size() == candidates.size()) {
            return this;
        }
        double[] trimmed = new double[kept.size()];
        System.arraycopy(keptSeparations, 0, trimmed, 0, kept.size());
        return new CandidateSet(target, kept, trimmed);
    }

    @Override
    public String toString() {
        return "CandidateSet[target=" + target.id() + ", candidates=" + candidates.size() + "]";
    }
}
