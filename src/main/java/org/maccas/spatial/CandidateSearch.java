package org.maccas.spatial;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.maccas.catalog.Catalog;
import org.maccas.catalog.SourceRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Coarse net: every reference source within a fixed angular radius of a target position.
 *
 * <p>Bound to one reference catalogue snapshot. Queries are independent and read-only, so
 * callers may run them for different target sources in parallel.</p>
 */
public final class CandidateSearch {
    private final Catalog reference;
    private final SkyIndex index;
    private final double radiusDegrees;

    /**
     * @param reference reference catalogue snapshot to search.
     * @param radiusDegrees inclusive search radius.
     */
    public CandidateSearch(Catalog reference, double radiusDegrees) {
        this.reference = Objects.requireNonNull(reference, "reference");
        if (!(radiusDegrees > 0.0d) || !Double.isFinite(radiusDegrees)) {
            throw new IllegalArgumentException("radiusDegrees must be finite and > 0, got " + radiusDegrees);
        }
        this.radiusDegrees = radiusDegrees;
        this.index = SkyIndex.build(reference);
    }

    public Catalog reference() {
        return reference;
    }

    public double radiusDegrees() {
        return radiusDegrees;
    }

    /**
     * Candidates around the position carried by {@code target}.
     */
    public CandidateSet candidatesFor(SourceRecord target) {
        IntArrayList rows = index.withinRadius(target.ra(), target.dec(), radiusDegrees);
        if (rows.isEmpty()) {
            return CandidateSet.empty(target);
        }
        List<SourceRecord> candidates = new ArrayList<>(rows.size());
        double[] separations = new double[rows.size()];
        for (int i = 0; i < rows.size(); i++) {
            SourceRecord candidate = reference.get(rows.getInt(i));
            candidates.add(candidate);
            separations[i] = SkyGeometry.separationDegrees(
                    target.ra(), target.dec(), candidate.ra(), candidate.dec());
        }
        return new CandidateSet(target, candidates, separations);
    }

    /**
     * Candidate sets for every row of {@code targets}, in row order. Empty sets are included.
     */
    public List<CandidateSet> candidatesFor(Catalog targets) {
        List<CandidateSet> sets = new ArrayList<>(targets.size());
        for (SourceRecord target : targets) {
            sets.add(candidatesFor(target));
        }
        return sets;
    }
}
