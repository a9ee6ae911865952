package org.maccas.spatial;

import it.unimi.dsi.fastutil.bytes.ByteArrayList;
import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntArrays;
import org.maccas.catalog.Catalog;

import java.util.Arrays;
import java.util.Objects;

/**
 * KD tree over catalogue positions projected onto the unit sphere.
 * <p>
 * Positions are stored as 3D unit vectors so that angular radius queries become chord-length
 * queries with no special handling of the RA wrap or the poles. The tree is immutable after
 * construction and safe for concurrent reads.
 * </p>
 */
public final class SkyIndex {
    private static final int LEAF_SIZE = 8;
    private static final int DIMENSIONS = 3;

    private final double[] vectors;
    private final int rootIndex;
    private final double[] splitValues;
    private final int[] leftChildren;
    private final int[] rightChildren;
    private final int[] itemStartIndices;
    private final int[] itemCounts;
    private final byte[] splitAxes;
    private final byte[] leafFlags;
    private final int[] leafItems;

    private SkyIndex(
            double[] vectors,
            int rootIndex,
            double[] splitValues,
            int[] leftChildren,
            int[] rightChildren,
            int[] itemStartIndices,
            int[] itemCounts,
            byte[] splitAxes,
            byte[] leafFlags,
            int[] leafItems
    ) {
        this.vectors = vectors;
        this.rootIndex = rootIndex;
        this.splitValues = splitValues;
        this.leftChildren = leftChildren;
        this.rightChildren = rightChildren;
        this.itemStartIndices = itemStartIndices;
        this.itemCounts = itemCounts;
        this.splitAxes = splitAxes;
        this.leafFlags = leafFlags;
        this.leafItems = leafItems;
    }

    /**
     * Builds an index over the catalogue rows. Query results refer to catalogue row numbers.
     */
    public static SkyIndex build(Catalog catalog) {
        Objects.requireNonNull(catalog, "catalog");
        int size = catalog.size();
        double[] vectors = new double[size * DIMENSIONS];
        for (int row = 0; row < size; row++) {
            double ra = catalog.get(row).ra();
            double dec = catalog.get(row).dec();
            if (!Double.isFinite(ra) || !Double.isFinite(dec)) {
                throw new IllegalArgumentException(
                        "Source '" + catalog.idAt(row) + "' has a non-finite position");
            }
            SkyGeometry.unitVector(ra, dec, vectors, row * DIMENSIONS);
        }

        int[] items = new int[size];
        for (int i = 0; i < size; i++) {
            items[i] = i;
        }

        Builder builder = new Builder(vectors, items);
        int root = size == 0 ? -1 : builder.buildNode(0, size);
        return new SkyIndex(
                vectors,
                root,
                builder.splitValues.toDoubleArray(),
                builder.leftChildren.toIntArray(),
                builder.rightChildren.toIntArray(),
                builder.itemStarts.toIntArray(),
                builder.itemCounts.toIntArray(),
                builder.splitAxes.toByteArray(),
                builder.leafFlags.toByteArray(),
                items
        );
    }

    public int size() {
        return vectors.length / DIMENSIONS;
    }

    public int treeNodeCount() {
        return splitValues.length;
    }

    /**
     * Rows within {@code radiusDeg} (inclusive) of the query position, in ascending row order.
     */
    public IntArrayList withinRadius(double raDeg, double decDeg, double radiusDeg) {
        validateQueryCoordinate(raDeg, "raDeg");
        validateQueryCoordinate(decDeg, "decDeg");
        if (!(radiusDeg >= 0.0d)) {
            throw new IllegalArgumentException("radiusDeg must be >= 0, got " + radiusDeg);
        }
        IntArrayList hits = new IntArrayList();
        if (rootIndex < 0) {
            return hits;
        }

        double[] query = new double[DIMENSIONS];
        SkyGeometry.unitVector(raDeg, decDeg, query, 0);
        double limitSquared = SkyGeometry.chordSquaredForAngle(radiusDeg);
        double limit = Math.sqrt(limitSquared);

        int[] stack = new int[Math.max(4, Math.min(64, splitValues.length))];
        int top = 0;
        stack[top++] = rootIndex;

        while (top > 0) {
            int nodeIndex = stack[--top];

            if (leafFlags[nodeIndex] != 0) {
                int start = itemStartIndices[nodeIndex];
                int end = start + itemCounts[nodeIndex];
                for (int i = start; i < end; i++) {
                    int row = leafItems[i];
                    if (chordSquared(row, query) <= limitSquared) {
                        hits.add(row);
                    }
                }
                continue;
            }

            int axis = splitAxes[nodeIndex];
            double coordinate = query[axis];
            double split = splitValues[nodeIndex];
            if (top + 2 > stack.length) {
                stack = Arrays.copyOf(stack, stack.length << 1);
            }
            if (coordinate - limit <= split) {
                stack[top++] = leftChildren[nodeIndex];
            }
            if (coordinate + limit >= split) {
                stack[top++] = rightChildren[nodeIndex];
            }
        }

        IntArrays.quickSort(hits.elements(), 0, hits.size());
        return hits;
    }

    /**
     * Nearest row to the query position. Tie-break is deterministic: lower row wins.
     *
     * @return nearest match, or {@code null} when the index is empty.
     */
    public SkyMatch nearest(double raDeg, double decDeg) {
        validateQueryCoordinate(raDeg, "raDeg");
        validateQueryCoordinate(decDeg, "decDeg");
        if (rootIndex < 0) {
            return null;
        }

        double[] query = new double[DIMENSIONS];
        SkyGeometry.unitVector(raDeg, decDeg, query, 0);

        int bestRow = -1;
        double bestDistanceSquared = Double.POSITIVE_INFINITY;

        int[] stack = new int[Math.max(4, Math.min(64, splitValues.length))];
        int top = 0;
        stack[top++] = rootIndex;

        while (top > 0) {
            int nodeIndex = stack[--top];

            if (leafFlags[nodeIndex] != 0) {
                int start = itemStartIndices[nodeIndex];
                int end = start + itemCounts[nodeIndex];
                for (int i = start; i < end; i++) {
                    int row = leafItems[i];
                    double distanceSquared = chordSquared(row, query);
                    if (distanceSquared < bestDistanceSquared
                            || (distanceSquared == bestDistanceSquared && row < bestRow)) {
                        bestDistanceSquared = distanceSquared;
                        bestRow = row;
                    }
                }
                continue;
            }

            int axis = splitAxes[nodeIndex];
            double delta = query[axis] - splitValues[nodeIndex];
            double splitPlaneDistanceSquared = delta * delta;

            int nearChild = delta <= 0.0d ? leftChildren[nodeIndex] : rightChildren[nodeIndex];
            int farChild = delta <= 0.0d ? rightChildren[nodeIndex] : leftChildren[nodeIndex];

            if (top + 2 > stack.length) {
                stack = Arrays.copyOf(stack, stack.length << 1);
            }
            if (splitPlaneDistanceSquared <= bestDistanceSquared) {
                stack[top++] = farChild;
            }
            stack[top++] = nearChild;
        }

        return new SkyMatch(bestRow, SkyGeometry.angleForChordSquared(bestDistanceSquared));
    }

    @Override
    public String toString() {
        return "SkyIndex[size=" + size() + ", treeNodes=" + splitValues.length + "]";
    }

    private double chordSquared(int row, double[] query) {
        int offset = row * DIMENSIONS;
        double dx = vectors[offset] - query[0];
        double dy = vectors[offset + 1] - query[1];
        double dz = vectors[offset + 2] - query[2];
        return dx * dx + dy * dy + dz * dz;
    }

    private static void validateQueryCoordinate(double value, String name) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException(name + " must be finite");
        }
    }

    /**
     * Median-split construction into flat node arrays.
     */
    private static final class Builder {
        private final double[] vectors;
        private final int[] items;
        private final DoubleArrayList splitValues = new DoubleArrayList();
        private final IntArrayList leftChildren = new IntArrayList();
        private final IntArrayList rightChildren = new IntArrayList();
        private final IntArrayList itemStarts = new IntArrayList();
        private final IntArrayList itemCounts = new IntArrayList();
        private final ByteArrayList splitAxes = new ByteArrayList();
        private final ByteArrayList leafFlags = new ByteArrayList();

        private Builder(double[] vectors, int[] items) {
            this.vectors = vectors;
            this.items = items;
        }

        private int buildNode(int from, int to) {
            int nodeIndex = splitValues.size();
            splitValues.add(0.0d);
            leftChildren.add(-1);
            rightChildren.add(-1);
            itemStarts.add(from);
            itemCounts.add(to - from);
            splitAxes.add((byte) 0);
            leafFlags.add((byte) 1);

            if (to - from <= LEAF_SIZE) {
                return nodeIndex;
            }

            int axis = widestAxis(from, to);
            IntArrays.quickSort(items, from, to,
                    (a, b) -> Double.compare(vectors[a * DIMENSIONS + axis], vectors[b * DIMENSIONS + axis]));
            int mid = (from + to) >>> 1;

            splitValues.set(nodeIndex, vectors[items[mid] * DIMENSIONS + axis]);
            splitAxes.set(nodeIndex, (byte) axis);
            leafFlags.set(nodeIndex, (byte) 0);
            itemCounts.set(nodeIndex, 0);

            int left = buildNode(from, mid);
            int right = buildNode(mid, to);
            leftChildren.set(nodeIndex, left);
            rightChildren.set(nodeIndex, right);
            return nodeIndex;
        }

        private int widestAxis(int from, int to) {
            int bestAxis = 0;
            double bestExtent = -1.0d;
            for (int axis = 0; axis < DIMENSIONS; axis++) {
                double min = Double.POSITIVE_INFINITY;
                double max = Double.NEGATIVE_INFINITY;
                for (int i = from; i < to; i++) {
                    double value = vectors[items[i] * DIMENSIONS + axis];
                    min = Math.min(min, value);
                    max = Math.max(max, value);
                }
                if (max - min > bestExtent) {
                    bestExtent = max - min;
                    bestAxis = axis;
                }
            }
            return bestAxis;
        }
    }
}
