package com.bridgesentinel.core.model;

import java.util.List;

/**
 * Divides a historical dataset into a training prefix and a replay suffix.
 *
 * <p>
 * For {@code N} rows and ratio {@code r} the boundary is
 * {@code k = floor(N * r)}: rows {@code [0, k)} are seeded for training and
 * rows {@code [k, N)} are replayed as the live feed. The seeder and the feed
 * producer must use the same ratio over the same row order or the two sets
 * overlap or leave a gap.
 * </p>
 *
 * @since 1.0.0
 */
public final class SplitBoundary {

    private final double ratio;

    /**
     * @param ratio training fraction in {@code [0, 1]}
     * @throws IllegalArgumentException if the ratio is out of range
     */
    public SplitBoundary(double ratio) {
        if (!(ratio >= 0.0 && ratio <= 1.0)) {
            throw new IllegalArgumentException("Split ratio must be in [0, 1], got: " + ratio);
        }
        this.ratio = ratio;
    }

    public double getRatio() {
        return ratio;
    }

    /**
     * @param totalRows dataset size
     * @return index of the first replay row
     */
    public int boundaryIndex(int totalRows) {
        if (totalRows < 0) {
            throw new IllegalArgumentException("totalRows must be >= 0, got: " + totalRows);
        }
        return (int) Math.floor(totalRows * ratio);
    }

    public <T> List<T> trainingPrefix(List<T> rows) {
        return List.copyOf(rows.subList(0, boundaryIndex(rows.size())));
    }

    public <T> List<T> replaySuffix(List<T> rows) {
        return List.copyOf(rows.subList(boundaryIndex(rows.size()), rows.size()));
    }

    @Override
    public String toString() {
        return "SplitBoundary{ratio=" + ratio + '}';
    }
}
