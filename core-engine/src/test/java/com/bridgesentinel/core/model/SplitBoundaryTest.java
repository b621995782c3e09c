package com.bridgesentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SplitBoundary}.
 */
class SplitBoundaryTest {

    private static List<Integer> rows(int n) {
        return IntStream.range(0, n).boxed().collect(Collectors.toList());
    }

    @Test
    @DisplayName("Prefix and suffix should partition the rows with no gap or overlap")
    void prefixAndSuffixPartition() {
        SplitBoundary split = new SplitBoundary(0.7);
        List<Integer> source = rows(1_000);

        List<Integer> training = split.trainingPrefix(source);
        List<Integer> replay = split.replaySuffix(source);

        assertThat(training).hasSize(700);
        assertThat(replay).hasSize(300);
        List<Integer> joined = new ArrayList<>(training);
        joined.addAll(replay);
        assertThat(joined).isEqualTo(source);
    }

    @Test
    @DisplayName("Boundary should round down")
    void boundaryRoundsDown() {
        SplitBoundary split = new SplitBoundary(0.7);

        assertThat(split.boundaryIndex(10)).isEqualTo(7);
        assertThat(split.boundaryIndex(9)).isEqualTo(6);
        assertThat(split.boundaryIndex(1)).isZero();
        assertThat(split.boundaryIndex(0)).isZero();
    }

    @Test
    @DisplayName("Ratio of 1 should leave nothing to replay")
    void ratioOneLeavesEmptySuffix() {
        SplitBoundary split = new SplitBoundary(1.0);

        assertThat(split.replaySuffix(rows(5))).isEmpty();
        assertThat(split.trainingPrefix(rows(5))).hasSize(5);
    }

    @Test
    @DisplayName("Should reject ratios outside [0, 1]")
    void rejectsOutOfRangeRatio() {
        assertThatThrownBy(() -> new SplitBoundary(1.5)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SplitBoundary(-0.1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SplitBoundary(Double.NaN)).isInstanceOf(IllegalArgumentException.class);
    }
}
