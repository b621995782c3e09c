package com.bridgesentinel.core.scoring;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link MedianImputer}.
 */
class MedianImputerTest {

    private static final double NaN = Double.NaN;

    @Test
    @DisplayName("Should impute with the median of present values")
    void shouldImputeWithColumnMedian() {
        MedianImputer imputer = MedianImputer.fit(new double[][] {
                { 1.0, NaN, 10.0 },
                { 5.0, NaN, NaN },
                { 3.0, NaN, 30.0 },
                { NaN, NaN, 20.0 },
        });

        assertThat(imputer.getMedians()).containsExactly(3.0, 0.0, 20.0);
        assertThat(imputer.transform(new double[] { NaN, NaN, 7.0 }))
                .containsExactly(3.0, 0.0, 7.0);
    }

    @Test
    @DisplayName("Infinite values should count as absent")
    void infiniteValuesAreAbsent() {
        MedianImputer imputer = MedianImputer.fit(new double[][] {
                { 2.0 }, { Double.POSITIVE_INFINITY }, { 4.0 }, { 6.0 },
        });

        assertThat(imputer.getMedians()).containsExactly(4.0);
        assertThat(imputer.transform(new double[] { Double.NEGATIVE_INFINITY })).containsExactly(4.0);
    }

    @Test
    @DisplayName("transform() should not modify its input")
    void transformCopiesInput() {
        MedianImputer imputer = MedianImputer.fit(new double[][] { { 1.0 } });
        double[] row = { NaN };

        imputer.transform(row);

        assertThat(row[0]).isNaN();
    }

    @Test
    @DisplayName("Should reject rows of the wrong width")
    void rejectsWrongWidth() {
        MedianImputer imputer = MedianImputer.fit(new double[][] { { 1.0, 2.0 } });

        assertThatThrownBy(() -> imputer.transform(new double[] { 1.0 }))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Expected 2 features");
    }

    @Test
    @DisplayName("Should reject ragged training rows")
    void rejectsRaggedRows() {
        assertThatThrownBy(() -> MedianImputer.fit(new double[][] { { 1.0, 2.0 }, { 1.0 } }))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
