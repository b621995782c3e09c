package com.bridgesentinel.core.scoring;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link StandardScaler}.
 */
class StandardScalerTest {

    @Test
    @DisplayName("Should use the population standard deviation")
    void usesPopulationDeviation() {
        StandardScaler scaler = StandardScaler.fit(new double[][] { { 1.0 }, { 3.0 } });

        assertThat(scaler.getMeans()).containsExactly(2.0);
        assertThat(scaler.getScales()).containsExactly(1.0);
        assertThat(scaler.transform(new double[] { 5.0 })[0]).isCloseTo(3.0, within(1e-12));
    }

    @Test
    @DisplayName("Constant features should scale by 1")
    void constantFeatureScalesByOne() {
        StandardScaler scaler = StandardScaler.fit(new double[][] { { 7.0, 0.0 }, { 7.0, 2.0 } });

        assertThat(scaler.getScales()[0]).isEqualTo(1.0);
        assertThat(scaler.transform(new double[] { 9.0, 1.0 })).containsExactly(2.0, 0.0);
    }
}
