package com.hostsentinel.core.detection;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link OutlierModel} and {@link FeatureScaler}.
 */
class OutlierModelTest {

    @Test
    @DisplayName("Quantile interpolates linearly between order statistics")
    void quantileInterpolates() {
        double[] values = {4, 1, 3, 2};

        assertThat(OutlierModel.quantile(values, 0.0)).isEqualTo(1.0);
        assertThat(OutlierModel.quantile(values, 1.0)).isEqualTo(4.0);
        assertThat(OutlierModel.quantile(values, 0.5)).isCloseTo(2.5, within(1e-12));
        assertThat(values).containsExactly(4, 1, 3, 2);
    }

    @Test
    @DisplayName("Scaler centres columns and leaves constant columns unscaled")
    void scalerStandardises() {
        FeatureScaler scaler = FeatureScaler.fit(List.of(
                new double[] {0, 7},
                new double[] {10, 7}));

        assertThat(scaler.transform(new double[] {10, 7})).containsExactly(1.0, 0.0);
        assertThat(scaler.transform(new double[] {5, 8})).containsExactly(0.0, 1.0);
    }

    @Test
    @DisplayName("An outlying row gets a negative decision")
    void outlierDecisionIsNegative() {
        List<double[]> rows = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            rows.add(new double[] {10 + i % 4, 20 + i % 3});
        }
        OutlierModel model = OutlierModel.fit(rows, 50, 0.1, 42L);

        assertThat(model.trainingRows()).isEqualTo(40);
        assertThat(model.decision(new double[] {500, -300})).isNegative();
    }

    @Test
    @DisplayName("Fitting needs at least two rows")
    void fitNeedsTwoRows() {
        assertThatThrownBy(() -> OutlierModel.fit(List.of(new double[] {1}), 10, 0.1, 1L))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
