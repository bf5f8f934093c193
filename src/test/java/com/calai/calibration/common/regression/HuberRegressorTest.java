package com.calai.calibration.common.regression;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class HuberRegressorTest {

    @Test
    void exact_linear_data_is_recovered_and_stops_early() {
        double[][] x = new double[10][2];
        double[] y = new double[10];
        for (int i = 0; i < 10; i++) {
            x[i][0] = i + 1;
            x[i][1] = (i % 3) - 1.5;
            y[i] = 2 * x[i][0] - 3 * x[i][1];
        }

        HuberFit fit = new HuberRegressor(1.35, 100, 1e-10).fit(x, y);

        assertThat(fit.coefficients()[0]).isCloseTo(2.0, within(1e-9));
        assertThat(fit.coefficients()[1]).isCloseTo(-3.0, within(1e-9));
        assertThat(fit.converged()).isTrue();
        assertThat(fit.iterations()).isLessThanOrEqualTo(2);
    }

    @Test
    void single_outlier_barely_moves_the_slope() {
        int n = 20;
        double[][] x = new double[n][1];
        double[] y = new double[n];
        for (int i = 0; i < n; i++) {
            x[i][0] = i + 1;
            y[i] = 2 * (i + 1) + (i % 2 == 0 ? 0.1 : -0.1);
        }
        y[n - 1] += 100;

        double ols = HuberRegressor.weightedLeastSquares(x, y, new double[]{
                1, 1, 1, 1, 1, 1, 1, 1, 1, 1, 1, 1, 1, 1, 1, 1, 1, 1, 1, 1})[0];
        HuberFit fit = new HuberRegressor(1.35, 500, 1e-10).fit(x, y);

        assertThat(ols).isGreaterThan(2.5);
        assertThat(fit.coefficients()[0]).isCloseTo(2.0, within(0.02));
        assertThat(fit.scale()).isLessThan(1.0);
    }

    @Test
    void rank_deficient_design_does_not_throw() {
        double[][] x = {{1, 2}, {2, 4}, {3, 6}};
        double[] y = {1, 2, 3};

        HuberFit fit = new HuberRegressor(1.35, 50, 1e-9).fit(x, y);

        double[] r = HuberRegressor.residuals(x, y, fit.coefficients());
        assertThat(r).containsOnly(new double[]{0.0}, within(1e-9));
    }

    @Test
    void shape_mismatch_is_rejected() {
        assertThatThrownBy(() -> new HuberRegressor(1.35, 10, 1e-6).fit(new double[][]{{1}}, new double[]{1, 2}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("HUBER_SHAPE_MISMATCH");
    }
}
