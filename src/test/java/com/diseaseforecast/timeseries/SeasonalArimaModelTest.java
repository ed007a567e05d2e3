package com.diseaseforecast.timeseries;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;

class SeasonalArimaModelTest {

    private static final SarimaOrder ORDER = new SarimaOrder(2, 1, 1, 52);

    static double[] seasonalSeries(int weeks, long seed) {
        Random random = new Random(seed);
        double[] y = new double[weeks];
        for (int t = 0; t < weeks; t++) {
            y[t] = 100 + 40 * Math.sin(2 * Math.PI * t / 52.0) + 0.2 * t + random.nextGaussian() * 5;
        }
        return y;
    }

    @Test
    void forecast_returnsRequestedStepsWithOrderedBounds() {
        SeasonalArimaModel model = SeasonalArimaModel.fit(seasonalSeries(156, 7L), ORDER);

        List<ForecastPoint> points = model.forecast(6, 0.95);

        assertThat(points).hasSize(6);
        assertThat(points).allSatisfy(p -> {
            assertThat(p.predicted()).isFinite();
            assertThat(p.lower()).isLessThanOrEqualTo(p.predicted());
            assertThat(p.upper()).isGreaterThanOrEqualTo(p.predicted());
        });
        assertThat(model.getAppliedSeasonalD()).isEqualTo(1);
        assertThat(model.getObservationCount()).isEqualTo(156);
    }

    @Test
    void forecast_intervalsWidenWithHorizon() {
        SeasonalArimaModel model = SeasonalArimaModel.fit(seasonalSeries(156, 11L), ORDER);

        List<ForecastPoint> points = model.forecast(4, 0.95);

        double first = points.get(0).upper() - points.get(0).lower();
        double last = points.get(3).upper() - points.get(3).lower();
        assertThat(last).isGreaterThanOrEqualTo(first);
    }

    @Test
    void fitAndForecast_areDeterministic() {
        double[] series = seasonalSeries(120, 3L);

        List<ForecastPoint> a = SeasonalArimaModel.fit(series, ORDER).forecast(4, 0.95);
        List<ForecastPoint> b = SeasonalArimaModel.fit(series, ORDER).forecast(4, 0.95);

        assertThat(a).isEqualTo(b);
    }

    @Test
    void stateRoundTrip_reproducesForecast() {
        SeasonalArimaModel model = SeasonalArimaModel.fit(seasonalSeries(110, 5L), ORDER);

        SeasonalArimaModel restored = SeasonalArimaModel.fromState(model.toState());

        assertThat(restored.forecast(4, 0.9)).isEqualTo(model.forecast(4, 0.9));
        assertThat(restored.getArCoefficients()).containsExactly(model.getArCoefficients());
    }

    @Test
    void shortSeries_skipsSeasonalDifferencing() {
        double[] series = {12, 15, 11, 14, 18, 13, 16, 12, 17, 15};

        SeasonalArimaModel model = SeasonalArimaModel.fit(series, ORDER);

        assertThat(model.getAppliedSeasonalD()).isZero();
        assertThat(model.forecast(3, 0.95)).hasSize(3)
            .allSatisfy(p -> {
                assertThat(p.predicted()).isFinite();
                assertThat(p.lower()).isLessThanOrEqualTo(p.upper());
            });
    }

    @Test
    void emptySeries_isRejected() {
        assertThatThrownBy(() -> SeasonalArimaModel.fit(new double[0], ORDER))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void forecast_rejectsNonPositiveSteps() {
        SeasonalArimaModel model = SeasonalArimaModel.fit(seasonalSeries(60, 1L), ORDER);
        assertThatThrownBy(() -> model.forecast(0, 0.95)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void fromState_rejectsMismatchedCoefficients() {
        SarimaState fitted = SeasonalArimaModel.fit(seasonalSeries(60, 2L), ORDER).toState();
        SarimaState state = SarimaState.builder()
            .p(fitted.getP()).seasonalD(fitted.getSeasonalD()).seasonalQ(fitted.getSeasonalQ())
            .period(fitted.getPeriod()).appliedSeasonalD(fitted.getAppliedSeasonalD()).mean(fitted.getMean())
            .arCoefficients(new double[] {0.1})
            .seasonalMaCoefficients(fitted.getSeasonalMaCoefficients())
            .sigma2(fitted.getSigma2()).observations(fitted.getObservations())
            .transformed(fitted.getTransformed()).residuals(fitted.getResiduals())
            .build();
        assertThatThrownBy(() -> SeasonalArimaModel.fromState(state)).isInstanceOf(IllegalArgumentException.class);
    }
}
