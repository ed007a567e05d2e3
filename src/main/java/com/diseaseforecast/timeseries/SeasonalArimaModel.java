package com.diseaseforecast.timeseries;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.SimpleBounds;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.BOBYQAOptimizer;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Seasonal ARIMA of the form SARIMA(p,0,0)(0,D,Q)s.
 * <p>
 * With {@code w_t = y_t - y_{t-s}} (or {@code y_t - mean} when no seasonal difference is applied):
 * <pre>
 *   w_t = φ₁w_{t-1} + ... + φₚw_{t-p} + ε_t + Θ₁ε_{t-s} + ... + Θ_Qε_{t-Qs}
 * </pre>
 * Coefficients are estimated by conditional sum of squares. Stationarity and invertibility are
 * not enforced; coefficients are only boxed to [-1.5, 1.5].
 */
@Slf4j
public final class SeasonalArimaModel {

    private static final double PARAMETER_BOUND = 1.5;
    private static final double GUESS_MARGIN = 0.01;
    private static final int MAX_EVALUATIONS = 5000;
    private static final double INITIAL_TRUST_REGION = 0.5;
    private static final double STOPPING_TRUST_REGION = 1e-6;

    private final SarimaOrder order;
    private final int appliedSeasonalD;
    private final double mean;
    private final double[] ar;
    private final double[] seasonalMa;
    private final double sigma2;
    private final double[] observations;
    private final double[] transformed;
    private final double[] residuals;

    private SeasonalArimaModel(SarimaOrder order, int appliedSeasonalD, double mean,
                               double[] ar, double[] seasonalMa, double sigma2,
                               double[] observations, double[] transformed, double[] residuals) {
        this.order = order;
        this.appliedSeasonalD = appliedSeasonalD;
        this.mean = mean;
        this.ar = ar;
        this.seasonalMa = seasonalMa;
        this.sigma2 = sigma2;
        this.observations = observations;
        this.transformed = transformed;
        this.residuals = residuals;
    }

    public static SeasonalArimaModel fit(double[] series, SarimaOrder order) {
        if (series == null || series.length == 0) {
            throw new IllegalArgumentException("Cannot fit a model on an empty series");
        }
        int n = series.length;
        int s = order.period();
        int appliedD = n > s * order.seasonalD() + order.p() ? order.seasonalD() : 0;
        if (appliedD < order.seasonalD()) {
            log.info("Seasonal differencing skipped | observations={} | period={}", n, s);
        }

        double mean = appliedD == 0 ? StatUtils.mean(series) : 0.0;
        double[] z = transform(series, appliedD, s, mean);

        double[] params = estimate(z, order);
        double[] ar = Arrays.copyOfRange(params, 0, order.p());
        double[] sma = Arrays.copyOfRange(params, order.p(), params.length);
        double[] e = residuals(z, ar, sma, s);
        double sigma2 = innovationVariance(e, order.p(), series);

        return new SeasonalArimaModel(order, appliedD, mean, ar, sma, sigma2, series.clone(), z, e);
    }

    public static SeasonalArimaModel fromState(SarimaState state) {
        SarimaOrder order = new SarimaOrder(state.getP(), state.getSeasonalD(), state.getSeasonalQ(), state.getPeriod());
        if (state.getArCoefficients().length != order.p()
                || state.getSeasonalMaCoefficients().length != order.seasonalQ()) {
            throw new IllegalArgumentException("Coefficient count does not match model order");
        }
        return new SeasonalArimaModel(order, state.getAppliedSeasonalD(), state.getMean(),
            state.getArCoefficients().clone(), state.getSeasonalMaCoefficients().clone(), state.getSigma2(),
            state.getObservations().clone(), state.getTransformed().clone(), state.getResiduals().clone());
    }

    public SarimaState toState() {
        return SarimaState.builder()
            .p(order.p())
            .seasonalD(order.seasonalD())
            .seasonalQ(order.seasonalQ())
            .period(order.period())
            .appliedSeasonalD(appliedSeasonalD)
            .mean(mean)
            .arCoefficients(ar.clone())
            .seasonalMaCoefficients(seasonalMa.clone())
            .sigma2(sigma2)
            .observations(observations.clone())
            .transformed(transformed.clone())
            .residuals(residuals.clone())
            .build();
    }

    /**
     * Forecasts the next {@code steps} observations after the training window.
     *
     * @param confidenceLevel two-sided coverage of the bounds, e.g. 0.95
     */
    public List<ForecastPoint> forecast(int steps, double confidenceLevel) {
        if (steps < 1) {
            throw new IllegalArgumentException("steps must be >= 1");
        }
        if (confidenceLevel <= 0.0 || confidenceLevel >= 1.0) {
            throw new IllegalArgumentException("confidenceLevel must be in (0, 1)");
        }
        int s = order.period();
        int m = transformed.length;
        int n = observations.length;

        double[] z = Arrays.copyOf(transformed, m + steps);
        double[] e = Arrays.copyOf(residuals, m + steps);
        for (int t = m; t < m + steps; t++) {
            z[t] = predict(z, e, t, ar, seasonalMa, s);
        }

        double quantile = new NormalDistribution().inverseCumulativeProbability(1.0 - (1.0 - confidenceLevel) / 2.0);
        double[] psi = psiWeights(steps);
        double[] y = Arrays.copyOf(observations, n + steps);
        List<ForecastPoint> points = new ArrayList<>(steps);
        double cumulative = 0.0;
        for (int h = 0; h < steps; h++) {
            int t = n + h;
            y[t] = appliedSeasonalD == 1 ? z[m + h] + y[t - s] : z[m + h] + mean;
            cumulative += psi[h] * psi[h];
            double margin = quantile * Math.sqrt(sigma2 * cumulative);
            points.add(new ForecastPoint(y[t], y[t] - margin, y[t] + margin));
        }
        return points;
    }

    public SarimaOrder getOrder() {
        return order;
    }

    public int getObservationCount() {
        return observations.length;
    }

    public int getAppliedSeasonalD() {
        return appliedSeasonalD;
    }

    public double getSigma2() {
        return sigma2;
    }

    public double[] getArCoefficients() {
        return ar.clone();
    }

    public double[] getSeasonalMaCoefficients() {
        return seasonalMa.clone();
    }

    private static double[] transform(double[] y, int seasonalD, int s, double mean) {
        if (seasonalD == 1) {
            double[] z = new double[y.length - s];
            for (int t = s; t < y.length; t++) {
                z[t - s] = y[t] - y[t - s];
            }
            return z;
        }
        double[] z = new double[y.length];
        for (int t = 0; t < y.length; t++) {
            z[t] = y[t] - mean;
        }
        return z;
    }

    private static double[] estimate(double[] z, SarimaOrder order) {
        int k = order.parameterCount();
        double[] initial = new double[k];
        if (k == 0 || z.length - order.p() <= k) {
            return initial;
        }
        double[] arGuess = olsAutoregression(z, order.p());
        for (int i = 0; i < arGuess.length; i++) {
            double bound = PARAMETER_BOUND - GUESS_MARGIN;
            initial[i] = Math.max(-bound, Math.min(bound, arGuess[i]));
        }
        // BOBYQA needs at least two dimensions
        if (k < 2) {
            return initial;
        }

        double[] lower = new double[k];
        double[] upper = new double[k];
        Arrays.fill(lower, -PARAMETER_BOUND);
        Arrays.fill(upper, PARAMETER_BOUND);
        try {
            BOBYQAOptimizer optimizer = new BOBYQAOptimizer(2 * k + 1, INITIAL_TRUST_REGION, STOPPING_TRUST_REGION);
            PointValuePair result = optimizer.optimize(
                new MaxEval(MAX_EVALUATIONS),
                new ObjectiveFunction(params -> conditionalSumOfSquares(z, params, order)),
                GoalType.MINIMIZE,
                new InitialGuess(initial),
                new SimpleBounds(lower, upper)
            );
            return result.getPoint();
        } catch (TooManyEvaluationsException ex) {
            log.warn("CSS optimisation did not converge | evaluations={} | using starting values", MAX_EVALUATIONS);
            return initial;
        }
    }

    private static double[] olsAutoregression(double[] z, int p) {
        double[] coefficients = new double[p];
        int rows = z.length - p;
        if (p == 0 || rows <= p) {
            return coefficients;
        }
        double[][] x = new double[rows][p];
        double[] target = new double[rows];
        for (int t = p; t < z.length; t++) {
            for (int j = 0; j < p; j++) {
                x[t - p][j] = z[t - 1 - j];
            }
            target[t - p] = z[t];
        }
        try {
            OLSMultipleLinearRegression ols = new OLSMultipleLinearRegression();
            ols.setNoIntercept(true);
            ols.newSampleData(target, x);
            return ols.estimateRegressionParameters();
        } catch (MathIllegalArgumentException ex) {
            log.debug("OLS starting values unavailable | reason={}", ex.getMessage());
            return coefficients;
        }
    }

    private static double conditionalSumOfSquares(double[] z, double[] params, SarimaOrder order) {
        double[] ar = Arrays.copyOfRange(params, 0, order.p());
        double[] sma = Arrays.copyOfRange(params, order.p(), params.length);
        double[] e = residuals(z, ar, sma, order.period());
        double rss = 0.0;
        for (int t = order.p(); t < e.length; t++) {
            rss += e[t] * e[t];
        }
        return rss;
    }

    private static double[] residuals(double[] z, double[] ar, double[] sma, int s) {
        double[] e = new double[z.length];
        for (int t = 0; t < z.length; t++) {
            e[t] = z[t] - predict(z, e, t, ar, sma, s);
        }
        return e;
    }

    private static double predict(double[] z, double[] e, int t, double[] ar, double[] sma, int s) {
        double value = 0.0;
        for (int i = 0; i < ar.length && t - 1 - i >= 0; i++) {
            value += ar[i] * z[t - 1 - i];
        }
        for (int j = 0; j < sma.length && t - s * (j + 1) >= 0; j++) {
            value += sma[j] * e[t - s * (j + 1)];
        }
        return value;
    }

    private static double innovationVariance(double[] e, int p, double[] series) {
        int count = e.length - p;
        if (count <= 0) {
            return series.length > 1 ? StatUtils.variance(series) : 0.0;
        }
        double rss = 0.0;
        for (int t = p; t < e.length; t++) {
            rss += e[t] * e[t];
        }
        return rss / count;
    }

    /** MA(∞) weights of the full model in terms of the original series. */
    private double[] psiWeights(int count) {
        int s = order.period();
        double[] arPoly = new double[ar.length + 1];
        arPoly[0] = 1.0;
        for (int i = 0; i < ar.length; i++) {
            arPoly[i + 1] = -ar[i];
        }
        if (appliedSeasonalD == 1) {
            double[] seasonalDiff = new double[s + 1];
            seasonalDiff[0] = 1.0;
            seasonalDiff[s] = -1.0;
            arPoly = multiply(arPoly, seasonalDiff);
        }
        double[] maPoly = new double[seasonalMa.length * s + 1];
        maPoly[0] = 1.0;
        for (int j = 0; j < seasonalMa.length; j++) {
            maPoly[s * (j + 1)] = seasonalMa[j];
        }

        double[] psi = new double[count];
        psi[0] = 1.0;
        for (int j = 1; j < count; j++) {
            double value = j < maPoly.length ? maPoly[j] : 0.0;
            for (int i = 1; i <= Math.min(j, arPoly.length - 1); i++) {
                value -= arPoly[i] * psi[j - i];
            }
            psi[j] = value;
        }
        return psi;
    }

    private static double[] multiply(double[] a, double[] b) {
        double[] product = new double[a.length + b.length - 1];
        for (int i = 0; i < a.length; i++) {
            for (int j = 0; j < b.length; j++) {
                product[i + j] += a[i] * b[j];
            }
        }
        return product;
    }
}
