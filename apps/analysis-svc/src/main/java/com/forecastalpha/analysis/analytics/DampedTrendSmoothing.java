package com.forecastalpha.analysis.analytics;

import org.apache.commons.math3.analysis.MultivariateFunction;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.SimpleBounds;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.BOBYQAOptimizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exponential smoothing with an additive damped trend and no seasonal component.
 * Smoothing parameters are chosen by minimising the one-step-ahead squared error: a coarse grid
 * search, then a bounded BOBYQA refinement from the best grid point.
 */
final class DampedTrendSmoothing {

    private static final Logger log = LoggerFactory.getLogger(DampedTrendSmoothing.class);

    static final double PHI_MIN = 0.8d;
    static final double PHI_MAX = 0.98d;
    private static final double[] LOWER = {0.0001d, 0d, PHI_MIN};
    private static final double[] UPPER = {0.9999d, 1d, PHI_MAX};
    private static final double[] GRID_ALPHA = {0.1d, 0.2d, 0.3d, 0.4d, 0.5d, 0.6d, 0.7d, 0.8d, 0.9d};
    private static final double[] GRID_BETA_SHARE = {0.05d, 0.2d, 0.4d, 0.6d, 0.8d};
    private static final double[] GRID_PHI = {0.8d, 0.85d, 0.9d, 0.94d, 0.98d};
    private static final int MAX_EVALUATIONS = 2_000;

    private final double alpha;
    private final double beta;
    private final double phi;
    private final double level;
    private final double trend;

    private DampedTrendSmoothing(double alpha, double beta, double phi, double level, double trend) {
        this.alpha = alpha;
        this.beta = beta;
        this.phi = phi;
        this.level = level;
        this.trend = trend;
    }

    static DampedTrendSmoothing fit(double[] series) {
        if (series.length < 3) {
            throw new IllegalArgumentException("damped trend smoothing needs at least 3 observations");
        }
        double[] best = gridSearch(series);
        best = refine(series, best);
        double alpha = best[0];
        double beta = best[0] * best[1];
        double phi = best[2];
        double[] state = run(series, alpha, beta, phi, null);
        return new DampedTrendSmoothing(alpha, beta, phi, state[0], state[1]);
    }

    double[] forecast(int horizon) {
        double[] predictions = new double[horizon];
        double damping = 0d;
        double power = 1d;
        for (int h = 0; h < horizon; h++) {
            power *= phi;
            damping += power;
            predictions[h] = level + damping * trend;
        }
        return predictions;
    }

    double alpha() {
        return alpha;
    }

    double beta() {
        return beta;
    }

    double phi() {
        return phi;
    }

    /**
     * Sum of squared one-step-ahead errors. {@code betaShare} is beta as a fraction of alpha, which
     * keeps {@code beta <= alpha} inside a box constraint.
     */
    static double sse(double[] series, double alpha, double betaShare, double phi) {
        double[] sse = new double[1];
        run(series, alpha, alpha * betaShare, phi, sse);
        return sse[0];
    }

    /**
     * Runs the recursions over the series and returns the final {level, trend}. Starts from
     * {@code level = y0}, {@code trend = y1 - y0}.
     */
    private static double[] run(double[] series, double alpha, double beta, double phi, double[] sseOut) {
        double level = series[0];
        double trend = series[1] - series[0];
        double sse = 0d;
        for (int t = 1; t < series.length; t++) {
            double fitted = level + phi * trend;
            double error = series[t] - fitted;
            sse += error * error;
            double nextLevel = alpha * series[t] + (1 - alpha) * fitted;
            trend = beta * (nextLevel - level) + (1 - beta) * phi * trend;
            level = nextLevel;
        }
        if (sseOut != null) {
            sseOut[0] = sse;
        }
        return new double[] {level, trend};
    }

    private static double[] gridSearch(double[] series) {
        double[] best = {GRID_ALPHA[0], GRID_BETA_SHARE[0], GRID_PHI[0]};
        double bestError = Double.POSITIVE_INFINITY;
        for (double alpha : GRID_ALPHA) {
            for (double share : GRID_BETA_SHARE) {
                for (double phi : GRID_PHI) {
                    double error = sse(series, alpha, share, phi);
                    if (error < bestError) {
                        bestError = error;
                        best = new double[] {alpha, share, phi};
                    }
                }
            }
        }
        return best;
    }

    private static double[] refine(double[] series, double[] start) {
        MultivariateFunction objective = point -> sse(series, point[0], point[1], point[2]);
        try {
            PointValuePair optimum = new BOBYQAOptimizer(7, 0.05d, 1e-6d).optimize(
                    new MaxEval(MAX_EVALUATIONS),
                    new ObjectiveFunction(objective),
                    GoalType.MINIMIZE,
                    new InitialGuess(start),
                    new SimpleBounds(LOWER, UPPER)
            );
            if (optimum.getValue() <= objective.value(start)) {
                return clamp(optimum.getPoint());
            }
            return start;
        } catch (MathIllegalStateException ex) {
            log.warn("Damped trend refinement did not converge, keeping grid estimate: {}", ex.getMessage());
            return start;
        }
    }

    private static double[] clamp(double[] point) {
        double[] clamped = new double[point.length];
        for (int i = 0; i < point.length; i++) {
            clamped[i] = Math.max(LOWER[i], Math.min(UPPER[i], point[i]));
        }
        return clamped;
    }
}
