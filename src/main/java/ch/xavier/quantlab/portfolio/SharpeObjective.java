package ch.xavier.quantlab.portfolio;

import org.apache.commons.math3.analysis.MultivariateFunction;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * Negative annualized Sharpe ratio of a long-only portfolio, as minimized by the max-Sharpe solver.
 * <p>
 * The solver works on the box {@code [0, 1]^n}; a point is mapped onto the simplex by dividing it by its sum, and
 * the distance of that sum from 1 is penalized so iterates stay close to the simplex.
 */
class SharpeObjective implements MultivariateFunction {

    static final double SIMPLEX_PENALTY = 10.0;
    private static final double MIN_WEIGHT_SUM = 1e-12;

    private final RealVector meanReturns;
    private final RealMatrix covariance;
    private final int periodsPerYear;
    private final double zeroVolatilityTolerance;

    SharpeObjective(double[] meanReturns, RealMatrix covariance, int periodsPerYear, double zeroVolatilityTolerance) {
        this.meanReturns = new ArrayRealVector(meanReturns);
        this.covariance = covariance;
        this.periodsPerYear = periodsPerYear;
        this.zeroVolatilityTolerance = zeroVolatilityTolerance;
    }

    @Override
    public double value(double[] point) {
        double sum = 0;
        for (double x : point) {
            sum += x;
        }

        double penalty = SIMPLEX_PENALTY * (sum - 1) * (sum - 1);
        if (sum < MIN_WEIGHT_SUM) {
            return penalty;
        }

        RealVector weights = new ArrayRealVector(point).mapDivide(sum);
        return negativeSharpe(weights.toArray()) + penalty;
    }

    /**
     * {@code -(w . mean * periodsPerYear) / sqrt(w' Cov w * periodsPerYear)}, or 0 when the portfolio volatility is
     * numerically zero.
     */
    double negativeSharpe(double[] weights) {
        RealVector w = new ArrayRealVector(weights);

        double portfolioReturn = w.dotProduct(meanReturns) * periodsPerYear;
        double portfolioVariance = Math.max(0, w.dotProduct(covariance.operate(w)));
        double portfolioVolatility = Math.sqrt(portfolioVariance) * Math.sqrt(periodsPerYear);

        if (portfolioVolatility < zeroVolatilityTolerance) {
            return 0.0;
        }
        return -portfolioReturn / portfolioVolatility;
    }
}
