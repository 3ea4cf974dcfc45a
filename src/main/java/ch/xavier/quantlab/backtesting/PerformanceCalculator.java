package ch.xavier.quantlab.backtesting;

import ch.xavier.quantlab.backtesting.model.BacktestResult;
import ch.xavier.quantlab.config.QuantLabProperties;
import ch.xavier.quantlab.series.ReturnSeries;
import org.apache.commons.math3.stat.StatUtils;
import org.springframework.stereotype.Service;

/**
 * Risk/return profile of a strategy return series. Mean and standard deviation are both sample statistics.
 */
@Service
public class PerformanceCalculator {

    // below this the series is treated as having no variance at all
    static final double ZERO_VOLATILITY = 1e-12;

    private final int periodsPerYear;

    public PerformanceCalculator(QuantLabProperties properties) {
        this.periodsPerYear = properties.backtest().periodsPerYear();
    }

    public BacktestResult calculate(double[] strategyReturns) {
        double[] equity = ReturnSeries.equityCurve(strategyReturns);

        return BacktestResult.builder()
                .totalReturn(equity[equity.length - 1] - 1)
                .sharpeRatio(sharpeRatio(strategyReturns))
                .maxDrawdown(ReturnSeries.maxDrawdown(equity))
                .periods(strategyReturns.length)
                .build();
    }

    /**
     * Annualized {@code mean / stdev}, 0 when the returns have no variance.
     */
    public double sharpeRatio(double[] returns) {
        double stdDev = Math.sqrt(StatUtils.variance(returns));
        if (Double.isNaN(stdDev) || stdDev < ZERO_VOLATILITY) {
            return 0.0;
        }
        return StatUtils.mean(returns) / stdDev * Math.sqrt(periodsPerYear);
    }
}
