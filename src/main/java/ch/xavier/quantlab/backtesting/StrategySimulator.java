package ch.xavier.quantlab.backtesting;

import ch.xavier.quantlab.backtesting.model.SimulationResult;
import ch.xavier.quantlab.config.QuantLabProperties;
import ch.xavier.quantlab.exception.InvalidParameterException;
import ch.xavier.quantlab.quote.PriceSeries;
import ch.xavier.quantlab.series.ReturnSeries;
import ch.xavier.quantlab.strategy.MovingAverageCrossoverStrategy;
import ch.xavier.quantlab.strategy.StrategyParams;
import ch.xavier.quantlab.strategy.TradingStrategy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs a long/flat strategy over a price series.
 * <p>
 * The position held during period {@code t} is the signal of period {@code t - 1}, so a decision taken on a close
 * only earns the following period's return. Each change of signal is charged {@code costRate} in the period where
 * the signal changes.
 */
@Service
@Slf4j
public class StrategySimulator {

    private final double defaultCostRate;

    public StrategySimulator(QuantLabProperties properties) {
        this.defaultCostRate = properties.backtest().costRate();
    }

    public SimulationResult simulate(PriceSeries prices, StrategyParams params) {
        return simulate(prices, params, defaultCostRate);
    }

    public SimulationResult simulate(PriceSeries prices, StrategyParams params, double costRate) {
        return simulate(prices.closes(), new MovingAverageCrossoverStrategy(params), costRate);
    }

    public SimulationResult simulate(double[] closes, TradingStrategy strategy, double costRate) {
        if (costRate < 0) {
            throw new InvalidParameterException("Cost rate must not be negative, got " + costRate);
        }

        double[] marketReturns = ReturnSeries.returns(closes);
        int[] signals = strategy.generateSignals(closes);

        int[] positions = new int[closes.length];
        double[] strategyReturns = new double[marketReturns.length];
        int tradeCount = 0;

        for (int t = 1; t < closes.length; t++) {
            positions[t] = signals[t - 1];

            int change = Math.abs(signals[t] - signals[t - 1]);
            tradeCount += change;

            double heldReturn = positions[t] == 1 ? marketReturns[t - 1] : 0.0;
            strategyReturns[t - 1] = heldReturn - costRate * change;
        }

        log.debug("Simulated {} over {} periods with {} position changes",
                strategy.getName(), closes.length, tradeCount);

        return new SimulationResult(signals, positions, marketReturns, strategyReturns, tradeCount);
    }
}
