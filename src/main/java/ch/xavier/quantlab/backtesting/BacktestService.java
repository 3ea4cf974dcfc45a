package ch.xavier.quantlab.backtesting;

import ch.xavier.quantlab.backtesting.model.BacktestResult;
import ch.xavier.quantlab.backtesting.model.SimulationResult;
import ch.xavier.quantlab.config.QuantLabProperties;
import ch.xavier.quantlab.exception.InsufficientDataException;
import ch.xavier.quantlab.quote.PriceSeries;
import ch.xavier.quantlab.quote.QuoteProvider;
import ch.xavier.quantlab.strategy.MovingAverageCrossoverStrategy;
import ch.xavier.quantlab.strategy.StrategyParams;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;

@Service
@Slf4j
public class BacktestService {

    private final QuoteProvider quoteProvider;
    private final StrategySimulator simulator;
    private final PerformanceCalculator performanceCalculator;
    private final QuantLabProperties.Backtest settings;

    public BacktestService(QuoteProvider quoteProvider,
                           StrategySimulator simulator,
                           PerformanceCalculator performanceCalculator,
                           QuantLabProperties properties) {
        this.quoteProvider = quoteProvider;
        this.simulator = simulator;
        this.performanceCalculator = performanceCalculator;
        this.settings = properties.backtest();
    }

    public BacktestResult runBacktest(String symbol, int fastWindow, int slowWindow) {
        return runBacktest(symbol, fastWindow, slowWindow, settings.defaultStart(), settings.defaultEnd());
    }

    /**
     * Fetches the closes of {@code symbol} and backtests a moving-average crossover with transaction costs.
     *
     * @throws ch.xavier.quantlab.exception.InvalidParameterException if the windows are not a valid pair
     * @throws InsufficientDataException                             if fewer than two quotes are available
     */
    public BacktestResult runBacktest(String symbol, int fastWindow, int slowWindow, LocalDate start, LocalDate end) {
        StrategyParams params = StrategyParams.of(fastWindow, slowWindow);

        PriceSeries prices = quoteProvider.fetch(symbol, start, end);
        log.info("Retrieved {} quotes for backtesting {} from {} to {}", prices.size(), symbol, start, end);

        return backtest(prices, params);
    }

    public BacktestResult backtest(PriceSeries prices, StrategyParams params) {
        if (prices.size() < 2) {
            throw new InsufficientDataException("Backtest of " + prices.getSymbol(), 2, prices.size());
        }

        MovingAverageCrossoverStrategy strategy = new MovingAverageCrossoverStrategy(params);
        SimulationResult simulation = simulator.simulate(prices.closes(), strategy, settings.costRate());

        BacktestResult result = performanceCalculator.calculate(simulation.getStrategyReturns()).toBuilder()
                .symbol(prices.getSymbol())
                .strategyName(strategy.getName())
                .params(params)
                .tradeCount(simulation.getTradeCount())
                .build();

        log.info("Backtest {} on {}: return {}%, sharpe {}, max drawdown {}%, {} position changes",
                strategy.getName(),
                prices.getSymbol(),
                String.format("%.2f", result.getTotalReturn() * 100),
                String.format("%.2f", result.getSharpeRatio()),
                String.format("%.2f", result.getMaxDrawdown() * 100),
                result.getTradeCount());

        return result;
    }
}
