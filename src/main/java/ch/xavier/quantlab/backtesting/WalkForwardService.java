package ch.xavier.quantlab.backtesting;

import ch.xavier.quantlab.backtesting.model.AggregationMode;
import ch.xavier.quantlab.backtesting.model.IndexRange;
import ch.xavier.quantlab.backtesting.model.ParameterGrid;
import ch.xavier.quantlab.backtesting.model.ParameterPerformance;
import ch.xavier.quantlab.backtesting.model.WalkForwardResult;
import ch.xavier.quantlab.backtesting.model.WalkForwardWindow;
import ch.xavier.quantlab.config.QuantLabProperties;
import ch.xavier.quantlab.exception.InsufficientDataException;
import ch.xavier.quantlab.exception.InvalidParameterException;
import ch.xavier.quantlab.quote.PriceSeries;
import ch.xavier.quantlab.quote.QuoteProvider;
import ch.xavier.quantlab.strategy.StrategyParams;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.LocalDate;

/**
 * Rolling walk-forward optimization of the moving-average crossover.
 * <p>
 * The train window has a fixed length and rolls forward by one test window per step, so test windows are
 * contiguous and never overlap. Each candidate is scored on the train slice by the plain sum of its period returns;
 * the winner is then run on the test slice from scratch, with its own warm-up.
 */
@Service
@Slf4j
public class WalkForwardService {

    private final QuoteProvider quoteProvider;
    private final StrategySimulator simulator;
    private final QuantLabProperties properties;

    public WalkForwardService(QuoteProvider quoteProvider,
                              StrategySimulator simulator,
                              QuantLabProperties properties) {
        this.quoteProvider = quoteProvider;
        this.simulator = simulator;
        this.properties = properties;
    }

    public WalkForwardResult walkForwardAnalysis(String symbol) {
        QuantLabProperties.WalkForward settings = properties.walkForward();
        return walkForwardAnalysis(symbol, properties.backtest().defaultStart(), properties.backtest().defaultEnd(),
                settings.trainMonths(), settings.testMonths());
    }

    /**
     * Walk-forward analysis over {@code symbol} with the configured parameter grid, window lengths given in months.
     *
     * @throws InsufficientDataException if the provider has no quotes at all for the range
     */
    public WalkForwardResult walkForwardAnalysis(String symbol, LocalDate start, LocalDate end,
                                                 int trainMonths, int testMonths) {
        QuantLabProperties.WalkForward settings = properties.walkForward();
        ParameterGrid grid = ParameterGrid.cartesian(settings.fastWindows(), settings.slowWindows());

        PriceSeries prices = quoteProvider.fetch(symbol, start, end);
        if (prices.isEmpty()) {
            throw new InsufficientDataException("Walk-forward analysis of " + symbol, 1, 0);
        }
        log.info("Retrieved {} quotes for walk-forward analysis of {}", prices.size(), symbol);

        return walkForward(prices,
                trainMonths * settings.periodsPerMonth(),
                testMonths * settings.periodsPerMonth(),
                grid,
                settings.aggregation());
    }

    public WalkForwardResult walkForward(PriceSeries prices, int trainPeriods, int testPeriods, ParameterGrid grid) {
        return walkForward(prices, trainPeriods, testPeriods, grid, properties.walkForward().aggregation());
    }

    /**
     * Blocking form of {@link #runWalkForward}. Must not be called from a non-blocking Reactor thread such as
     * {@code Schedulers.parallel()}, where {@code block()} throws {@link IllegalStateException}; reactive callers
     * compose {@link #runWalkForward} instead.
     */
    public WalkForwardResult walkForward(PriceSeries prices, int trainPeriods, int testPeriods, ParameterGrid grid,
                                         AggregationMode aggregationMode) {
        return runWalkForward(prices, trainPeriods, testPeriods, grid, aggregationMode).block();
    }

    /**
     * Performs walk-forward optimization and testing
     *
     * @param prices          Full price history
     * @param trainPeriods    Observations in each train slice
     * @param testPeriods     Observations in each test slice, also the step between windows
     * @param grid            Candidate parameters, in tie-break order
     * @param aggregationMode How test returns are combined
     * @return Windows in chronological order with their aggregated out-of-sample return, empty when no window fits
     */
    public Mono<WalkForwardResult> runWalkForward(PriceSeries prices,
                                                  int trainPeriods,
                                                  int testPeriods,
                                                  ParameterGrid grid,
                                                  AggregationMode aggregationMode) {
        if (trainPeriods < 2 || testPeriods < 2) {
            return Mono.error(new InvalidParameterException(String.format(
                    "Train and test windows need at least 2 periods each, got train=%d test=%d",
                    trainPeriods, testPeriods)));
        }

        int windowCount = countWindows(prices.size(), trainPeriods, testPeriods);
        if (windowCount == 0) {
            log.info("History of {} quotes for {} is too short for a {}+{} walk-forward window",
                    prices.size(), prices.getSymbol(), trainPeriods, testPeriods);
        }

        double costRate = properties.walkForward().costRate();

        return Flux.range(0, windowCount)
                .flatMapSequential(window -> {
                    int trainStart = window * testPeriods;
                    int trainEnd = trainStart + trainPeriods;
                    int testStart = trainEnd;
                    int testEnd = testStart + testPeriods;

                    IndexRange trainRange = range(prices, trainStart, trainEnd);
                    IndexRange testRange = range(prices, testStart, testEnd);

                    log.info("Window {}: Training on {} (quotes {}-{}), testing on {} (quotes {}-{})",
                            window, trainRange, trainStart, trainEnd, testRange, testStart, testEnd);

                    PriceSeries trainData = prices.slice(trainStart, trainEnd);
                    PriceSeries testData = prices.slice(testStart, testEnd);

                    return findBestParameters(trainData, grid, costRate)
                            .map(best -> {
                                double testReturn = simulator.simulate(testData, best.getParameters(), costRate)
                                        .sumOfReturns();

                                log.info("Window {}: Best parameters: {}, in-sample return: {}%, test return: {}%",
                                        window,
                                        best.getParameters(),
                                        String.format("%.2f", best.getPerformanceMetric() * 100),
                                        String.format("%.2f", testReturn * 100));

                                return WalkForwardWindow.builder()
                                        .windowIndex(window)
                                        .trainRange(trainRange)
                                        .testRange(testRange)
                                        .chosenParams(best.getParameters())
                                        .inSampleScore(best.getPerformanceMetric())
                                        .testReturn(testReturn)
                                        .build();
                            });
                })
                .collectList()
                .map(windows -> new WalkForwardResult(prices.getSymbol(), windows, aggregationMode));
    }

    /**
     * Number of windows with {@code start + trainPeriods + testPeriods <= size}, starts spaced by
     * {@code testPeriods}.
     */
    static int countWindows(int size, int trainPeriods, int testPeriods) {
        if (size < trainPeriods + testPeriods) {
            return 0;
        }
        return (size - trainPeriods - testPeriods) / testPeriods + 1;
    }

    /**
     * Evaluates every candidate on the train slice. Candidates run in parallel but are reduced in grid order,
     * so on equal scores the earlier candidate wins.
     */
    Mono<ParameterPerformance> findBestParameters(PriceSeries trainData, ParameterGrid grid, double costRate) {
        return Flux.fromIterable(grid)
                .flatMapSequential(params -> Mono.fromCallable(() -> score(trainData, params, costRate))
                        .subscribeOn(Schedulers.parallel()))
                .reduce((best, candidate) ->
                        candidate.getPerformanceMetric() > best.getPerformanceMetric() ? candidate : best);
    }

    private ParameterPerformance score(PriceSeries trainData, StrategyParams params, double costRate) {
        double score = simulator.simulate(trainData, params, costRate).sumOfReturns();
        log.debug("Candidate {} scored {} on {} quotes", params, score, trainData.size());
        return new ParameterPerformance(params, score);
    }

    private static IndexRange range(PriceSeries prices, int startIndex, int endIndex) {
        return new IndexRange(startIndex, endIndex, prices.dateAt(startIndex), prices.dateAt(endIndex - 1));
    }
}
