package ch.xavier.quantlab.backtesting;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import ch.xavier.quantlab.backtesting.model.BacktestResult;
import ch.xavier.quantlab.config.QuantLabProperties;
import ch.xavier.quantlab.exception.InsufficientDataException;
import ch.xavier.quantlab.exception.InvalidParameterException;
import ch.xavier.quantlab.quote.PriceSeries;
import ch.xavier.quantlab.quote.QuoteProvider;
import ch.xavier.quantlab.strategy.StrategyParams;
import java.time.LocalDate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class BacktestServiceTest {

    private static final LocalDate START = LocalDate.of(2024, 1, 1);
    private static final double[] CLOSES = {100, 102, 101, 105, 108, 107, 110, 115, 112, 118};

    @Mock
    private QuoteProvider quoteProvider;

    private BacktestService backtestService;

    @BeforeEach
    void setUp() {
        QuantLabProperties properties = QuantLabProperties.defaults();
        backtestService = new BacktestService(quoteProvider, new StrategySimulator(properties),
                new PerformanceCalculator(properties), properties);
    }

    @Test
    void backtest_matchesManualCalculationOfCrossoverRule() {
        BacktestResult result = backtestService.backtest(
                PriceSeries.ofCloses("TEST", START, CLOSES), StrategyParams.of(2, 4));

        // flat until the signal of period 3, charged 10bps on the flip, then long to the end
        double[] expectedReturns = {
                0, 0, -0.001,
                108.0 / 105 - 1, 107.0 / 108 - 1, 110.0 / 107 - 1,
                115.0 / 110 - 1, 112.0 / 115 - 1, 118.0 / 112 - 1
        };
        double mean = 0;
        for (double r : expectedReturns) {
            mean += r / expectedReturns.length;
        }
        double squares = 0;
        for (double r : expectedReturns) {
            squares += (r - mean) * (r - mean);
        }
        double expectedSharpe = mean / Math.sqrt(squares / (expectedReturns.length - 1)) * Math.sqrt(252);

        assertThat(result.getTotalReturn()).isCloseTo(0.999 * 118.0 / 105.0 - 1, within(1e-12));
        assertThat(result.getSharpeRatio()).isCloseTo(expectedSharpe, within(1e-9));
        assertThat(result.getMaxDrawdown()).isCloseTo(112.0 / 115.0 - 1, within(1e-12));
        assertThat(result.getTradeCount()).isEqualTo(1);
        assertThat(result.getSymbol()).isEqualTo("TEST");
        assertThat(result.getParams()).isEqualTo(StrategyParams.of(2, 4));
        assertThat(result.getStrategyName()).isEqualTo("MA Crossover 2/4");
    }

    @Test
    void runBacktest_fetchesRequestedRange() {
        LocalDate end = START.plusDays(30);
        when(quoteProvider.fetch("AAPL", START, end)).thenReturn(PriceSeries.ofCloses("AAPL", START, CLOSES));

        BacktestResult result = backtestService.runBacktest("AAPL", 2, 4, START, end);

        assertThat(result.getSymbol()).isEqualTo("AAPL");
        verify(quoteProvider).fetch("AAPL", START, end);
    }

    @Test
    void runBacktest_usesConfiguredDefaultRange() {
        when(quoteProvider.fetch("AAPL", LocalDate.of(2020, 1, 1), LocalDate.of(2023, 12, 31)))
                .thenReturn(PriceSeries.ofCloses("AAPL", START, CLOSES));

        assertThat(backtestService.runBacktest("AAPL", 2, 4).getPeriods()).isEqualTo(CLOSES.length - 1);
    }

    @Test
    void runBacktest_raisesInsufficientDataOnEmptyHistory() {
        when(quoteProvider.fetch(any(), any(), any())).thenReturn(PriceSeries.empty("NONE"));

        assertThatThrownBy(() -> backtestService.runBacktest("NONE", 10, 20, START, START.plusDays(5)))
                .isInstanceOf(InsufficientDataException.class);
    }

    @Test
    void runBacktest_validatesWindowsBeforeFetching() {
        assertThatThrownBy(() -> backtestService.runBacktest("AAPL", 20, 10, START, START.plusDays(5)))
                .isInstanceOf(InvalidParameterException.class);

        verifyNoInteractions(quoteProvider);
    }

    @Test
    void backtest_returnsFlatResultWhenSlowWindowExceedsHistory() {
        BacktestResult result = backtestService.backtest(
                PriceSeries.ofCloses("TEST", START, 100, 101, 99), StrategyParams.of(2, 5));

        assertThat(result.getTotalReturn()).isEqualTo(0.0);
        assertThat(result.getSharpeRatio()).isEqualTo(0.0);
        assertThat(result.getMaxDrawdown()).isEqualTo(0.0);
    }
}
