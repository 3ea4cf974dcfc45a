package ch.xavier.quantlab.portfolio;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

import ch.xavier.quantlab.config.QuantLabProperties;
import ch.xavier.quantlab.exception.DegenerateInputException;
import ch.xavier.quantlab.exception.InsufficientDataException;
import ch.xavier.quantlab.exception.OptimizationFailureException;
import ch.xavier.quantlab.quote.PriceSeries;
import ch.xavier.quantlab.quote.QuoteProvider;
import java.time.LocalDate;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PortfolioOptimizerServiceTest {

    private static final double[] BASE = {0.01, -0.01, 0.02, -0.02, 0.01, 0.005, -0.015};

    @Mock
    private QuoteProvider quoteProvider;

    private PortfolioOptimizerService optimizer;

    @BeforeEach
    void setUp() {
        optimizer = new PortfolioOptimizerService(quoteProvider, QuantLabProperties.defaults());
    }

    @Test
    void riskParityWeights_areInverselyProportionalToVolatility() {
        // second asset is the first scaled by two, so its volatility is exactly double
        WeightVector weights = optimizer.riskParityWeights(matrix(BASE, 1.0, 2.0));

        assertThat(weights.get("A")).isCloseTo(2.0 / 3.0, within(1e-9));
        assertThat(weights.get("B")).isCloseTo(1.0 / 3.0, within(1e-9));
        assertThat(weights.sum()).isCloseTo(1.0, within(1e-6));
    }

    @Test
    void riskParityWeights_ignoreUniformRescalingOfVolatility() {
        WeightVector weights = optimizer.riskParityWeights(matrix(BASE, 1.0, 2.0, 3.0));
        WeightVector rescaled = optimizer.riskParityWeights(matrix(BASE, 5.0, 10.0, 15.0));

        for (String symbol : List.of("A", "B", "C")) {
            assertThat(rescaled.get(symbol)).isCloseTo(weights.get(symbol), within(1e-9));
        }
    }

    @Test
    void riskParityWeights_rejectZeroVolatilityAsset() {
        ReturnMatrix returns = new ReturnMatrix(List.of("A", "FLAT"), new double[][]{
                {0.01, 0.0}, {-0.02, 0.0}, {0.015, 0.0}
        });

        assertThatThrownBy(() -> optimizer.riskParityWeights(returns))
                .isInstanceOf(DegenerateInputException.class)
                .hasMessageContaining("FLAT");
    }

    @Test
    void maxSharpeWeights_stayWithinBoundsAndSumToOne() {
        ReturnMatrix returns = randomMatrix(new Random(42), 250, new double[]{0.0008, 0.0004, 0.0006},
                new double[]{0.012, 0.008, 0.02});

        WeightVector weights = optimizer.maxSharpeWeights(returns);

        assertThat(weights.asMap()).hasSize(3);
        assertThat(weights.asMap().values()).allSatisfy(w -> assertThat(w).isBetween(0.0, 1.0));
        assertThat(weights.sum()).isCloseTo(1.0, within(1e-6));
    }

    @Test
    void maxSharpeWeights_improveOnEqualWeights() {
        ReturnMatrix returns = randomMatrix(new Random(7), 250, new double[]{0.0010, 0.0002, 0.0005},
                new double[]{0.010, 0.015, 0.012});
        SharpeObjective objective = new SharpeObjective(returns.meanReturns(), returns.covariance(), 252, 1e-6);

        WeightVector weights = optimizer.maxSharpeWeights(returns);
        double[] solved = {weights.get("A"), weights.get("B"), weights.get("C")};
        double[] equal = {1.0 / 3, 1.0 / 3, 1.0 / 3};

        assertThat(objective.negativeSharpe(solved)).isLessThanOrEqualTo(objective.negativeSharpe(equal) + 1e-9);
    }

    @Test
    void maxSharpeWeights_dropAssetWithNegativeDrift() {
        ReturnMatrix returns = randomMatrix(new Random(3), 500, new double[]{0.002, -0.002},
                new double[]{0.01, 0.01});

        WeightVector weights = optimizer.maxSharpeWeights(returns);

        assertThat(weights.get("A")).isGreaterThan(0.9);
        assertThat(weights.get("B")).isLessThan(0.1);
    }

    @Test
    void maxSharpeWeights_giveWholeWeightToSingleAsset() {
        WeightVector weights = optimizer.maxSharpeWeights(matrix(BASE, 1.0));

        assertThat(weights.asMap()).containsOnlyKeys("A");
        assertThat(weights.get("A")).isEqualTo(1.0);
    }

    @Test
    void maxSharpeWeights_reportSolverDiagnosticWhenEvaluationBudgetRunsOut() {
        QuantLabProperties defaults = QuantLabProperties.defaults();
        QuantLabProperties starved = new QuantLabProperties(defaults.backtest(), defaults.walkForward(),
                new QuantLabProperties.Portfolio(365, 0.01, 1e-6, 3), defaults.data(), defaults.runner());
        PortfolioOptimizerService starvedOptimizer = new PortfolioOptimizerService(quoteProvider, starved);

        assertThatThrownBy(() -> starvedOptimizer.maxSharpeWeights(matrix(BASE, 1.0, 2.0)))
                .isInstanceOf(OptimizationFailureException.class)
                .satisfies(e -> assertThat(((OptimizationFailureException) e).getSolverMessage()).isNotBlank());
    }

    @Test
    void objective_isZeroForZeroVolatilityPortfolio() {
        ReturnMatrix returns = new ReturnMatrix(List.of("A", "B"), new double[][]{
                {0.0, 0.0}, {0.0, 0.0}, {0.0, 0.0}
        });
        SharpeObjective objective = new SharpeObjective(returns.meanReturns(), returns.covariance(), 252, 1e-6);

        assertThat(objective.negativeSharpe(new double[]{0.5, 0.5})).isEqualTo(0.0);
        assertThat(objective.value(new double[]{0.5, 0.5})).isEqualTo(0.0);
        assertThat(objective.value(new double[]{0.0, 0.0})).isEqualTo(SharpeObjective.SIMPLEX_PENALTY);
    }

    @Test
    void symbolBasedWeights_fetchEachSymbolOverTheRange() {
        LocalDate start = LocalDate.of(2024, 1, 1);
        LocalDate end = LocalDate.of(2024, 1, 31);
        when(quoteProvider.fetch(eq("AAA"), eq(start), eq(end)))
                .thenReturn(PriceSeries.ofCloses("AAA", start, 100, 101, 99, 102, 100, 103));
        when(quoteProvider.fetch(eq("BBB"), eq(start), eq(end)))
                .thenReturn(PriceSeries.ofCloses("BBB", start, 50, 52, 48, 53, 49, 54));

        WeightVector weights = optimizer.riskParityWeights(List.of("AAA", "BBB"), start, end);

        assertThat(weights.get("AAA")).isGreaterThan(weights.get("BBB"));
        assertThat(weights.sum()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void symbolBasedWeights_raiseInsufficientDataForMissingHistory() {
        LocalDate start = LocalDate.of(2024, 1, 1);
        LocalDate end = LocalDate.of(2024, 1, 31);
        when(quoteProvider.fetch("NONE", start, end)).thenReturn(PriceSeries.empty("NONE"));

        assertThatThrownBy(() -> optimizer.maxSharpeWeights(List.of("NONE"), start, end))
                .isInstanceOf(InsufficientDataException.class);
    }

    private static ReturnMatrix matrix(double[] base, double... scales) {
        double[][] rows = new double[base.length][scales.length];
        for (int row = 0; row < base.length; row++) {
            for (int asset = 0; asset < scales.length; asset++) {
                rows[row][asset] = base[row] * scales[asset];
            }
        }
        return new ReturnMatrix(symbols(scales.length), rows);
    }

    private static ReturnMatrix randomMatrix(Random random, int periods, double[] drifts, double[] volatilities) {
        double[][] rows = new double[periods][drifts.length];
        for (int row = 0; row < periods; row++) {
            for (int asset = 0; asset < drifts.length; asset++) {
                rows[row][asset] = drifts[asset] + volatilities[asset] * random.nextGaussian();
            }
        }
        return new ReturnMatrix(symbols(drifts.length), rows);
    }

    private static List<String> symbols(int count) {
        return List.of("A", "B", "C").subList(0, count);
    }
}
