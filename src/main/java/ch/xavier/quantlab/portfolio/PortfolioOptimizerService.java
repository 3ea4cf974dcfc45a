package ch.xavier.quantlab.portfolio;

import ch.xavier.quantlab.config.QuantLabProperties;
import ch.xavier.quantlab.exception.DegenerateInputException;
import ch.xavier.quantlab.exception.InsufficientDataException;
import ch.xavier.quantlab.exception.OptimizationFailureException;
import ch.xavier.quantlab.quote.PriceSeries;
import ch.xavier.quantlab.quote.QuoteProvider;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.SimpleBounds;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.BOBYQAOptimizer;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
@Slf4j
public class PortfolioOptimizerService {

    // must stay below half of the [0, 1] bound width
    private static final double INITIAL_TRUST_REGION_RADIUS = 0.1;
    private static final double STOPPING_TRUST_REGION_RADIUS = 1e-10;
    private static final double ZERO_VOLATILITY = 1e-12;

    private final QuoteProvider quoteProvider;
    private final QuantLabProperties.Portfolio settings;
    private final int periodsPerYear;

    public PortfolioOptimizerService(QuoteProvider quoteProvider, QuantLabProperties properties) {
        this.quoteProvider = quoteProvider;
        this.settings = properties.portfolio();
        this.periodsPerYear = properties.backtest().periodsPerYear();
    }

    public WeightVector maxSharpeWeights(List<String> symbols) {
        LocalDate end = LocalDate.now();
        return maxSharpeWeights(symbols, end.minusDays(settings.lookbackDays()), end);
    }

    public WeightVector maxSharpeWeights(List<String> symbols, LocalDate start, LocalDate end) {
        return maxSharpeWeights(fetchReturns(symbols, start, end));
    }

    public WeightVector riskParityWeights(List<String> symbols) {
        LocalDate end = LocalDate.now();
        return riskParityWeights(symbols, end.minusDays(settings.lookbackDays()), end);
    }

    public WeightVector riskParityWeights(List<String> symbols, LocalDate start, LocalDate end) {
        return riskParityWeights(fetchReturns(symbols, start, end));
    }

    /**
     * Long-only weights maximizing the annualized Sharpe ratio, starting from equal weights.
     *
     * @throws OptimizationFailureException if the solver stops without converging
     */
    public WeightVector maxSharpeWeights(ReturnMatrix returns) {
        int assets = returns.assetCount();
        if (assets == 1) {
            return new WeightVector(Map.of(returns.getSymbols().get(0), 1.0));
        }

        SharpeObjective objective = new SharpeObjective(returns.meanReturns(), returns.covariance(),
                periodsPerYear, settings.zeroVolatilityTolerance());

        double[] initialGuess = new double[assets];
        Arrays.fill(initialGuess, 1.0 / assets);
        double[] lowerBounds = new double[assets];
        double[] upperBounds = new double[assets];
        Arrays.fill(upperBounds, 1.0);

        BOBYQAOptimizer optimizer = new BOBYQAOptimizer(2 * assets + 1,
                INITIAL_TRUST_REGION_RADIUS, STOPPING_TRUST_REGION_RADIUS);

        PointValuePair solution;
        try {
            solution = optimizer.optimize(
                    new MaxEval(settings.maxEvaluations()),
                    new ObjectiveFunction(objective),
                    GoalType.MINIMIZE,
                    new InitialGuess(initialGuess),
                    new SimpleBounds(lowerBounds, upperBounds));
        } catch (MathIllegalStateException e) {
            log.warn("Max-Sharpe optimization over {} did not converge: {}", returns.getSymbols(), e.getMessage());
            throw new OptimizationFailureException(e.getMessage(), e);
        }

        double[] weights = normalize(solution.getPoint());
        log.info("Max-Sharpe weights for {} found after {} evaluations, Sharpe {}",
                returns.getSymbols(),
                optimizer.getEvaluations(),
                String.format("%.4f", -objective.negativeSharpe(weights)));

        return toWeightVector(returns.getSymbols(), weights);
    }

    /**
     * Inverse-volatility weights, {@code w_i = (1 / vol_i) / sum_j(1 / vol_j)}.
     *
     * @throws DegenerateInputException if any asset has zero volatility
     */
    public WeightVector riskParityWeights(ReturnMatrix returns) {
        double[] volatilities = returns.volatilities();
        double[] inverseVolatilities = new double[volatilities.length];
        double total = 0;

        for (int asset = 0; asset < volatilities.length; asset++) {
            if (!(volatilities[asset] > ZERO_VOLATILITY)) {
                throw new DegenerateInputException(String.format(
                        "%s has zero volatility, inverse-volatility weight is undefined",
                        returns.getSymbols().get(asset)));
            }
            inverseVolatilities[asset] = 1 / volatilities[asset];
            total += inverseVolatilities[asset];
        }

        double[] weights = new double[inverseVolatilities.length];
        for (int asset = 0; asset < weights.length; asset++) {
            weights[asset] = inverseVolatilities[asset] / total;
        }

        log.info("Risk parity weights for {} computed from volatilities {}",
                returns.getSymbols(), Arrays.toString(volatilities));
        return toWeightVector(returns.getSymbols(), weights);
    }

    private ReturnMatrix fetchReturns(List<String> symbols, LocalDate start, LocalDate end) {
        List<PriceSeries> series = new ArrayList<>(symbols.size());
        for (String symbol : symbols) {
            PriceSeries prices = quoteProvider.fetch(symbol, start, end);
            if (prices.isEmpty()) {
                throw new InsufficientDataException("Price history of " + symbol, 3, 0);
            }
            series.add(prices);
        }
        log.info("Retrieved price history for {} from {} to {}", symbols, start, end);
        return ReturnMatrix.fromPriceSeries(series);
    }

    private static double[] normalize(double[] point) {
        double[] weights = new double[point.length];
        double sum = 0;
        for (int i = 0; i < point.length; i++) {
            weights[i] = Math.min(1.0, Math.max(0.0, point[i]));
            sum += weights[i];
        }

        if (!(sum > 0) || Double.isInfinite(sum)) {
            throw new OptimizationFailureException("solver returned a point with no positive weight: "
                    + Arrays.toString(point));
        }

        for (int i = 0; i < weights.length; i++) {
            weights[i] /= sum;
        }
        return weights;
    }

    private static WeightVector toWeightVector(List<String> symbols, double[] weights) {
        Map<String, Double> bySymbol = new LinkedHashMap<>();
        for (int i = 0; i < weights.length; i++) {
            bySymbol.put(symbols.get(i), weights[i]);
        }
        return new WeightVector(bySymbol);
    }
}
