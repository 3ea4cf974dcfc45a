package ch.xavier.quantlab.report;

import ch.xavier.quantlab.backtesting.model.BacktestResult;
import ch.xavier.quantlab.backtesting.model.WalkForwardResult;
import ch.xavier.quantlab.backtesting.model.WalkForwardWindow;
import ch.xavier.quantlab.config.QuantLabProperties;
import ch.xavier.quantlab.exception.InsufficientDataException;
import ch.xavier.quantlab.exception.OptimizationFailureException;
import ch.xavier.quantlab.exception.QuantLabException;
import ch.xavier.quantlab.portfolio.WeightVector;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Text summaries of the structured results, for callers that want a message rather than an object.
 */
@Component
public class ReportFormatter {

    private final double displayThreshold;

    public ReportFormatter(QuantLabProperties properties) {
        this.displayThreshold = properties.portfolio().displayThreshold();
    }

    public String formatBacktest(BacktestResult result) {
        return String.format(Locale.ROOT,
                "Backtest Results (%s %d/%d) [w/ Costs]:%nTotal Return: %s%nSharpe Ratio: %.2f%nMax Drawdown: %s",
                result.getSymbol(),
                result.getParams().getFastWindow(),
                result.getParams().getSlowWindow(),
                percent(result.getTotalReturn()),
                result.getSharpeRatio(),
                percent(result.getMaxDrawdown()));
    }

    public String formatWalkForward(WalkForwardResult result) {
        StringJoiner output = new StringJoiner(System.lineSeparator());
        output.add("Walk Forward Analysis Results:");

        if (result.isEmpty()) {
            output.add("Not enough history for a single train/test window.");
        }
        for (WalkForwardWindow window : result.getWindows()) {
            output.add(String.format(Locale.ROOT, "[%s] Params: %s, Return: %s",
                    window.getTestRange(), window.getChosenParams(), percent(window.getTestReturn())));
        }

        output.add("Total Walk Forward Return: " + percent(result.getAggregatedReturn()));
        return output.toString();
    }

    /**
     * Weights at or below the display threshold are left out.
     */
    public String formatMaxSharpe(WeightVector weights) {
        return "Optimal Weights (Max Sharpe): " + formatWeights(weights.aboveThreshold(displayThreshold));
    }

    public String formatRiskParity(WeightVector weights) {
        return "Risk Parity Weights: " + formatWeights(weights.asMap());
    }

    public String error(QuantLabException exception) {
        if (exception instanceof InsufficientDataException) {
            return "No data found. " + exception.getMessage();
        }
        if (exception instanceof OptimizationFailureException failure) {
            return "Optimization failed: " + failure.getSolverMessage();
        }
        return "Error: " + exception.getMessage();
    }

    private static String formatWeights(Map<String, Double> weights) {
        StringJoiner joiner = new StringJoiner(", ", "{", "}");
        weights.forEach((symbol, weight) -> joiner.add(String.format(Locale.ROOT, "%s: %.4f", symbol, weight)));
        return joiner.toString();
    }

    private static String percent(double value) {
        return String.format(Locale.ROOT, "%.2f%%", value * 100);
    }
}
