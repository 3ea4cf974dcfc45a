package ch.xavier.quantlab.series;

import ch.xavier.quantlab.exception.InsufficientDataException;
import ch.xavier.quantlab.quote.PriceSeries;

/**
 * Derivations from a price series: period returns, compounded equity and drawdown.
 * Every method returns a new array and leaves its input untouched.
 */
public final class ReturnSeries {

    private ReturnSeries() {
    }

    public static double[] returns(PriceSeries prices) {
        return returns(prices.closes());
    }

    /**
     * {@code returns[i] = prices[i + 1] / prices[i] - 1}, one element shorter than {@code prices}.
     */
    public static double[] returns(double[] prices) {
        if (prices.length < 2) {
            throw new InsufficientDataException("Return series", 2, prices.length);
        }

        double[] returns = new double[prices.length - 1];
        for (int i = 0; i < returns.length; i++) {
            returns[i] = prices[i + 1] / prices[i] - 1;
        }
        return returns;
    }

    /**
     * Cumulative product of {@code 1 + r}. Element 0 is the starting value 1.0 for the period before the first
     * return, so the curve is one element longer than {@code returns}.
     */
    public static double[] equityCurve(double[] returns) {
        // a single return already spans two price observations
        if (returns.length < 1) {
            throw new InsufficientDataException("Equity curve", 1, returns.length);
        }

        double[] equity = new double[returns.length + 1];
        equity[0] = 1.0;
        for (int i = 0; i < returns.length; i++) {
            equity[i + 1] = equity[i] * (1 + returns[i]);
        }
        return equity;
    }

    /**
     * {@code equity[t] / max(equity[0..t]) - 1}, always zero or negative.
     */
    public static double[] drawdown(double[] equityCurve) {
        if (equityCurve.length < 2) {
            throw new InsufficientDataException("Drawdown", 2, equityCurve.length);
        }

        double[] drawdown = new double[equityCurve.length];
        double peak = equityCurve[0];
        for (int i = 0; i < equityCurve.length; i++) {
            peak = Math.max(peak, equityCurve[i]);
            drawdown[i] = equityCurve[i] / peak - 1;
        }
        return drawdown;
    }

    /**
     * Most negative drawdown of the curve, 0 when the curve never falls below a previous peak.
     */
    public static double maxDrawdown(double[] equityCurve) {
        double maxDrawdown = 0;
        for (double value : drawdown(equityCurve)) {
            maxDrawdown = Math.min(maxDrawdown, value);
        }
        return maxDrawdown;
    }
}
