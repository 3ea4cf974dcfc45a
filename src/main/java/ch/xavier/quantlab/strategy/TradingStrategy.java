package ch.xavier.quantlab.strategy;

public interface TradingStrategy {
    /**
     * Get strategy name for reporting
     */
    String getName();

    /**
     * Generate the raw signal for every period, using only closes up to and including that period.
     * @return 1 for long, 0 for flat
     */
    int[] generateSignals(double[] closes);
}
