package ch.xavier.quantlab.backtesting.model;

import lombok.Getter;

/**
 * Output of one simulated run. {@code signals} and {@code positions} are aligned with the price series;
 * {@code marketReturns} and {@code strategyReturns} start at the second period and are one element shorter.
 */
public class SimulationResult {
    private final int[] signals;
    private final int[] positions;
    private final double[] marketReturns;
    private final double[] strategyReturns;
    @Getter
    private final int tradeCount;

    public SimulationResult(int[] signals, int[] positions, double[] marketReturns, double[] strategyReturns,
                            int tradeCount) {
        this.signals = signals.clone();
        this.positions = positions.clone();
        this.marketReturns = marketReturns.clone();
        this.strategyReturns = strategyReturns.clone();
        this.tradeCount = tradeCount;
    }

    public int[] getSignals() {
        return signals.clone();
    }

    public int[] getPositions() {
        return positions.clone();
    }

    public double[] getMarketReturns() {
        return marketReturns.clone();
    }

    public double[] getStrategyReturns() {
        return strategyReturns.clone();
    }

    public double sumOfReturns() {
        double sum = 0;
        for (double r : strategyReturns) {
            sum += r;
        }
        return sum;
    }
}
