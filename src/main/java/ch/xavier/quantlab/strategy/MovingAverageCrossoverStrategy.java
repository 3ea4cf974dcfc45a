package ch.xavier.quantlab.strategy;

import ch.xavier.quantlab.indicator.SimpleMovingAverage;
import lombok.Getter;

@Getter
public class MovingAverageCrossoverStrategy implements TradingStrategy {
    private final StrategyParams params;
    private final SimpleMovingAverage fastAverage;
    private final SimpleMovingAverage slowAverage;

    public MovingAverageCrossoverStrategy(StrategyParams params) {
        this.params = params;
        this.fastAverage = new SimpleMovingAverage(params.getFastWindow());
        this.slowAverage = new SimpleMovingAverage(params.getSlowWindow());
    }

    @Override
    public String getName() {
        return "MA Crossover " + params.getFastWindow() + "/" + params.getSlowWindow();
    }

    @Override
    public int[] generateSignals(double[] closes) {
        int[] signals = new int[closes.length];

        // a slow average first defined on the last close can never be traded
        if (params.getSlowWindow() >= closes.length) {
            return signals;
        }

        double[] fast = fastAverage.calculate(closes);
        double[] slow = slowAverage.calculate(closes);

        for (int i = 0; i < closes.length; i++) {
            // NaN during warm-up compares false, so the signal stays flat
            signals[i] = fast[i] > slow[i] ? 1 : 0;
        }
        return signals;
    }
}
