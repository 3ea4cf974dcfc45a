package ch.xavier.quantlab.backtesting.model;

import java.util.List;

/**
 * How per-window out-of-sample returns are combined into one walk-forward figure.
 */
public enum AggregationMode {
    /**
     * Plain sum of the window returns. Not compounded; kept as the default for comparability with earlier runs.
     */
    ADDITIVE {
        @Override
        public double aggregate(List<Double> windowReturns) {
            return windowReturns.stream().mapToDouble(Double::doubleValue).sum();
        }
    },
    /**
     * Product of {@code 1 + r} over the windows, minus 1.
     */
    COMPOUNDED {
        @Override
        public double aggregate(List<Double> windowReturns) {
            double growth = 1.0;
            for (double windowReturn : windowReturns) {
                growth *= 1 + windowReturn;
            }
            return growth - 1;
        }
    };

    public abstract double aggregate(List<Double> windowReturns);
}
