package ch.xavier.quantlab.indicator;

public interface Indicator {
    /**
     * @return one value per close, {@link Double#NaN} where the indicator is not yet defined
     */
    double[] calculate(double[] closes);
}
