package ch.xavier.quantlab.indicator;

import ch.xavier.quantlab.exception.InvalidParameterException;
import lombok.Getter;

import java.util.Arrays;

@Getter
public class SimpleMovingAverage implements Indicator {
    private final int period;

    public SimpleMovingAverage(int period) {
        if (period < 1) {
            throw new InvalidParameterException("Moving average period must be at least 1, got " + period);
        }
        this.period = period;
    }

    /**
     * The first {@code period - 1} values are the warm-up and stay NaN.
     */
    @Override
    public double[] calculate(double[] closes) {
        double[] values = new double[closes.length];
        Arrays.fill(values, Double.NaN);

        for (int index = period - 1; index < closes.length; index++) {
            values[index] = calculateSMA(closes, index);
        }
        return values;
    }

    private double calculateSMA(double[] closes, int index) {
        double sum = 0;
        for (int i = index - period + 1; i <= index; i++) {
            sum += closes[i];
        }
        return sum / period;
    }
}
