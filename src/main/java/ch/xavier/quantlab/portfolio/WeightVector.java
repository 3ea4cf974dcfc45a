package ch.xavier.quantlab.portfolio;

import ch.xavier.quantlab.exception.InvalidParameterException;
import lombok.EqualsAndHashCode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Non-negative weights per symbol summing to 1, in the order of the input symbols.
 */
@EqualsAndHashCode
public final class WeightVector {

    private static final double SUM_TOLERANCE = 1e-6;

    private final Map<String, Double> weights;

    /**
     * @throws InvalidParameterException if a weight is negative or not finite, or the weights do not sum to 1
     */
    public WeightVector(Map<String, Double> weights) {
        double sum = 0;
        for (Map.Entry<String, Double> entry : weights.entrySet()) {
            Double weight = entry.getValue();
            if (weight == null || !Double.isFinite(weight) || weight < 0) {
                throw new InvalidParameterException(String.format(
                        "Weight of %s must be a finite non-negative number, got %s", entry.getKey(), weight));
            }
            sum += weight;
        }
        if (Math.abs(sum - 1) > SUM_TOLERANCE) {
            throw new InvalidParameterException(String.format("Weights must sum to 1, got %s for %s", sum, weights));
        }

        this.weights = Collections.unmodifiableMap(new LinkedHashMap<>(weights));
    }

    public Map<String, Double> asMap() {
        return weights;
    }

    public double get(String symbol) {
        return weights.getOrDefault(symbol, 0.0);
    }

    public double sum() {
        return weights.values().stream().mapToDouble(Double::doubleValue).sum();
    }

    /**
     * Weights strictly above {@code threshold}, for display. The full vector is still the one that satisfies the
     * constraints.
     */
    public Map<String, Double> aboveThreshold(double threshold) {
        Map<String, Double> visible = new LinkedHashMap<>();
        weights.forEach((symbol, weight) -> {
            if (weight > threshold) {
                visible.put(symbol, weight);
            }
        });
        return visible;
    }

    @Override
    public String toString() {
        return weights.toString();
    }
}
