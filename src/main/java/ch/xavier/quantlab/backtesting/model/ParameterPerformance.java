package ch.xavier.quantlab.backtesting.model;

import ch.xavier.quantlab.strategy.StrategyParams;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class ParameterPerformance {
    private final StrategyParams parameters;
    private final double performanceMetric;
}
