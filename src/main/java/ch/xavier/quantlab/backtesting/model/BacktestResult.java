package ch.xavier.quantlab.backtesting.model;

import ch.xavier.quantlab.strategy.StrategyParams;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Builder(toBuilder = true)
@Getter
@ToString
public class BacktestResult {
    private final String symbol;
    private final String strategyName;
    private final StrategyParams params;
    private final double totalReturn;
    private final double sharpeRatio;
    private final double maxDrawdown;
    private final int periods;
    private final int tradeCount;
}
