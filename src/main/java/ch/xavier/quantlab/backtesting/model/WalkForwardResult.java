package ch.xavier.quantlab.backtesting.model;

import lombok.Getter;
import lombok.ToString;

import java.util.List;

@Getter
@ToString
public class WalkForwardResult {
    private final String symbol;
    private final List<WalkForwardWindow> windows;
    private final AggregationMode aggregationMode;
    private final double aggregatedReturn;

    public WalkForwardResult(String symbol, List<WalkForwardWindow> windows, AggregationMode aggregationMode) {
        this.symbol = symbol;
        this.windows = List.copyOf(windows);
        this.aggregationMode = aggregationMode;
        this.aggregatedReturn = aggregationMode.aggregate(
                this.windows.stream().map(WalkForwardWindow::getTestReturn).toList());
    }

    public boolean isEmpty() {
        return windows.isEmpty();
    }
}
