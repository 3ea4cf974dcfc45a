package ch.xavier.quantlab.backtesting.model;

import ch.xavier.quantlab.strategy.StrategyParams;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Builder
@Getter
@ToString
public class WalkForwardWindow {
    private final int windowIndex;
    private final IndexRange trainRange;
    private final IndexRange testRange;
    private final StrategyParams chosenParams;
    private final double inSampleScore;
    private final double testReturn;
}
