package ch.xavier.quantlab.strategy;

import ch.xavier.quantlab.exception.InvalidParameterException;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Fast and slow moving-average windows, with {@code 1 <= fastWindow < slowWindow}.
 */
@Getter
@EqualsAndHashCode
public final class StrategyParams {
    private final int fastWindow;
    private final int slowWindow;

    public StrategyParams(int fastWindow, int slowWindow) {
        if (fastWindow < 1 || slowWindow < 1) {
            throw new InvalidParameterException(String.format(
                    "Moving average windows must be at least 1, got fast=%d slow=%d", fastWindow, slowWindow));
        }
        if (fastWindow >= slowWindow) {
            throw new InvalidParameterException(String.format(
                    "Fast window must be shorter than slow window, got fast=%d slow=%d", fastWindow, slowWindow));
        }
        this.fastWindow = fastWindow;
        this.slowWindow = slowWindow;
    }

    public static StrategyParams of(int fastWindow, int slowWindow) {
        return new StrategyParams(fastWindow, slowWindow);
    }

    @Override
    public String toString() {
        return "(" + fastWindow + ", " + slowWindow + ")";
    }
}
