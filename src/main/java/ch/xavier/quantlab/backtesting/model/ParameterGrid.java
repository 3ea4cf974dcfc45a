package ch.xavier.quantlab.backtesting.model;

import ch.xavier.quantlab.exception.InvalidParameterException;
import ch.xavier.quantlab.strategy.StrategyParams;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Finite, ordered set of candidate parameters. Iteration order is the tie-break order of the optimizer.
 */
@Getter
@EqualsAndHashCode
public final class ParameterGrid implements Iterable<StrategyParams> {
    private final List<StrategyParams> candidates;

    private ParameterGrid(List<StrategyParams> candidates) {
        if (candidates.isEmpty()) {
            throw new InvalidParameterException("Parameter grid has no candidate with fast window < slow window");
        }
        this.candidates = List.copyOf(new LinkedHashSet<>(candidates));
    }

    public static ParameterGrid of(List<StrategyParams> candidates) {
        return new ParameterGrid(candidates);
    }

    public static ParameterGrid single(int fastWindow, int slowWindow) {
        return new ParameterGrid(List.of(StrategyParams.of(fastWindow, slowWindow)));
    }

    /**
     * Every (fast, slow) combination in fast-major order. Pairs with {@code fast >= slow} are skipped,
     * windows below 1 are rejected.
     */
    public static ParameterGrid cartesian(List<Integer> fastWindows, List<Integer> slowWindows) {
        List<StrategyParams> candidates = new ArrayList<>();

        for (int fast : fastWindows) {
            for (int slow : slowWindows) {
                if (fast < 1 || slow < 1) {
                    throw new InvalidParameterException(String.format(
                            "Moving average windows must be at least 1, got fast=%d slow=%d", fast, slow));
                }
                if (fast >= slow) {
                    continue;
                }
                candidates.add(StrategyParams.of(fast, slow));
            }
        }

        return new ParameterGrid(candidates);
    }

    public int size() {
        return candidates.size();
    }

    @Override
    public Iterator<StrategyParams> iterator() {
        return candidates.iterator();
    }
}
