package ch.xavier.quantlab.backtesting.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.List;
import org.junit.jupiter.api.Test;

class AggregationModeTest {

    @Test
    void additive_sumsWindowReturns() {
        assertThat(AggregationMode.ADDITIVE.aggregate(List.of(0.10, -0.05, 0.02))).isCloseTo(0.07, within(1e-12));
    }

    @Test
    void compounded_multipliesGrowthFactors() {
        assertThat(AggregationMode.COMPOUNDED.aggregate(List.of(0.10, -0.05, 0.02)))
                .isCloseTo(1.10 * 0.95 * 1.02 - 1, within(1e-12));
    }

    @Test
    void bothModes_returnZeroWithoutWindows() {
        assertThat(AggregationMode.ADDITIVE.aggregate(List.of())).isEqualTo(0.0);
        assertThat(AggregationMode.COMPOUNDED.aggregate(List.of())).isEqualTo(0.0);
    }
}
