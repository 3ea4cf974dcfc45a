package ch.xavier.quantlab.indicator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import ch.xavier.quantlab.exception.InvalidParameterException;
import org.junit.jupiter.api.Test;

class SimpleMovingAverageTest {

    @Test
    void calculate_leavesWarmUpUndefined() {
        double[] values = new SimpleMovingAverage(3).calculate(new double[]{1, 2, 3, 4, 5});

        assertThat(values[0]).isNaN();
        assertThat(values[1]).isNaN();
        assertThat(values[2]).isCloseTo(2.0, within(1e-12));
        assertThat(values[3]).isCloseTo(3.0, within(1e-12));
        assertThat(values[4]).isCloseTo(4.0, within(1e-12));
    }

    @Test
    void calculate_isUndefinedEverywhereWhenPeriodExceedsHistory() {
        double[] values = new SimpleMovingAverage(10).calculate(new double[]{1, 2, 3});

        assertThat(values).hasSize(3);
        for (double value : values) {
            assertThat(value).isNaN();
        }
    }

    @Test
    void constructor_rejectsNonPositivePeriod() {
        assertThatThrownBy(() -> new SimpleMovingAverage(0)).isInstanceOf(InvalidParameterException.class);
    }
}
