package ch.xavier.quantlab.backtesting.model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.time.LocalDate;

/**
 * Half-open index range {@code [startIndex, endIndex)} into a price series, with the dates of its first and
 * last observations.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
public class IndexRange {
    private final int startIndex;
    private final int endIndex;
    private final LocalDate firstDate;
    private final LocalDate lastDate;

    public int length() {
        return endIndex - startIndex;
    }

    @Override
    public String toString() {
        return firstDate + " to " + lastDate;
    }
}
