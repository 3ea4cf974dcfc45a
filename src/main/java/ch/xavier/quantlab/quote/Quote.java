package ch.xavier.quantlab.quote;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDate;

@Builder
@Getter
@ToString
public class Quote {
    private final LocalDate date;
    private final double open;
    private final double high;
    private final double low;
    private final double close;
    private final double volume;

    public static Quote ofClose(LocalDate date, double close) {
        return Quote.builder()
                .date(date)
                .open(close)
                .high(close)
                .low(close)
                .close(close)
                .build();
    }
}
