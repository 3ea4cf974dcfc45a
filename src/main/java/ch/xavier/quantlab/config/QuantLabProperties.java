package ch.xavier.quantlab.config;

import ch.xavier.quantlab.backtesting.model.AggregationMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.validation.annotation.Validated;

import java.time.LocalDate;
import java.util.List;

@Validated
@ConfigurationProperties(prefix = "quantlab")
public record QuantLabProperties(
        @Valid @NotNull @DefaultValue Backtest backtest,
        @Valid @NotNull @DefaultValue WalkForward walkForward,
        @Valid @NotNull @DefaultValue Portfolio portfolio,
        @Valid @NotNull @DefaultValue Data data,
        @Valid @NotNull @DefaultValue Runner runner
) {

    public static QuantLabProperties defaults() {
        return new QuantLabProperties(
                new Backtest(0.001, 252, LocalDate.of(2020, 1, 1), LocalDate.of(2023, 12, 31)),
                new WalkForward(12, 3, 21, 0.0, List.of(10, 20, 50), List.of(50, 100, 200), AggregationMode.ADDITIVE),
                new Portfolio(365, 0.01, 1e-6, 20000),
                new Data("data"),
                new Runner(false, List.of("AAPL"), 10, 50));
    }

    public record Backtest(
            // charged per position flip, 0.001 = 10bps
            @DecimalMin("0") @DefaultValue("0.001") double costRate,
            @Positive @DefaultValue("252") int periodsPerYear,
            @NotNull @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) @DefaultValue("2020-01-01") LocalDate defaultStart,
            @NotNull @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) @DefaultValue("2023-12-31") LocalDate defaultEnd
    ) {
    }

    public record WalkForward(
            @Positive @DefaultValue("12") int trainMonths,
            @Positive @DefaultValue("3") int testMonths,
            // trading days per month used to turn months into periods
            @Positive @DefaultValue("21") int periodsPerMonth,
            @DecimalMin("0") @DefaultValue("0.0") double costRate,
            @NotEmpty @DefaultValue({"10", "20", "50"}) List<Integer> fastWindows,
            @NotEmpty @DefaultValue({"50", "100", "200"}) List<Integer> slowWindows,
            @NotNull @DefaultValue("ADDITIVE") AggregationMode aggregation
    ) {
    }

    public record Portfolio(
            // calendar days fetched for symbol based allocation
            @Positive @DefaultValue("365") int lookbackDays,
            @DecimalMin("0") @DefaultValue("0.01") double displayThreshold,
            @DecimalMin("0") @DefaultValue("1e-6") double zeroVolatilityTolerance,
            @Positive @DefaultValue("20000") int maxEvaluations
    ) {
    }

    public record Data(
            @NotNull @DefaultValue("data") String csvDirectory
    ) {
    }

    public record Runner(
            @DefaultValue("false") boolean enabled,
            @NotEmpty @DefaultValue("AAPL") List<String> symbols,
            @Positive @DefaultValue("10") int fastWindow,
            @Positive @DefaultValue("50") int slowWindow
    ) {
    }
}
