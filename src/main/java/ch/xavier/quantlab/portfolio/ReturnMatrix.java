package ch.xavier.quantlab.portfolio;

import ch.xavier.quantlab.exception.InsufficientDataException;
import ch.xavier.quantlab.exception.InvalidParameterException;
import ch.xavier.quantlab.quote.PriceSeries;
import ch.xavier.quantlab.quote.Quote;
import ch.xavier.quantlab.series.ReturnSeries;
import lombok.Getter;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.correlation.Covariance;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Aligned period returns of several assets: one row per period, one column per symbol.
 */
public final class ReturnMatrix {

    @Getter
    private final List<String> symbols;
    private final double[][] returns;

    public ReturnMatrix(List<String> symbols, double[][] returns) {
        if (symbols.isEmpty()) {
            throw new InvalidParameterException("At least one symbol is required");
        }
        if (new HashSet<>(symbols).size() != symbols.size()) {
            throw new InvalidParameterException("Symbols must be unique, got " + symbols);
        }
        if (returns.length < 2) {
            throw new InsufficientDataException("Return matrix", 2, returns.length);
        }

        this.symbols = List.copyOf(symbols);
        this.returns = new double[returns.length][];
        for (int row = 0; row < returns.length; row++) {
            if (returns[row].length != symbols.size()) {
                throw new InvalidParameterException(String.format(
                        "Row %d has %d returns for %d symbols", row, returns[row].length, symbols.size()));
            }
            this.returns[row] = returns[row].clone();
        }
    }

    /**
     * Keeps only the dates every series has, then derives period returns from the aligned closes.
     * The first aligned date has no return and is dropped.
     */
    public static ReturnMatrix fromPriceSeries(List<PriceSeries> series) {
        if (series.isEmpty()) {
            throw new InvalidParameterException("At least one price series is required");
        }

        Set<LocalDate> commonDates = new LinkedHashSet<>();
        series.get(0).getQuotes().forEach(quote -> commonDates.add(quote.getDate()));
        for (PriceSeries prices : series.subList(1, series.size())) {
            Set<LocalDate> dates = prices.getQuotes().stream().map(Quote::getDate).collect(Collectors.toSet());
            commonDates.retainAll(dates);
        }

        if (commonDates.size() < 3) {
            throw new InsufficientDataException("Aligned price history", 3, commonDates.size());
        }

        int periods = commonDates.size() - 1;
        double[][] matrix = new double[periods][series.size()];
        List<String> symbols = new ArrayList<>(series.size());

        for (int column = 0; column < series.size(); column++) {
            PriceSeries prices = series.get(column);
            symbols.add(prices.getSymbol());

            Map<LocalDate, Double> closeByDate = prices.getQuotes().stream()
                    .collect(Collectors.toMap(Quote::getDate, Quote::getClose));
            double[] alignedCloses = commonDates.stream().mapToDouble(closeByDate::get).toArray();

            double[] columnReturns = ReturnSeries.returns(alignedCloses);
            for (int row = 0; row < periods; row++) {
                matrix[row][column] = columnReturns[row];
            }
        }

        return new ReturnMatrix(symbols, matrix);
    }

    public int assetCount() {
        return symbols.size();
    }

    public int periods() {
        return returns.length;
    }

    public double[] column(int asset) {
        double[] column = new double[returns.length];
        for (int row = 0; row < returns.length; row++) {
            column[row] = returns[row][asset];
        }
        return column;
    }

    public double[] meanReturns() {
        double[] means = new double[assetCount()];
        for (int asset = 0; asset < means.length; asset++) {
            means[asset] = StatUtils.mean(column(asset));
        }
        return means;
    }

    /**
     * Sample (n - 1) standard deviation of each column.
     */
    public double[] volatilities() {
        double[] volatilities = new double[assetCount()];
        for (int asset = 0; asset < volatilities.length; asset++) {
            volatilities[asset] = Math.sqrt(StatUtils.variance(column(asset)));
        }
        return volatilities;
    }

    /**
     * Sample covariance matrix, bias corrected.
     */
    public RealMatrix covariance() {
        return new Covariance(returns, true).getCovarianceMatrix();
    }
}
