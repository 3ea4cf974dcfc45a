package ch.xavier.quantlab.quote;

import ch.xavier.quantlab.exception.InvalidParameterException;
import lombok.Getter;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Immutable, date-ascending sequence of quotes for one symbol. Dates are unique.
 */
public final class PriceSeries {

    @Getter
    private final String symbol;
    private final List<Quote> quotes;

    public PriceSeries(String symbol, List<Quote> quotes) {
        this.symbol = symbol;
        this.quotes = List.copyOf(quotes);

        for (int i = 1; i < this.quotes.size(); i++) {
            LocalDate previous = this.quotes.get(i - 1).getDate();
            LocalDate current = this.quotes.get(i).getDate();
            if (!current.isAfter(previous)) {
                throw new InvalidParameterException(String.format(
                        "Quotes for %s must be strictly ascending by date, found %s after %s",
                        symbol, current, previous));
            }
        }
    }

    public static PriceSeries empty(String symbol) {
        return new PriceSeries(symbol, List.of());
    }

    /**
     * Builds a series of close-only quotes on consecutive calendar days starting at {@code firstDate}.
     */
    public static PriceSeries ofCloses(String symbol, LocalDate firstDate, double... closes) {
        List<Quote> quotes = new ArrayList<>(closes.length);
        for (int i = 0; i < closes.length; i++) {
            quotes.add(Quote.ofClose(firstDate.plusDays(i), closes[i]));
        }
        return new PriceSeries(symbol, quotes);
    }

    public int size() {
        return quotes.size();
    }

    public boolean isEmpty() {
        return quotes.isEmpty();
    }

    public Quote get(int index) {
        return quotes.get(index);
    }

    public LocalDate dateAt(int index) {
        return quotes.get(index).getDate();
    }

    public List<Quote> getQuotes() {
        return quotes;
    }

    public double[] closes() {
        double[] closes = new double[quotes.size()];
        for (int i = 0; i < closes.length; i++) {
            closes[i] = quotes.get(i).getClose();
        }
        return closes;
    }

    /**
     * @param fromIndex inclusive
     * @param toIndex   exclusive
     */
    public PriceSeries slice(int fromIndex, int toIndex) {
        return new PriceSeries(symbol, quotes.subList(fromIndex, toIndex));
    }

    @Override
    public String toString() {
        if (quotes.isEmpty()) {
            return "PriceSeries(" + symbol + ", empty)";
        }
        return String.format("PriceSeries(%s, %d quotes, %s to %s)",
                symbol, quotes.size(), dateAt(0), dateAt(quotes.size() - 1));
    }
}
