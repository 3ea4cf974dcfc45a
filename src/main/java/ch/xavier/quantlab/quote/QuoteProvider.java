package ch.xavier.quantlab.quote;

import java.time.LocalDate;

/**
 * Source of historical prices. Implementations own gap filling and caching; callers only see a validated
 * {@link PriceSeries}, which may be empty when nothing is available for the requested range.
 */
public interface QuoteProvider {

    /**
     * @param start inclusive
     * @param end   inclusive
     */
    PriceSeries fetch(String symbol, LocalDate start, LocalDate end);
}
