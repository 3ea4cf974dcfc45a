package ch.xavier.quantlab.quote;

import ch.xavier.quantlab.config.QuantLabProperties;
import ch.xavier.quantlab.exception.InvalidParameterException;
import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reads daily quotes from {@code <csv-directory>/<SYMBOL>.csv}.
 * Expected columns: date (ISO), open, high, low, close, volume, with a header row.
 */
@Service
@Slf4j
public class CsvQuoteProvider implements QuoteProvider {

    private final Path directory;

    @Autowired
    public CsvQuoteProvider(QuantLabProperties properties) {
        this(Path.of(properties.data().csvDirectory()));
    }

    CsvQuoteProvider(Path directory) {
        this.directory = directory;
    }

    @Override
    public PriceSeries fetch(String symbol, LocalDate start, LocalDate end) {
        // the symbol names a file directly inside the data directory
        if (symbol.isBlank() || symbol.contains("/") || symbol.contains("\\") || symbol.contains("..")) {
            throw new InvalidParameterException("Invalid symbol for a quote file: " + symbol);
        }

        Path file = directory.resolve(symbol + ".csv");
        if (!Files.isRegularFile(file)) {
            log.warn("No quote file found for {} at {}", symbol, file.toAbsolutePath());
            return PriceSeries.empty(symbol);
        }

        // keyed by date so a repeated row replaces the earlier one
        Map<LocalDate, Quote> quotesByDate = new TreeMap<>();

        try (CSVReader reader = new CSVReader(Files.newBufferedReader(file, StandardCharsets.UTF_8))) {
            String[] line;
            reader.readNext();

            while ((line = reader.readNext()) != null) {
                Quote quote;
                try {
                    quote = parse(line);
                } catch (RuntimeException e) {
                    log.warn("Skipping malformed quote row for {}: {}", symbol, String.join(",", line), e);
                    continue;
                }

                if (!quote.getDate().isBefore(start) && !quote.getDate().isAfter(end)) {
                    quotesByDate.put(quote.getDate(), quote);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read quotes from " + file, e);
        } catch (CsvValidationException e) {
            throw new IllegalStateException("Invalid quote file " + file, e);
        }

        log.info("Loaded {} quotes for {} between {} and {}", quotesByDate.size(), symbol, start, end);
        return new PriceSeries(symbol, new ArrayList<>(quotesByDate.values()));
    }

    private static Quote parse(String[] line) {
        return Quote.builder()
                .date(LocalDate.parse(line[0].trim()))
                .open(Double.parseDouble(line[1].trim()))
                .high(Double.parseDouble(line[2].trim()))
                .low(Double.parseDouble(line[3].trim()))
                .close(Double.parseDouble(line[4].trim()))
                .volume(Double.parseDouble(line[5].trim()))
                .build();
    }
}
