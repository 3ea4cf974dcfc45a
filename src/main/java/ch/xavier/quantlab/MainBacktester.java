package ch.xavier.quantlab;

import ch.xavier.quantlab.backtesting.BacktestService;
import ch.xavier.quantlab.backtesting.WalkForwardService;
import ch.xavier.quantlab.config.QuantLabProperties;
import ch.xavier.quantlab.exception.QuantLabException;
import ch.xavier.quantlab.portfolio.PortfolioOptimizerService;
import ch.xavier.quantlab.report.ReportFormatter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.Supplier;

/**
 * Runs every analysis on the configured symbols at startup and logs the summaries.
 * Enabled with {@code quantlab.runner.enabled=true}.
 */
@Component
@Slf4j
@ConditionalOnProperty(prefix = "quantlab.runner", name = "enabled", havingValue = "true")
public class MainBacktester implements CommandLineRunner {

    private final BacktestService backtestService;
    private final WalkForwardService walkForwardService;
    private final PortfolioOptimizerService portfolioOptimizerService;
    private final ReportFormatter reportFormatter;
    private final QuantLabProperties.Runner settings;

    public MainBacktester(BacktestService backtestService,
                          WalkForwardService walkForwardService,
                          PortfolioOptimizerService portfolioOptimizerService,
                          ReportFormatter reportFormatter,
                          QuantLabProperties properties) {
        this.backtestService = backtestService;
        this.walkForwardService = walkForwardService;
        this.portfolioOptimizerService = portfolioOptimizerService;
        this.reportFormatter = reportFormatter;
        this.settings = properties.runner();
    }

    @Override
    public void run(String... args) {
        List<String> symbols = settings.symbols();
        log.info("Starting analysis of {}", symbols);

        for (String symbol : symbols) {
            report(() -> reportFormatter.formatBacktest(
                    backtestService.runBacktest(symbol, settings.fastWindow(), settings.slowWindow())));
            report(() -> reportFormatter.formatWalkForward(walkForwardService.walkForwardAnalysis(symbol)));
        }

        report(() -> reportFormatter.formatMaxSharpe(portfolioOptimizerService.maxSharpeWeights(symbols)));
        report(() -> reportFormatter.formatRiskParity(portfolioOptimizerService.riskParityWeights(symbols)));
    }

    private void report(Supplier<String> analysis) {
        try {
            log.info("{}{}", System.lineSeparator(), analysis.get());
        } catch (QuantLabException e) {
            log.error(reportFormatter.error(e));
        }
    }
}
