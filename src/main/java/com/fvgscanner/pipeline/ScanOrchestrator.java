package com.fvgscanner.pipeline;

import com.fvgscanner.config.ConfigurationValidator;
import com.fvgscanner.domain.model.Bar;
import com.fvgscanner.domain.model.ScanReport;
import com.fvgscanner.domain.model.SymbolScanResult;
import com.fvgscanner.exception.BarSourceException;
import com.fvgscanner.exception.BaseException;
import com.fvgscanner.exception.ErrorCode;
import com.fvgscanner.observability.ScanMetricsService;
import com.fvgscanner.report.SetupSink;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Scans many symbols in parallel and collects one result per symbol.
 *
 * <p>Flow:
 * <ol>
 *   <li>Validate configuration. A {@link com.fvgscanner.exception.ConfigurationException}
 *       aborts the run before any symbol starts.</li>
 *   <li>Submit one task per symbol to the {@code scanExecutor} pool. A symbol's bars are
 *       loaded, validated and processed entirely inside its own task.</li>
 *   <li>Join all tasks. A failure in one symbol becomes a FAILED result for that symbol;
 *       the other symbols are unaffected.</li>
 *   <li>Record metrics and hand the report to every {@link SetupSink}.</li>
 * </ol>
 */
@Service
public class ScanOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ScanOrchestrator.class);

    private final ConfigurationValidator configurationValidator;
    private final SetupScanPipeline pipeline;
    private final Executor scanExecutor;
    private final ScanMetricsService scanMetricsService;
    private final List<SetupSink> sinks;

    public ScanOrchestrator(
            ConfigurationValidator configurationValidator,
            SetupScanPipeline pipeline,
            @Qualifier("scanExecutor") Executor scanExecutor,
            ScanMetricsService scanMetricsService,
            List<SetupSink> sinks) {
        this.configurationValidator = configurationValidator;
        this.pipeline = pipeline;
        this.scanExecutor = scanExecutor;
        this.scanMetricsService = scanMetricsService;
        this.sinks = sinks;
    }

    /**
     * Scans in-memory series. Results follow the map's iteration order.
     */
    public ScanReport scan(Map<String, List<Bar>> barsBySymbol) {
        return run(new ArrayList<>(barsBySymbol.keySet()), barsBySymbol::get);
    }

    /**
     * Scans symbols whose bars are loaded from {@code barSource} inside each symbol's task.
     */
    public ScanReport scan(List<String> symbols, BarSource barSource) {
        return run(symbols, barSource);
    }

    private ScanReport run(List<String> symbols, BarSource barSource) {
        configurationValidator.validate();

        Instant startedAt = Instant.now();
        long start = System.currentTimeMillis();
        log.info("Scan started for {} symbols", symbols.size());

        List<CompletableFuture<SymbolScanResult>> futures = new ArrayList<>(symbols.size());
        for (String symbol : symbols) {
            futures.add(CompletableFuture.supplyAsync(isolated(symbol, barSource), scanExecutor));
        }
        List<SymbolScanResult> results =
                futures.stream().map(CompletableFuture::join).toList();

        ScanReport report = ScanReport.builder()
                .startedAt(startedAt)
                .durationMs(System.currentTimeMillis() - start)
                .results(results)
                .build();

        results.forEach(scanMetricsService::recordSymbol);
        scanMetricsService.recordRun(report);

        log.info(
                "Scan finished: {} symbols, {} setups, {} failed in {}ms",
                results.size(),
                report.totalSetups(),
                report.failedResults().size(),
                report.getDurationMs());

        publish(report);
        return report;
    }

    private Supplier<SymbolScanResult> isolated(String symbol, BarSource barSource) {
        return () -> {
            long start = System.currentTimeMillis();
            try {
                return pipeline.scan(symbol, load(symbol, barSource));
            } catch (BaseException e) {
                log.warn("{}: scan failed [{}] {}", symbol, e.getErrorCode().getCode(), e.getMessage());
                return SymbolScanResult.failed(
                        symbol, e.getErrorCode(), e.getMessage(), System.currentTimeMillis() - start);
            } catch (RuntimeException e) {
                log.error("{}: unexpected error during scan", symbol, e);
                return SymbolScanResult.failed(
                        symbol, ErrorCode.INTERNAL_ERROR, String.valueOf(e.getMessage()),
                        System.currentTimeMillis() - start);
            }
        };
    }

    private static List<Bar> load(String symbol, BarSource barSource) {
        List<Bar> bars;
        try {
            bars = barSource.loadBars(symbol);
        } catch (RuntimeException e) {
            throw new BarSourceException(symbol, e);
        }
        return bars != null ? bars : List.of();
    }

    private void publish(ScanReport report) {
        for (SetupSink sink : sinks) {
            try {
                sink.accept(report);
            } catch (RuntimeException e) {
                log.error("Setup sink {} failed", sink.getClass().getSimpleName(), e);
            }
        }
    }
}
