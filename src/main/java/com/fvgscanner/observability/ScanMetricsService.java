package com.fvgscanner.observability;

import com.fvgscanner.domain.enums.CandidateStatus;
import com.fvgscanner.domain.model.ScanReport;
import com.fvgscanner.domain.model.SymbolScanResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.springframework.stereotype.Service;

/**
 * Micrometer metrics for scan runs:
 * <ul>
 *   <li><b>scan.symbol.duration</b> (timer): wall time of one symbol's pipeline, tagged by outcome</li>
 *   <li><b>scan.setups.count</b> (counter): scored setups produced</li>
 *   <li><b>scan.candidates.pending</b> (counter): gaps too close to the series end to evaluate</li>
 *   <li><b>scan.symbols.failed</b> (counter): symbols whose pipeline failed, tagged by error code</li>
 *   <li><b>scan.run.duration</b> (timer): wall time of a whole multi-symbol run</li>
 * </ul>
 */
@Service
public class ScanMetricsService {

    private final MeterRegistry meterRegistry;
    private final Counter setupsCounter;
    private final Counter pendingCounter;
    private final Timer runTimer;

    public ScanMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.setupsCounter = Counter.builder("scan.setups.count")
                .description("Scored sweep + FVG setups produced")
                .register(meterRegistry);

        this.pendingCounter = Counter.builder("scan.candidates.pending")
                .description("Gaps left pending because the series ended before their evaluation bar")
                .register(meterRegistry);

        this.runTimer = Timer.builder("scan.run.duration")
                .description("Wall time of a multi-symbol scan run")
                .maximumExpectedValue(Duration.ofMinutes(5))
                .register(meterRegistry);
    }

    public void recordSymbol(SymbolScanResult result) {
        String outcome = result.getStatus().name();
        Timer.builder("scan.symbol.duration")
                .description("Wall time of one symbol's scan pipeline")
                .tag("status", outcome)
                .register(meterRegistry)
                .record(result.getDurationMs(), TimeUnit.MILLISECONDS);

        if (result.isFailed()) {
            Counter.builder("scan.symbols.failed")
                    .description("Symbols whose scan pipeline failed")
                    .tag("error", result.getErrorCode().getCode())
                    .register(meterRegistry)
                    .increment();
            return;
        }
        setupsCounter.increment(result.getSetups().size());
        pendingCounter.increment(result.candidatesWithStatus(CandidateStatus.PENDING).size());
    }

    public void recordRun(ScanReport report) {
        runTimer.record(report.getDurationMs(), TimeUnit.MILLISECONDS);
    }

    // Expose for testing
    public Counter getSetupsCounter() {
        return setupsCounter;
    }

    public Counter getPendingCounter() {
        return pendingCounter;
    }

    public Timer getRunTimer() {
        return runTimer;
    }
}
