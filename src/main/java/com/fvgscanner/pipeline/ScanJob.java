package com.fvgscanner.pipeline;

import com.fvgscanner.domain.model.ScanReport;
import com.fvgscanner.domain.model.Setup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Runs one scan of the configured symbols once the application is ready.
 *
 * <p>Skipped unless {@code fvgscanner.scan.run-on-startup=true}. Needs a
 * {@link BarSource} bean; without one the job logs a warning and does nothing.
 */
@Service
public class ScanJob {

    private static final Logger log = LoggerFactory.getLogger(ScanJob.class);

    private final ScanConfig scanConfig;
    private final ScanOrchestrator scanOrchestrator;
    private final ObjectProvider<BarSource> barSourceProvider;

    public ScanJob(ScanConfig scanConfig, ScanOrchestrator scanOrchestrator, ObjectProvider<BarSource> barSourceProvider) {
        this.scanConfig = scanConfig;
        this.scanOrchestrator = scanOrchestrator;
        this.barSourceProvider = barSourceProvider;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!scanConfig.isRunOnStartup()) {
            log.debug("Startup scan disabled");
            return;
        }
        BarSource barSource = barSourceProvider.getIfAvailable();
        if (barSource == null) {
            log.warn("Startup scan enabled but no BarSource bean is registered, skipping");
            return;
        }
        if (scanConfig.getSymbols().isEmpty()) {
            log.warn("Startup scan enabled but fvgscanner.scan.symbols is empty, skipping");
            return;
        }

        ScanReport report = scanOrchestrator.scan(scanConfig.getSymbols(), barSource);
        for (Setup setup : report.rankedSetups()) {
            log.info(
                    "Setup {} {} gap [{}, {}] at {} ({}), score {}",
                    setup.getSymbol(),
                    setup.getDirection(),
                    String.format("%.4f", setup.getGap().lower()),
                    String.format("%.4f", setup.getGap().upper()),
                    setup.getEntryTime(),
                    setup.getSessionTag(),
                    String.format("%.1f", setup.getScore()));
        }
    }
}
