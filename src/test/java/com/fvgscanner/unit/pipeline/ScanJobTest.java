package com.fvgscanner.unit.pipeline;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fvgscanner.domain.model.ScanReport;
import com.fvgscanner.pipeline.BarSource;
import com.fvgscanner.pipeline.ScanConfig;
import com.fvgscanner.pipeline.ScanJob;
import com.fvgscanner.pipeline.ScanOrchestrator;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;

@ExtendWith(MockitoExtension.class)
class ScanJobTest {

    @Mock
    private ScanOrchestrator scanOrchestrator;

    @Mock
    private ObjectProvider<BarSource> barSourceProvider;

    @Mock
    private BarSource barSource;

    private ScanConfig scanConfig;
    private ScanJob scanJob;

    @BeforeEach
    void setUp() {
        scanConfig = new ScanConfig();
        scanJob = new ScanJob(scanConfig, scanOrchestrator, barSourceProvider);
    }

    @Test
    @DisplayName("Does nothing unless enabled")
    void disabledByDefault() {
        scanJob.onApplicationReady();

        verify(scanOrchestrator, never()).scan(anyList(), any(BarSource.class));
    }

    @Test
    @DisplayName("Skips when no bar source is registered")
    void noBarSource() {
        scanConfig.setRunOnStartup(true);
        scanConfig.setSymbols(List.of("AAPL"));
        when(barSourceProvider.getIfAvailable()).thenReturn(null);

        scanJob.onApplicationReady();

        verify(scanOrchestrator, never()).scan(anyList(), any(BarSource.class));
    }

    @Test
    @DisplayName("Scans the configured symbols with the registered bar source")
    void scansConfiguredSymbols() {
        scanConfig.setRunOnStartup(true);
        scanConfig.setSymbols(List.of("AAPL", "MSFT"));
        when(barSourceProvider.getIfAvailable()).thenReturn(barSource);
        when(scanOrchestrator.scan(List.of("AAPL", "MSFT"), barSource))
                .thenReturn(ScanReport.builder()
                        .startedAt(Instant.parse("2024-03-05T14:30:00Z"))
                        .results(List.of())
                        .build());

        scanJob.onApplicationReady();

        verify(scanOrchestrator).scan(List.of("AAPL", "MSFT"), barSource);
    }
}
