package com.fvgscanner.unit.report;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fvgscanner.domain.enums.GapDirection;
import com.fvgscanner.domain.enums.ScanStatus;
import com.fvgscanner.domain.enums.SessionTag;
import com.fvgscanner.domain.model.FairValueGap;
import com.fvgscanner.domain.model.ScanReport;
import com.fvgscanner.domain.model.ScoreBreakdown;
import com.fvgscanner.domain.model.Setup;
import com.fvgscanner.domain.model.SymbolScanResult;
import com.fvgscanner.exception.ErrorCode;
import com.fvgscanner.report.JsonSummaryReportWriter;
import com.fvgscanner.report.ReportConfig;
import com.fvgscanner.support.BarFixtures;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonSummaryReportWriterTest {

    @TempDir
    Path tempDir;

    private ReportConfig reportConfig;
    private JsonSummaryReportWriter writer;

    @BeforeEach
    void setUp() {
        reportConfig = new ReportConfig();
        writer = new JsonSummaryReportWriter(reportConfig);
    }

    private static Setup setup(String symbol, double score, int formationIndex) {
        return Setup.builder()
                .symbol(symbol)
                .gap(new FairValueGap(GapDirection.BULLISH, 100.0, 100.5, formationIndex, 1.0, 0.5))
                .entryIndex(formationIndex + 5)
                .entryTime(BarFixtures.SESSION_OPEN.plusSeconds(60L * (formationIndex + 5)))
                .sessionTag(SessionTag.AM)
                .score(score)
                .breakdown(new ScoreBreakdown(0.8, 1.0, 1.0, 0.40, 0.35, 0.25))
                .untouchedAtEvaluation(true)
                .vwapAtEntry(100.2)
                .build();
    }

    private static ScanReport report() {
        SymbolScanResult aapl = SymbolScanResult.builder()
                .symbol("AAPL")
                .status(ScanStatus.SUCCESS_WITH_SETUPS)
                .setups(List.of(setup("AAPL", 71.0, 11)))
                .barCount(390)
                .build();
        SymbolScanResult msft = SymbolScanResult.builder()
                .symbol("MSFT")
                .status(ScanStatus.SUCCESS_WITH_SETUPS)
                .setups(List.of(setup("MSFT", 88.5, 40), setup("MSFT", 64.0, 12)))
                .barCount(390)
                .build();
        SymbolScanResult tsla = SymbolScanResult.failed("TSLA", ErrorCode.DATA_INTEGRITY, "Duplicate timestamp", 3);
        return ScanReport.builder()
                .startedAt(BarFixtures.SESSION_OPEN)
                .durationMs(42)
                .results(List.of(aapl, msft, tsla))
                .build();
    }

    @Test
    @DisplayName("Summary ranks setups across symbols and lists every symbol's outcome")
    void writesRankedSummary() throws IOException {
        Path file = writer.write(report(), tempDir.resolve("out"));

        JsonNode root = new ObjectMapper().readTree(Files.readString(file));
        JsonNode setups = root.get("setups");
        assertThat(setups).hasSize(3);
        assertThat(setups.get(0).get("symbol").asText()).isEqualTo("MSFT");
        assertThat(setups.get(0).get("score").asDouble()).isEqualTo(88.5);
        assertThat(setups.get(1).get("symbol").asText()).isEqualTo("AAPL");
        assertThat(setups.get(2).get("score").asDouble()).isEqualTo(64.0);
        assertThat(setups.get(0).get("entryTime").asText()).startsWith("2024-03-05T");

        JsonNode symbols = root.get("symbols");
        assertThat(symbols).hasSize(3);
        assertThat(symbols.get(2).get("status").asText()).isEqualTo("FAILED");
        assertThat(symbols.get(2).get("errorCode").asText()).isEqualTo("DATA_INTEGRITY");
    }

    @Test
    @DisplayName("Disabled writer leaves the directory untouched")
    void disabled() {
        reportConfig.setEnabled(false);
        reportConfig.setDirectory(tempDir.resolve("disabled").toString());

        writer.accept(report());

        assertThat(Files.exists(tempDir.resolve("disabled"))).isFalse();
    }

    @Test
    @DisplayName("Enabled writer creates summary.json in the configured directory")
    void enabled() {
        reportConfig.setEnabled(true);
        reportConfig.setDirectory(tempDir.resolve("reports").toString());

        writer.accept(report());

        assertThat(tempDir.resolve("reports").resolve("summary.json")).exists();
    }
}
