package com.fvgscanner.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fvgscanner.domain.enums.CandidateStatus;
import com.fvgscanner.domain.enums.GapDirection;
import com.fvgscanner.domain.enums.ScanStatus;
import com.fvgscanner.domain.enums.SessionTag;
import com.fvgscanner.domain.model.ScanReport;
import com.fvgscanner.domain.model.Setup;
import com.fvgscanner.domain.model.SymbolScanResult;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes {@code summary.json} into the configured report directory: every setup of the
 * run ranked by score across symbols, followed by one outcome line per symbol.
 * Does nothing when {@code fvgscanner.report.enabled} is false.
 */
@Component
public class JsonSummaryReportWriter implements SetupSink {

    private static final Logger log = LoggerFactory.getLogger(JsonSummaryReportWriter.class);

    static final String FILE_NAME = "summary.json";

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    static {
        OBJECT_MAPPER.findAndRegisterModules();
        OBJECT_MAPPER.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        OBJECT_MAPPER.enable(SerializationFeature.INDENT_OUTPUT);
    }

    private final ReportConfig reportConfig;

    public JsonSummaryReportWriter(ReportConfig reportConfig) {
        this.reportConfig = reportConfig;
    }

    @Override
    public void accept(ScanReport report) {
        if (!reportConfig.isEnabled()) {
            return;
        }
        Path target = write(report, Path.of(reportConfig.getDirectory()));
        log.info("Summary with {} setups written to {}", report.totalSetups(), target);
    }

    /**
     * @return the written file
     * @throws UncheckedIOException if the directory or file cannot be written
     */
    public Path write(ScanReport report, Path directory) {
        Path target = directory.resolve(FILE_NAME);
        try {
            Files.createDirectories(directory);
            OBJECT_MAPPER.writeValue(target.toFile(), toSummary(report));
        } catch (IOException e) {
            log.error("Failed to write summary to {}", target, e);
            throw new UncheckedIOException("Summary report write failed: " + target, e);
        }
        return target;
    }

    static Summary toSummary(ScanReport report) {
        List<SetupRow> setups = report.rankedSetups().stream().map(SetupRow::of).toList();
        List<SymbolRow> symbols = report.getResults().stream().map(SymbolRow::of).toList();
        return new Summary(report.getStartedAt(), report.getDurationMs(), setups, symbols);
    }

    record Summary(Instant startedAt, long durationMs, List<SetupRow> setups, List<SymbolRow> symbols) {}

    record SetupRow(
            String symbol,
            GapDirection direction,
            double score,
            double gapLower,
            double gapUpper,
            double gapWidth,
            int formationIndex,
            Double sizeInAtr,
            Instant entryTime,
            SessionTag session,
            Double sweptLevel,
            Instant sweepTime,
            Double sweepPenetration,
            boolean structureBreak,
            double cleanliness,
            Double sizeScore,
            double sessionScore,
            Double rvolAtEntry,
            double vwapAtEntry) {

        static SetupRow of(Setup setup) {
            return new SetupRow(
                    setup.getSymbol(),
                    setup.getDirection(),
                    setup.getScore(),
                    setup.getGap().lower(),
                    setup.getGap().upper(),
                    setup.getGap().width(),
                    setup.getGap().formationIndex(),
                    setup.getGap().sizeInAtr(),
                    setup.getEntryTime(),
                    setup.getSessionTag(),
                    setup.getSweep() != null ? setup.getSweep().pivot().price() : null,
                    setup.getSweep() != null ? setup.getSweep().sweepTime() : null,
                    setup.getSweep() != null ? setup.getSweep().penetration() : null,
                    setup.isStructureBreakConfirmed(),
                    setup.getBreakdown().cleanliness(),
                    setup.getBreakdown().size(),
                    setup.getBreakdown().session(),
                    setup.getRvolAtEntry(),
                    setup.getVwapAtEntry());
        }
    }

    record SymbolRow(
            String symbol,
            ScanStatus status,
            int barCount,
            boolean insufficientHistory,
            int setups,
            int pending,
            String errorCode,
            String errorMessage,
            long durationMs) {

        static SymbolRow of(SymbolScanResult result) {
            return new SymbolRow(
                    result.getSymbol(),
                    result.getStatus(),
                    result.getBarCount(),
                    result.isInsufficientHistory(),
                    result.getSetups().size(),
                    result.candidatesWithStatus(CandidateStatus.PENDING).size(),
                    result.getErrorCode() != null ? result.getErrorCode().getCode() : null,
                    result.getErrorMessage(),
                    result.getDurationMs());
        }
    }
}
