package com.fvgscanner.pipeline;

import com.fvgscanner.calendar.MarketSessionCalendar;
import com.fvgscanner.calendar.SessionConfig;
import com.fvgscanner.domain.enums.ScanStatus;
import com.fvgscanner.domain.model.AnnotatedBar;
import com.fvgscanner.domain.model.Bar;
import com.fvgscanner.domain.model.FvgCandidate;
import com.fvgscanner.domain.model.Setup;
import com.fvgscanner.domain.model.SymbolScanResult;
import com.fvgscanner.indicator.IndicatorEngine;
import com.fvgscanner.scoring.ScoringEngine;
import com.fvgscanner.structure.StructureAnalysis;
import com.fvgscanner.structure.StructureDetector;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs one symbol through validation, indicators, structure detection and scoring.
 *
 * <p>Every collaborator is stateless per call, so one instance serves all symbol
 * workers concurrently. Exceptions propagate to the caller; isolation between
 * symbols is the orchestrator's job.
 */
@Service
public class SetupScanPipeline {

    private static final Logger log = LoggerFactory.getLogger(SetupScanPipeline.class);

    static final Comparator<Setup> BY_SCORE =
            Comparator.comparingDouble(Setup::getScore).reversed()
                    .thenComparingInt(s -> s.getGap().formationIndex());

    private final IndicatorEngine indicatorEngine;
    private final StructureDetector structureDetector;
    private final ScoringEngine scoringEngine;
    private final MarketSessionCalendar sessionCalendar;
    private final SessionConfig sessionConfig;

    public SetupScanPipeline(
            IndicatorEngine indicatorEngine,
            StructureDetector structureDetector,
            ScoringEngine scoringEngine,
            MarketSessionCalendar sessionCalendar,
            SessionConfig sessionConfig) {
        this.indicatorEngine = indicatorEngine;
        this.structureDetector = structureDetector;
        this.scoringEngine = scoringEngine;
        this.sessionCalendar = sessionCalendar;
        this.sessionConfig = sessionConfig;
    }

    /**
     * @throws com.fvgscanner.exception.DataIntegrityException if the series is malformed
     */
    public SymbolScanResult scan(String symbol, List<Bar> bars) {
        long start = System.currentTimeMillis();
        BarSeriesValidator.validate(symbol, bars);

        List<Bar> series = bars;
        if (sessionConfig.isRegularHoursOnly()) {
            series = bars.stream()
                    .filter(b -> sessionCalendar.isRegularHours(b.timestamp()))
                    .toList();
            log.debug("{}: kept {} of {} bars inside regular hours", symbol, series.size(), bars.size());
        }

        boolean insufficientHistory = !indicatorEngine.hasSufficientHistory(series.size());
        if (insufficientHistory) {
            log.warn("{}: only {} bars, indicators will be partially undefined", symbol, series.size());
        }

        List<AnnotatedBar> annotated = indicatorEngine.annotate(series);
        StructureAnalysis analysis = structureDetector.detect(annotated);

        List<Setup> setups = new ArrayList<>();
        for (FvgCandidate candidate : analysis.qualified()) {
            setups.add(scoringEngine.score(symbol, candidate, annotated));
        }
        setups.sort(BY_SCORE);

        long durationMs = System.currentTimeMillis() - start;
        log.info(
                "{}: {} bars, {} gaps, {} setups{} in {}ms",
                symbol,
                series.size(),
                analysis.candidates().size(),
                setups.size(),
                setups.isEmpty() ? "" : " (best " + String.format("%.1f", setups.get(0).getScore()) + ")",
                durationMs);

        return SymbolScanResult.builder()
                .symbol(symbol)
                .status(setups.isEmpty() ? ScanStatus.SUCCESS_NO_SETUPS : ScanStatus.SUCCESS_WITH_SETUPS)
                .setups(setups)
                .candidates(analysis.candidates())
                .barCount(series.size())
                .insufficientHistory(insufficientHistory)
                .durationMs(durationMs)
                .build();
    }
}
