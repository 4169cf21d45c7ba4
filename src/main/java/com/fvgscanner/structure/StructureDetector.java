package com.fvgscanner.structure;

import com.fvgscanner.domain.enums.CandidateStatus;
import com.fvgscanner.domain.model.AnnotatedBar;
import com.fvgscanner.domain.model.FairValueGap;
import com.fvgscanner.domain.model.FvgCandidate;
import com.fvgscanner.domain.model.LiquiditySweep;
import com.fvgscanner.domain.model.StructureBreak;
import com.fvgscanner.domain.model.SwingPivot;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns an annotated series into fair value gap candidates.
 *
 * <p>Steps, each over the full series:
 * <ol>
 *   <li>swing pivots ({@link SwingPivotDetector})</li>
 *   <li>strict three-bar gaps ({@link FairValueGapDetector})</li>
 *   <li>breaks of structure ({@link BreakOfStructureDetector})</li>
 *   <li>per gap: sweep lookup, then a forward walk of a {@link GapTouchTracker} up to
 *       the evaluation bar {@code formationIndex + entryOffsetBars}</li>
 * </ol>
 *
 * <p>Status resolution: a gap re-entered at or before the evaluation bar is TOUCHED.
 * An untouched gap whose evaluation bar lies beyond the series end is PENDING. An
 * untouched gap that reached its evaluation bar is QUALIFIED with a sweep and
 * NO_SWEEP without one.
 */
@Service
public class StructureDetector {

    private static final Logger log = LoggerFactory.getLogger(StructureDetector.class);

    private final StructureConfig structureConfig;

    public StructureDetector(StructureConfig structureConfig) {
        this.structureConfig = structureConfig;
    }

    public StructureAnalysis detect(List<AnnotatedBar> bars) {
        List<SwingPivot> pivots = SwingPivotDetector.detect(bars);
        List<FairValueGap> gaps = FairValueGapDetector.detect(bars);
        List<StructureBreak> breaks =
                BreakOfStructureDetector.detect(bars, pivots, structureConfig.getBosAtrBuffer());
        LiquiditySweepLocator sweepLocator =
                new LiquiditySweepLocator(bars, pivots, structureConfig.getSweepLookbackBars());

        List<FvgCandidate> candidates = new ArrayList<>(gaps.size());
        for (FairValueGap gap : gaps) {
            candidates.add(evaluate(gap, bars, sweepLocator, breaks));
        }

        StructureAnalysis analysis = new StructureAnalysis(pivots, breaks, candidates);
        log.debug(
                "Structure: {} pivots, {} breaks, {} gaps (qualified={}, noSweep={}, touched={}, pending={})",
                pivots.size(),
                breaks.size(),
                gaps.size(),
                analysis.count(CandidateStatus.QUALIFIED),
                analysis.count(CandidateStatus.NO_SWEEP),
                analysis.count(CandidateStatus.TOUCHED),
                analysis.count(CandidateStatus.PENDING));
        return analysis;
    }

    private FvgCandidate evaluate(
            FairValueGap gap, List<AnnotatedBar> bars, LiquiditySweepLocator sweepLocator, List<StructureBreak> breaks) {
        int evaluationIndex = gap.formationIndex() + structureConfig.getEntryOffsetBars();
        int lastObservable = Math.min(evaluationIndex, bars.size() - 1);

        GapTouchTracker tracker = new GapTouchTracker(gap);
        for (int j = gap.formationIndex() + 1; j <= lastObservable && !tracker.isTouched(); j++) {
            AnnotatedBar bar = bars.get(j);
            tracker.observe(j, bar.low(), bar.high());
        }

        // a gap completed on one of the final two bars stays pending whatever the offset
        boolean reachedEvaluation = evaluationIndex < bars.size() && gap.formationIndex() < bars.size() - 2;
        LiquiditySweep sweep = sweepLocator.locate(gap).orElse(null);

        CandidateStatus status;
        if (tracker.isTouched()) {
            status = CandidateStatus.TOUCHED;
        } else if (!reachedEvaluation) {
            status = CandidateStatus.PENDING;
        } else if (sweep != null) {
            status = CandidateStatus.QUALIFIED;
        } else {
            status = CandidateStatus.NO_SWEEP;
        }

        int breakFrom = sweep != null ? sweep.sweepIndex() : gap.firstIndex();
        return FvgCandidate.builder()
                .gap(gap)
                .status(status)
                .touchState(tracker.getState())
                .touchedAtIndex(tracker.getTouchedAtIndex())
                .evaluationIndex(reachedEvaluation ? evaluationIndex : null)
                .sweep(sweep)
                .structureBreak(firstBreak(breaks, gap, breakFrom, lastObservable))
                .build();
    }

    /** First break in the gap's direction with {@code from < index <= to}. */
    private static StructureBreak firstBreak(List<StructureBreak> breaks, FairValueGap gap, int from, int to) {
        for (StructureBreak structureBreak : breaks) {
            if (structureBreak.index() > to) {
                break;
            }
            if (structureBreak.index() > from && structureBreak.direction() == gap.direction()) {
                return structureBreak;
            }
        }
        return null;
    }
}
