package com.fvgscanner.domain.model;

import com.fvgscanner.domain.enums.CandidateStatus;
import com.fvgscanner.domain.enums.TouchState;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * A detected fair value gap together with the result of validating it.
 *
 * <p>Every gap the detector finds becomes a candidate, whatever its status, so that
 * pending and rejected structures stay visible to callers.
 */
@Getter
@Builder
@ToString
public class FvgCandidate {

    private final FairValueGap gap;
    private final CandidateStatus status;

    /** Fill state at the evaluation bar, or at the end of the series for pending gaps. */
    private final TouchState touchState;

    /** Index of the first bar that re-entered the gap, null if none did. */
    private final Integer touchedAtIndex;

    /** Candidate entry bar ({@code formationIndex + entryOffsetBars}); null when pending. */
    private final Integer evaluationIndex;

    /** Sweep that preceded the gap, null if none was found in the lookback. */
    private final LiquiditySweep sweep;

    /** First break of structure in the gap's direction after the sweep, if any. */
    private final StructureBreak structureBreak;

    public boolean isUntouched() {
        return touchState == TouchState.UNTOUCHED;
    }

    public boolean hasSweep() {
        return sweep != null;
    }
}
