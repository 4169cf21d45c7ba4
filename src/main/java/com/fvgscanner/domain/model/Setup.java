package com.fvgscanner.domain.model;

import com.fvgscanner.domain.enums.GapDirection;
import com.fvgscanner.domain.enums.SessionTag;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * A scored sweep + fair value gap setup for one symbol.
 *
 * <p>Created once per qualified candidate by the ScoringEngine and never modified
 * afterwards. The entry bar is the candidate's evaluation bar; the session tag is
 * derived from its local time.
 */
@Getter
@Builder
@ToString
public class Setup {

    private final String symbol;
    private final FairValueGap gap;
    private final LiquiditySweep sweep;
    private final StructureBreak structureBreak;

    private final int entryIndex;
    private final Instant entryTime;
    private final SessionTag sessionTag;

    /** Composite score in {@code [0, 100]}. */
    private final double score;

    private final ScoreBreakdown breakdown;
    private final boolean untouchedAtEvaluation;

    // Context at the entry bar
    private final Double atrAtEntry;
    private final Double rvolAtEntry;
    private final double vwapAtEntry;

    public GapDirection getDirection() {
        return gap.direction();
    }

    public boolean isStructureBreakConfirmed() {
        return structureBreak != null;
    }
}
