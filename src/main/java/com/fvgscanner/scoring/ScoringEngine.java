package com.fvgscanner.scoring;

import com.fvgscanner.calendar.SessionClassifier;
import com.fvgscanner.domain.enums.GapDirection;
import com.fvgscanner.domain.enums.SessionTag;
import com.fvgscanner.domain.model.AnnotatedBar;
import com.fvgscanner.domain.model.Bar;
import com.fvgscanner.domain.model.FairValueGap;
import com.fvgscanner.domain.model.FvgCandidate;
import com.fvgscanner.domain.model.ScoreBreakdown;
import com.fvgscanner.domain.model.Setup;
import java.util.List;
import org.springframework.stereotype.Service;

/**
 * Scores qualified candidates into {@link Setup}s.
 *
 * <p>Three components, each in {@code [0, 1]}, always combined in the same order
 * (cleanliness, size, session):
 * <pre>
 * score = 100 * (wc*c + ws*s + wq*q) / (wc + ws + wq)
 * </pre>
 * clipped to {@code [0, 100]}. When ATR was undefined at formation the size
 * component is null and {@code ws} is dropped from both sums. A zero weight sum
 * scores 0.
 */
@Service
public class ScoringEngine {

    public static final double MIN_SCORE = 0.0;
    public static final double MAX_SCORE = 100.0;

    private final ScoringConfig scoringConfig;
    private final SessionClassifier sessionClassifier;

    public ScoringEngine(ScoringConfig scoringConfig, SessionClassifier sessionClassifier) {
        this.scoringConfig = scoringConfig;
        this.sessionClassifier = sessionClassifier;
    }

    /**
     * @param candidate a QUALIFIED candidate
     * @param bars      the annotated series the candidate was detected in
     * @throws IllegalArgumentException if the candidate is not scorable
     */
    public Setup score(String symbol, FvgCandidate candidate, List<AnnotatedBar> bars) {
        if (!candidate.getStatus().isScorable()) {
            throw new IllegalArgumentException("Only qualified candidates can be scored, got " + candidate.getStatus());
        }
        FairValueGap gap = candidate.getGap();
        AnnotatedBar entry = bars.get(candidate.getEvaluationIndex());
        SessionTag sessionTag = sessionClassifier.classify(entry.timestamp());

        double cleanliness = cleanliness(
                bars.get(gap.firstIndex()).bar(),
                bars.get(gap.middleIndex()).bar(),
                bars.get(gap.formationIndex()).bar(),
                gap.direction());
        Double size = sizeScore(gap.sizeInAtr());
        double session = sessionQuality(sessionTag);

        double cleanlinessWeight = scoringConfig.getCleanlinessWeight();
        double sizeWeight = size != null ? scoringConfig.getSizeWeight() : 0.0;
        double sessionWeight = scoringConfig.getSessionWeight();

        double weighted = cleanlinessWeight * cleanliness;
        if (size != null) {
            weighted += sizeWeight * size;
        }
        weighted += sessionWeight * session;
        double totalWeight = cleanlinessWeight + sizeWeight + sessionWeight;
        double score = totalWeight > 0 ? clamp(MAX_SCORE * weighted / totalWeight, MIN_SCORE, MAX_SCORE) : MIN_SCORE;

        return Setup.builder()
                .symbol(symbol)
                .gap(gap)
                .sweep(candidate.getSweep())
                .structureBreak(candidate.getStructureBreak())
                .entryIndex(entry.index())
                .entryTime(entry.timestamp())
                .sessionTag(sessionTag)
                .score(score)
                .breakdown(new ScoreBreakdown(
                        cleanliness, size, session, cleanlinessWeight, sizeWeight, sessionWeight))
                .untouchedAtEvaluation(candidate.isUntouched())
                .atrAtEntry(entry.atr())
                .rvolAtEntry(entry.rvol())
                .vwapAtEntry(entry.vwap())
                .build();
    }

    /**
     * Geometric quality of the three-bar structure: mean of direction alignment of
     * the three bodies, the impulse bar's body-to-range ratio, and one minus the share
     * of the impulse body overlapped by the outer bars' ranges.
     */
    static double cleanliness(Bar first, Bar middle, Bar third, GapDirection direction) {
        int aligned = 0;
        for (Bar bar : new Bar[] {first, middle, third}) {
            if (direction == GapDirection.BULLISH ? bar.isBullish() : bar.isBearish()) {
                aligned++;
            }
        }
        double alignment = aligned / 3.0;

        double bodyRatio = middle.range() > 0 ? middle.body() / middle.range() : 0.0;

        double body = middle.body();
        double intrusion = 1.0;
        if (body > 0) {
            double bodyLow = Math.min(middle.open(), middle.close());
            double bodyHigh = Math.max(middle.open(), middle.close());
            double overlap = overlap(first.low(), first.high(), bodyLow, bodyHigh)
                    + overlap(third.low(), third.high(), bodyLow, bodyHigh);
            intrusion = Math.min(1.0, overlap / body);
        }

        return clamp((alignment + bodyRatio + (1.0 - intrusion)) / 3.0, 0.0, 1.0);
    }

    /**
     * 1 inside the ideal ATR band, linear ramp from 0 below it, linear decay above it
     * over one band width. Null when the gap has no ATR size.
     */
    Double sizeScore(Double sizeInAtr) {
        if (sizeInAtr == null) {
            return null;
        }
        double min = scoringConfig.getAtrIdealMin();
        double max = scoringConfig.getAtrIdealMax();
        if (sizeInAtr >= min && sizeInAtr <= max) {
            return 1.0;
        }
        if (sizeInAtr < min) {
            return clamp(sizeInAtr / min, 0.0, 1.0);
        }
        double width = max - min;
        if (width <= 0) {
            return 0.0;
        }
        return clamp(1.0 - (sizeInAtr - max) / width, 0.0, 1.0);
    }

    double sessionQuality(SessionTag sessionTag) {
        Double quality = scoringConfig.getSessionQuality().get(sessionTag);
        return quality == null ? 0.0 : clamp(quality, 0.0, 1.0);
    }

    private static double overlap(double aLow, double aHigh, double bLow, double bHigh) {
        return Math.max(0.0, Math.min(aHigh, bHigh) - Math.max(aLow, bLow));
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
