package com.fvgscanner.unit.structure;

import static com.fvgscanner.support.BarFixtures.bar;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.fvgscanner.domain.enums.GapDirection;
import com.fvgscanner.domain.model.Bar;
import com.fvgscanner.domain.model.FairValueGap;
import com.fvgscanner.structure.FairValueGapDetector;
import com.fvgscanner.support.BarFixtures;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class FairValueGapDetectorTest {

    @Nested
    @DisplayName("Bullish gaps")
    class Bullish {

        @Test
        @DisplayName("Third bar low above first bar high forms a gap at the third bar")
        void detectsBullishGap() {
            List<FairValueGap> gaps =
                    FairValueGapDetector.detect(BarFixtures.annotate(BarFixtures.sweepThenBullishGap()));

            assertThat(gaps).hasSize(1);
            FairValueGap gap = gaps.get(0);
            assertThat(gap.direction()).isEqualTo(GapDirection.BULLISH);
            assertThat(gap.lower()).isEqualTo(100.00);
            assertThat(gap.upper()).isEqualTo(100.50);
            assertThat(gap.formationIndex()).isEqualTo(11);
            assertThat(gap.firstIndex()).isEqualTo(9);
        }

        @Test
        @DisplayName("Touching outer bars do not form a gap")
        void strictInequality() {
            List<Bar> bars = List.of(
                    bar(0, 100.0, 100.5, 99.5, 100.2),
                    bar(1, 100.2, 101.5, 100.1, 101.3),
                    bar(2, 101.3, 101.8, 100.5, 101.6));

            assertThat(FairValueGapDetector.detect(BarFixtures.annotate(bars))).isEmpty();
        }
    }

    @Nested
    @DisplayName("Bearish gaps")
    class Bearish {

        @Test
        @DisplayName("Third bar high below first bar low forms a gap")
        void detectsBearishGap() {
            List<FairValueGap> gaps =
                    FairValueGapDetector.detect(BarFixtures.annotate(BarFixtures.sweepThenBearishGap()));

            assertThat(gaps).hasSize(1);
            FairValueGap gap = gaps.get(0);
            assertThat(gap.direction()).isEqualTo(GapDirection.BEARISH);
            assertThat(gap.lower()).isCloseTo(99.50, within(1e-9));
            assertThat(gap.upper()).isCloseTo(100.00, within(1e-9));
            assertThat(gap.formationIndex()).isEqualTo(11);
        }
    }

    @Nested
    @DisplayName("ATR sizing")
    class Sizing {

        @Test
        @DisplayName("Size is width over the formation bar's ATR")
        void sizeInAtr() {
            FairValueGap gap = FairValueGapDetector.detect(
                            BarFixtures.annotate(BarFixtures.sweepThenBullishGap(), 2.0))
                    .get(0);

            assertThat(gap.atrAtFormation()).isEqualTo(2.0);
            assertThat(gap.sizeInAtr()).isCloseTo(0.25, within(1e-9));
        }

        @Test
        @DisplayName("Null ATR leaves the size undefined but still reports the gap")
        void nullAtr() {
            FairValueGap gap = FairValueGapDetector.detect(BarFixtures.annotate(BarFixtures.sweepThenBullishGap()))
                    .get(0);

            assertThat(gap.atrAtFormation()).isNull();
            assertThat(gap.sizeInAtr()).isNull();
        }

        @Test
        @DisplayName("Zero ATR leaves the size undefined")
        void zeroAtr() {
            FairValueGap gap = FairValueGapDetector.detect(
                            BarFixtures.annotate(BarFixtures.sweepThenBullishGap(), 0.0))
                    .get(0);

            assertThat(gap.sizeInAtr()).isNull();
        }
    }

    @Test
    @DisplayName("Gap bounds must be strictly ordered")
    void rejectsDegenerateGap() {
        assertThatThrownBy(() -> new FairValueGap(GapDirection.BULLISH, 100.0, 100.0, 5, null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Fewer than three bars yields no gaps")
    void tooShort() {
        assertThat(FairValueGapDetector.detect(BarFixtures.annotate(BarFixtures.steady(2)))).isEmpty();
    }
}
