package com.fvgscanner.unit.indicator;

import static com.fvgscanner.support.BarFixtures.bar;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.fvgscanner.domain.enums.AtrMode;
import com.fvgscanner.domain.model.Bar;
import com.fvgscanner.indicator.AtrAccumulator;
import com.fvgscanner.support.BarFixtures;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class AtrAccumulatorTest {

    private static List<Double> run(AtrAccumulator accumulator, List<Bar> bars) {
        List<Double> values = new ArrayList<>();
        for (Bar bar : bars) {
            values.add(accumulator.update(bar));
        }
        return values;
    }

    /** 15 bars with TR 1.0, then one bar with TR 2.5, then one with TR 1.0. */
    private static List<Bar> spikeSeries() {
        List<Bar> bars = new ArrayList<>(BarFixtures.steady(15));
        bars.add(bar(15, 100.0, 101.25, 98.75, 100.0));
        bars.add(bar(16, 100.0, 100.5, 99.5, 100.0));
        return bars;
    }

    @Nested
    @DisplayName("Warmup")
    class Warmup {

        @Test
        @DisplayName("ATR is null through index 13 and defined from index 14")
        void nullUntilPeriodBarsWithPriorClose() {
            List<Double> values = run(new AtrAccumulator(14, AtrMode.SIMPLE), BarFixtures.steady(20));

            assertThat(values.subList(0, 14)).containsOnlyNulls();
            assertThat(values.subList(14, 20)).doesNotContainNull();
            assertThat(values.get(14)).isCloseTo(1.0, within(1e-12));
        }

        @Test
        @DisplayName("Non-positive period is rejected")
        void rejectsBadPeriod() {
            assertThatThrownBy(() -> new AtrAccumulator(0, AtrMode.SIMPLE))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("True range")
    class TrueRange {

        @Test
        @DisplayName("Gap away from the previous close widens the true range")
        void gapUsesPreviousClose() {
            AtrAccumulator accumulator = new AtrAccumulator(1, AtrMode.SIMPLE);
            accumulator.update(bar(0, 100.0, 100.5, 99.5, 100.0));

            Double atr = accumulator.update(bar(1, 102.5, 103.0, 102.0, 102.8));

            assertThat(atr).isCloseTo(3.0, within(1e-12));
        }
    }

    @Nested
    @DisplayName("Smoothing modes")
    class Smoothing {

        @Test
        @DisplayName("SIMPLE is the rolling mean of the last 14 true ranges")
        void simpleRollingMean() {
            List<Double> values = run(new AtrAccumulator(14, AtrMode.SIMPLE), spikeSeries());

            assertThat(values.get(15)).isCloseTo(15.5 / 14, within(1e-12));
            assertThat(values.get(16)).isCloseTo(15.5 / 14, within(1e-12));
        }

        @Test
        @DisplayName("EXPONENTIAL seeds with the simple mean then applies Wilder smoothing")
        void wilderSmoothing() {
            List<Double> values = run(new AtrAccumulator(14, AtrMode.EXPONENTIAL), spikeSeries());

            double at15 = (1.0 * 13 + 2.5) / 14;
            double at16 = (at15 * 13 + 1.0) / 14;
            assertThat(values.get(14)).isCloseTo(1.0, within(1e-12));
            assertThat(values.get(15)).isCloseTo(at15, within(1e-12));
            assertThat(values.get(16)).isCloseTo(at16, within(1e-12));
        }

        @Test
        @DisplayName("ATR is never negative")
        void nonNegative() {
            List<Double> values = run(new AtrAccumulator(3, AtrMode.EXPONENTIAL), spikeSeries());

            assertThat(values).filteredOn(v -> v != null).allSatisfy(v -> assertThat(v).isGreaterThanOrEqualTo(0.0));
        }
    }
}
