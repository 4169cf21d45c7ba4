package com.fvgscanner.indicator;

import com.fvgscanner.calendar.SessionCalendar;
import com.fvgscanner.domain.model.AnnotatedBar;
import com.fvgscanner.domain.model.Bar;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Annotates a symbol's bar series with ATR, relative volume and session VWAP.
 *
 * <p>One pass over the series with three accumulators carried forward bar by bar.
 * The output has the same length and order as the input. Accumulators are created
 * per call, so the engine itself is stateless and safe to share across symbol
 * workers.
 *
 * <p>Series shorter than a warmup period are not an error: the affected values are
 * left null and {@link #hasSufficientHistory(int)} reports the shortfall.
 */
@Service
public class IndicatorEngine {

    private static final Logger log = LoggerFactory.getLogger(IndicatorEngine.class);

    private final IndicatorConfig indicatorConfig;
    private final SessionCalendar sessionCalendar;

    public IndicatorEngine(IndicatorConfig indicatorConfig, SessionCalendar sessionCalendar) {
        this.indicatorConfig = indicatorConfig;
        this.sessionCalendar = sessionCalendar;
    }

    /**
     * Computes indicators for every bar.
     *
     * @param bars strictly ascending bars of one symbol
     * @return annotated bars, index-aligned with the input
     */
    public List<AnnotatedBar> annotate(List<Bar> bars) {
        AtrAccumulator atr = new AtrAccumulator(indicatorConfig.getAtrPeriod(), indicatorConfig.getAtrMode());
        RelativeVolumeAccumulator rvol = new RelativeVolumeAccumulator(indicatorConfig.getRvolPeriod());
        SessionVwapAccumulator vwap = new SessionVwapAccumulator();

        List<AnnotatedBar> annotated = new ArrayList<>(bars.size());
        for (int i = 0; i < bars.size(); i++) {
            Bar bar = bars.get(i);
            LocalDate tradingDay = sessionCalendar.tradingDayOf(bar.timestamp());
            annotated.add(new AnnotatedBar(
                    i, bar, tradingDay, atr.update(bar), rvol.update(bar.volume()), vwap.update(bar, tradingDay)));
        }

        log.debug(
                "Annotated {} bars (atrPeriod={}, atrMode={}, rvolPeriod={})",
                annotated.size(),
                indicatorConfig.getAtrPeriod(),
                indicatorConfig.getAtrMode(),
                indicatorConfig.getRvolPeriod());
        return annotated;
    }

    /** True when a series of this length reaches both the ATR and RVOL warmup. */
    public boolean hasSufficientHistory(int barCount) {
        return barCount > indicatorConfig.getAtrPeriod() && barCount > indicatorConfig.getRvolPeriod();
    }
}
