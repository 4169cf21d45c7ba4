package com.fvgscanner.indicator;

import com.fvgscanner.domain.model.Bar;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Cumulative session-anchored VWAP over typical price.
 *
 * <p>Sums reset when the trading day changes. On the first bar of a session, and
 * for as long as the session's cumulative volume is zero, the VWAP is the bar's
 * typical price itself rather than a quotient, so it matches that price exactly.
 */
public class SessionVwapAccumulator {

    private LocalDate session;
    private double cumulativePriceVolume;
    private long cumulativeVolume;

    public double update(Bar bar, LocalDate tradingDay) {
        double typical = bar.typicalPrice();
        if (!Objects.equals(session, tradingDay)) {
            session = tradingDay;
            cumulativePriceVolume = typical * bar.volume();
            cumulativeVolume = bar.volume();
            return typical;
        }

        cumulativePriceVolume += typical * bar.volume();
        cumulativeVolume += bar.volume();
        if (cumulativeVolume == 0) {
            return typical;
        }
        return cumulativePriceVolume / cumulativeVolume;
    }
}
