package com.fvgscanner.pipeline;

import com.fvgscanner.domain.model.Bar;
import com.fvgscanner.exception.DataIntegrityException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rejects bar series that cannot be scanned: timestamps that are not strictly
 * ascending, non-finite prices, a high below the low, an open or close outside the
 * high-low range or negative volume.
 */
public final class BarSeriesValidator {

    private BarSeriesValidator() {}

    /**
     * @throws DataIntegrityException on the first offending bar
     */
    public static void validate(String symbol, List<Bar> bars) {
        for (int i = 0; i < bars.size(); i++) {
            Bar bar = bars.get(i);
            if (bar == null || bar.timestamp() == null) {
                throw violation(symbol, i, "Bar " + i + " of " + symbol + " has no timestamp", null, null);
            }
            if (!isFinite(bar.open()) || !isFinite(bar.high()) || !isFinite(bar.low()) || !isFinite(bar.close())) {
                throw violation(symbol, i, "Bar " + i + " of " + symbol + " has a non-finite price", null, bar);
            }
            if (bar.high() < bar.low()) {
                throw violation(
                        symbol, i, "Bar " + i + " of " + symbol + " has high " + bar.high() + " below low " + bar.low(),
                        null, bar);
            }
            if (!withinRange(bar.open(), bar) || !withinRange(bar.close(), bar)) {
                throw violation(
                        symbol, i, "Bar " + i + " of " + symbol + " has open/close outside its high-low range",
                        null, bar);
            }
            if (bar.volume() < 0) {
                throw violation(symbol, i, "Bar " + i + " of " + symbol + " has negative volume", null, bar);
            }
            if (i > 0) {
                Bar previous = bars.get(i - 1);
                if (!bar.timestamp().isAfter(previous.timestamp())) {
                    String kind = bar.timestamp().equals(previous.timestamp()) ? "Duplicate" : "Out-of-order";
                    throw violation(
                            symbol, i, kind + " timestamp " + bar.timestamp() + " at bar " + i + " of " + symbol,
                            previous, bar);
                }
            }
        }
    }

    private static boolean withinRange(double price, Bar bar) {
        return price >= bar.low() && price <= bar.high();
    }

    private static DataIntegrityException violation(String symbol, int index, String message, Bar previous, Bar current) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("symbol", symbol);
        details.put("index", index);
        if (previous != null) {
            details.put("previousTimestamp", previous.timestamp());
        }
        if (current != null) {
            details.put("timestamp", current.timestamp());
        }
        return new DataIntegrityException(message, details);
    }

    private static boolean isFinite(double value) {
        return Double.isFinite(value);
    }
}
