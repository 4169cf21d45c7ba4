package com.fvgscanner.pipeline;

import com.fvgscanner.domain.model.Bar;
import java.util.List;

/**
 * Supplies one symbol's intraday bars, oldest first.
 *
 * <p>Implementations may throw any runtime exception; the orchestrator treats it as
 * a failure of that symbol only.
 */
@FunctionalInterface
public interface BarSource {

    List<Bar> loadBars(String symbol);
}
