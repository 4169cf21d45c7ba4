package com.fvgscanner.domain.model;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

/**
 * Results of one multi-symbol scan run, in the order the symbols were requested.
 */
@Getter
@Builder
public class ScanReport {

    private final Instant startedAt;
    private final long durationMs;
    private final List<SymbolScanResult> results;

    /** All setups across symbols, best score first; ties by symbol then formation index. */
    public List<Setup> rankedSetups() {
        return results.stream()
                .flatMap(r -> r.getSetups().stream())
                .sorted(Comparator.comparingDouble(Setup::getScore)
                        .reversed()
                        .thenComparing(Setup::getSymbol)
                        .thenComparingInt(s -> s.getGap().formationIndex()))
                .toList();
    }

    public List<SymbolScanResult> failedResults() {
        return results.stream().filter(SymbolScanResult::isFailed).toList();
    }

    public int totalSetups() {
        return results.stream().mapToInt(r -> r.getSetups().size()).sum();
    }
}
