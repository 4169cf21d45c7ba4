package com.fvgscanner.domain.model;

import com.fvgscanner.domain.enums.CandidateStatus;
import com.fvgscanner.domain.enums.ScanStatus;
import com.fvgscanner.exception.ErrorCode;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of scanning one symbol: either a success with zero or more ranked setups,
 * or a failure with the error that stopped the symbol's pipeline.
 */
@Getter
@Builder
@ToString
public class SymbolScanResult {

    private final String symbol;
    private final ScanStatus status;

    /** Scored setups ranked by score descending, ties broken by formation index. */
    @Builder.Default
    private final List<Setup> setups = new ArrayList<>();

    /** Every detected gap including pending, rejected and no-sweep ones. */
    @Builder.Default
    private final List<FvgCandidate> candidates = new ArrayList<>();

    private final int barCount;

    /** True when the series was shorter than an indicator warmup period. */
    private final boolean insufficientHistory;

    private final ErrorCode errorCode;
    private final String errorMessage;
    private final long durationMs;

    public boolean isFailed() {
        return status == ScanStatus.FAILED;
    }

    public List<FvgCandidate> candidatesWithStatus(CandidateStatus candidateStatus) {
        return candidates.stream()
                .filter(c -> c.getStatus() == candidateStatus)
                .toList();
    }

    public static SymbolScanResult failed(String symbol, ErrorCode errorCode, String message, long durationMs) {
        return SymbolScanResult.builder()
                .symbol(symbol)
                .status(ScanStatus.FAILED)
                .errorCode(errorCode)
                .errorMessage(message)
                .durationMs(durationMs)
                .build();
    }
}
