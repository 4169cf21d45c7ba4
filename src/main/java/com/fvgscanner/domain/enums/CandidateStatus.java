package com.fvgscanner.domain.enums;

/**
 * Outcome of validating one fair value gap.
 *
 * <pre>
 * QUALIFIED  untouched at the evaluation bar and preceded by a liquidity sweep; scored
 * NO_SWEEP   untouched at the evaluation bar but no sweep in the lookback; recorded only
 * TOUCHED    re-entered at or before the evaluation bar; rejected
 * PENDING    series ended before the evaluation bar; unresolved, never dropped
 * </pre>
 */
public enum CandidateStatus {
    QUALIFIED,
    NO_SWEEP,
    TOUCHED,
    PENDING;

    public boolean isScorable() {
        return this == QUALIFIED;
    }
}
