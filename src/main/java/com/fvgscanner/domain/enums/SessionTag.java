package com.fvgscanner.domain.enums;

/**
 * Intraday session windows used to tag entry bars and weight setups.
 *
 * <pre>
 * 04:00-09:30  PRE_MARKET
 * 09:30-11:00  AM           morning liquidity window
 * 11:30-13:00  LUNCH
 * 13:30-15:30  PM           afternoon liquidity window
 * 16:00-20:00  AFTER_HOURS
 * otherwise    OTHER
 * </pre>
 *
 * <p>The times above are the defaults in the market's local timezone; the actual
 * boundaries come from {@code fvgscanner.sessions.windows}.
 */
public enum SessionTag {
    PRE_MARKET,
    AM,
    LUNCH,
    PM,
    AFTER_HOURS,
    OTHER
}
