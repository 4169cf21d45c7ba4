package com.fvgscanner.calendar;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Maps a bar timestamp to the trading session it belongs to.
 *
 * <p>Two bars share a session exactly when this function returns equal values for
 * both. The indicator engine resets session VWAP whenever the value changes, so a
 * gap in the minute sequence inside one session never triggers a reset.
 */
@FunctionalInterface
public interface SessionCalendar {

    LocalDate tradingDayOf(Instant timestamp);
}
