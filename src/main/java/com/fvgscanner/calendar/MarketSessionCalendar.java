package com.fvgscanner.calendar;

import com.fvgscanner.domain.enums.SessionTag;
import com.fvgscanner.exception.ConfigurationException;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Default calendar: one session per local calendar day in the market timezone, with
 * intraday windows taken from {@link SessionConfig}.
 *
 * <p>Holds only immutable state resolved at construction, so a single instance is
 * shared by every symbol's pipeline without synchronization.
 */
@Component
public class MarketSessionCalendar implements SessionCalendar, SessionClassifier {

    private static final Logger log = LoggerFactory.getLogger(MarketSessionCalendar.class);

    private final ZoneId zone;
    private final List<ResolvedWindow> windows;
    private final LocalTime regularStart;
    private final LocalTime regularEnd;

    /**
     * @throws ConfigurationException if the timezone or any session time cannot be parsed
     */
    public MarketSessionCalendar(SessionConfig sessionConfig) {
        try {
            this.zone = ZoneId.of(sessionConfig.getTimezone());
            this.windows = sessionConfig.getWindows().stream()
                    .map(w -> new ResolvedWindow(w.getTag(), LocalTime.parse(w.getStart()), LocalTime.parse(w.getEnd())))
                    .toList();
            this.regularStart = LocalTime.parse(sessionConfig.getRegularStart());
            this.regularEnd = LocalTime.parse(sessionConfig.getRegularEnd());
        } catch (DateTimeException | NullPointerException e) {
            throw new ConfigurationException(
                    List.of("sessions could not be resolved (timezone=" + sessionConfig.getTimezone()
                            + ", regular-start=" + sessionConfig.getRegularStart()
                            + ", regular-end=" + sessionConfig.getRegularEnd() + "): " + e.getMessage()),
                    e);
        }
        log.info("Session calendar initialized for {} with {} windows", zone, windows.size());
    }

    @Override
    public LocalDate tradingDayOf(Instant timestamp) {
        return timestamp.atZone(zone).toLocalDate();
    }

    @Override
    public SessionTag classify(Instant timestamp) {
        LocalTime time = localTime(timestamp);
        for (ResolvedWindow window : windows) {
            if (!time.isBefore(window.start()) && time.isBefore(window.end())) {
                return window.tag();
            }
        }
        return SessionTag.OTHER;
    }

    /** True when the local time lies within regular trading hours, both ends inclusive. */
    public boolean isRegularHours(Instant timestamp) {
        LocalTime time = localTime(timestamp);
        return !time.isBefore(regularStart) && !time.isAfter(regularEnd);
    }

    private LocalTime localTime(Instant timestamp) {
        ZonedDateTime local = timestamp.atZone(zone);
        return local.toLocalTime();
    }

    private record ResolvedWindow(SessionTag tag, LocalTime start, LocalTime end) {}
}
