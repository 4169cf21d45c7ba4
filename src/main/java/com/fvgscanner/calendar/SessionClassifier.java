package com.fvgscanner.calendar;

import com.fvgscanner.domain.enums.SessionTag;
import java.time.Instant;

/** Assigns an intraday session window to a bar timestamp. */
@FunctionalInterface
public interface SessionClassifier {

    SessionTag classify(Instant timestamp);
}
