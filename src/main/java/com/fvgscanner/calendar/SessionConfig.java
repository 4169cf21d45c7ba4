package com.fvgscanner.calendar;

import com.fvgscanner.domain.enums.SessionTag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Market timezone and intraday session windows, bound from the
 * {@code fvgscanner.sessions} prefix.
 *
 * <p>Times are {@code HH:mm} strings in the market's local timezone. Windows are
 * half-open ({@code start <= t < end}); a time outside every window is tagged OTHER.
 * The regular-hours filter, when enabled, keeps bars with
 * {@code regularStart <= t <= regularEnd}.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "fvgscanner.sessions")
public class SessionConfig {

    private static final String TIME_PATTERN = "^([01]\\d|2[0-3]):[0-5]\\d$";

    @NotBlank
    private String timezone = "America/New_York";

    @Valid
    private List<Window> windows = defaultWindows();

    /** Drop bars outside regular trading hours before computing indicators. */
    private boolean regularHoursOnly = false;

    @Pattern(regexp = TIME_PATTERN)
    private String regularStart = "09:30";

    @Pattern(regexp = TIME_PATTERN)
    private String regularEnd = "16:00";

    public static List<Window> defaultWindows() {
        List<Window> windows = new ArrayList<>();
        windows.add(new Window(SessionTag.PRE_MARKET, "04:00", "09:30"));
        windows.add(new Window(SessionTag.AM, "09:30", "11:00"));
        windows.add(new Window(SessionTag.LUNCH, "11:30", "13:00"));
        windows.add(new Window(SessionTag.PM, "13:30", "15:30"));
        windows.add(new Window(SessionTag.AFTER_HOURS, "16:00", "20:00"));
        return windows;
    }

    /** A named intraday window. */
    @Getter
    @Setter
    public static class Window {

        @NotNull
        private SessionTag tag;

        @Pattern(regexp = TIME_PATTERN)
        private String start;

        @Pattern(regexp = TIME_PATTERN)
        private String end;

        public Window() {}

        public Window(SessionTag tag, String start, String end) {
            this.tag = tag;
            this.start = start;
            this.end = end;
        }
    }
}
