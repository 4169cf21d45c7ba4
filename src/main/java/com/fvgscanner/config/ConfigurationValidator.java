package com.fvgscanner.config;

import com.fvgscanner.calendar.SessionConfig;
import com.fvgscanner.domain.enums.SessionTag;
import com.fvgscanner.exception.ConfigurationException;
import com.fvgscanner.indicator.IndicatorConfig;
import com.fvgscanner.scoring.ScoringConfig;
import com.fvgscanner.structure.StructureConfig;
import jakarta.annotation.PostConstruct;
import java.time.DateTimeException;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Cross-field validation of the scanner configuration.
 *
 * <p>Bean Validation on the individual properties classes rejects single bad values
 * at bind time; this validator covers the rules that span fields (ideal size band
 * ordering, window boundaries, timezone) and is re-run by the orchestrator before
 * every scan so that a bad configuration never reaches symbol processing.
 */
@Component
public class ConfigurationValidator {

    private static final Logger log = LoggerFactory.getLogger(ConfigurationValidator.class);

    private final ScoringConfig scoringConfig;
    private final StructureConfig structureConfig;
    private final IndicatorConfig indicatorConfig;
    private final SessionConfig sessionConfig;

    public ConfigurationValidator(
            ScoringConfig scoringConfig,
            StructureConfig structureConfig,
            IndicatorConfig indicatorConfig,
            SessionConfig sessionConfig) {
        this.scoringConfig = scoringConfig;
        this.structureConfig = structureConfig;
        this.indicatorConfig = indicatorConfig;
        this.sessionConfig = sessionConfig;
    }

    @PostConstruct
    void validateOnStartup() {
        validate();
        log.info(
                "Scanner configuration valid: weights[clean={}, size={}, session={}], idealAtr=[{}, {}], "
                        + "sweepLookback={}, entryOffset={}, atrMode={}",
                scoringConfig.getCleanlinessWeight(),
                scoringConfig.getSizeWeight(),
                scoringConfig.getSessionWeight(),
                scoringConfig.getAtrIdealMin(),
                scoringConfig.getAtrIdealMax(),
                structureConfig.getSweepLookbackBars(),
                structureConfig.getEntryOffsetBars(),
                indicatorConfig.getAtrMode());
    }

    /**
     * @throws ConfigurationException listing every violation found
     */
    public void validate() {
        List<String> violations = new ArrayList<>();

        requireNonNegative(violations, "scoring.cleanliness-weight", scoringConfig.getCleanlinessWeight());
        requireNonNegative(violations, "scoring.size-weight", scoringConfig.getSizeWeight());
        requireNonNegative(violations, "scoring.session-weight", scoringConfig.getSessionWeight());
        requireNonNegative(violations, "scoring.atr-ideal-min", scoringConfig.getAtrIdealMin());
        requireNonNegative(violations, "scoring.atr-ideal-max", scoringConfig.getAtrIdealMax());
        if (scoringConfig.getAtrIdealMin() > scoringConfig.getAtrIdealMax()) {
            violations.add("scoring.atr-ideal-min (" + scoringConfig.getAtrIdealMin()
                    + ") must not exceed scoring.atr-ideal-max (" + scoringConfig.getAtrIdealMax() + ")");
        }
        if (scoringConfig.getSessionQuality() != null) {
            for (Map.Entry<SessionTag, Double> entry : scoringConfig.getSessionQuality().entrySet()) {
                Double quality = entry.getValue();
                if (quality == null || !(quality >= 0.0 && quality <= 1.0)) {
                    violations.add("scoring.session-quality." + entry.getKey() + " must be within [0, 1]");
                }
            }
        }

        if (structureConfig.getSweepLookbackBars() < 0) {
            violations.add("structure.sweep-lookback-bars must not be negative");
        }
        if (structureConfig.getEntryOffsetBars() < 1) {
            violations.add("structure.entry-offset-bars must be at least 1");
        }
        requireNonNegative(violations, "structure.bos-atr-buffer", structureConfig.getBosAtrBuffer());

        if (indicatorConfig.getAtrPeriod() < 1) {
            violations.add("indicators.atr-period must be at least 1");
        }
        if (indicatorConfig.getRvolPeriod() < 1) {
            violations.add("indicators.rvol-period must be at least 1");
        }
        if (indicatorConfig.getAtrMode() == null) {
            violations.add("indicators.atr-mode is required");
        }

        validateSessions(violations);

        if (!violations.isEmpty()) {
            throw new ConfigurationException(violations);
        }
    }

    private void validateSessions(List<String> violations) {
        try {
            ZoneId.of(sessionConfig.getTimezone());
        } catch (DateTimeException | NullPointerException e) {
            violations.add("sessions.timezone '" + sessionConfig.getTimezone() + "' is not a valid zone id");
        }

        checkRange(violations, "sessions.regular-start/end", sessionConfig.getRegularStart(), sessionConfig.getRegularEnd());

        List<SessionConfig.Window> windows = sessionConfig.getWindows();
        if (windows == null) {
            return;
        }
        for (int i = 0; i < windows.size(); i++) {
            SessionConfig.Window window = windows.get(i);
            String name = "sessions.windows[" + i + "]";
            if (window.getTag() == null) {
                violations.add(name + ".tag is required");
            }
            checkRange(violations, name, window.getStart(), window.getEnd());
        }
    }

    private static void checkRange(List<String> violations, String name, String start, String end) {
        try {
            if (!LocalTime.parse(start).isBefore(LocalTime.parse(end))) {
                violations.add(name + " start " + start + " must be before end " + end);
            }
        } catch (DateTimeParseException | NullPointerException e) {
            violations.add(name + " times must be HH:mm, got start=" + start + " end=" + end);
        }
    }

    private static void requireNonNegative(List<String> violations, String name, double value) {
        if (!(value >= 0.0) || Double.isInfinite(value)) {
            violations.add(name + " must be a non-negative number, got " + value);
        }
    }
}
