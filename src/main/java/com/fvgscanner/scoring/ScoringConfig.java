package com.fvgscanner.scoring;

import com.fvgscanner.domain.enums.SessionTag;
import jakarta.validation.constraints.DecimalMin;
import java.util.EnumMap;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Setup scoring weights and thresholds under the {@code fvgscanner.scoring} prefix.
 *
 * <p>Weights need not sum to one: the engine divides the weighted sum by the sum of
 * the weights actually applied. Session quality values are per-tag scores in
 * {@code [0, 1]}; tags missing from the map score zero.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "fvgscanner.scoring")
public class ScoringConfig {

    @DecimalMin("0.0")
    private double cleanlinessWeight = 0.40;

    @DecimalMin("0.0")
    private double sizeWeight = 0.35;

    @DecimalMin("0.0")
    private double sessionWeight = 0.25;

    /** Lower edge of the ideal gap size band, in ATR units. */
    @DecimalMin("0.0")
    private double atrIdealMin = 0.2;

    /** Upper edge of the ideal gap size band, in ATR units. */
    @DecimalMin("0.0")
    private double atrIdealMax = 0.8;

    private Map<SessionTag, Double> sessionQuality = defaultSessionQuality();

    public static Map<SessionTag, Double> defaultSessionQuality() {
        Map<SessionTag, Double> quality = new EnumMap<>(SessionTag.class);
        quality.put(SessionTag.PRE_MARKET, 0.2);
        quality.put(SessionTag.AM, 1.0);
        quality.put(SessionTag.LUNCH, 0.4);
        quality.put(SessionTag.PM, 1.0);
        quality.put(SessionTag.AFTER_HOURS, 0.2);
        quality.put(SessionTag.OTHER, 0.0);
        return quality;
    }
}
