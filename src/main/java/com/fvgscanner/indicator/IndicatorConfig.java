package com.fvgscanner.indicator;

import com.fvgscanner.domain.enums.AtrMode;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Indicator periods and ATR smoothing, bound from {@code fvgscanner.indicators}.
 *
 * <p>ATR defaults to a simple rolling mean of true range. Set
 * {@code fvgscanner.indicators.atr-mode=EXPONENTIAL} for Wilder smoothing.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "fvgscanner.indicators")
public class IndicatorConfig {

    @Min(1)
    private int atrPeriod = 14;

    @NotNull
    private AtrMode atrMode = AtrMode.SIMPLE;

    @Min(1)
    private int rvolPeriod = 20;
}
