package com.fvgscanner.structure;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Structure detection thresholds under the {@code fvgscanner.structure} prefix.
 *
 * <ul>
 *   <li>{@code sweepLookbackBars} -- how many bars before a gap's first bar may hold the sweep (default 10)</li>
 *   <li>{@code entryOffsetBars} -- bars after formation at which the gap is evaluated for entry (default 5)</li>
 *   <li>{@code bosAtrBuffer} -- ATR multiple a close must clear a swing level by to count as a break (default 0.1)</li>
 * </ul>
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "fvgscanner.structure")
public class StructureConfig {

    @Min(0)
    private int sweepLookbackBars = 10;

    @Min(1)
    private int entryOffsetBars = 5;

    @DecimalMin("0.0")
    private double bosAtrBuffer = 0.1;
}
