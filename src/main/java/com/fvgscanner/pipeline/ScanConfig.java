package com.fvgscanner.pipeline;

import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Symbols scanned by the startup job, bound from {@code fvgscanner.scan}.
 * The job only runs when {@code run-on-startup} is true and a {@link BarSource} bean exists.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "fvgscanner.scan")
public class ScanConfig {

    private List<String> symbols = new ArrayList<>();

    private boolean runOnStartup = false;
}
