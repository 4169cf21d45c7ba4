package com.fvgscanner.report;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "fvgscanner.report")
public class ReportConfig {

    /** Write {@code summary.json} after each run. */
    private boolean enabled = false;

    private String directory = "reports";
}
