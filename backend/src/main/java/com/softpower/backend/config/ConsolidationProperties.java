package com.softpower.backend.config;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "consolidation")
@Data
public class ConsolidationProperties {

    // Countries processed when no single country is requested
    private List<String> countries = new ArrayList<>(Arrays.asList(
            "China", "Russia", "Iran", "Turkey", "United States"
    ));

    // Run countries on the consolidation executor instead of one after another
    private boolean parallelCountries = false;

    // Log per-master progress at INFO instead of DEBUG
    private boolean verbose = true;

    // How many multi-day masters to log after a committed run
    private int multiDayReportSize = 10;

    private Verification verification = new Verification();

    @Data
    public static class Verification {
        // Offending rows kept per check
        private int sampleSize = 10;

        // Mentions whose document references are checked when not doing a full scan
        private int referenceSampleSize = 100;

        // Page size used by the full reference scan
        private int scanPageSize = 500;
    }
}
