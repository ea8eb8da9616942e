package com.softpower.backend.startup;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.softpower.backend.events.dto.ConsolidationReport;
import com.softpower.backend.events.service.CanonicalEventMergeService;
import com.softpower.backend.events.service.ConsolidationScope;
import com.softpower.backend.integrity.dto.IntegrityReport;
import com.softpower.backend.integrity.service.IntegrityVerificationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Batch entry point: {@code --app.command=consolidate} or {@code --app.command=verify}.
 * The JSON report goes to stdout and the process exit code tells automation whether to proceed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app", name = "command")
public class PipelineCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private final CanonicalEventMergeService mergeService;
    private final IntegrityVerificationService verificationService;
    private final ObjectMapper objectMapper;

    @Value("${app.command}")
    private String command;

    @Value("${app.country:}")
    private String country;

    @Value("${app.dry-run:false}")
    private boolean dryRun;

    @Value("${app.verbose:true}")
    private boolean verbose;

    @Value("${app.full-scan:false}")
    private boolean fullScan;

    private volatile int exitCode = EXIT_OK;

    @Override
    public void run(ApplicationArguments args) {
        switch (command.trim().toLowerCase()) {
            case "consolidate" -> runConsolidation();
            case "verify" -> runVerification();
            default -> {
                log.error("❌ Unknown command '{}'; expected 'consolidate' or 'verify'", command);
                exitCode = EXIT_USAGE;
            }
        }
    }

    private void runConsolidation() {
        ConsolidationScope scope = country.isBlank() ? ConsolidationScope.configured() : ConsolidationScope.country(country);
        ConsolidationReport report = mergeService.consolidate(scope, dryRun, verbose);
        print(report);
        exitCode = report.isSuccessful() ? EXIT_OK : EXIT_FAILED;
    }

    private void runVerification() {
        IntegrityReport report = verificationService.verify(fullScan);
        print(report);
        exitCode = report.getExitCode();
    }

    private void print(Object report) {
        try {
            System.out.println(objectMapper.copy()
                    .enable(SerializationFeature.INDENT_OUTPUT)
                    .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                    .writeValueAsString(report));
        } catch (JsonProcessingException e) {
            log.error("❌ Failed to render report: {}", e.getMessage());
            exitCode = EXIT_FAILED;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
