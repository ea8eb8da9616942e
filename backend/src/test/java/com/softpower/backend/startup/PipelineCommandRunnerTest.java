package com.softpower.backend.startup;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.softpower.backend.events.dto.ConsolidationReport;
import com.softpower.backend.events.dto.ConsolidationStatus;
import com.softpower.backend.events.dto.CountryConsolidationResult;
import com.softpower.backend.events.service.CanonicalEventMergeService;
import com.softpower.backend.events.service.ConsolidationScope;
import com.softpower.backend.integrity.dto.CheckResult;
import com.softpower.backend.integrity.dto.IntegrityCheck;
import com.softpower.backend.integrity.dto.IntegrityReport;
import com.softpower.backend.integrity.service.IntegrityVerificationService;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class PipelineCommandRunnerTest {

    @Mock
    private CanonicalEventMergeService mergeService;

    @Mock
    private IntegrityVerificationService verificationService;

    private PipelineCommandRunner runner;

    @BeforeEach
    void setUp() {
        runner = new PipelineCommandRunner(mergeService, verificationService,
                new ObjectMapper().findAndRegisterModules());
        ReflectionTestUtils.setField(runner, "country", "");
        ReflectionTestUtils.setField(runner, "verbose", true);
    }

    private void run(String command) {
        ReflectionTestUtils.setField(runner, "command", command);
        runner.run(new DefaultApplicationArguments());
    }

    private static ConsolidationReport consolidationReport(ConsolidationStatus... statuses) {
        List<CountryConsolidationResult> results = Arrays.stream(statuses)
                .map(status -> CountryConsolidationResult.builder().country("China").status(status).build())
                .toList();
        return ConsolidationReport.of(false, results, LocalDateTime.now());
    }

    private static IntegrityReport integrityReport(long violations) {
        return IntegrityReport.builder()
                .checks(List.of(CheckResult.builder()
                        .check(IntegrityCheck.EVENTS_WITHOUT_MENTIONS)
                        .description(IntegrityCheck.EVENTS_WITHOUT_MENTIONS.getDescription())
                        .count(violations)
                        .build()))
                .generatedAt(LocalDateTime.now())
                .build();
    }

    @Test
    void consolidateUsesConfiguredCountriesByDefault() {
        when(mergeService.consolidate(any(ConsolidationScope.class), eq(false), eq(true)))
                .thenReturn(consolidationReport(ConsolidationStatus.SUCCEEDED));

        run("consolidate");

        verify(mergeService).consolidate(argThat(ConsolidationScope::isConfigured), eq(false), eq(true));
        assertThat(runner.getExitCode()).isEqualTo(PipelineCommandRunner.EXIT_OK);
    }

    @Test
    void consolidateSingleCountryDryRun() {
        ReflectionTestUtils.setField(runner, "country", "Russia");
        ReflectionTestUtils.setField(runner, "dryRun", true);
        when(mergeService.consolidate(any(ConsolidationScope.class), eq(true), eq(true)))
                .thenReturn(consolidationReport(ConsolidationStatus.DRY_RUN));

        run("consolidate");

        verify(mergeService).consolidate(argThat(scope -> "Russia".equals(scope.getCountry())), eq(true), eq(true));
        assertThat(runner.getExitCode()).isEqualTo(PipelineCommandRunner.EXIT_OK);
    }

    @Test
    void failedCountryGivesNonZeroExit() {
        when(mergeService.consolidate(any(ConsolidationScope.class), anyBoolean(), anyBoolean()))
                .thenReturn(consolidationReport(ConsolidationStatus.SUCCEEDED, ConsolidationStatus.FAILED));

        run("consolidate");

        assertThat(runner.getExitCode()).isEqualTo(PipelineCommandRunner.EXIT_FAILED);
    }

    @Test
    void verifyExitCodeFollowsReport() {
        ReflectionTestUtils.setField(runner, "fullScan", true);
        when(verificationService.verify(true)).thenReturn(integrityReport(4));

        run("verify");

        assertThat(runner.getExitCode()).isEqualTo(PipelineCommandRunner.EXIT_FAILED);

        when(verificationService.verify(true)).thenReturn(integrityReport(0));
        run("VERIFY");

        assertThat(runner.getExitCode()).isEqualTo(PipelineCommandRunner.EXIT_OK);
    }

    @Test
    void unknownCommandIsUsageError() {
        run("rebuild");

        assertThat(runner.getExitCode()).isEqualTo(PipelineCommandRunner.EXIT_USAGE);
        verify(mergeService, never()).consolidate(any(), anyBoolean(), anyBoolean());
        verify(verificationService, never()).verify(anyBoolean());
    }
}
