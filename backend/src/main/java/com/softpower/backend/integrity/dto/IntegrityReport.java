package com.softpower.backend.integrity.dto;

import java.time.LocalDateTime;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IntegrityReport {
    private List<CheckResult> checks;
    private PipelineStatistics statistics;
    private boolean fullScan;
    private LocalDateTime generatedAt;

    public boolean isPassed() {
        return checks.stream().allMatch(CheckResult::isPassed);
    }

    public int getExitCode() {
        return isPassed() ? 0 : 1;
    }

    public CheckResult getCheck(IntegrityCheck check) {
        return checks.stream()
                .filter(result -> result.getCheck() == check)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Check not in report: " + check));
    }

    public List<String> getIssues() {
        return checks.stream()
                .filter(result -> !result.isPassed())
                .map(result -> String.format("%,d %s", result.getCount(), result.getDescription().toLowerCase()))
                .toList();
    }
}
