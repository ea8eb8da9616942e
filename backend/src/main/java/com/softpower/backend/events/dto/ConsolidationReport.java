package com.softpower.backend.events.dto;

import java.time.LocalDateTime;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ConsolidationReport {
    private boolean dryRun;
    private List<CountryConsolidationResult> countries;
    private MergeStats totals;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;

    public static ConsolidationReport of(boolean dryRun, List<CountryConsolidationResult> countries,
                                         LocalDateTime startedAt) {
        MergeStats totals = MergeStats.empty();
        countries.stream()
                .filter(result -> !result.isFailed())
                .forEach(result -> totals.add(result.getStats()));
        return new ConsolidationReport(dryRun, countries, totals, startedAt, LocalDateTime.now());
    }

    public List<String> getFailedCountries() {
        return countries.stream()
                .filter(CountryConsolidationResult::isFailed)
                .map(CountryConsolidationResult::getCountry)
                .toList();
    }

    public boolean isSuccessful() {
        return getFailedCountries().isEmpty();
    }
}
