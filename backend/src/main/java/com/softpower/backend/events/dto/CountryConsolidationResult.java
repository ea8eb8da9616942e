package com.softpower.backend.events.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CountryConsolidationResult {
    private String country;
    private ConsolidationStatus status;
    @Builder.Default
    private MergeStats stats = MergeStats.empty();
    private boolean retryable;
    private String error;
    private Double durationSeconds;

    public static CountryConsolidationResult skipped(String country, String reason) {
        return CountryConsolidationResult.builder()
                .country(country)
                .status(ConsolidationStatus.SKIPPED)
                .error(reason)
                .durationSeconds(0.0)
                .build();
    }

    public boolean isFailed() {
        return status == ConsolidationStatus.FAILED;
    }
}
