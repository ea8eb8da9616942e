package com.softpower.backend.integrity.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CountryPipelineStats {
    private String country;
    private long canonicalEvents;
    private long materialityScored;
    private double materialityScoredPercentage;
    private long remainingUnscored;
    private long clusters;
    private long clustersProcessed;
    private double processedPercentage;
    private long clustersDeconflicted;
    private double deconflictedPercentage;
}
