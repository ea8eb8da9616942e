package com.softpower.backend.integrity.dto;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PipelineStatistics {
    private long documents;

    private long clusters;
    private long clustersProcessed;
    private double processedPercentage;
    private long clustersDeconflicted;
    private double deconflictedPercentage;

    private long canonicalEvents;
    private long masterEvents;
    private long childEvents;
    private long materialityScored;
    private double materialityScoredPercentage;

    private long mentions;
    private long mentionsWithDocuments;
    private double mentionsWithDocumentsPercentage;

    private List<CountryPipelineStats> countries;

    public static double percentage(long part, long total) {
        if (total == 0) {
            return 0.0;
        }
        return Math.round(part * 1000.0 / total) / 10.0;
    }
}
