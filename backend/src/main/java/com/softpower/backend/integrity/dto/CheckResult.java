package com.softpower.backend.integrity.dto;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckResult {
    private IntegrityCheck check;
    private String description;
    private long count;
    @Builder.Default
    private List<String> samples = List.of();
    // Check-specific breakdown, e.g. masters vs children
    @Builder.Default
    private Map<String, Long> details = new LinkedHashMap<>();

    public boolean isPassed() {
        return count == 0;
    }
}
