package com.softpower.backend.events.dto;

import java.time.LocalDate;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MasterEventSummaryDto {
    private UUID id;
    private String canonicalName;
    private String country;
    private LocalDate firstMentionDate;
    private LocalDate lastMentionDate;
    private Integer totalArticles;
    private Long childEvents;
    private Long daysSpan;
    private Boolean llmValidated;
}
