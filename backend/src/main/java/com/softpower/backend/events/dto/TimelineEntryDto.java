package com.softpower.backend.events.dto;

import java.time.LocalDate;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TimelineEntryDto {
    private LocalDate date;
    private UUID canonicalEventId;
    private String eventName;
    private Integer articles;
    private Integer documents;
}
