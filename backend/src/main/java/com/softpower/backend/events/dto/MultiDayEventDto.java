package com.softpower.backend.events.dto;

import java.time.LocalDate;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MultiDayEventDto {
    private UUID masterEventId;
    private String canonicalName;
    private Long days;
    private LocalDate firstDate;
    private LocalDate lastDate;
    private Long totalArticles;
}
