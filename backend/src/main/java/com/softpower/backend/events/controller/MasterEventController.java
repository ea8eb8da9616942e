package com.softpower.backend.events.controller;

import com.softpower.backend.events.dto.MasterEventSummaryDto;
import com.softpower.backend.events.dto.MentionDto;
import com.softpower.backend.events.dto.MultiDayEventDto;
import com.softpower.backend.events.dto.TimelineEntryDto;
import com.softpower.backend.events.entity.CanonicalEvent;
import com.softpower.backend.events.exception.HierarchyDepthException;
import com.softpower.backend.events.service.HierarchyLinkService;
import com.softpower.backend.events.service.MasterEventQueryService;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/master-events")
@RequiredArgsConstructor
public class MasterEventController {

    private final MasterEventQueryService queryService;
    private final HierarchyLinkService linkService;

    /**
     * Top master events by article volume
     */
    @GetMapping("/top")
    public ResponseEntity<List<MasterEventSummaryDto>> getTopMasters(
            @RequestParam(required = false) String country,
            @RequestParam(defaultValue = "10") int limit) {
        return ResponseEntity.ok(queryService.listTopMasters(country, limit));
    }

    /**
     * Daily timeline of a master and any children it still has
     */
    @GetMapping("/{id}/timeline")
    public ResponseEntity<List<TimelineEntryDto>> getTimeline(@PathVariable UUID id) {
        try {
            return ResponseEntity.ok(queryService.getTimeline(id));
        } catch (NoSuchElementException e) {
            return ResponseEntity.notFound().build();
        }
    }

    /**
     * Every source document behind a master event
     */
    @GetMapping("/{id}/documents")
    public ResponseEntity<Map<String, Object>> getDocuments(@PathVariable UUID id) {
        try {
            List<String> docIds = queryService.getDocumentIds(id);
            return ResponseEntity.ok(Map.of(
                    "masterEventId", id,
                    "total", docIds.size(),
                    "docIds", docIds
            ));
        } catch (NoSuchElementException e) {
            return ResponseEntity.notFound().build();
        }
    }

    @GetMapping("/multi-day")
    public ResponseEntity<List<MultiDayEventDto>> getMultiDayEvents(
            @RequestParam String country,
            @RequestParam(defaultValue = "10") int limit) {
        return ResponseEntity.ok(queryService.listMultiDayEvents(country, limit));
    }

    /**
     * Consolidated mentions of a country in a date range, for period summaries
     */
    @GetMapping("/mentions")
    public ResponseEntity<?> getMentions(
            @RequestParam String country,
            @RequestParam String startDate,
            @RequestParam String endDate) {
        try {
            List<MentionDto> mentions = queryService.findMentions(country, LocalDate.parse(startDate),
                    LocalDate.parse(endDate));
            return ResponseEntity.ok(mentions);

        } catch (DateTimeParseException e) {
            log.error("❌ Error parsing date range: {}", e.getMessage());
            return ResponseEntity.badRequest().body(Map.of(
                    "error", "Invalid date range",
                    "message", e.getMessage()
            ));
        }
    }

    /**
     * Attach a child to a master; rejected when it would nest the hierarchy
     */
    @PostMapping("/{masterId}/children/{childId}")
    public ResponseEntity<Map<String, Object>> linkChild(@PathVariable UUID masterId, @PathVariable UUID childId) {
        try {
            CanonicalEvent child = linkService.assignMaster(childId, masterId);
            return ResponseEntity.ok(Map.of(
                    "childId", child.getId(),
                    "masterEventId", child.getMasterEventId()
            ));
        } catch (HierarchyDepthException e) {
            log.error("❌ Rejected hierarchy edge {} -> {}: {}", childId, masterId, e.getMessage());
            return ResponseEntity.badRequest().body(Map.of(
                    "error", "Invalid hierarchy edge",
                    "message", e.getMessage()
            ));
        }
    }

    /**
     * Record the deconfliction verdict that gates consolidation of the group
     */
    @PostMapping("/{masterId}/validation")
    public ResponseEntity<Map<String, Object>> markValidated(@PathVariable UUID masterId,
                                                             @RequestParam(defaultValue = "true") boolean validated) {
        try {
            CanonicalEvent master = linkService.markValidated(masterId, validated);
            return ResponseEntity.ok(Map.of(
                    "masterEventId", master.getId(),
                    "llmValidated", master.getLlmValidated()
            ));
        } catch (HierarchyDepthException e) {
            return ResponseEntity.badRequest().body(Map.of(
                    "error", "Invalid validation target",
                    "message", e.getMessage()
            ));
        }
    }
}
