package com.softpower.backend.events.controller;

import com.softpower.backend.events.dto.ConsolidationReport;
import com.softpower.backend.events.service.CanonicalEventMergeService;
import com.softpower.backend.events.service.ConsolidationScope;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/consolidation")
@RequiredArgsConstructor
public class ConsolidationController {

    private final CanonicalEventMergeService mergeService;

    /**
     * Merge validated child events into their masters for one country, or every configured country
     * when {@code country} is omitted. Answers 207 when some countries failed.
     */
    @PostMapping("/run")
    public ResponseEntity<?> runConsolidation(
            @RequestParam(required = false) String country,
            @RequestParam(defaultValue = "false") boolean dryRun,
            @RequestParam(required = false) Boolean verbose) {

        ConsolidationScope scope = country == null ? ConsolidationScope.configured() : ConsolidationScope.country(country);
        log.info("🚀 Consolidation requested for {} (dryRun={})", scope, dryRun);

        try {
            ConsolidationReport report = verbose == null
                    ? mergeService.consolidate(scope, dryRun)
                    : mergeService.consolidate(scope, dryRun, verbose);

            return ResponseEntity.status(report.isSuccessful() ? HttpStatus.OK : HttpStatus.MULTI_STATUS)
                    .body(report);

        } catch (Exception e) {
            log.error("❌ Consolidation request failed: {}", e.getMessage());
            return ResponseEntity.badRequest().body(Map.of(
                    "error", "Consolidation failed",
                    "message", String.valueOf(e.getMessage()),
                    "timestamp", System.currentTimeMillis()
            ));
        }
    }
}
