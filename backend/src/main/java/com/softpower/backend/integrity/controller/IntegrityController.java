package com.softpower.backend.integrity.controller;

import com.softpower.backend.integrity.dto.IntegrityReport;
import com.softpower.backend.integrity.dto.PipelineStatistics;
import com.softpower.backend.integrity.service.IntegrityVerificationService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/integrity")
@RequiredArgsConstructor
public class IntegrityController {

    private final IntegrityVerificationService verificationService;

    /**
     * Full integrity report; 409 when any check found violations so callers can gate on the status
     */
    @GetMapping("/report")
    public ResponseEntity<IntegrityReport> getReport(@RequestParam(defaultValue = "false") boolean fullScan) {
        IntegrityReport report = verificationService.verify(fullScan);
        return ResponseEntity.status(report.isPassed() ? HttpStatus.OK : HttpStatus.CONFLICT).body(report);
    }

    @GetMapping("/statistics")
    public ResponseEntity<PipelineStatistics> getStatistics() {
        return ResponseEntity.ok(verificationService.collectStatistics());
    }
}
