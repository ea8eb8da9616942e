package com.softpower.backend.events.dto;

public enum ConsolidationStatus {
    SUCCEEDED,
    DRY_RUN,
    SKIPPED,
    FAILED
}
