package com.softpower.backend.integrity.dto;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum IntegrityCheck {
    MENTIONS_WITHOUT_DOCUMENTS("Daily event mentions with no document ids"),
    BROKEN_DOCUMENT_REFERENCES("Document ids referenced by mentions that do not exist"),
    EVENTS_WITHOUT_MENTIONS("Canonical events that own no daily mentions"),
    CLUSTERS_WITHOUT_DOCUMENTS("Event clusters with no document ids"),
    HIERARCHY_REFERENCES("Master references that dangle, point at another child or cross countries");

    private final String description;
}
