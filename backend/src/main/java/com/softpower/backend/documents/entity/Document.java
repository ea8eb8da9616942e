package com.softpower.backend.documents.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Source document. Owned by the ingestion side; mentions and clusters only reference {@code docId}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "documents")
public class Document {
    @Id
    @Column(name = "doc_id", length = 255)
    private String docId;

    @Column(columnDefinition = "TEXT")
    private String title;

    @Column(length = 255)
    private String sourceName;

    @Column(name = "document_date")
    private LocalDate documentDate;

    @Column(length = 100)
    private String initiatingCountry;

    @Column(length = 100)
    private String recipientCountry;

    @Column(length = 100)
    private String category;

    @Column(length = 500)
    private String eventName;
}
