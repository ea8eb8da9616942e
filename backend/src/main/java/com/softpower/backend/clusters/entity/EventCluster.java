package com.softpower.backend.clusters.entity;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

/**
 * Raw per-day cluster written by the upstream clustering job. Never mutated here.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "event_clusters",
        uniqueConstraints = @UniqueConstraint(name = "uq_event_cluster",
                columnNames = {"initiating_country", "cluster_date", "batch_number", "cluster_id"}),
        indexes = {
                @Index(name = "ix_event_cluster_country_date", columnList = "initiating_country, cluster_date"),
                @Index(name = "ix_event_cluster_processed", columnList = "processed, llm_deconflicted")
        })
public class EventCluster {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "initiating_country", nullable = false, length = 100)
    private String country;

    @Column(name = "cluster_date", nullable = false)
    private LocalDate clusterDate;

    @Column(name = "batch_number", nullable = false)
    private Integer batchNumber;

    // DBSCAN label within the batch
    @Column(name = "cluster_id", nullable = false)
    private Integer clusterId;

    @ElementCollection
    @CollectionTable(name = "event_cluster_event_names", joinColumns = @JoinColumn(name = "event_cluster_id"))
    @Column(name = "event_name", length = 500)
    @Builder.Default
    private Set<String> eventNames = new LinkedHashSet<>();

    @ElementCollection
    @CollectionTable(name = "event_cluster_doc_ids", joinColumns = @JoinColumn(name = "event_cluster_id"))
    @Column(name = "doc_id", length = 255)
    @Builder.Default
    private Set<String> docIds = new LinkedHashSet<>();

    @Column(nullable = false)
    private Integer clusterSize;

    @Column(nullable = false)
    @Builder.Default
    private Boolean isNoise = false;

    @Column(columnDefinition = "TEXT")
    private String representativeName;

    @Column(nullable = false)
    @Builder.Default
    private Boolean processed = false;

    @Column(name = "llm_deconflicted", nullable = false)
    @Builder.Default
    private Boolean llmDeconflicted = false;

    @CreationTimestamp
    private LocalDateTime createdAt;
}
