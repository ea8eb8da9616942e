package com.softpower.backend.events.entity;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.persistence.Version;
import java.time.LocalDate;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * All articles about one canonical event on one calendar day.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
@Entity
@Table(name = "daily_event_mentions",
        uniqueConstraints = @UniqueConstraint(name = "uq_daily_mention",
                columnNames = {"canonical_event_id", "mention_date"}),
        indexes = {
                @Index(name = "ix_daily_mention_date", columnList = "mention_date"),
                @Index(name = "ix_daily_mention_country_date", columnList = "initiating_country, mention_date")
        })
public class DailyEventMention {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @EqualsAndHashCode.Include
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "canonical_event_id", nullable = false)
    @ToString.Exclude
    private CanonicalEvent canonicalEvent;

    @Column(name = "initiating_country", nullable = false, length = 100)
    private String country;

    @Column(name = "mention_date", nullable = false)
    private LocalDate mentionDate;

    @Column(nullable = false)
    @Builder.Default
    private Integer articleCount = 0;

    @Column(columnDefinition = "TEXT")
    private String consolidatedHeadline;

    @Column(columnDefinition = "TEXT")
    private String dailySummary;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "daily_event_mention_sources", joinColumns = @JoinColumn(name = "mention_id"))
    @Column(name = "source_name", length = 500)
    @Builder.Default
    private Set<String> sourceNames = new LinkedHashSet<>();

    @Builder.Default
    private Double sourceDiversityScore = 0.0;

    @Column(length = 50)
    private String mentionContext; // announcement, preparation, execution, aftermath

    @Column(length = 20)
    private String newsIntensity; // breaking, developing, follow-up, recap

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "daily_event_mention_doc_ids", joinColumns = @JoinColumn(name = "mention_id"))
    @Column(name = "doc_id", length = 255)
    @Builder.Default
    private Set<String> docIds = new LinkedHashSet<>();

    @Version
    private Long version;
}
