package com.softpower.backend.events.entity;

import com.softpower.backend.events.converter.CountMapConverter;
import com.softpower.backend.events.converter.StringMapConverter;
import com.softpower.backend.events.converter.VectorConverter;
import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * A tracked story. Rows with a null {@code masterEventId} are masters; every other row points at a master.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
@Entity
@Table(name = "canonical_events", indexes = {
        @Index(name = "ix_canonical_event_country_dates",
                columnList = "initiating_country, first_mention_date, last_mention_date"),
        @Index(name = "ix_canonical_event_story_phase", columnList = "story_phase"),
        @Index(name = "ix_canonical_event_master", columnList = "master_event_id"),
        @Index(name = "ix_canonical_event_llm_validated", columnList = "llm_validated")
})
public class CanonicalEvent {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @EqualsAndHashCode.Include
    private UUID id;

    // Plain reference so dangling parents stay detectable by the verifier
    @Column(name = "master_event_id")
    private UUID masterEventId;

    @Column(nullable = false, length = 500)
    private String canonicalName;

    @Column(name = "initiating_country", nullable = false, length = 100)
    private String country;

    @Column(name = "first_mention_date", nullable = false)
    private LocalDate firstMentionDate;

    @Column(name = "last_mention_date", nullable = false)
    private LocalDate lastMentionDate;

    @Builder.Default
    private Integer totalMentionDays = 1;

    @Builder.Default
    private Integer totalArticles = 0;

    @Column(name = "story_phase", length = 50)
    private String storyPhase; // emerging, developing, peak, fading, dormant

    @Builder.Default
    private Integer daysSinceLastMention = 0;

    @ElementCollection
    @CollectionTable(name = "canonical_event_sources", joinColumns = @JoinColumn(name = "canonical_event_id"))
    @Column(name = "source_name", length = 500)
    @Builder.Default
    @ToString.Exclude
    private Set<String> uniqueSources = new LinkedHashSet<>();

    @Builder.Default
    private Integer sourceCount = 0;

    private LocalDate peakMentionDate;

    @Builder.Default
    private Integer peakDailyArticleCount = 0;

    @Column(columnDefinition = "TEXT")
    private String consolidatedDescription;

    @Convert(converter = StringMapConverter.class)
    @Column(columnDefinition = "TEXT")
    @ToString.Exclude
    private Map<String, String> keyFacts;

    @Convert(converter = VectorConverter.class)
    @Column(columnDefinition = "TEXT")
    @ToString.Exclude
    private List<Double> embeddingVector;

    @ElementCollection
    @CollectionTable(name = "canonical_event_alternative_names", joinColumns = @JoinColumn(name = "canonical_event_id"))
    @Column(name = "alternative_name", length = 500)
    @Builder.Default
    @ToString.Exclude
    private Set<String> alternativeNames = new LinkedHashSet<>();

    @Convert(converter = CountMapConverter.class)
    @Column(columnDefinition = "TEXT")
    @ToString.Exclude
    private Map<String, Integer> primaryCategories;

    @Convert(converter = CountMapConverter.class)
    @Column(columnDefinition = "TEXT")
    @ToString.Exclude
    private Map<String, Integer> primaryRecipients;

    @Column(precision = 3, scale = 1)
    private BigDecimal materialScore;

    @Column(columnDefinition = "TEXT")
    private String materialJustification;

    // Set by the deconfliction step; gates consolidation of the whole group
    @Column(name = "llm_validated", nullable = false)
    @Builder.Default
    private Boolean llmValidated = false;

    private LocalDateTime llmValidatedAt;

    @Version
    private Long version;

    public boolean isMaster() {
        return masterEventId == null;
    }
}
