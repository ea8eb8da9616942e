package com.softpower.backend.integrity.service;

import com.softpower.backend.clusters.entity.EventCluster;
import com.softpower.backend.clusters.repository.EventClusterRepository;
import com.softpower.backend.config.ConsolidationProperties;
import com.softpower.backend.documents.repository.DocumentRepository;
import com.softpower.backend.events.entity.DailyEventMention;
import com.softpower.backend.events.repository.CanonicalEventRepository;
import com.softpower.backend.events.repository.DailyEventMentionRepository;
import com.softpower.backend.integrity.dto.CheckResult;
import com.softpower.backend.integrity.dto.CountryClusterRow;
import com.softpower.backend.integrity.dto.CountryMaterialityRow;
import com.softpower.backend.integrity.dto.CountryPipelineStats;
import com.softpower.backend.integrity.dto.IntegrityCheck;
import com.softpower.backend.integrity.dto.IntegrityReport;
import com.softpower.backend.integrity.dto.PipelineStatistics;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Audits the Document → DailyEventMention → CanonicalEvent chain. Never writes; violations are
 * reported for a separate remediation step.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class IntegrityVerificationService {

    // Keeps IN lists well under driver parameter limits
    private static final int DOC_ID_BATCH_SIZE = 1000;

    private final DailyEventMentionRepository mentionRepository;
    private final CanonicalEventRepository eventRepository;
    private final EventClusterRepository clusterRepository;
    private final DocumentRepository documentRepository;
    private final ConsolidationProperties properties;

    public IntegrityReport verify(boolean fullScan) {
        log.info("🔎 Data integrity verification started (document references: {})",
                fullScan ? "full scan" : "sampled");

        List<CheckResult> checks = List.of(
                checkMentionsWithoutDocuments(),
                checkDocumentReferences(fullScan),
                checkEventsWithoutMentions(),
                checkClustersWithoutDocuments(),
                checkHierarchyReferences()
        );

        IntegrityReport report = IntegrityReport.builder()
                .checks(checks)
                .statistics(collectStatistics())
                .fullScan(fullScan)
                .generatedAt(LocalDateTime.now())
                .build();

        if (report.isPassed()) {
            log.info("✅ ALL DATA INTEGRITY CHECKS PASSED");
        } else {
            log.warn("❌ DATA INTEGRITY ISSUES FOUND: {}", report.getIssues());
        }
        return report;
    }

    public CheckResult checkMentionsWithoutDocuments() {
        long missing = nullSafe(mentionRepository.countWithoutDocuments());
        List<String> samples = missing == 0 ? List.of() : mentionRepository.findWithoutDocuments(samplePage()).stream()
                .map(mention -> String.format("mention %s | event '%s' | %s | %s",
                        mention.getId(), mention.getCanonicalEvent().getCanonicalName(),
                        mention.getMentionDate(), mention.getCountry()))
                .toList();

        logCheck(IntegrityCheck.MENTIONS_WITHOUT_DOCUMENTS, missing);
        return result(IntegrityCheck.MENTIONS_WITHOUT_DOCUMENTS, missing, samples, Map.of());
    }

    /**
     * Resolves document ids against the document table. The sampled mode looks at the first
     * {@code referenceSampleSize} mentions; the full scan pages through all of them.
     */
    public CheckResult checkDocumentReferences(boolean fullScan) {
        ConsolidationProperties.Verification config = properties.getVerification();
        int pageSize = fullScan ? config.getScanPageSize() : config.getReferenceSampleSize();

        long broken = 0;
        long valid = 0;
        long mentionsChecked = 0;
        List<String> samples = new ArrayList<>();

        for (int page = 0; ; page++) {
            List<DailyEventMention> mentions = mentionRepository.findWithDocuments(PageRequest.of(page, pageSize));
            Set<String> existing = existingDocIds(mentions);

            for (DailyEventMention mention : mentions) {
                mentionsChecked++;
                for (String docId : mention.getDocIds()) {
                    if (existing.contains(docId)) {
                        valid++;
                        continue;
                    }
                    broken++;
                    if (samples.size() < config.getSampleSize()) {
                        samples.add(String.format("mention %s -> doc_id %s (not found)", mention.getId(), docId));
                    }
                }
            }

            if (!fullScan || mentions.size() < pageSize) {
                break;
            }
        }

        Map<String, Long> details = new TreeMap<>();
        details.put("mentionsChecked", mentionsChecked);
        details.put("validReferences", valid);
        details.put("mentionsWithDocuments", nullSafe(mentionRepository.countWithDocuments()));

        logCheck(IntegrityCheck.BROKEN_DOCUMENT_REFERENCES, broken);
        return result(IntegrityCheck.BROKEN_DOCUMENT_REFERENCES, broken, samples, details);
    }

    public CheckResult checkEventsWithoutMentions() {
        long orphaned = nullSafe(eventRepository.countWithoutMentions());
        long orphanedMasters = orphaned == 0 ? 0 : nullSafe(eventRepository.countMastersWithoutMentions());
        List<String> samples = orphaned == 0 ? List.of() : eventRepository.findWithoutMentions(samplePage()).stream()
                .map(event -> String.format("%s %s | '%s' | %s | first mention %s",
                        event.isMaster() ? "master" : "child", event.getId(), event.getCanonicalName(),
                        event.getCountry(), event.getFirstMentionDate()))
                .toList();

        Map<String, Long> details = new TreeMap<>();
        details.put("masters", orphanedMasters);
        details.put("children", orphaned - orphanedMasters);

        logCheck(IntegrityCheck.EVENTS_WITHOUT_MENTIONS, orphaned);
        return result(IntegrityCheck.EVENTS_WITHOUT_MENTIONS, orphaned, samples, details);
    }

    public CheckResult checkClustersWithoutDocuments() {
        long missing = nullSafe(clusterRepository.countWithoutDocuments());
        List<String> samples = missing == 0 ? List.of() : clusterRepository.findWithoutDocuments(samplePage()).stream()
                .map(this::describeCluster)
                .toList();

        logCheck(IntegrityCheck.CLUSTERS_WITHOUT_DOCUMENTS, missing);
        return result(IntegrityCheck.CLUSTERS_WITHOUT_DOCUMENTS, missing, samples, Map.of());
    }

    public CheckResult checkHierarchyReferences() {
        long dangling = nullSafe(eventRepository.countDanglingMasterReferences());
        long nested = nullSafe(eventRepository.countNestedMasterReferences());
        long crossCountry = nullSafe(eventRepository.countCrossCountryMasterReferences());
        long violations = dangling + nested + crossCountry;

        List<String> samples = new ArrayList<>();
        if (dangling > 0) {
            eventRepository.findDanglingMasterReferences(samplePage()).forEach(event -> samples.add(String.format(
                    "event %s -> master %s (missing)", event.getId(), event.getMasterEventId())));
        }
        if (nested > 0) {
            eventRepository.findNestedMasterReferences(samplePage()).forEach(event -> samples.add(String.format(
                    "event %s -> master %s (itself a child)", event.getId(), event.getMasterEventId())));
        }
        if (crossCountry > 0) {
            eventRepository.findCrossCountryMasterReferences(samplePage()).forEach(event -> samples.add(String.format(
                    "event %s (%s) -> master %s (other country)", event.getId(), event.getCountry(),
                    event.getMasterEventId())));
        }

        Map<String, Long> details = new TreeMap<>();
        details.put("dangling", dangling);
        details.put("nested", nested);
        details.put("crossCountry", crossCountry);
        details.put("masters", nullSafe(eventRepository.countByMasterEventIdIsNull()));
        details.put("children", nullSafe(eventRepository.countByMasterEventIdIsNotNull()));

        logCheck(IntegrityCheck.HIERARCHY_REFERENCES, violations);
        return result(IntegrityCheck.HIERARCHY_REFERENCES, violations,
                samples.stream().limit(properties.getVerification().getSampleSize()).toList(), details);
    }

    public PipelineStatistics collectStatistics() {
        long clusters = clusterRepository.count();
        long processed = nullSafe(clusterRepository.countByProcessed(true));
        long deconflicted = nullSafe(clusterRepository.countByLlmDeconflicted(true));
        long canonical = eventRepository.count();
        long scored = nullSafe(eventRepository.countMaterialityScored());
        long mentions = mentionRepository.count();
        long withDocs = nullSafe(mentionRepository.countWithDocuments());

        PipelineStatistics statistics = PipelineStatistics.builder()
                .documents(documentRepository.count())
                .clusters(clusters)
                .clustersProcessed(processed)
                .processedPercentage(PipelineStatistics.percentage(processed, clusters))
                .clustersDeconflicted(deconflicted)
                .deconflictedPercentage(PipelineStatistics.percentage(deconflicted, clusters))
                .canonicalEvents(canonical)
                .masterEvents(nullSafe(eventRepository.countByMasterEventIdIsNull()))
                .childEvents(nullSafe(eventRepository.countByMasterEventIdIsNotNull()))
                .materialityScored(scored)
                .materialityScoredPercentage(PipelineStatistics.percentage(scored, canonical))
                .mentions(mentions)
                .mentionsWithDocuments(withDocs)
                .mentionsWithDocumentsPercentage(PipelineStatistics.percentage(withDocs, mentions))
                .countries(statisticsByCountry())
                .build();

        log.info("📊 Documents: {} | Clusters: {} ({}% deconflicted) | Canonical events: {} ({}% scored) | Mentions: {} ({}% with doc_ids)",
                statistics.getDocuments(), clusters, statistics.getDeconflictedPercentage(), canonical,
                statistics.getMaterialityScoredPercentage(), mentions, statistics.getMentionsWithDocumentsPercentage());
        return statistics;
    }

    private List<CountryPipelineStats> statisticsByCountry() {
        Map<String, CountryMaterialityRow> materiality = eventRepository.summarizeMaterialityByCountry().stream()
                .collect(Collectors.toMap(CountryMaterialityRow::getCountry, Function.identity(),
                        (first, second) -> first, LinkedHashMap::new));
        Map<String, CountryClusterRow> clusters = clusterRepository.summarizeByCountry().stream()
                .filter(row -> row.getCountry() != null)
                .collect(Collectors.toMap(CountryClusterRow::getCountry, Function.identity()));

        // Materiality ordering first (largest event count), then countries known only from clusters
        Set<String> countries = new LinkedHashSet<>(materiality.keySet());
        countries.addAll(clusters.keySet());

        List<CountryPipelineStats> rows = new ArrayList<>();
        for (String country : countries) {
            CountryMaterialityRow events = materiality.getOrDefault(country, new CountryMaterialityRow(country, 0L, 0L));
            CountryClusterRow clusterRow = clusters.getOrDefault(country, new CountryClusterRow(country, 0L, 0L, 0L));
            long total = nullSafe(events.getTotal());
            long scored = nullSafe(events.getScored());
            long clusterTotal = nullSafe(clusterRow.getTotal());
            long processed = nullSafe(clusterRow.getProcessed());
            long deconflicted = nullSafe(clusterRow.getDeconflicted());

            rows.add(CountryPipelineStats.builder()
                    .country(country)
                    .canonicalEvents(total)
                    .materialityScored(scored)
                    .materialityScoredPercentage(PipelineStatistics.percentage(scored, total))
                    .remainingUnscored(total - scored)
                    .clusters(clusterTotal)
                    .clustersProcessed(processed)
                    .processedPercentage(PipelineStatistics.percentage(processed, clusterTotal))
                    .clustersDeconflicted(deconflicted)
                    .deconflictedPercentage(PipelineStatistics.percentage(deconflicted, clusterTotal))
                    .build());
        }
        return rows;
    }

    private Set<String> existingDocIds(List<DailyEventMention> mentions) {
        List<String> referenced = mentions.stream()
                .flatMap(mention -> mention.getDocIds().stream())
                .distinct()
                .toList();

        Set<String> existing = new HashSet<>();
        for (int start = 0; start < referenced.size(); start += DOC_ID_BATCH_SIZE) {
            List<String> batch = referenced.subList(start, Math.min(referenced.size(), start + DOC_ID_BATCH_SIZE));
            existing.addAll(documentRepository.findExistingDocIds(batch));
        }
        return existing;
    }

    private String describeCluster(EventCluster cluster) {
        return String.format("cluster %s | %s | %s | size %d | '%s'", cluster.getId(), cluster.getCountry(),
                cluster.getClusterDate(), cluster.getClusterSize(), cluster.getRepresentativeName());
    }

    private PageRequest samplePage() {
        return PageRequest.of(0, Math.max(1, properties.getVerification().getSampleSize()));
    }

    private CheckResult result(IntegrityCheck check, long count, List<String> samples, Map<String, Long> details) {
        return CheckResult.builder()
                .check(check)
                .description(check.getDescription())
                .count(count)
                .samples(samples)
                .details(new TreeMap<>(details))
                .build();
    }

    private void logCheck(IntegrityCheck check, long count) {
        if (count > 0) {
            log.warn("⚠️ {}: {}", check.getDescription(), count);
        } else {
            log.info("✅ {}: none", check.getDescription());
        }
    }

    private static long nullSafe(Long value) {
        return value == null ? 0L : value;
    }
}
