package com.softpower.backend.events.service;

import com.softpower.backend.config.ConsolidationProperties;
import com.softpower.backend.events.dto.ConsolidationReport;
import com.softpower.backend.events.dto.ConsolidationStatus;
import com.softpower.backend.events.dto.CountryConsolidationResult;
import com.softpower.backend.events.dto.MergeStats;
import com.softpower.backend.events.dto.MultiDayEventDto;
import com.softpower.backend.events.exception.HierarchyDepthException;
import com.softpower.backend.events.exception.NonEmptyChildException;
import com.softpower.backend.events.repository.DailyEventMentionRepository;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.CannotCreateTransactionException;

/**
 * Entry point for consolidation runs. Each country is committed or rolled back on its own;
 * a failing country is reported and the batch moves on.
 */
@Slf4j
@Service
public class CanonicalEventMergeService {

    private static final String DAILY_MENTION_CONSTRAINT = "uq_daily_mention";

    private final CountryConsolidationService countryConsolidationService;
    private final DailyEventMentionRepository mentionRepository;
    private final ConsolidationProperties properties;
    private final ThreadPoolTaskExecutor consolidationTaskExecutor;

    public CanonicalEventMergeService(CountryConsolidationService countryConsolidationService,
                                      DailyEventMentionRepository mentionRepository,
                                      ConsolidationProperties properties,
                                      @Qualifier("consolidationTaskExecutor") ThreadPoolTaskExecutor consolidationTaskExecutor) {
        this.countryConsolidationService = countryConsolidationService;
        this.mentionRepository = mentionRepository;
        this.properties = properties;
        this.consolidationTaskExecutor = consolidationTaskExecutor;
    }

    public ConsolidationReport consolidate(ConsolidationScope scope, boolean dryRun) {
        return consolidate(scope, dryRun, properties.isVerbose());
    }

    public ConsolidationReport consolidate(ConsolidationScope scope, boolean dryRun, boolean verbose) {
        LocalDateTime startedAt = LocalDateTime.now();
        List<String> countries = scope.resolve(properties.getCountries());

        log.info("🚀 Canonical event consolidation started for {}{}", scope, dryRun ? " [DRY RUN]" : "");
        if (countries.isEmpty()) {
            log.warn("⚠️ No countries configured for consolidation, nothing to do");
            return ConsolidationReport.of(dryRun, List.of(), startedAt);
        }

        List<CountryConsolidationResult> results;
        if (properties.isParallelCountries() && countries.size() > 1) {
            List<CompletableFuture<CountryConsolidationResult>> futures = countries.stream()
                    .map(country -> CompletableFuture.supplyAsync(
                            () -> consolidateCountry(country, dryRun, verbose), consolidationTaskExecutor))
                    .toList();
            results = futures.stream().map(CompletableFuture::join).toList();
        } else {
            results = countries.stream()
                    .map(country -> consolidateCountry(country, dryRun, verbose))
                    .toList();
        }

        ConsolidationReport report = ConsolidationReport.of(dryRun, results, startedAt);
        MergeStats totals = report.getTotals();
        log.info("🎯 CONSOLIDATION SUMMARY: masters={}, children={}, mentions={}, deleted={}, failed countries={}",
                totals.getMasterCount(), totals.getChildCount(), totals.getMentionsReassigned(),
                totals.getEventsDeleted(), report.getFailedCountries());
        return report;
    }

    public CountryConsolidationResult consolidateCountry(String country, boolean dryRun, boolean verbose) {
        if (country == null || country.isBlank()) {
            log.warn("⚠️ Skipping consolidation for blank country scope");
            return CountryConsolidationResult.skipped(country, "Country scope is empty");
        }

        long started = System.nanoTime();
        try {
            MergeStats stats = countryConsolidationService.consolidateCountry(country, dryRun, verbose);
            if (!dryRun && stats.hasActivity()) {
                logMultiDayEvents(country);
            }
            return CountryConsolidationResult.builder()
                    .country(country)
                    .status(dryRun ? ConsolidationStatus.DRY_RUN : ConsolidationStatus.SUCCEEDED)
                    .stats(stats)
                    .durationSeconds(secondsSince(started))
                    .build();

        } catch (NonEmptyChildException | HierarchyDepthException e) {
            log.error("❌ Invariant breach while consolidating {}, rolled back: {}", country, e.getMessage());
            return failed(country, e, false, started);
        } catch (RuntimeException e) {
            boolean retryable = isTransient(e);
            log.error("❌ Consolidation failed for {} (retryable: {}), rolled back: {}", country, retryable,
                    e.getMessage());
            return failed(country, e, retryable, started);
        }
    }

    static boolean isTransient(Throwable error) {
        if (isConcurrentMentionInsert(error)) {
            return true;
        }
        for (Throwable cause = error; cause != null; cause = cause.getCause()) {
            if (cause instanceof TransientDataAccessException
                    || cause instanceof RecoverableDataAccessException
                    || cause instanceof DataAccessResourceFailureException
                    || cause instanceof CannotCreateTransactionException
                    || cause instanceof java.sql.SQLTransientException
                    || cause instanceof java.sql.SQLRecoverableException) {
                return true;
            }
        }
        return false;
    }

    // A writer outside this run inserted the same (event, date) row between our read and our insert
    static boolean isConcurrentMentionInsert(Throwable error) {
        boolean integrityViolation = false;
        boolean onDailyMention = false;
        for (Throwable cause = error; cause != null; cause = cause.getCause()) {
            if (cause instanceof DataIntegrityViolationException
                    || cause instanceof java.sql.SQLIntegrityConstraintViolationException) {
                integrityViolation = true;
            }
            String message = cause.getMessage();
            if (message != null && message.toLowerCase(Locale.ROOT).contains(DAILY_MENTION_CONSTRAINT)) {
                onDailyMention = true;
            }
        }
        return integrityViolation && onDailyMention;
    }

    private void logMultiDayEvents(String country) {
        try {
            List<MultiDayEventDto> multiDay = mentionRepository.findMultiDayMasters(
                    country, PageRequest.of(0, properties.getMultiDayReportSize()));
            if (multiDay.isEmpty()) {
                log.warn("⚠️ No multi-day events found for {}", country);
                return;
            }
            log.info("📊 {} multi-day master events for {} (top {}):", multiDay.size(), country,
                    properties.getMultiDayReportSize());
            for (MultiDayEventDto event : multiDay) {
                log.info("   {} | {} days: {} to {} | {} articles", event.getCanonicalName(), event.getDays(),
                        event.getFirstDate(), event.getLastDate(), event.getTotalArticles());
            }
        } catch (RuntimeException e) {
            // Reporting only; the country is already committed
            log.warn("⚠️ Could not list multi-day events for {}: {}", country, e.getMessage());
        }
    }

    private CountryConsolidationResult failed(String country, RuntimeException e, boolean retryable, long started) {
        return CountryConsolidationResult.builder()
                .country(country)
                .status(ConsolidationStatus.FAILED)
                .retryable(retryable)
                .error(e.getMessage())
                .durationSeconds(secondsSince(started))
                .build();
    }

    private static double secondsSince(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000_000.0;
    }
}
