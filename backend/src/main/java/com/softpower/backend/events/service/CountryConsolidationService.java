package com.softpower.backend.events.service;

import com.softpower.backend.events.dto.MergeStats;
import com.softpower.backend.events.entity.CanonicalEvent;
import com.softpower.backend.events.entity.DailyEventMention;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.interceptor.TransactionAspectSupport;

/**
 * Folds every validated master's children into the master, one country per transaction.
 * Any exception rolls back the whole country.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CountryConsolidationService {

    private final CanonicalEventHierarchy hierarchy;

    @Transactional
    public MergeStats consolidateCountry(String country, boolean dryRun, boolean verbose) {
        List<CanonicalEvent> masters = hierarchy.findEligibleMasters(country);
        MergeStats stats = MergeStats.empty();

        if (masters.isEmpty()) {
            log.info("🔕 No validated master events found for {}", country);
            return stats;
        }

        log.info("🔍 Found {} validated master events for {}{}", masters.size(), country, dryRun ? " (dry run)" : "");
        stats.setMasterCount(masters.size());

        for (CanonicalEvent master : masters) {
            stats.add(consolidateMaster(master, dryRun, verbose));
        }

        if (dryRun) {
            // Nothing was written, but make sure nothing can be
            TransactionAspectSupport.currentTransactionStatus().setRollbackOnly();
            log.info("📝 [DRY RUN] {}: would fold {} mentions ({} conflicts) and delete {} child events",
                    country, stats.getMentionsReassigned(), stats.getConflictsMerged(), stats.getEventsDeleted());
        } else {
            log.info("✅ {}: folded {} mentions ({} conflicts) and deleted {} child events",
                    country, stats.getMentionsReassigned(), stats.getConflictsMerged(), stats.getEventsDeleted());
        }
        return stats;
    }

    private MergeStats consolidateMaster(CanonicalEvent listed, boolean dryRun, boolean verbose) {
        CanonicalEvent master = dryRun ? listed : hierarchy.lockMaster(listed);
        List<CanonicalEvent> children = hierarchy.findChildren(master, !dryRun);
        MergeStats stats = MergeStats.empty();

        if (children.isEmpty()) {
            return stats;
        }

        stats.setChildCount(children.size());
        progress(verbose, "🔄 Master '{}': {} child events to merge", abbreviate(master.getCanonicalName(), 60),
                children.size());

        // Dates the master owns so far; a dry run decides every transition from this alone
        Set<LocalDate> masterDates = hierarchy.findMentionDates(master);

        for (CanonicalEvent child : children) {
            List<DailyEventMention> mentions = hierarchy.findMentions(child, !dryRun);
            if (!mentions.isEmpty()) {
                progress(verbose, "   ↪ {} mentions from '{}'", mentions.size(),
                        abbreviate(child.getCanonicalName(), 50));
            }

            for (DailyEventMention mention : mentions) {
                MentionTransition transition = dryRun
                        ? MentionTransition.classify(masterDates.contains(mention.getMentionDate()))
                        : apply(master, mention);
                masterDates.add(mention.getMentionDate());

                if (transition == MentionTransition.ADDITIVE_MERGE) {
                    stats.setConflictsMerged(stats.getConflictsMerged() + 1);
                }
                stats.setMentionsReassigned(stats.getMentionsReassigned() + 1);
            }

            if (!dryRun) {
                hierarchy.deleteDrainedChild(child, master);
            }
            stats.setEventsDeleted(stats.getEventsDeleted() + 1);
        }

        if (!dryRun) {
            hierarchy.refreshMasterRollup(master);
        }
        return stats;
    }

    private MentionTransition apply(CanonicalEvent master, DailyEventMention mention) {
        Optional<DailyEventMention> existing = hierarchy.findMentionOn(master, mention.getMentionDate());
        MentionTransition transition = MentionTransition.classify(existing.isPresent());

        switch (transition) {
            case ADDITIVE_MERGE -> hierarchy.accumulate(existing.get(), mention);
            case REASSIGNMENT -> hierarchy.reassign(mention, master);
        }
        return transition;
    }

    private void progress(boolean verbose, String format, Object... args) {
        if (verbose) {
            log.info(format, args);
        } else {
            log.debug(format, args);
        }
    }

    private static String abbreviate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        return text.length() <= maxLength ? text : text.substring(0, maxLength) + "…";
    }
}
