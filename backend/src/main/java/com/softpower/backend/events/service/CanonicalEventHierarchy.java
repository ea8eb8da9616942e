package com.softpower.backend.events.service;

import com.softpower.backend.events.entity.CanonicalEvent;
import com.softpower.backend.events.entity.DailyEventMention;
import com.softpower.backend.events.exception.NonEmptyChildException;
import com.softpower.backend.events.repository.CanonicalEventRepository;
import com.softpower.backend.events.repository.DailyEventMentionRepository;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.stereotype.Component;

/**
 * Queries and row-level mutations over the master/child event graph and its daily mentions.
 * Callers own the transaction; the locking variants only make sense inside one.
 */
@Component
@RequiredArgsConstructor
public class CanonicalEventHierarchy {

    private final CanonicalEventRepository eventRepository;
    private final DailyEventMentionRepository mentionRepository;

    public List<CanonicalEvent> findEligibleMasters(String country) {
        return eventRepository.findValidatedMasters(country);
    }

    /**
     * Re-reads the master under a write lock. A master that vanished since it was listed means
     * someone else is writing the hierarchy, which is treated as a retryable concurrency failure.
     */
    public CanonicalEvent lockMaster(CanonicalEvent master) {
        return eventRepository.findByIdForUpdate(master.getId())
                .orElseThrow(() -> new ConcurrencyFailureException(
                        "Master event " + master.getId() + " disappeared during consolidation"));
    }

    public List<CanonicalEvent> findChildren(CanonicalEvent master, boolean forUpdate) {
        return forUpdate
                ? eventRepository.findChildrenForUpdate(master.getId(), master.getCountry())
                : eventRepository.findByMasterEventIdAndCountryOrderByFirstMentionDateAscIdAsc(
                        master.getId(), master.getCountry());
    }

    public List<DailyEventMention> findMentions(CanonicalEvent event, boolean forUpdate) {
        return forUpdate
                ? mentionRepository.findByEventForUpdate(event)
                : mentionRepository.findByEventId(event.getId());
    }

    public Set<LocalDate> findMentionDates(CanonicalEvent event) {
        return new HashSet<>(mentionRepository.findMentionDates(event));
    }

    public Optional<DailyEventMention> findMentionOn(CanonicalEvent master, LocalDate mentionDate) {
        return mentionRepository.findOnDateForUpdate(master, mentionDate);
    }

    /**
     * Adds the drained mention onto the surviving one and removes the drained row.
     * Document ids and source names travel with the count so no reference is lost.
     */
    public void accumulate(DailyEventMention target, DailyEventMention drained) {
        target.setArticleCount(target.getArticleCount() + drained.getArticleCount());
        target.getDocIds().addAll(drained.getDocIds());
        target.getSourceNames().addAll(drained.getSourceNames());
        mentionRepository.save(target);
        mentionRepository.delete(drained);
    }

    public void reassign(DailyEventMention mention, CanonicalEvent master) {
        mention.setCanonicalEvent(master);
        mentionRepository.save(mention);
    }

    /**
     * Compare-and-delete: the child goes only if it owns nothing at this instant.
     */
    public void deleteDrainedChild(CanonicalEvent child, CanonicalEvent master) {
        long remaining = mentionRepository.countByEvent(child);
        if (remaining > 0) {
            throw new NonEmptyChildException(child.getId(), remaining);
        }
        if (child.getCanonicalName() != null && !child.getCanonicalName().equals(master.getCanonicalName())) {
            master.getAlternativeNames().add(child.getCanonicalName());
        }
        eventRepository.delete(child);
    }

    /**
     * Recomputes the master's mention-derived aggregates from the rows it now owns.
     */
    public void refreshMasterRollup(CanonicalEvent master) {
        List<DailyEventMention> mentions = mentionRepository.findByEventId(master.getId());
        if (mentions.isEmpty()) {
            return;
        }

        DailyEventMention peak = mentions.stream()
                .max(Comparator.comparing(DailyEventMention::getArticleCount)
                        .thenComparing(DailyEventMention::getMentionDate, Comparator.reverseOrder()))
                .orElseThrow();

        master.setFirstMentionDate(mentions.get(0).getMentionDate());
        master.setLastMentionDate(mentions.get(mentions.size() - 1).getMentionDate());
        master.setTotalMentionDays(mentions.size());
        master.setTotalArticles(mentions.stream().mapToInt(DailyEventMention::getArticleCount).sum());
        master.setPeakMentionDate(peak.getMentionDate());
        master.setPeakDailyArticleCount(peak.getArticleCount());
        mentions.forEach(mention -> master.getUniqueSources().addAll(mention.getSourceNames()));
        master.setSourceCount(master.getUniqueSources().size());
        eventRepository.save(master);
    }
}
