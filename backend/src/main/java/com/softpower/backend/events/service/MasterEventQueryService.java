package com.softpower.backend.events.service;

import com.softpower.backend.events.dto.MasterEventSummaryDto;
import com.softpower.backend.events.dto.MentionDto;
import com.softpower.backend.events.dto.MultiDayEventDto;
import com.softpower.backend.events.dto.TimelineEntryDto;
import com.softpower.backend.events.entity.CanonicalEvent;
import com.softpower.backend.events.repository.CanonicalEventRepository;
import com.softpower.backend.events.repository.DailyEventMentionRepository;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Read side over consolidated masters. Works before and after a merge: a master's view always
 * includes whatever children it still has.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class MasterEventQueryService {

    private final CanonicalEventRepository eventRepository;
    private final DailyEventMentionRepository mentionRepository;

    public List<MasterEventSummaryDto> listTopMasters(String country, int limit) {
        PageRequest page = PageRequest.of(0, Math.max(1, limit));
        List<CanonicalEvent> masters = country == null || country.isBlank()
                ? eventRepository.findTopMasters(page)
                : eventRepository.findTopMastersByCountry(country, page);

        return masters.stream()
                .map(master -> MasterEventSummaryDto.builder()
                        .id(master.getId())
                        .canonicalName(master.getCanonicalName())
                        .country(master.getCountry())
                        .firstMentionDate(master.getFirstMentionDate())
                        .lastMentionDate(master.getLastMentionDate())
                        .totalArticles(master.getTotalArticles())
                        .childEvents(eventRepository.countByMasterEventId(master.getId()))
                        .daysSpan(ChronoUnit.DAYS.between(master.getFirstMentionDate(), master.getLastMentionDate()) + 1)
                        .llmValidated(master.getLlmValidated())
                        .build())
                .toList();
    }

    public List<TimelineEntryDto> getTimeline(UUID masterId) {
        List<CanonicalEvent> members = groupOf(masterId);
        List<TimelineEntryDto> timeline = new ArrayList<>();
        for (CanonicalEvent member : members) {
            mentionRepository.findByEventId(member.getId()).forEach(mention -> timeline.add(new TimelineEntryDto(
                    mention.getMentionDate(),
                    member.getId(),
                    member.getCanonicalName(),
                    mention.getArticleCount(),
                    mention.getDocIds().size())));
        }
        timeline.sort(Comparator.comparing(TimelineEntryDto::getDate)
                .thenComparing(entry -> entry.getCanonicalEventId().toString()));
        return timeline;
    }

    public List<String> getDocumentIds(UUID masterId) {
        List<UUID> ids = groupOf(masterId).stream().map(CanonicalEvent::getId).toList();
        return mentionRepository.findDocIdsForEvents(ids);
    }

    public List<MultiDayEventDto> listMultiDayEvents(String country, int limit) {
        return mentionRepository.findMultiDayMasters(country, PageRequest.of(0, Math.max(1, limit)));
    }

    public List<MentionDto> findMentions(String country, LocalDate startDate, LocalDate endDate) {
        return mentionRepository.findByCountryAndDateRange(country, startDate, endDate).stream()
                .map(MentionDto::from)
                .toList();
    }

    private List<CanonicalEvent> groupOf(UUID masterId) {
        CanonicalEvent master = eventRepository.findById(masterId)
                .filter(CanonicalEvent::isMaster)
                .orElseThrow(() -> new NoSuchElementException("Master event not found: " + masterId));
        List<CanonicalEvent> members = new ArrayList<>();
        members.add(master);
        members.addAll(eventRepository.findByMasterEventIdOrderByFirstMentionDateAscIdAsc(masterId));
        return members;
    }
}
