package com.softpower.backend.events.repository;

import com.softpower.backend.events.dto.MultiDayEventDto;
import com.softpower.backend.events.entity.CanonicalEvent;
import com.softpower.backend.events.entity.DailyEventMention;
import jakarta.persistence.LockModeType;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface DailyEventMentionRepository extends JpaRepository<DailyEventMention, UUID> {

    @Query("SELECT m FROM DailyEventMention m WHERE m.canonicalEvent.id = :eventId ORDER BY m.mentionDate")
    List<DailyEventMention> findByEventId(@Param("eventId") UUID eventId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT m FROM DailyEventMention m WHERE m.canonicalEvent = :event ORDER BY m.mentionDate")
    List<DailyEventMention> findByEventForUpdate(@Param("event") CanonicalEvent event);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT m FROM DailyEventMention m WHERE m.canonicalEvent = :event AND m.mentionDate = :mentionDate")
    Optional<DailyEventMention> findOnDateForUpdate(@Param("event") CanonicalEvent event,
                                                    @Param("mentionDate") LocalDate mentionDate);

    @Query("SELECT COUNT(m) FROM DailyEventMention m WHERE m.canonicalEvent = :event")
    Long countByEvent(@Param("event") CanonicalEvent event);

    @Query("SELECT m.mentionDate FROM DailyEventMention m WHERE m.canonicalEvent = :event")
    List<LocalDate> findMentionDates(@Param("event") CanonicalEvent event);

    // Downstream read surface
    @Query("""
            SELECT m FROM DailyEventMention m
            WHERE m.country = :country AND m.mentionDate BETWEEN :startDate AND :endDate
            ORDER BY m.mentionDate, m.id
            """)
    List<DailyEventMention> findByCountryAndDateRange(@Param("country") String country,
                                                      @Param("startDate") LocalDate startDate,
                                                      @Param("endDate") LocalDate endDate);

    @Query("""
            SELECT DISTINCT d FROM DailyEventMention m JOIN m.docIds d
            WHERE m.canonicalEvent.id IN :eventIds
            ORDER BY d
            """)
    List<String> findDocIdsForEvents(@Param("eventIds") Collection<UUID> eventIds);

    // Masters that now span more than one day
    @Query("""
            SELECT new com.softpower.backend.events.dto.MultiDayEventDto(
                e.id, e.canonicalName, COUNT(DISTINCT m.mentionDate),
                MIN(m.mentionDate), MAX(m.mentionDate), SUM(m.articleCount))
            FROM DailyEventMention m JOIN m.canonicalEvent e
            WHERE e.country = :country AND e.masterEventId IS NULL
            GROUP BY e.id, e.canonicalName
            HAVING COUNT(DISTINCT m.mentionDate) > 1
            ORDER BY COUNT(DISTINCT m.mentionDate) DESC, e.canonicalName
            """)
    List<MultiDayEventDto> findMultiDayMasters(@Param("country") String country, Pageable pageable);

    // Integrity checks
    @Query("SELECT COUNT(m) FROM DailyEventMention m WHERE m.docIds IS EMPTY")
    Long countWithoutDocuments();

    @Query("SELECT m FROM DailyEventMention m WHERE m.docIds IS EMPTY ORDER BY m.mentionDate, m.id")
    List<DailyEventMention> findWithoutDocuments(Pageable pageable);

    @Query("SELECT COUNT(m) FROM DailyEventMention m WHERE m.docIds IS NOT EMPTY")
    Long countWithDocuments();

    @Query("SELECT m FROM DailyEventMention m WHERE m.docIds IS NOT EMPTY ORDER BY m.id")
    List<DailyEventMention> findWithDocuments(Pageable pageable);
}
