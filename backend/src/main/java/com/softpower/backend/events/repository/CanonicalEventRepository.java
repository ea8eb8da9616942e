package com.softpower.backend.events.repository;

import com.softpower.backend.events.entity.CanonicalEvent;
import com.softpower.backend.integrity.dto.CountryMaterialityRow;
import jakarta.persistence.LockModeType;
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
public interface CanonicalEventRepository extends JpaRepository<CanonicalEvent, UUID> {

    // Validated masters of a country, the only rows consolidation touches
    @Query("""
            SELECT e FROM CanonicalEvent e
            WHERE e.country = :country AND e.masterEventId IS NULL AND e.llmValidated = true
            ORDER BY e.canonicalName, e.id
            """)
    List<CanonicalEvent> findValidatedMasters(@Param("country") String country);

    List<CanonicalEvent> findByMasterEventIdOrderByFirstMentionDateAscIdAsc(UUID masterEventId);

    // Consolidation only ever touches children in the master's own country
    List<CanonicalEvent> findByMasterEventIdAndCountryOrderByFirstMentionDateAscIdAsc(UUID masterEventId,
                                                                                    String country);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
            SELECT e FROM CanonicalEvent e
            WHERE e.masterEventId = :masterId AND e.country = :country
            ORDER BY e.firstMentionDate, e.id
            """)
    List<CanonicalEvent> findChildrenForUpdate(@Param("masterId") UUID masterId, @Param("country") String country);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT e FROM CanonicalEvent e WHERE e.id = :id")
    Optional<CanonicalEvent> findByIdForUpdate(@Param("id") UUID id);

    Long countByMasterEventId(UUID masterEventId);

    Long countByMasterEventIdIsNull();

    Long countByMasterEventIdIsNotNull();

    // Top masters by article volume
    @Query("SELECT e FROM CanonicalEvent e WHERE e.masterEventId IS NULL ORDER BY e.totalArticles DESC, e.id")
    List<CanonicalEvent> findTopMasters(Pageable pageable);

    @Query("""
            SELECT e FROM CanonicalEvent e
            WHERE e.masterEventId IS NULL AND e.country = :country
            ORDER BY e.totalArticles DESC, e.id
            """)
    List<CanonicalEvent> findTopMastersByCountry(@Param("country") String country, Pageable pageable);

    // Orphaned nodes: events without a single daily mention
    @Query("""
            SELECT COUNT(e) FROM CanonicalEvent e
            WHERE NOT EXISTS (SELECT m.id FROM DailyEventMention m WHERE m.canonicalEvent = e)
            """)
    Long countWithoutMentions();

    @Query("""
            SELECT COUNT(e) FROM CanonicalEvent e
            WHERE e.masterEventId IS NULL
              AND NOT EXISTS (SELECT m.id FROM DailyEventMention m WHERE m.canonicalEvent = e)
            """)
    Long countMastersWithoutMentions();

    @Query("""
            SELECT e FROM CanonicalEvent e
            WHERE NOT EXISTS (SELECT m.id FROM DailyEventMention m WHERE m.canonicalEvent = e)
            ORDER BY e.country, e.id
            """)
    List<CanonicalEvent> findWithoutMentions(Pageable pageable);

    // Children whose master row does not exist
    @Query("""
            SELECT COUNT(c) FROM CanonicalEvent c
            WHERE c.masterEventId IS NOT NULL
              AND NOT EXISTS (SELECT p.id FROM CanonicalEvent p WHERE p.id = c.masterEventId)
            """)
    Long countDanglingMasterReferences();

    @Query("""
            SELECT c FROM CanonicalEvent c
            WHERE c.masterEventId IS NOT NULL
              AND NOT EXISTS (SELECT p.id FROM CanonicalEvent p WHERE p.id = c.masterEventId)
            ORDER BY c.id
            """)
    List<CanonicalEvent> findDanglingMasterReferences(Pageable pageable);

    // Children whose master is itself a child
    @Query("""
            SELECT COUNT(c) FROM CanonicalEvent c
            WHERE EXISTS (SELECT p.id FROM CanonicalEvent p
                          WHERE p.id = c.masterEventId AND p.masterEventId IS NOT NULL)
            """)
    Long countNestedMasterReferences();

    @Query("""
            SELECT c FROM CanonicalEvent c
            WHERE EXISTS (SELECT p.id FROM CanonicalEvent p
                          WHERE p.id = c.masterEventId AND p.masterEventId IS NOT NULL)
            ORDER BY c.id
            """)
    List<CanonicalEvent> findNestedMasterReferences(Pageable pageable);

    // Children filed under a master of another country
    @Query("""
            SELECT COUNT(c) FROM CanonicalEvent c
            WHERE EXISTS (SELECT p.id FROM CanonicalEvent p
                          WHERE p.id = c.masterEventId AND p.country <> c.country)
            """)
    Long countCrossCountryMasterReferences();

    @Query("""
            SELECT c FROM CanonicalEvent c
            WHERE EXISTS (SELECT p.id FROM CanonicalEvent p
                          WHERE p.id = c.masterEventId AND p.country <> c.country)
            ORDER BY c.id
            """)
    List<CanonicalEvent> findCrossCountryMasterReferences(Pageable pageable);

    @Query("SELECT COUNT(e) FROM CanonicalEvent e WHERE e.materialScore IS NOT NULL AND e.materialScore > 0")
    Long countMaterialityScored();

    @Query("""
            SELECT new com.softpower.backend.integrity.dto.CountryMaterialityRow(
                e.country,
                COUNT(e),
                SUM(CASE WHEN e.materialScore IS NOT NULL AND e.materialScore > 0 THEN 1 ELSE 0 END))
            FROM CanonicalEvent e
            WHERE e.country IS NOT NULL
            GROUP BY e.country
            ORDER BY COUNT(e) DESC
            """)
    List<CountryMaterialityRow> summarizeMaterialityByCountry();
}
