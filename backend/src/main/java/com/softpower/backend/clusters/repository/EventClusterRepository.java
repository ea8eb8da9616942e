package com.softpower.backend.clusters.repository;

import com.softpower.backend.clusters.entity.EventCluster;
import com.softpower.backend.integrity.dto.CountryClusterRow;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

@Repository
public interface EventClusterRepository extends JpaRepository<EventCluster, UUID> {

    // Clusters the upstream producer wrote without any source documents
    @Query("SELECT COUNT(c) FROM EventCluster c WHERE c.docIds IS EMPTY")
    Long countWithoutDocuments();

    @Query("SELECT c FROM EventCluster c WHERE c.docIds IS EMPTY ORDER BY c.clusterDate, c.id")
    List<EventCluster> findWithoutDocuments(Pageable pageable);

    Long countByProcessed(Boolean processed);

    Long countByLlmDeconflicted(Boolean llmDeconflicted);

    @Query("""
            SELECT new com.softpower.backend.integrity.dto.CountryClusterRow(
                c.country,
                COUNT(c),
                SUM(CASE WHEN c.processed = true THEN 1 ELSE 0 END),
                SUM(CASE WHEN c.llmDeconflicted = true THEN 1 ELSE 0 END))
            FROM EventCluster c
            GROUP BY c.country
            ORDER BY COUNT(c) DESC
            """)
    List<CountryClusterRow> summarizeByCountry();
}
