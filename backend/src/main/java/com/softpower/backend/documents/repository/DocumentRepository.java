package com.softpower.backend.documents.repository;

import com.softpower.backend.documents.entity.Document;
import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface DocumentRepository extends JpaRepository<Document, String> {

    // Which of the given ids actually exist (batch reference check)
    @Query("SELECT d.docId FROM Document d WHERE d.docId IN :docIds")
    List<String> findExistingDocIds(@Param("docIds") Collection<String> docIds);
}
