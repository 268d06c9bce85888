package edu.uconn.newscube.repository;

import edu.uconn.newscube.entity.FactDocument;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for Fact_Document rows.
 */
@Repository
public interface FactDocumentRepository extends JpaRepository<FactDocument, Long> {

    Optional<FactDocument> findByDocumentId(String documentId);

    List<FactDocument> findByDateKey(Integer dateKey);

    /**
     * Count documents flagged with at least one matched tag
     */
    @Query("SELECT COUNT(f) FROM FactDocument f WHERE f.hasKeyEvent = 'Yes'")
    long countKeyEventDocuments();

    /**
     * Documents per source, for quick sanity checks after a load
     */
    @Query("SELECT COUNT(f) FROM FactDocument f WHERE f.sourceKey = :sourceKey")
    long countBySourceKey(@Param("sourceKey") Integer sourceKey);
}
