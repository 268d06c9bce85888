package edu.uconn.newscube.repository;

import edu.uconn.newscube.entity.BridgeFactEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for document-to-entity relationships.
 */
@Repository
public interface BridgeFactEntityRepository extends JpaRepository<BridgeFactEntity, Long> {

    List<BridgeFactEntity> findByFactId(Long factId);

    /**
     * Total mentions of an entity across all documents
     */
    @Query("SELECT COALESCE(SUM(b.mentionCount), 0) FROM BridgeFactEntity b WHERE b.entityKey = :entityKey")
    long sumMentionsByEntityKey(@Param("entityKey") Integer entityKey);
}
