package edu.uconn.newscube.repository;

import edu.uconn.newscube.entity.BridgeFactTag;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for document-to-tag relationships.
 */
@Repository
public interface BridgeFactTagRepository extends JpaRepository<BridgeFactTag, Long> {

    List<BridgeFactTag> findByFactId(Long factId);

    /**
     * Count tagged documents for one tag
     */
    @Query("SELECT COUNT(DISTINCT b.factId) FROM BridgeFactTag b WHERE b.tagKey = :tagKey")
    long countDocumentsByTagKey(@Param("tagKey") Integer tagKey);
}
