package edu.uconn.newscube.repository;

import edu.uconn.newscube.entity.RejectedEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface RejectedEntityRepository extends JpaRepository<RejectedEntity, Long> {

    List<RejectedEntity> findAllByOrderByOccurrenceCountDescRejectedEntityAsc();
}
