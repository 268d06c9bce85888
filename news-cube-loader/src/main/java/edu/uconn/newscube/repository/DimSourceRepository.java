package edu.uconn.newscube.repository;

import edu.uconn.newscube.entity.DimSource;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface DimSourceRepository extends JpaRepository<DimSource, Integer> {

    Optional<DimSource> findBySourceName(String sourceName);

    List<DimSource> findBySourceType(String sourceType);
}
