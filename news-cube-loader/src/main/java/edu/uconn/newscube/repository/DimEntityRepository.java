package edu.uconn.newscube.repository;

import edu.uconn.newscube.entity.DimEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface DimEntityRepository extends JpaRepository<DimEntity, Integer> {

    Optional<DimEntity> findByEntityName(String entityName);
}
