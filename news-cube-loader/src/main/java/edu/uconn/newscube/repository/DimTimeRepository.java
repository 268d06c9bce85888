package edu.uconn.newscube.repository;

import edu.uconn.newscube.entity.DimTime;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface DimTimeRepository extends JpaRepository<DimTime, Integer> {

    List<DimTime> findByYearOrderByDateKey(Integer year);
}
