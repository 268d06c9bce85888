package edu.uconn.newscube.repository;

import edu.uconn.newscube.entity.DimTag;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface DimTagRepository extends JpaRepository<DimTag, Integer> {

    List<DimTag> findByTagName(String tagName);

    List<DimTag> findByTagCategory(String tagCategory);
}
