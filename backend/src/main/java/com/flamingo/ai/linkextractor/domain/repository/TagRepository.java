package com.flamingo.ai.linkextractor.domain.repository;

import com.flamingo.ai.linkextractor.domain.entity.Tag;
import com.flamingo.ai.linkextractor.service.storage.TagCount;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

/** Repository for the tag catalogue. */
@Repository
public interface TagRepository extends JpaRepository<Tag, UUID> {

  Optional<Tag> findByName(String name);

  /** Every catalogue tag with the number of links carrying it, most used first. */
  @Query(
      "SELECT new com.flamingo.ai.linkextractor.service.storage.TagCount("
          + "t.name, t.category, COUNT(lt.id)) "
          + "FROM Tag t LEFT JOIN LinkTag lt ON lt.tag = t "
          + "GROUP BY t.id, t.name, t.category "
          + "ORDER BY COUNT(lt.id) DESC, t.name ASC")
  List<TagCount> findAllWithCounts();
}
