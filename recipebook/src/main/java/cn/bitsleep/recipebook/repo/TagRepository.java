package cn.bitsleep.recipebook.repo;

import cn.bitsleep.recipebook.domain.Tag;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface TagRepository extends JpaRepository<Tag, Long> {
    List<Tag> findAllByOrderByTitleAsc();

    @Modifying
    @Query(value = "DELETE FROM recipe_tag WHERE tag_id = :tagId", nativeQuery = true)
    int detachFromRecipes(@Param("tagId") Long tagId);
}
