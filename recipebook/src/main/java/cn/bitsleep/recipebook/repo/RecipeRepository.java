package cn.bitsleep.recipebook.repo;

import cn.bitsleep.recipebook.domain.Recipe;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface RecipeRepository extends JpaRepository<Recipe, Long> {

    // authorId null means every author
    @Query(value = """
            SELECT DISTINCT r FROM Recipe r
            LEFT JOIN r.tags t
            WHERE ( :authorId IS NULL OR r.author.id = :authorId )
              AND ( :categoryId IS NULL OR r.category.id = :categoryId )
              AND ( :tagId IS NULL OR t.id = :tagId )
            """,
            countQuery = """
            SELECT COUNT(DISTINCT r) FROM Recipe r
            LEFT JOIN r.tags t
            WHERE ( :authorId IS NULL OR r.author.id = :authorId )
              AND ( :categoryId IS NULL OR r.category.id = :categoryId )
              AND ( :tagId IS NULL OR t.id = :tagId )
            """)
    Page<Recipe> findFiltered(@Param("authorId") Long authorId,
                              @Param("categoryId") Long categoryId,
                              @Param("tagId") Long tagId,
                              Pageable pageable);

    boolean existsByCategoryId(Long categoryId);

    @Query("""
            SELECT rt.recipe.id AS recipeId,
                   AVG(rt.score) AS averageScore,
                   COUNT(rt) AS ratingCount
            FROM Rating rt
            GROUP BY rt.recipe.id
            ORDER BY AVG(rt.score) DESC, COUNT(rt) DESC, rt.recipe.id ASC
            """)
    List<RecipeRatingSummary> findTopRatedRecipes(Pageable pageable);
}
