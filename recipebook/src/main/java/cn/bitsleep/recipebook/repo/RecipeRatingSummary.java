package cn.bitsleep.recipebook.repo;

/**
 * Aggregate row returned by {@link RecipeRepository#findTopRatedRecipes}.
 */
public interface RecipeRatingSummary {
    Long getRecipeId();
    Double getAverageScore();
    Long getRatingCount();
}
