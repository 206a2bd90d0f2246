package cn.bitsleep.recipebook.service;

import cn.bitsleep.recipebook.domain.Recipe;
import cn.bitsleep.recipebook.domain.User;
import cn.bitsleep.recipebook.repo.RecipeRatingSummary;
import cn.bitsleep.recipebook.repo.RecipeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class RecipeService {

    private final RecipeRepository repo;

    @Value("${recipebook.pagination.items-per-page:10}")
    private int itemsPerPage;

    @Value("${recipebook.top-rated.limit:10}")
    private int topRatedLimit;

    /**
     * Recipes written by {@code author}, newest first.
     *
     * @param page       1-based page number
     * @param categoryId optional category filter
     * @param tagId      optional tag filter
     */
    @Transactional(readOnly = true)
    public Page<Recipe> getPaginatedList(int page, User author, Long categoryId, Long tagId) {
        return repo.findFiltered(author.getId(), categoryId, tagId, pageable(page));
    }

    /**
     * Same as {@link #getPaginatedList} without the author restriction.
     */
    @Transactional(readOnly = true)
    public Page<Recipe> getAllPaginatedList(int page, Long categoryId, Long tagId) {
        return repo.findFiltered(null, categoryId, tagId, pageable(page));
    }

    public Optional<Recipe> findById(Long id) {
        return repo.findById(id);
    }

    @Transactional
    public Recipe save(Recipe recipe) {
        boolean created = recipe.getId() == null;
        Recipe saved = repo.save(recipe);
        log.info("{} recipe {} by author {}", created ? "Created" : "Updated", saved.getId(), saved.getAuthor().getId());
        return saved;
    }

    @Transactional
    public void delete(Recipe recipe) {
        repo.delete(recipe);
        log.info("Deleted recipe {}", recipe.getId());
    }

    @Transactional(readOnly = true)
    public List<TopRatedRecipe> findTopRatedRecipes() {
        List<RecipeRatingSummary> rows = repo.findTopRatedRecipes(PageRequest.of(0, topRatedLimit));
        if (rows.isEmpty()) return List.of();
        Map<Long, Recipe> byId = repo.findAllById(rows.stream().map(RecipeRatingSummary::getRecipeId).toList())
                .stream()
                .collect(Collectors.toMap(Recipe::getId, Function.identity()));
        // keep the ranking order of the aggregate query
        return rows.stream()
                .filter(row -> byId.containsKey(row.getRecipeId()))
                .map(row -> new TopRatedRecipe(byId.get(row.getRecipeId()), row.getAverageScore(), row.getRatingCount()))
                .toList();
    }

    // offsets past Integer.MAX_VALUE are rejected by JPA; such pages are empty anyway
    private Pageable pageable(int page) {
        int index = Math.min(Math.max(page, 1) - 1, Integer.MAX_VALUE / itemsPerPage);
        return PageRequest.of(index, itemsPerPage,
                Sort.by(Sort.Direction.DESC, "updatedAt").and(Sort.by(Sort.Direction.DESC, "id")));
    }
}
