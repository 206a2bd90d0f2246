package cn.bitsleep.recipebook.auth;

import cn.bitsleep.recipebook.domain.Recipe;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Decides whether the acting identity may see or change a recipe: administrators always may,
 * other users only for recipes they wrote, anonymous callers never.
 */
@Component
public class RecipeAccessPolicy {

    public boolean canAccess(Recipe recipe, AppUserDetails principal) {
        if (recipe == null || principal == null) return false;
        if (principal.isAdmin()) return true;
        return recipe.getAuthor() != null && Objects.equals(recipe.getAuthor().getId(), principal.getId());
    }
}
