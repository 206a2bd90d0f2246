package cn.bitsleep.recipebook.web;

import cn.bitsleep.recipebook.auth.AppUserDetails;
import cn.bitsleep.recipebook.auth.RecipeAccessPolicy;
import cn.bitsleep.recipebook.domain.Category;
import cn.bitsleep.recipebook.domain.Recipe;
import cn.bitsleep.recipebook.domain.Tag;
import cn.bitsleep.recipebook.service.CategoryService;
import cn.bitsleep.recipebook.service.RatingService;
import cn.bitsleep.recipebook.service.RecipeService;
import cn.bitsleep.recipebook.service.TagService;
import cn.bitsleep.recipebook.web.dto.PaginationDto;
import cn.bitsleep.recipebook.web.dto.RecipeDto;
import cn.bitsleep.recipebook.web.dto.TopRatedRecipeDto;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.MessageSource;
import org.springframework.context.i18n.LocaleContextHolder;
import org.springframework.data.domain.Page;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.validation.BindingResult;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Recipe pages: listing, detail, create, edit, delete, rating and the top rated list.
 */
@RestController
@RequestMapping("/recipe")
@RequiredArgsConstructor
@Slf4j
public class RecipeController {

    private static final String ID = "/{id:[1-9]\\d*}";
    private static final Map<String, List<String>> MISSING_FORM = Map.of("form", List.of("Form data is missing"));

    private final RecipeService recipeService;
    private final RatingService ratingService;
    private final CategoryService categoryService;
    private final TagService tagService;
    private final RecipeAccessPolicy accessPolicy;
    private final MessageSource messageSource;

    // recipe_index
    @GetMapping
    public ResponseEntity<Map<String, Object>> index(
            @RequestParam(required = false) String categoryId,
            @RequestParam(required = false) String tagId,
            @RequestParam(required = false) String page,
            @AuthenticationPrincipal AppUserDetails principal) {
        Long category = digits(categoryId);
        Long tag = digits(tagId);
        Long requestedPage = digits(page);
        int pageNo = requestedPage == null || requestedPage < 1 ? 1 : (int) Math.min(requestedPage, Integer.MAX_VALUE);

        Page<Recipe> pagination = (principal == null || principal.isAdmin())
                ? recipeService.getAllPaginatedList(pageNo, category, tag)
                : recipeService.getPaginatedList(pageNo, principal.getUser(), category, tag);

        Map<String, Object> model = new LinkedHashMap<>();
        model.put("pagination", PaginationDto.from(pagination));
        model.put("categories", categoryService.findAll());
        model.put("tags", tagService.findAll());
        return Responses.render("recipe/index", model);
    }

    // recipe_top-rated
    @GetMapping("/top-rated")
    public ResponseEntity<Map<String, Object>> topRated() {
        List<TopRatedRecipeDto> recipes = recipeService.findTopRatedRecipes().stream()
                .map(TopRatedRecipeDto::from)
                .toList();
        return Responses.render("recipe/top_rated", Map.of("recipes", recipes));
    }

    // recipe_show
    @GetMapping(ID)
    public ResponseEntity<Map<String, Object>> show(@PathVariable Long id,
                                                    @AuthenticationPrincipal AppUserDetails principal) {
        Optional<Recipe> recipe = accessibleRecipe(id, principal);
        if (recipe.isEmpty()) return recordNotFound();
        return Responses.render("recipe/show", Map.of("recipe", RecipeDto.from(recipe.get())));
    }

    // recipe_create
    @GetMapping("/create")
    public ResponseEntity<Map<String, Object>> createForm(@AuthenticationPrincipal AppUserDetails principal) {
        if (principal == null) return loginRequired();
        return Responses.render("recipe/create", Map.of("form", new RecipeForm()));
    }

    @PostMapping("/create")
    public ResponseEntity<Map<String, Object>> create(@Valid @RequestBody(required = false) RecipeForm form,
                                                      BindingResult errors,
                                                      @AuthenticationPrincipal AppUserDetails principal) {
        if (principal == null) return loginRequired();
        if (form == null) {
            return Responses.renderInvalid("recipe/create", Map.of("form", new RecipeForm()), MISSING_FORM);
        }

        Recipe recipe = new Recipe();
        recipe.setAuthor(principal.getUser());
        if (!bind(form, errors, recipe)) {
            return Responses.renderInvalid("recipe/create", Map.of("form", form), Responses.errors(errors));
        }
        recipeService.save(recipe);
        return Responses.redirect(Route.RECIPE_INDEX, Flash.success(trans("message.created_successfully")));
    }

    // recipe_edit
    @GetMapping(ID + "/edit")
    public ResponseEntity<Map<String, Object>> editForm(@PathVariable Long id,
                                                        @AuthenticationPrincipal AppUserDetails principal) {
        Optional<Recipe> recipe = accessibleRecipe(id, principal);
        if (recipe.isEmpty()) return recordNotFound();
        return Responses.render("recipe/edit", Map.of(
                "form", RecipeForm.from(recipe.get()),
                "recipe", RecipeDto.from(recipe.get())));
    }

    @PutMapping(ID + "/edit")
    public ResponseEntity<Map<String, Object>> edit(@PathVariable Long id,
                                                    @Valid @RequestBody(required = false) RecipeForm form,
                                                    BindingResult errors,
                                                    @AuthenticationPrincipal AppUserDetails principal) {
        Optional<Recipe> found = accessibleRecipe(id, principal);
        if (found.isEmpty()) return recordNotFound();

        Recipe recipe = found.get();
        if (form == null) {
            return Responses.renderInvalid("recipe/edit",
                    Map.of("form", RecipeForm.from(recipe), "recipe", RecipeDto.from(recipe)), MISSING_FORM);
        }
        if (!bind(form, errors, recipe)) {
            return Responses.renderInvalid("recipe/edit",
                    Map.of("form", form, "recipe", RecipeDto.from(recipe)), Responses.errors(errors));
        }
        recipeService.save(recipe);
        return Responses.redirect(Route.RECIPE_INDEX, Flash.success(trans("message.edited_successfully")));
    }

    // recipe_delete
    @GetMapping(ID + "/delete")
    public ResponseEntity<Map<String, Object>> deleteForm(@PathVariable Long id,
                                                          @AuthenticationPrincipal AppUserDetails principal) {
        Optional<Recipe> recipe = accessibleRecipe(id, principal);
        if (recipe.isEmpty()) return recordNotFound();
        return Responses.render("recipe/delete", Map.of(
                "form", new DeleteForm(recipe.get().getId()),
                "recipe", RecipeDto.from(recipe.get())));
    }

    @DeleteMapping(ID + "/delete")
    public ResponseEntity<Map<String, Object>> delete(@PathVariable Long id,
                                                      @RequestBody(required = false) DeleteForm form,
                                                      @AuthenticationPrincipal AppUserDetails principal) {
        Optional<Recipe> found = accessibleRecipe(id, principal);
        if (found.isEmpty()) return recordNotFound();

        Recipe recipe = found.get();
        if (form == null || !recipe.getId().equals(form.getId())) {
            return Responses.renderInvalid("recipe/delete",
                    Map.of("form", new DeleteForm(recipe.getId()), "recipe", RecipeDto.from(recipe)),
                    Map.of("id", List.of("Confirmation does not match this recipe")));
        }
        recipeService.delete(recipe);
        return Responses.redirect(Route.RECIPE_INDEX, Flash.success(trans("message.deleted_successfully")));
    }

    // recipe_rate
    @GetMapping(ID + "/rate")
    public ResponseEntity<Map<String, Object>> rateForm(@PathVariable Long id,
                                                        @AuthenticationPrincipal AppUserDetails principal) {
        if (principal == null) throw new AccessDeniedException(trans("message.access_denied"));
        Optional<Recipe> recipe = recipeService.findById(id);
        if (recipe.isEmpty()) return recordNotFound();
        return Responses.render("recipe/rate", Map.of(
                "form", new RatingForm(),
                "recipe", RecipeDto.from(recipe.get())));
    }

    @PostMapping(ID + "/rate")
    public ResponseEntity<Map<String, Object>> rate(@PathVariable Long id,
                                                    @Valid @RequestBody(required = false) RatingForm form,
                                                    BindingResult errors,
                                                    @AuthenticationPrincipal AppUserDetails principal) {
        if (principal == null) throw new AccessDeniedException(trans("message.access_denied"));
        Optional<Recipe> recipe = recipeService.findById(id);
        if (recipe.isEmpty()) return recordNotFound();

        if (form == null) {
            return Responses.renderInvalid("recipe/rate",
                    Map.of("form", new RatingForm(), "recipe", RecipeDto.from(recipe.get())), MISSING_FORM);
        }
        if (errors.hasErrors()) {
            return Responses.renderInvalid("recipe/rate",
                    Map.of("form", form, "recipe", RecipeDto.from(recipe.get())), Responses.errors(errors));
        }
        ratingService.rate(principal.getUser(), recipe.get(), form.getScore());
        return Responses.redirect(Route.RECIPE_INDEX, Flash.success(trans("message.rated_successfully")));
    }

    /**
     * Missing and inaccessible recipes are reported the same way, so the response never reveals
     * whether a recipe exists.
     */
    private Optional<Recipe> accessibleRecipe(Long id, AppUserDetails principal) {
        Optional<Recipe> recipe = recipeService.findById(id);
        if (recipe.isPresent() && !accessPolicy.canAccess(recipe.get(), principal)) {
            log.debug("Denied access to recipe {} for {}", id, principal == null ? "anonymous" : principal.getId());
            return Optional.empty();
        }
        return recipe;
    }

    private ResponseEntity<Map<String, Object>> recordNotFound() {
        return Responses.redirect(Route.RECIPE_INDEX, Flash.warning(trans("message.record_not_found")));
    }

    private ResponseEntity<Map<String, Object>> loginRequired() {
        return Responses.redirect(Route.APP_LOGIN, Flash.error(trans("message.access_denied")));
    }

    // Resolves category and tags; the recipe is only touched when the whole form is valid.
    private boolean bind(RecipeForm form, BindingResult errors, Recipe target) {
        Category category = null;
        if (form.getCategoryId() != null) {
            category = categoryService.findById(form.getCategoryId()).orElse(null);
            if (category == null) errors.rejectValue("categoryId", "unknown", "Unknown category");
        }
        List<Tag> tags = List.of();
        Set<Long> tagIds = form.getTagIds() == null ? Set.of() : new HashSet<>(form.getTagIds());
        if (!tagIds.isEmpty()) {
            tags = tagService.findAllById(tagIds);
            if (tags.size() != tagIds.size()) errors.rejectValue("tagIds", "unknown", "Unknown tag");
        }
        if (errors.hasErrors()) return false;

        target.setTitle(form.getTitle());
        target.setContent(form.getContent());
        target.setCategory(category);
        target.getTags().clear();
        target.getTags().addAll(tags);
        return true;
    }

    private String trans(String key) {
        return messageSource.getMessage(key, null, key, LocaleContextHolder.getLocale());
    }

    // digit strings only, anything else counts as absent
    static Long digits(String raw) {
        if (raw == null || raw.isEmpty() || raw.length() > 18) return null;
        for (int i = 0; i < raw.length(); i++) {
            char ch = raw.charAt(i);
            if (ch < '0' || ch > '9') return null;
        }
        return Long.valueOf(raw);
    }

    @Data
    @NoArgsConstructor
    public static class RecipeForm {
        @NotBlank @Size(min = 3, max = 255)
        private String title;
        @NotBlank
        private String content;
        @NotNull
        private Long categoryId;
        private List<@NotNull Long> tagIds = new ArrayList<>();

        // trimmed before validation so the length rule applies to what gets stored
        public void setTitle(String title) {
            this.title = title == null ? null : title.trim();
        }

        static RecipeForm from(Recipe recipe) {
            RecipeForm f = new RecipeForm();
            f.setTitle(recipe.getTitle());
            f.setContent(recipe.getContent());
            f.setCategoryId(recipe.getCategory() == null ? null : recipe.getCategory().getId());
            f.setTagIds(recipe.getTags().stream().map(Tag::getId).sorted().toList());
            return f;
        }
    }

    @Data
    @NoArgsConstructor
    public static class RatingForm {
        @NotNull @Min(1) @Max(5)
        private Integer score;
    }

    @Data
    @NoArgsConstructor
    public static class DeleteForm {
        private Long id;

        public DeleteForm(Long id) { this.id = id; }
    }
}
