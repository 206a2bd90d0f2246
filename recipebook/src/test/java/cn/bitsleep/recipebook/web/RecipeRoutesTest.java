package cn.bitsleep.recipebook.web;

import cn.bitsleep.recipebook.auth.AppUserDetails;
import cn.bitsleep.recipebook.auth.AppUserDetailsService;
import cn.bitsleep.recipebook.auth.RecipeAccessPolicy;
import cn.bitsleep.recipebook.auth.SecurityConfig;
import cn.bitsleep.recipebook.auth.TokenService;
import cn.bitsleep.recipebook.domain.Category;
import cn.bitsleep.recipebook.domain.Recipe;
import cn.bitsleep.recipebook.domain.Role;
import cn.bitsleep.recipebook.domain.User;
import cn.bitsleep.recipebook.service.CategoryService;
import cn.bitsleep.recipebook.service.RatingService;
import cn.bitsleep.recipebook.service.RecipeService;
import cn.bitsleep.recipebook.service.TagService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/*
 * Routes of RecipeController through the dispatcher and the security filter chain:
 * path patterns, response statuses and headers, exception mapping.
 * Signed-in requests carry a bearer token the mocked TokenService accepts.
 */
@WebMvcTest(RecipeController.class)
@Import({SecurityConfig.class, RecipeAccessPolicy.class})
class RecipeRoutesTest {

    private static final String TOKEN = "Bearer owner-token";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private RecipeService recipeService;
    @MockBean
    private RatingService ratingService;
    @MockBean
    private CategoryService categoryService;
    @MockBean
    private TagService tagService;

    // security infrastructure
    @MockBean
    private TokenService tokenService;
    @MockBean
    private AppUserDetailsService userDetailsService;

    private User owner;
    private Recipe recipe;

    @BeforeEach
    void setUp() {
        owner = User.builder().id(1L).email("owner@example.com").roles(Set.of(Role.USER)).build();
        recipe = Recipe.builder()
                .id(5L)
                .title("Pancakes")
                .content("Mix and fry.")
                .category(Category.builder().id(7L).title("Desserts").build())
                .author(owner)
                .build();

        when(tokenService.validate("owner-token")).thenReturn(1L);
        when(userDetailsService.loadById(1L)).thenReturn(Optional.of(new AppUserDetails(owner)));
        when(recipeService.findById(5L)).thenReturn(Optional.of(recipe));
        when(recipeService.getAllPaginatedList(anyInt(), any(), any()))
                .thenReturn(new PageImpl<>(List.of(recipe), PageRequest.of(0, 10), 1));
    }

    @Nested
    class Routing {

        @Test
        @DisplayName("GET /recipe is public and renders the listing")
        void index_public() throws Exception {
            mockMvc.perform(get("/recipe"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.view").value("recipe/index"))
                    .andExpect(jsonPath("$.model.pagination.items[0].id").value(5));
        }

        @Test
        @DisplayName("GET /recipe/top-rated is not taken for a recipe id")
        void topRated_resolvedBeforeId() throws Exception {
            when(recipeService.findTopRatedRecipes()).thenReturn(List.of());

            mockMvc.perform(get("/recipe/top-rated"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.view").value("recipe/top_rated"));

            verify(recipeService, never()).findById(any());
        }

        @Test
        @DisplayName("ids with a leading zero or zero itself match no route")
        void idPattern_rejectsLeadingZero() throws Exception {
            mockMvc.perform(get("/recipe/05")).andExpect(status().isNotFound());
            mockMvc.perform(get("/recipe/0/edit")).andExpect(status().isNotFound());
            mockMvc.perform(get("/recipe/05/rate").header(HttpHeaders.AUTHORIZATION, TOKEN))
                    .andExpect(status().isNotFound());

            verify(recipeService, never()).findById(any());
        }
    }

    @Nested
    class Anonymous {

        @Test
        @DisplayName("GET /recipe/5 redirects with 303, a Location header and the not-found notice")
        void show_redirects() throws Exception {
            mockMvc.perform(get("/recipe/5"))
                    .andExpect(status().isSeeOther())
                    .andExpect(header().string(HttpHeaders.LOCATION, "/recipe"))
                    .andExpect(jsonPath("$.redirect").value("recipe_index"))
                    .andExpect(jsonPath("$.flashes[0].type").value("warning"))
                    .andExpect(jsonPath("$.flashes[0].message").value("Record not found."));
        }

        @Test
        @DisplayName("POST /recipe/3/rate is denied with 403, with or without a body")
        void rate_forbidden() throws Exception {
            mockMvc.perform(post("/recipe/3/rate"))
                    .andExpect(status().isForbidden())
                    .andExpect(jsonPath("$.error").value("ACCESS_DENIED"))
                    .andExpect(jsonPath("$.message").value("Access denied."));
            mockMvc.perform(post("/recipe/3/rate")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"score\":3}"))
                    .andExpect(status().isForbidden());

            verifyNoInteractions(ratingService);
        }

        @Test
        @DisplayName("POST /recipe/create without a body redirects to the login page")
        void create_redirectsToLogin() throws Exception {
            mockMvc.perform(post("/recipe/create"))
                    .andExpect(status().isSeeOther())
                    .andExpect(header().string(HttpHeaders.LOCATION, "/login"))
                    .andExpect(jsonPath("$.redirect").value("app_login"))
                    .andExpect(jsonPath("$.flashes[0].type").value("error"));

            verify(recipeService, never()).save(any());
        }
    }

    @Nested
    class SignedIn {

        @Test
        @DisplayName("GET /recipe/5 renders the recipe for its author")
        void show_author() throws Exception {
            mockMvc.perform(get("/recipe/5").header(HttpHeaders.AUTHORIZATION, TOKEN))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.view").value("recipe/show"))
                    .andExpect(jsonPath("$.model.recipe.title").value("Pancakes"));
        }

        @Test
        @DisplayName("POST /recipe/5/rate stores the score and redirects to the listing")
        void rate_valid() throws Exception {
            mockMvc.perform(post("/recipe/5/rate")
                            .header(HttpHeaders.AUTHORIZATION, TOKEN)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"score\":4}"))
                    .andExpect(status().isSeeOther())
                    .andExpect(header().string(HttpHeaders.LOCATION, "/recipe"))
                    .andExpect(jsonPath("$.flashes[0].message").value("Rated successfully."));

            verify(ratingService).rate(owner, recipe, 4);
        }

        @Test
        @DisplayName("POST /recipe/5/rate without a body is an invalid submission")
        void rate_missingBody() throws Exception {
            mockMvc.perform(post("/recipe/5/rate").header(HttpHeaders.AUTHORIZATION, TOKEN))
                    .andExpect(status().isUnprocessableEntity())
                    .andExpect(jsonPath("$.view").value("recipe/rate"))
                    .andExpect(jsonPath("$.errors.form").exists());

            verifyNoInteractions(ratingService);
        }

        @Test
        @DisplayName("POST /recipe/create rejects a title that is too short once trimmed")
        void create_paddedShortTitle() throws Exception {
            mockMvc.perform(post("/recipe/create")
                            .header(HttpHeaders.AUTHORIZATION, TOKEN)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"title\":\"  ab  \",\"content\":\"Stir.\",\"categoryId\":7}"))
                    .andExpect(status().isUnprocessableEntity())
                    .andExpect(jsonPath("$.errors.title").exists());

            verify(recipeService, never()).save(any());
        }

        @Test
        @DisplayName("PUT /recipe/5/edit without a body leaves the recipe untouched")
        void edit_missingBody() throws Exception {
            mockMvc.perform(put("/recipe/5/edit").header(HttpHeaders.AUTHORIZATION, TOKEN))
                    .andExpect(status().isUnprocessableEntity())
                    .andExpect(jsonPath("$.view").value("recipe/edit"));

            verify(recipeService, never()).save(any());
        }
    }
}
