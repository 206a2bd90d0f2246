package cn.bitsleep.recipebook.web.dto;

import cn.bitsleep.recipebook.domain.Category;
import cn.bitsleep.recipebook.domain.Recipe;
import cn.bitsleep.recipebook.domain.Tag;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

@Getter
@Builder
@AllArgsConstructor
public class RecipeDto {
    private Long id;
    private String title;
    private String content;
    private Ref category;
    private List<Ref> tags;
    private Long authorId;
    private String authorEmail;
    private Instant createdAt;
    private Instant updatedAt;

    public static RecipeDto from(Recipe recipe) {
        Category c = recipe.getCategory();
        return RecipeDto.builder()
                .id(recipe.getId())
                .title(recipe.getTitle())
                .content(recipe.getContent())
                .category(c == null ? null : new Ref(c.getId(), c.getTitle()))
                .tags(recipe.getTags().stream()
                        .sorted(Comparator.comparing(Tag::getTitle))
                        .map(t -> new Ref(t.getId(), t.getTitle()))
                        .toList())
                .authorId(recipe.getAuthor() == null ? null : recipe.getAuthor().getId())
                .authorEmail(recipe.getAuthor() == null ? null : recipe.getAuthor().getEmail())
                .createdAt(recipe.getCreatedAt())
                .updatedAt(recipe.getUpdatedAt())
                .build();
    }

    @Getter
    @AllArgsConstructor
    public static class Ref {
        private Long id;
        private String title;
    }
}
