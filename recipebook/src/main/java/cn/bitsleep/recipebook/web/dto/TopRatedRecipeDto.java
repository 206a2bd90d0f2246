package cn.bitsleep.recipebook.web.dto;

import cn.bitsleep.recipebook.service.TopRatedRecipe;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class TopRatedRecipeDto {
    private Long id;
    private String title;
    private double averageScore;
    private long ratingCount;

    public static TopRatedRecipeDto from(TopRatedRecipe row) {
        return new TopRatedRecipeDto(row.getRecipe().getId(), row.getRecipe().getTitle(),
                row.getAverageScore(), row.getRatingCount());
    }
}
