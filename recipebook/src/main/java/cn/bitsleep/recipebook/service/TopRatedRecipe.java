package cn.bitsleep.recipebook.service;

import cn.bitsleep.recipebook.domain.Recipe;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class TopRatedRecipe {
    private final Recipe recipe;
    private final double averageScore;
    private final long ratingCount;
}
