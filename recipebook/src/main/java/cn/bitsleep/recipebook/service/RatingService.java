package cn.bitsleep.recipebook.service;

import cn.bitsleep.recipebook.domain.Rating;
import cn.bitsleep.recipebook.domain.Recipe;
import cn.bitsleep.recipebook.domain.User;
import cn.bitsleep.recipebook.repo.RatingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
@Slf4j
public class RatingService {

    private final RatingRepository repo;

    /**
     * Stores the score {@code user} gives {@code recipe}. A repeated rating replaces the previous score.
     */
    @Transactional
    public Rating rate(User user, Recipe recipe, int score) {
        Rating rating = repo.findByUserAndRecipe(user, recipe)
                .orElseGet(() -> Rating.builder().user(user).recipe(recipe).build());
        boolean update = rating.getId() != null;
        rating.setScore(score);
        Rating saved = repo.save(rating);
        log.info("{} rating {} of recipe {} by user {}: {}", update ? "Updated" : "Created",
                saved.getId(), recipe.getId(), user.getId(), score);
        return saved;
    }
}
