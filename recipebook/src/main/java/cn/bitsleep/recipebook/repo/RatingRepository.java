package cn.bitsleep.recipebook.repo;

import cn.bitsleep.recipebook.domain.Rating;
import cn.bitsleep.recipebook.domain.Recipe;
import cn.bitsleep.recipebook.domain.User;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface RatingRepository extends JpaRepository<Rating, Long> {
    Optional<Rating> findByUserAndRecipe(User user, Recipe recipe);
}
