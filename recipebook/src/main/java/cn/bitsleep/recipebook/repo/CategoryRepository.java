package cn.bitsleep.recipebook.repo;

import cn.bitsleep.recipebook.domain.Category;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface CategoryRepository extends JpaRepository<Category, Long> {
    List<Category> findAllByOrderByTitleAsc();
    Optional<Category> findByTitle(String title);
}
