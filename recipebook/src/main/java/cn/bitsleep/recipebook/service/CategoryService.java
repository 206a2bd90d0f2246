package cn.bitsleep.recipebook.service;

import cn.bitsleep.recipebook.domain.Category;
import cn.bitsleep.recipebook.repo.CategoryRepository;
import cn.bitsleep.recipebook.repo.RecipeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class CategoryService {
    private final CategoryRepository repo;
    private final RecipeRepository recipeRepo;

    public List<Category> findAll() { return repo.findAllByOrderByTitleAsc(); }

    public Optional<Category> findById(Long id) { return repo.findById(id); }

    @Transactional
    public Category create(String title) {
        String t = title.trim();
        if (repo.findByTitle(t).isPresent()) throw new IllegalStateException("Category already exists: " + t);
        Category c = repo.save(Category.builder().title(t).build());
        log.info("Created category {} '{}'", c.getId(), t);
        return c;
    }

    @Transactional
    public void rename(Long id, String newTitle) {
        Category c = repo.findById(id).orElseThrow();
        String t = newTitle.trim();
        if (repo.findByTitle(t).filter(other -> !other.getId().equals(id)).isPresent()) {
            throw new IllegalStateException("Category already exists: " + t);
        }
        c.setTitle(t);
        repo.save(c);
        log.info("Renamed category {} to '{}'", id, t);
    }

    @Transactional
    public void delete(Long id) {
        Category c = repo.findById(id).orElseThrow();
        // recipes keep a hard reference to their category
        if (recipeRepo.existsByCategoryId(id)) throw new IllegalStateException("Category is in use");
        repo.delete(c);
        log.info("Deleted category {}", id);
    }
}
