package cn.bitsleep.recipebook.web;

import cn.bitsleep.recipebook.domain.Category;
import cn.bitsleep.recipebook.domain.Tag;
import cn.bitsleep.recipebook.service.CategoryService;
import cn.bitsleep.recipebook.service.TagService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Categories and tags used to classify recipes. Reading is public, changes need an administrator.
 */
@RestController
@RequiredArgsConstructor
@Validated
public class CatalogController {

    private final CategoryService categoryService;
    private final TagService tagService;

    // ===== Categories =====
    @GetMapping("/category")
    public List<Category> listCategories() {
        return categoryService.findAll();
    }

    @PostMapping("/category")
    @PreAuthorize("hasRole('ADMIN')")
    public Category createCategory(@Valid @RequestBody CategoryReq req) {
        return categoryService.create(req.title);
    }

    @PatchMapping("/category/{id}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<?> renameCategory(@PathVariable Long id, @Valid @RequestBody CategoryReq req) {
        categoryService.rename(id, req.title);
        return ResponseEntity.ok(Map.of("id", id));
    }

    @DeleteMapping("/category/{id}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<?> deleteCategory(@PathVariable Long id) {
        categoryService.delete(id);
        return ResponseEntity.ok(Map.of("id", id));
    }

    // ===== Tags =====
    @GetMapping("/tag")
    public List<Tag> listTags() {
        return tagService.findAll();
    }

    @PostMapping("/tag")
    @PreAuthorize("hasRole('ADMIN')")
    public Tag createTag(@Valid @RequestBody TagReq req) {
        return tagService.create(req.title);
    }

    @PatchMapping("/tag/{id}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<?> renameTag(@PathVariable Long id, @Valid @RequestBody TagReq req) {
        tagService.rename(id, req.title);
        return ResponseEntity.ok(Map.of("id", id));
    }

    @DeleteMapping("/tag/{id}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<?> deleteTag(@PathVariable Long id) {
        tagService.delete(id);
        return ResponseEntity.ok(Map.of("id", id));
    }

    // ===== DTOs =====
    // titles are trimmed on binding, so the size limits see the stored value
    @Data public static class CategoryReq {
        @NotBlank @Size(min = 3, max = 64) public String title;
        public void setTitle(String title) { this.title = title == null ? null : title.trim(); }
    }
    @Data public static class TagReq {
        @NotBlank @Size(max = 64) public String title;
        public void setTitle(String title) { this.title = title == null ? null : title.trim(); }
    }
}
