package cn.bitsleep.recipebook.fixtures;

import cn.bitsleep.recipebook.domain.Category;
import cn.bitsleep.recipebook.repo.CategoryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.datafaker.Faker;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Component
@RequiredArgsConstructor
@Slf4j
public class CategoryFixtures {

    static final int COUNT = 20;

    private final CategoryRepository categoryRepository;
    private final Faker faker = new Faker();

    @Transactional
    public List<Category> load() {
        // titles are unique in the table
        Set<String> titles = new LinkedHashSet<>();
        while (titles.size() < COUNT) {
            String title = faker.food().dish();
            if (title.length() >= 3 && title.length() <= 64) titles.add(title);
        }
        List<Category> saved = categoryRepository.saveAll(titles.stream()
                .map(t -> Category.builder().title(t).build())
                .toList());
        log.info("Loaded {} category fixtures", saved.size());
        return saved;
    }
}
