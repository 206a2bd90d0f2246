package cn.bitsleep.recipebook.fixtures;

import cn.bitsleep.recipebook.repo.CategoryRepository;
import cn.bitsleep.recipebook.repo.TagRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Seeds demo data at startup when {@code recipebook.fixtures.enabled} is set.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FixtureLoader implements ApplicationRunner {

    private final UserFixtures userFixtures;
    private final CategoryFixtures categoryFixtures;
    private final TagFixtures tagFixtures;
    private final CategoryRepository categoryRepository;
    private final TagRepository tagRepository;

    @Value("${recipebook.fixtures.enabled:false}")
    private boolean enabled;

    @Override
    public void run(ApplicationArguments args) {
        if (!enabled) return;
        userFixtures.load();
        if (categoryRepository.count() == 0) categoryFixtures.load();
        else log.info("Categories present, skipping category fixtures");
        if (tagRepository.count() == 0) tagFixtures.load();
        else log.info("Tags present, skipping tag fixtures");
    }
}
