package cn.bitsleep.recipebook.fixtures;

import cn.bitsleep.recipebook.domain.Tag;
import cn.bitsleep.recipebook.repo.TagRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.datafaker.Faker;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Demo tags: one random word each, creation and update time picked independently within the last 100 days.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TagFixtures {

    static final int COUNT = 100;

    private final TagRepository tagRepository;
    private final Faker faker = new Faker();

    @Transactional
    public List<Tag> load() {
        Instant now = Instant.now();
        long from = now.minus(100, ChronoUnit.DAYS).toEpochMilli();
        long to = now.minus(1, ChronoUnit.DAYS).toEpochMilli();

        List<Tag> tags = new ArrayList<>(COUNT);
        for (int i = 0; i < COUNT; i++) {
            tags.add(Tag.builder()
                    .title(faker.lorem().word())
                    .createdAt(randomInstant(from, to))
                    .updatedAt(randomInstant(from, to))
                    .build());
        }
        // one batch, one commit
        List<Tag> saved = tagRepository.saveAll(tags);
        log.info("Loaded {} tag fixtures", saved.size());
        return saved;
    }

    private Instant randomInstant(long fromMillis, long toMillis) {
        return Instant.ofEpochMilli(faker.number().numberBetween(fromMillis, toMillis));
    }
}
