package cn.bitsleep.recipebook.fixtures;

import cn.bitsleep.recipebook.domain.Tag;
import cn.bitsleep.recipebook.repo.TagRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.*;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TagFixturesTest {

    @Mock
    private TagRepository tagRepository;

    @InjectMocks
    private TagFixtures tagFixtures;

    @Test
    @DisplayName("load: 100 titled tags backdated within the last 100 days, saved in one batch")
    void load_hundredTagsInOneBatch() {
        when(tagRepository.saveAll(anyIterable())).thenAnswer(inv -> inv.getArgument(0));
        Instant before = Instant.now();

        List<Tag> tags = tagFixtures.load();

        Instant after = Instant.now();
        assertEquals(100, tags.size());
        verify(tagRepository, times(1)).saveAll(anyIterable());
        verify(tagRepository, never()).save(any());
        for (Tag tag : tags) {
            assertNotNull(tag.getTitle());
            assertFalse(tag.getTitle().isBlank());
            assertWithinLastHundredDays(tag.getCreatedAt(), before, after);
            assertWithinLastHundredDays(tag.getUpdatedAt(), before, after);
        }
    }

    private static void assertWithinLastHundredDays(Instant value, Instant before, Instant after) {
        assertNotNull(value);
        assertFalse(value.isBefore(before.minus(100, ChronoUnit.DAYS)), "older than 100 days: " + value);
        assertFalse(value.isAfter(after.minus(1, ChronoUnit.DAYS)), "newer than one day: " + value);
    }
}
