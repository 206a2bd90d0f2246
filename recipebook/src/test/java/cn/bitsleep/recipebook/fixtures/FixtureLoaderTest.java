package cn.bitsleep.recipebook.fixtures;

import cn.bitsleep.recipebook.repo.CategoryRepository;
import cn.bitsleep.recipebook.repo.TagRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.*;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.test.util.ReflectionTestUtils;

import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class FixtureLoaderTest {

    @Mock
    private UserFixtures userFixtures;
    @Mock
    private CategoryFixtures categoryFixtures;
    @Mock
    private TagFixtures tagFixtures;
    @Mock
    private CategoryRepository categoryRepository;
    @Mock
    private TagRepository tagRepository;

    @InjectMocks
    private FixtureLoader fixtureLoader;

    @Test
    @DisplayName("run: does nothing unless enabled")
    void run_disabled_noop() {
        ReflectionTestUtils.setField(fixtureLoader, "enabled", false);

        fixtureLoader.run(new DefaultApplicationArguments());

        verifyNoInteractions(userFixtures, categoryFixtures, tagFixtures, categoryRepository, tagRepository);
    }

    @Test
    @DisplayName("run: seeds empty tables and skips filled ones")
    void run_enabled_seedsEmptyTables() {
        ReflectionTestUtils.setField(fixtureLoader, "enabled", true);
        when(categoryRepository.count()).thenReturn(0L);
        when(tagRepository.count()).thenReturn(100L);

        fixtureLoader.run(new DefaultApplicationArguments());

        verify(userFixtures).load();
        verify(categoryFixtures).load();
        verify(tagFixtures, never()).load();
    }
}
