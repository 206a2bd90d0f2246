package cn.bitsleep.recipebook.service;

import cn.bitsleep.recipebook.domain.Tag;
import cn.bitsleep.recipebook.repo.TagRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class TagService {
    private final TagRepository tagRepo;

    public List<Tag> findAll() { return tagRepo.findAllByOrderByTitleAsc(); }

    public List<Tag> findAllById(Collection<Long> ids) { return tagRepo.findAllById(ids); }

    @Transactional
    public Tag create(String title) {
        Tag tag = tagRepo.save(Tag.builder().title(title.trim()).build());
        log.info("Created tag {} '{}'", tag.getId(), tag.getTitle());
        return tag;
    }

    @Transactional
    public void rename(Long id, String newTitle) {
        Tag tag = tagRepo.findById(id).orElseThrow();
        tag.setTitle(newTitle.trim());
        tagRepo.save(tag);
    }

    @Transactional
    public void delete(Long id) {
        Tag tag = tagRepo.findById(id).orElseThrow();
        // drop the join rows first, recipes themselves stay
        int detached = tagRepo.detachFromRecipes(id);
        tagRepo.delete(tag);
        log.info("Deleted tag {} (detached from {} recipes)", id, detached);
    }
}
