package wikisearch.services.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import wikisearch.exception.InvalidPageDataException;
import wikisearch.model.Page;
import wikisearch.repository.PageRepository;
import wikisearch.services.PageStoreService;

import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Stream;

@Slf4j
@Service
@RequiredArgsConstructor
public class PageStoreServiceImpl implements PageStoreService {
    private final PageRepository pageRepository;

    @Override
    @Transactional
    public Page upsertPage(Page page) {
        if (page == null || isBlank(page.getUrl()) || isBlank(page.getTitle()) || isBlank(page.getContent())) {
            throw new InvalidPageDataException();
        }

        String language = page.getLanguage() == null ? "" : page.getLanguage();
        LocalDateTime now = LocalDateTime.now();
        int inserted = pageRepository.insertIgnoreConflict(page.getUrl(), page.getTitle(), page.getContent(), language, now);
        if (inserted == 0) {
            pageRepository.updateContent(page.getUrl(), page.getTitle(), page.getContent(), language, now);
        }
        log.info("Saved page to DB [{}]: {}", language, page.getTitle());

        Page saved = new Page(page.getUrl(), page.getTitle(), page.getContent(), language);
        saved.setLastUpdated(now);
        return saved;
    }

    @Override
    public long countPages() {
        return pageRepository.count();
    }

    @Override
    public Stream<Page> streamAll() {
        return pageRepository.streamAll();
    }

    @Override
    @Transactional(readOnly = true)
    public List<Page> findByContentContaining(String fragment) {
        return pageRepository.findByContentContaining(fragment);
    }

    private boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
