package wikisearch.services.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import wikisearch.config.SearchEngineConfig;
import wikisearch.dto.search.SearchHit;
import wikisearch.exception.SearchFailedException;
import wikisearch.model.Page;
import wikisearch.services.PageStoreService;
import wikisearch.services.SearchBackend;
import wikisearch.services.SearchBackendType;
import wikisearch.util.SnippetBuilder;

import java.util.List;

/**
 * Case-sensitive substring match on page content, in storage order and without ranking.
 */
@Slf4j
@RequiredArgsConstructor
public class StoreScanSearchBackend implements SearchBackend {
    private final PageStoreService pageStoreService;
    private final SearchEngineConfig searchEngineConfig;

    @Override
    public SearchBackendType type() {
        return SearchBackendType.FALLBACK;
    }

    @Override
    public List<SearchHit> search(String query) {
        List<Page> pages;
        try {
            pages = pageStoreService.findByContentContaining(query);
        } catch (DataAccessException e) {
            throw new SearchFailedException("Error scanning page store", e);
        }
        log.debug("Store scan returned {} pages for query '{}'", pages.size(), query);

        return pages.stream()
                .map(page -> new SearchHit(page.getTitle(), page.getUrl(),
                        SnippetBuilder.build(page.getContent(), query, searchEngineConfig.getSnippetLength())))
                .toList();
    }
}
