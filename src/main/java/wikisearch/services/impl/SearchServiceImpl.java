package wikisearch.services.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import wikisearch.dto.search.SearchHit;
import wikisearch.services.SearchBackend;
import wikisearch.services.SearchBackendType;
import wikisearch.services.SearchService;

import java.util.Collections;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class SearchServiceImpl implements SearchService {
    private final SearchBackend searchBackend;

    @Override
    public List<SearchHit> search(String query) {
        if (query == null || query.isBlank()) {
            return Collections.emptyList();
        }
        List<SearchHit> hits = searchBackend.search(query);
        log.info("Search '{}' via {} returned {} results", query, searchBackend.type(), hits.size());
        return hits;
    }

    @Override
    public SearchBackendType backendType() {
        return searchBackend.type();
    }
}
