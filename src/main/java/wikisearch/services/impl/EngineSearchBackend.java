package wikisearch.services.impl;

import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import wikisearch.config.SearchEngineConfig;
import wikisearch.dto.index.PageDocument;
import wikisearch.dto.search.SearchHit;
import wikisearch.exception.SearchFailedException;
import wikisearch.services.PageIndexGateway;
import wikisearch.services.SearchBackend;
import wikisearch.services.SearchBackendType;
import wikisearch.util.SnippetBuilder;

import java.io.IOException;
import java.util.List;

/**
 * Relevance search in the engine index, title weighted highest, then url, then content.
 */
@Slf4j
@RequiredArgsConstructor
public class EngineSearchBackend implements SearchBackend {
    private static final String INDEX_NOT_FOUND = "index_not_found_exception";

    private final PageIndexGateway pageIndexGateway;
    private final SearchEngineConfig searchEngineConfig;

    @Override
    public SearchBackendType type() {
        return SearchBackendType.ENGINE;
    }

    @Override
    public List<SearchHit> search(String query) {
        List<PageDocument> documents;
        try {
            documents = pageIndexGateway.search(searchEngineConfig.getIndexName(), query, searchEngineConfig.getMaxHits());
        } catch (ElasticsearchException e) {
            if (isMissingIndex(e)) {
                // the index is dropped and recreated on every sync
                log.warn("Index '{}' not found, returning no hits for '{}'", searchEngineConfig.getIndexName(), query);
                return List.of();
            }
            throw new SearchFailedException("Error searching index '" + searchEngineConfig.getIndexName() + "'", e);
        } catch (IOException e) {
            throw new SearchFailedException("Error searching index '" + searchEngineConfig.getIndexName() + "'", e);
        }
        log.debug("Engine returned {} hits for query '{}'", documents.size(), query);

        return documents.stream()
                .map(doc -> new SearchHit(doc.getTitle(), doc.getUrl(),
                        SnippetBuilder.build(doc.getContent(), query, searchEngineConfig.getSnippetLength())))
                .toList();
    }

    private boolean isMissingIndex(ElasticsearchException e) {
        return e.status() == 404 || INDEX_NOT_FOUND.equals(e.error().type());
    }
}
