package wikisearch.services.impl;

import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import wikisearch.dto.index.PageDocument;
import wikisearch.dto.response.SyncReport;
import wikisearch.exception.IndexSyncException;
import wikisearch.model.IndexState;
import wikisearch.model.Page;
import wikisearch.services.IndexSyncStrategy;
import wikisearch.services.PageIndexGateway;
import wikisearch.services.PageStoreService;

import java.io.IOException;
import java.util.Iterator;
import java.util.stream.Stream;

/**
 * Drops the index and loads every stored page again. Readers may see a missing or
 * half-filled index while this runs.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FullRebuildSyncStrategy implements IndexSyncStrategy {
    private final PageIndexGateway pageIndexGateway;
    private final PageStoreService pageStoreService;

    @Override
    @Transactional(readOnly = true)
    public SyncReport sync(String indexName) {
        IndexState state = IndexState.of(checkExists(indexName));

        if (state == IndexState.PRESENT) {
            log.info("Index '{}' already exists - removing and rebuilding", indexName);
            try {
                pageIndexGateway.deleteIndex(indexName);
            } catch (IOException | ElasticsearchException e) {
                throw new IndexSyncException("Error deleting index '" + indexName + "'", e);
            }
            state = state.delete();
        }

        try {
            pageIndexGateway.createIndex(indexName);
        } catch (IOException | ElasticsearchException e) {
            throw new IndexSyncException("Error creating index '" + indexName + "'", e);
        }
        state = state.create();
        log.debug("Index '{}' is {}", indexName, state);

        int indexed = 0;
        int failed = 0;
        try (Stream<Page> pages = pageStoreService.streamAll()) {
            Iterator<Page> iterator = pages.iterator();
            while (iterator.hasNext()) {
                Page page = iterator.next();
                try {
                    pageIndexGateway.indexDocument(indexName, PageDocument.from(page));
                    indexed++;
                    log.debug("Indexed page: {}", page.getUrl());
                } catch (IOException | ElasticsearchException e) {
                    failed++;
                    log.error("Error indexing {}: {}", page.getUrl(), e.getMessage());
                }
            }
        }

        log.info("Synced {} pages to index '{}', {} failed, index holds {} documents",
                indexed, indexName, failed, countDocuments(indexName));
        return new SyncReport(true, indexed, failed);
    }

    private String countDocuments(String indexName) {
        try {
            return String.valueOf(pageIndexGateway.countDocuments(indexName));
        } catch (IOException | ElasticsearchException e) {
            log.warn("Could not count documents in index '{}': {}", indexName, e.getMessage());
            return "unknown";
        }
    }

    private boolean checkExists(String indexName) {
        try {
            return pageIndexGateway.indexExists(indexName);
        } catch (IOException | ElasticsearchException e) {
            throw new IndexSyncException("Error checking if index '" + indexName + "' exists", e);
        }
    }
}
