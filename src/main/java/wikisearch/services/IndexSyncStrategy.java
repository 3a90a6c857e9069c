package wikisearch.services;

import wikisearch.dto.response.SyncReport;

/**
 * Brings the search index in line with the page store.
 */
public interface IndexSyncStrategy {

    SyncReport sync(String indexName);
}
