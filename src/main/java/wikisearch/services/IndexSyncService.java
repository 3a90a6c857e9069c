package wikisearch.services;

import wikisearch.dto.response.SyncReport;

public interface IndexSyncService {

    /**
     * Rebuilds the search index from the page store.
     *
     * @throws wikisearch.exception.IndexSyncException if the index could not be checked, deleted or created
     */
    SyncReport synchronize();
}
