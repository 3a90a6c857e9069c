package wikisearch.services;

import wikisearch.dto.response.IngestionReport;

public interface IngestionService {

    /**
     * One sequential pass over the terms found in the query log.
     */
    IngestionReport runIngestion();

    /**
     * Runs ingestion and rebuilds the index when new pages were stored.
     */
    IngestionReport runCycle();
}
