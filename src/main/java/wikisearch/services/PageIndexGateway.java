package wikisearch.services;

import wikisearch.dto.index.PageDocument;

import java.io.IOException;
import java.util.List;

/**
 * Operations on the search engine index that holds {@link PageDocument}s.
 */
public interface PageIndexGateway {

    boolean ping();

    boolean indexExists(String indexName) throws IOException;

    void deleteIndex(String indexName) throws IOException;

    void createIndex(String indexName) throws IOException;

    /**
     * Indexes one document and waits until it is searchable.
     */
    void indexDocument(String indexName, PageDocument document) throws IOException;

    long countDocuments(String indexName) throws IOException;

    List<PageDocument> search(String indexName, String query, int maxHits) throws IOException;
}
