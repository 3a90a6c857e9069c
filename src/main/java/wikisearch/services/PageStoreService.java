package wikisearch.services;

import wikisearch.model.Page;

import java.util.List;
import java.util.stream.Stream;

public interface PageStoreService {

    /**
     * Inserts the page or overwrites the stored page with the same url.
     *
     * @throws wikisearch.exception.InvalidPageDataException if url, title or content is empty
     */
    Page upsertPage(Page page);

    long countPages();

    /**
     * Streams every stored page. Must be consumed inside a read transaction.
     */
    Stream<Page> streamAll();

    List<Page> findByContentContaining(String fragment);
}
