package wikisearch.services;

import wikisearch.dto.search.SearchHit;

import java.util.List;

public interface SearchService {

    /**
     * @return matching pages, never {@code null}
     * @throws wikisearch.exception.SearchFailedException on transport or query errors
     */
    List<SearchHit> search(String query);

    SearchBackendType backendType();
}
