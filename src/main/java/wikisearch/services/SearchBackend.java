package wikisearch.services;

import wikisearch.dto.search.SearchHit;

import java.util.List;

public interface SearchBackend {

    SearchBackendType type();

    List<SearchHit> search(String query);
}
