package wikisearch.services;

import wikisearch.dto.fetch.ResolvedPage;

import java.util.List;

public interface PageResolverService {

    /**
     * Tries the languages in order and returns the first article that was fetched with a title.
     *
     * @throws wikisearch.exception.NoPageFoundException when no language gives a valid page
     */
    ResolvedPage resolve(String term, List<String> languages);
}
