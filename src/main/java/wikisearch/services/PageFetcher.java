package wikisearch.services;

import wikisearch.dto.fetch.FetchedPage;
import wikisearch.exception.PageFetchException;

public interface PageFetcher {

    /**
     * Downloads one article and extracts its heading and paragraph text. Requests never leave
     * the host of the given language.
     *
     * @throws wikisearch.exception.PageNotFoundException when the article does not exist
     * @throws PageFetchException on any other transport or HTTP failure
     */
    FetchedPage fetch(String url, String language) throws PageFetchException;
}
