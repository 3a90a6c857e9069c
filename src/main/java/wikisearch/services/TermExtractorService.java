package wikisearch.services;

import java.nio.file.Path;
import java.util.Set;

/**
 * Extracts search terms from the query log.
 */
public interface TermExtractorService {

    /**
     * Reads every line with a {@code query="..."} marker and returns the distinct terms,
     * trimmed and lowercased. A missing or unreadable file gives an empty set.
     *
     * @param logFile path to the query log
     * @return distinct normalized terms, in no particular order
     */
    Set<String> extractTerms(Path logFile);
}
