package wikisearch.services.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import wikisearch.config.WikiSourceConfig;
import wikisearch.dto.fetch.FetchedPage;
import wikisearch.dto.fetch.ResolvedPage;
import wikisearch.exception.NoPageFoundException;
import wikisearch.exception.PageFetchException;
import wikisearch.services.PageFetcher;
import wikisearch.services.PageResolverService;
import wikisearch.util.WikiUrlBuilder;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class PageResolverServiceImpl implements PageResolverService {
    private final PageFetcher pageFetcher;
    private final WikiSourceConfig wikiSourceConfig;

    @Override
    public ResolvedPage resolve(String term, List<String> languages) {
        // one language at a time, the source is rate sensitive
        for (String language : languages) {
            String url = WikiUrlBuilder.buildArticleUrl(
                    wikiSourceConfig.getScheme(), wikiSourceConfig.hostFor(language), term);
            log.info("Trying to scrape: {}", url);
            try {
                FetchedPage page = pageFetcher.fetch(url, language);
                if (page.hasTitle()) {
                    return new ResolvedPage(page, language);
                }
                log.warn("Failed scraping '{}' ({}): page has no title", term, language);
            } catch (PageFetchException e) {
                log.warn("Failed scraping '{}' ({}): {}", term, language, e.getMessage());
            }
        }
        throw new NoPageFoundException(term);
    }
}
