package wikisearch.services.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Connection;
import org.jsoup.HttpStatusException;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;
import wikisearch.config.ConnectionConfig;
import wikisearch.config.WikiSourceConfig;
import wikisearch.dto.fetch.FetchedPage;
import wikisearch.exception.CrossDomainRedirectException;
import wikisearch.exception.PageFetchException;
import wikisearch.exception.PageNotFoundException;
import wikisearch.services.PageFetcher;
import wikisearch.util.WikiUrlBuilder;

import java.io.IOException;
import java.net.SocketTimeoutException;

@Slf4j
@Component
@RequiredArgsConstructor
public class WikiPageFetcher implements PageFetcher {
    private static final String TITLE_SELECTOR = "#firstHeading";
    private static final String CONTENT_SELECTOR = "div.mw-parser-output";
    private static final String PARAGRAPH_SELECTOR = "p";

    private final WikiSourceConfig wikiSourceConfig;
    private final ConnectionConfig connectionConfig;

    @Override
    public FetchedPage fetch(String url, String language) throws PageFetchException {
        String allowedHost = wikiSourceConfig.hostFor(language);
        String currentUrl = url;

        for (int redirects = 0; redirects <= wikiSourceConfig.getMaxRedirects(); redirects++) {
            checkAllowedHost(currentUrl, allowedHost);
            Connection.Response response = executeRequest(currentUrl);
            int statusCode = response.statusCode();

            if (isRedirect(statusCode)) {
                String location = response.header("Location");
                if (location == null || location.isBlank()) {
                    throw new PageFetchException("Redirect without location from " + currentUrl, statusCode);
                }
                currentUrl = WikiUrlBuilder.resolve(currentUrl, location);
                log.debug("Following redirect {} -> {}", response.url(), currentUrl);
                continue;
            }

            Document document;
            try {
                document = response.parse();
            } catch (IOException e) {
                throw new PageFetchException("Could not parse response from " + currentUrl, e);
            }
            return extractPage(document, url, language, statusCode);
        }

        throw new PageFetchException("Too many redirects for " + url);
    }

    FetchedPage extractPage(Document document, String url, String language, int statusCode) {
        Element heading = document.selectFirst(TITLE_SELECTOR);
        String title = heading == null ? "" : heading.text();

        StringBuilder content = new StringBuilder();
        for (Element container : document.select(CONTENT_SELECTOR)) {
            for (Element paragraph : container.select(PARAGRAPH_SELECTOR)) {
                content.append(paragraph.text()).append('\n');
            }
        }

        return FetchedPage.builder()
                .url(url)
                .title(title)
                .content(content.toString())
                .language(language)
                .statusCode(statusCode)
                .build();
    }

    protected Connection.Response execute(String url) throws IOException {
        return getConnection(url).execute();
    }

    private Connection.Response executeRequest(String url) throws PageFetchException {
        try {
            return execute(url);
        } catch (HttpStatusException e) {
            if (e.getStatusCode() == 404) {
                throw new PageNotFoundException(url);
            }
            throw new PageFetchException("HTTP error " + e.getStatusCode() + " fetching " + url, e.getStatusCode());
        } catch (SocketTimeoutException e) {
            throw new PageFetchException("Timeout fetching " + url, e);
        } catch (IOException e) {
            throw new PageFetchException("Error fetching " + url + ": " + e.getMessage(), e);
        }
    }

    private Connection getConnection(String url) {
        return Jsoup.connect(url)
                .userAgent(connectionConfig.getUserAgent())
                .referrer(connectionConfig.getReferer())
                .timeout(connectionConfig.getTimeout())
                .followRedirects(false)
                .maxBodySize(0);
    }

    private void checkAllowedHost(String url, String allowedHost) throws CrossDomainRedirectException {
        String host = WikiUrlBuilder.getHost(url);
        if (host == null || !host.equalsIgnoreCase(allowedHost)) {
            throw new CrossDomainRedirectException(url, allowedHost);
        }
    }

    private boolean isRedirect(int statusCode) {
        return statusCode >= 300 && statusCode < 400;
    }
}
