package wikisearch.services.impl;

import org.jsoup.Connection;
import org.jsoup.HttpStatusException;
import org.jsoup.Jsoup;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import wikisearch.config.ConnectionConfig;
import wikisearch.config.WikiSourceConfig;
import wikisearch.dto.fetch.FetchedPage;
import wikisearch.exception.CrossDomainRedirectException;
import wikisearch.exception.PageFetchException;
import wikisearch.exception.PageNotFoundException;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class WikiPageFetcherTest {
    private static final String URL = "https://en.wikipedia.org/wiki/Golang";
    private static final String ARTICLE_HTML = """
            <html><body>
              <h1 id="firstHeading">Go (programming language)</h1>
              <div class="mw-parser-output">
                <p>Go is a statically typed language.</p>
                <table><tr><td>infobox</td></tr></table>
                <p>It was designed at Google.</p>
              </div>
              <p>Footer paragraph</p>
            </body></html>
            """;

    private final Map<String, Object> responses = new HashMap<>();
    private final List<String> requested = new ArrayList<>();
    private StubFetcher fetcher;

    @BeforeEach
    void setUp() {
        fetcher = new StubFetcher(new WikiSourceConfig(), new ConnectionConfig());
    }

    @Test
    void extractsHeadingAndParagraphs() throws Exception {
        responses.put(URL, htmlResponse(200, ARTICLE_HTML));

        FetchedPage page = fetcher.fetch(URL, "en");

        assertThat(page.getTitle()).isEqualTo("Go (programming language)");
        assertThat(page.getContent()).isEqualTo("Go is a statically typed language.\nIt was designed at Google.\n");
        assertThat(page.getUrl()).isEqualTo(URL);
        assertThat(page.getLanguage()).isEqualTo("en");
        assertThat(page.getStatusCode()).isEqualTo(200);
    }

    @Test
    void returnsPageWithEmptyTitleWhenHeadingMissing() throws Exception {
        responses.put(URL, htmlResponse(200, "<html><body><p>nothing here</p></body></html>"));

        FetchedPage page = fetcher.fetch(URL, "en");

        assertThat(page.hasTitle()).isFalse();
        assertThat(page.getContent()).isEmpty();
    }

    @Test
    void notFoundIsReportedSeparately() {
        responses.put(URL, new HttpStatusException("HTTP error fetching URL", 404, URL));

        assertThatThrownBy(() -> fetcher.fetch(URL, "en"))
                .isInstanceOf(PageNotFoundException.class)
                .extracting(e -> ((PageFetchException) e).getStatusCode())
                .isEqualTo(404);
    }

    @Test
    void serverErrorIsFetchFailure() {
        responses.put(URL, new HttpStatusException("HTTP error fetching URL", 503, URL));

        assertThatThrownBy(() -> fetcher.fetch(URL, "en"))
                .isInstanceOf(PageFetchException.class)
                .isNotInstanceOf(PageNotFoundException.class);
    }

    @Test
    void timeoutIsFetchFailure() {
        responses.put(URL, new SocketTimeoutException("Read timed out"));

        assertThatThrownBy(() -> fetcher.fetch(URL, "en"))
                .isInstanceOf(PageFetchException.class)
                .hasMessageContaining("Timeout");
    }

    @Test
    void followsRedirectWithinLanguageDomain() throws Exception {
        String target = "https://en.wikipedia.org/wiki/Go_(programming_language)";
        responses.put(URL, redirectResponse("/wiki/Go_(programming_language)"));
        responses.put(target, htmlResponse(200, ARTICLE_HTML));

        FetchedPage page = fetcher.fetch(URL, "en");

        assertThat(page.getTitle()).isEqualTo("Go (programming language)");
        assertThat(page.getUrl()).isEqualTo(URL);
        assertThat(requested).containsExactly(URL, target);
    }

    @Test
    void refusesRedirectToOtherDomain() {
        responses.put(URL, redirectResponse("https://da.wikipedia.org/wiki/Go"));

        assertThatThrownBy(() -> fetcher.fetch(URL, "en"))
                .isInstanceOf(CrossDomainRedirectException.class);
        assertThat(requested).containsExactly(URL);
    }

    @Test
    void refusesStartUrlOutsideLanguageDomain() {
        assertThatThrownBy(() -> fetcher.fetch("https://da.wikipedia.org/wiki/Golang", "en"))
                .isInstanceOf(CrossDomainRedirectException.class);
        assertThat(requested).isEmpty();
    }

    @Test
    void stopsAfterTooManyRedirects() {
        responses.put(URL, redirectResponse(URL));

        assertThatThrownBy(() -> fetcher.fetch(URL, "en"))
                .isInstanceOf(PageFetchException.class)
                .hasMessageContaining("Too many redirects");
    }

    private Connection.Response htmlResponse(int status, String html) throws IOException {
        Connection.Response response = mock(Connection.Response.class);
        when(response.statusCode()).thenReturn(status);
        when(response.parse()).thenReturn(Jsoup.parse(html));
        return response;
    }

    private Connection.Response redirectResponse(String location) {
        Connection.Response response = mock(Connection.Response.class);
        when(response.statusCode()).thenReturn(301);
        when(response.header("Location")).thenReturn(location);
        return response;
    }

    private class StubFetcher extends WikiPageFetcher {
        StubFetcher(WikiSourceConfig wikiSourceConfig, ConnectionConfig connectionConfig) {
            super(wikiSourceConfig, connectionConfig);
        }

        @Override
        protected Connection.Response execute(String url) throws IOException {
            requested.add(url);
            Object response = responses.get(url);
            if (response instanceof IOException) {
                throw (IOException) response;
            }
            if (response == null) {
                throw new IOException("Unexpected request " + url);
            }
            return (Connection.Response) response;
        }
    }
}
