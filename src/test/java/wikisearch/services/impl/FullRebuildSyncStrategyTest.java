package wikisearch.services.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import wikisearch.dto.index.PageDocument;
import wikisearch.dto.response.SyncReport;
import wikisearch.exception.IndexSyncException;
import wikisearch.model.Page;
import wikisearch.services.PageStoreService;

import java.io.IOException;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FullRebuildSyncStrategyTest {
    private static final String INDEX = "pages";

    @Mock
    private PageStoreService pageStoreService;

    private InMemoryPageIndexGateway gateway;
    private FullRebuildSyncStrategy strategy;

    @BeforeEach
    void setUp() {
        gateway = new InMemoryPageIndexGateway();
        strategy = new FullRebuildSyncStrategy(gateway, pageStoreService);
    }

    @Test
    void createsAbsentIndexAndLoadsAllPages() throws IOException {
        List<Page> pages = pages(3);
        when(pageStoreService.streamAll()).thenReturn(pages.stream());

        SyncReport report = strategy.sync(INDEX);

        assertThat(report.getIndexed()).isEqualTo(3);
        assertThat(report.getFailed()).isZero();
        assertThat(gateway.countDocuments(INDEX)).isEqualTo(3);
        assertThat(gateway.operations).containsExactly("exists", "create");
    }

    @Test
    void rebuildsEmptyIndex() throws IOException {
        gateway.indices.put(INDEX, new LinkedHashMap<>());
        when(pageStoreService.streamAll()).thenReturn(pages(4).stream());

        strategy.sync(INDEX);

        assertThat(gateway.countDocuments(INDEX)).isEqualTo(4);
        assertThat(gateway.operations).containsExactly("exists", "delete", "create");
    }

    @Test
    void replacesStaleDocumentsInExistingIndex() throws IOException {
        LinkedHashMap<String, PageDocument> stale = new LinkedHashMap<>();
        stale.put("https://en.wikipedia.org/wiki/Removed", PageDocument.builder().url("https://en.wikipedia.org/wiki/Removed").build());
        stale.put("https://en.wikipedia.org/wiki/Page_0", PageDocument.builder().url("https://en.wikipedia.org/wiki/Page_0").build());
        gateway.indices.put(INDEX, stale);
        when(pageStoreService.streamAll()).thenReturn(pages(2).stream());

        strategy.sync(INDEX);

        assertThat(gateway.countDocuments(INDEX)).isEqualTo(2);
        assertThat(gateway.indices.get(INDEX)).doesNotContainKey("https://en.wikipedia.org/wiki/Removed");
    }

    @Test
    void documentCarriesAllPageFields() {
        Page page = pages(1).get(0);
        when(pageStoreService.streamAll()).thenReturn(List.of(page).stream());

        strategy.sync(INDEX);

        PageDocument document = gateway.indices.get(INDEX).get(page.getUrl());
        assertThat(document.getTitle()).isEqualTo("Page 0");
        assertThat(document.getContent()).isEqualTo("Content of page 0");
        assertThat(document.getLanguage()).isEqualTo("en");
        assertThat(document.getLastUpdated()).isEqualTo("2024-05-01T10:15:30Z");
    }

    @Test
    void documentFailureIsCountedAndRunContinues() throws IOException {
        List<Page> pages = pages(3);
        gateway.failingUrls.add(pages.get(1).getUrl());
        when(pageStoreService.streamAll()).thenReturn(pages.stream());

        SyncReport report = strategy.sync(INDEX);

        assertThat(report.getIndexed()).isEqualTo(2);
        assertThat(report.getFailed()).isEqualTo(1);
        assertThat(gateway.countDocuments(INDEX)).isEqualTo(2);
    }

    @Test
    void countFailureDoesNotFailSync() {
        gateway.failCount = true;
        when(pageStoreService.streamAll()).thenReturn(pages(2).stream());

        SyncReport report = strategy.sync(INDEX);

        assertThat(report.isPerformed()).isTrue();
        assertThat(report.getIndexed()).isEqualTo(2);
        assertThat(gateway.indices.get(INDEX)).hasSize(2);
    }

    @Test
    void existenceCheckFailureAbortsSync() {
        gateway.failExists = true;

        assertThatThrownBy(() -> strategy.sync(INDEX))
                .isInstanceOf(IndexSyncException.class)
                .hasMessageContaining("exists");
        assertThat(gateway.operations).containsExactly("exists");
        verifyNoInteractions(pageStoreService);
    }

    @Test
    void deleteFailureAbortsSync() {
        gateway.indices.put(INDEX, new LinkedHashMap<>());
        gateway.failDelete = true;

        assertThatThrownBy(() -> strategy.sync(INDEX)).isInstanceOf(IndexSyncException.class);
        assertThat(gateway.operations).containsExactly("exists", "delete");
        verifyNoInteractions(pageStoreService);
    }

    @Test
    void createFailureAbortsSync() {
        gateway.failCreate = true;

        assertThatThrownBy(() -> strategy.sync(INDEX)).isInstanceOf(IndexSyncException.class);
        verifyNoInteractions(pageStoreService);
    }

    private List<Page> pages(int count) {
        return IntStream.range(0, count)
                .mapToObj(i -> {
                    Page page = new Page("https://en.wikipedia.org/wiki/Page_" + i, "Page " + i, "Content of page " + i, "en");
                    page.setLastUpdated(LocalDateTime.of(2024, 5, 1, 10, 15, 30));
                    return page;
                })
                .toList();
    }
}
