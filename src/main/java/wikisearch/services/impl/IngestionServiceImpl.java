package wikisearch.services.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import wikisearch.config.IngestionConfig;
import wikisearch.dto.fetch.FetchedPage;
import wikisearch.dto.fetch.ResolvedPage;
import wikisearch.dto.response.IngestionReport;
import wikisearch.exception.IndexSyncException;
import wikisearch.exception.InvalidPageDataException;
import wikisearch.exception.NoPageFoundException;
import wikisearch.model.Page;
import wikisearch.services.IndexSyncService;
import wikisearch.services.IngestionService;
import wikisearch.services.PageResolverService;
import wikisearch.services.PageStoreService;
import wikisearch.services.ProcessedTermLedger;
import wikisearch.services.TermExtractorService;

import java.nio.file.Path;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionServiceImpl implements IngestionService {
    private final TermExtractorService termExtractorService;
    private final ProcessedTermLedger processedTermLedger;
    private final PageResolverService pageResolverService;
    private final PageStoreService pageStoreService;
    private final IndexSyncService indexSyncService;
    private final IngestionConfig ingestionConfig;

    @Override
    public IngestionReport runIngestion() {
        IngestionReport report = new IngestionReport();
        Set<String> terms = termExtractorService.extractTerms(Path.of(ingestionConfig.getLogPath()));
        report.setExtracted(terms.size());
        if (terms.isEmpty()) {
            log.info("No search terms found.");
            return report;
        }

        for (String term : terms) {
            if (processedTermLedger.isProcessed(term)) {
                log.debug("Skipping already processed term: {}", term);
                report.incrementSkipped();
                continue;
            }
            ingestTerm(term, report);
        }

        log.info("Ingestion finished: {}", report);
        return report;
    }

    @Override
    public IngestionReport runCycle() {
        long countBefore = pageStoreService.countPages();
        IngestionReport report = runIngestion();
        long countAfter = pageStoreService.countPages();

        if (countAfter <= countBefore) {
            log.info("No new pages added. Skipping index sync.");
            return report;
        }

        log.info("New pages added ({} -> {}). Syncing index.", countBefore, countAfter);
        try {
            report.setSynced(indexSyncService.synchronize().isPerformed());
        } catch (IndexSyncException e) {
            log.error("Error syncing index after ingestion", e);
        }
        return report;
    }

    private void ingestTerm(String term, IngestionReport report) {
        ResolvedPage resolved;
        try {
            resolved = pageResolverService.resolve(term, ingestionConfig.getLanguages());
        } catch (NoPageFoundException e) {
            log.warn("Failed to scrape any language for term '{}': {}", term, e.getMessage());
            report.incrementFailed();
            return;
        }
        report.incrementResolved();

        FetchedPage fetched = resolved.getPage();
        Page page = new Page(fetched.getUrl(), fetched.getTitle(), fetched.getContent(), resolved.getLanguage());
        try {
            pageStoreService.upsertPage(page);
        } catch (InvalidPageDataException | DataAccessException e) {
            log.error("Error saving page {} for term '{}': {}", fetched.getUrl(), term, e.getMessage());
            report.incrementFailed();
            return;
        }
        report.incrementSaved();

        processedTermLedger.markProcessed(term);
    }
}
