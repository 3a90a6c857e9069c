package wikisearch.runner;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;
import wikisearch.config.IngestionConfig;
import wikisearch.exception.IndexSyncException;
import wikisearch.services.IndexSyncService;
import wikisearch.services.IngestionService;
import wikisearch.services.SearchService;
import wikisearch.services.SearchBackendType;

@Slf4j
@Component
@RequiredArgsConstructor
public class SearchStartupRunner implements CommandLineRunner {
    private final SearchService searchService;
    private final IndexSyncService indexSyncService;
    private final IngestionService ingestionService;
    private final IngestionConfig ingestionConfig;

    @Override
    public void run(String... args) {
        if (searchService.backendType() == SearchBackendType.ENGINE) {
            try {
                indexSyncService.synchronize();
            } catch (IndexSyncException ex) {
                log.error("Initial index sync failed", ex);
            }
        }
        if (ingestionConfig.isRunOnStartup()) {
            log.info("Running ingestion on startup");
            ingestionService.runCycle();
        }
    }
}
