package wikisearch.services.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import wikisearch.config.SearchEngineConfig;
import wikisearch.dto.response.SyncReport;
import wikisearch.services.IndexSyncService;
import wikisearch.services.IndexSyncStrategy;
import wikisearch.services.SearchBackend;
import wikisearch.services.SearchBackendType;

@Slf4j
@Service
@RequiredArgsConstructor
public class IndexSyncServiceImpl implements IndexSyncService {
    private final IndexSyncStrategy indexSyncStrategy;
    private final SearchBackend searchBackend;
    private final SearchEngineConfig searchEngineConfig;

    @Override
    public synchronized SyncReport synchronize() {
        if (searchBackend.type() != SearchBackendType.ENGINE) {
            log.info("Search engine is not in use, skipping index sync");
            return SyncReport.skipped();
        }
        long start = System.currentTimeMillis();
        SyncReport report = indexSyncStrategy.sync(searchEngineConfig.getIndexName());
        log.info("Index sync finished in {} ms: {}", System.currentTimeMillis() - start, report);
        return report;
    }
}
