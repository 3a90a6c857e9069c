package wikisearch.services.impl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import wikisearch.config.SearchEngineConfig;
import wikisearch.services.PageIndexGateway;
import wikisearch.services.PageStoreService;
import wikisearch.services.SearchBackend;

/**
 * Chooses the search backend once, when the context starts.
 */
@Slf4j
@Configuration
public class SearchBackendSelector {

    @Bean
    public SearchBackend searchBackend(SearchEngineConfig searchEngineConfig,
                                       PageIndexGateway pageIndexGateway,
                                       PageStoreService pageStoreService) {
        return select(searchEngineConfig, pageIndexGateway, pageStoreService);
    }

    static SearchBackend select(SearchEngineConfig searchEngineConfig,
                                PageIndexGateway pageIndexGateway,
                                PageStoreService pageStoreService) {
        if (searchEngineConfig.isEnabled() && pageIndexGateway.ping()) {
            log.info("Connected to search engine at {}://{}:{}",
                    searchEngineConfig.getScheme(), searchEngineConfig.getHost(), searchEngineConfig.getPort());
            return new EngineSearchBackend(pageIndexGateway, searchEngineConfig);
        }
        log.warn("Search engine unavailable, searches will scan the page store");
        return new StoreScanSearchBackend(pageStoreService, searchEngineConfig);
    }
}
