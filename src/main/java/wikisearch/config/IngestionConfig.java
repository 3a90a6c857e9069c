package wikisearch.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Setter
@Getter
@Component
@ConfigurationProperties(prefix = "wiki.ingestion")
public class IngestionConfig {
    private String logPath = "search.log";
    /** Languages in priority order. */
    private List<String> languages = new ArrayList<>(List.of("da", "en"));
    private boolean runOnStartup;
}
