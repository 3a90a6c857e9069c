package wikisearch.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Setter
@Getter
@Component
@ConfigurationProperties(prefix = "wiki.connection")
public class ConnectionConfig {
    private String userAgent = "Mozilla/5.0 (compatible; WikiSearchBot/1.0)";
    private String referer = "https://www.google.com";
    /** Per-request timeout, ms. */
    private int timeout = 10_000;
}
