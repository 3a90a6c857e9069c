package wikisearch.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Setter
@Getter
@Component
@ConfigurationProperties(prefix = "wiki.source")
public class WikiSourceConfig {
    private String domain = "wikipedia.org";
    private String scheme = "https";
    private int maxRedirects = 5;

    public String hostFor(String language) {
        return language + "." + domain;
    }
}
