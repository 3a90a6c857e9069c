package wikisearch.dto.index;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import wikisearch.model.Page;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Copy of a {@link Page} as stored in the search index.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PageDocument {
    private String title;
    private String url;
    private String content;
    private String language;

    @JsonProperty("last_updated")
    private String lastUpdated;

    public static PageDocument from(Page page) {
        String lastUpdated = page.getLastUpdated() == null
                ? null
                : page.getLastUpdated().atOffset(ZoneOffset.UTC).format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
        return PageDocument.builder()
                .title(page.getTitle())
                .url(page.getUrl())
                .content(page.getContent())
                .language(page.getLanguage())
                .lastUpdated(lastUpdated)
                .build();
    }
}
