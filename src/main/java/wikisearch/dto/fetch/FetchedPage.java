package wikisearch.dto.fetch;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@AllArgsConstructor
@ToString(exclude = "content")
public class FetchedPage {
    private final String url;
    private final String title;
    private final String content;
    private final String language;
    private final int statusCode;

    public boolean hasTitle() {
        return title != null && !title.isBlank();
    }
}
