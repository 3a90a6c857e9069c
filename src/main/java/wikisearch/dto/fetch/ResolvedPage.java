package wikisearch.dto.fetch;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor
public class ResolvedPage {
    private final FetchedPage page;
    private final String language;
}
