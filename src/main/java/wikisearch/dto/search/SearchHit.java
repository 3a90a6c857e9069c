package wikisearch.dto.search;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public class SearchHit {
    private final String title;
    private final String url;
    private final String snippet;
}
