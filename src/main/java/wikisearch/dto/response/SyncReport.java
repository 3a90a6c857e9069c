package wikisearch.dto.response;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor
public class SyncReport {
    private final boolean performed;
    private final int indexed;
    private final int failed;

    public static SyncReport skipped() {
        return new SyncReport(false, 0, 0);
    }
}
