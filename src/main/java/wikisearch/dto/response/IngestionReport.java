package wikisearch.dto.response;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

@Getter
@Setter
@ToString
public class IngestionReport {
    private int extracted;
    private int skipped;
    private int resolved;
    private int saved;
    private int failed;
    private boolean synced;

    public void incrementSkipped() {
        skipped++;
    }

    public void incrementResolved() {
        resolved++;
    }

    public void incrementSaved() {
        saved++;
    }

    public void incrementFailed() {
        failed++;
    }
}
