package wikisearch.exception;

public class IndexSyncException extends RuntimeException {
    public IndexSyncException(String message) {
        super(message);
    }

    public IndexSyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
