package wikisearch.exception;

public class SearchFailedException extends RuntimeException {
    public SearchFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
