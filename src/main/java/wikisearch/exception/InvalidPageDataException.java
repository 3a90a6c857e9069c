package wikisearch.exception;

public class InvalidPageDataException extends RuntimeException {
    public static final String defaultMessage = "invalid page data";

    public InvalidPageDataException() {
        super(defaultMessage);
    }

    public InvalidPageDataException(String message) {
        super(message);
    }
}
