package wikisearch.exception;

import java.io.IOException;

public class PageFetchException extends IOException {
    public static final int NO_STATUS = -1;

    private final int statusCode;

    public PageFetchException(String message) {
        this(message, NO_STATUS);
    }

    public PageFetchException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public PageFetchException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = NO_STATUS;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
