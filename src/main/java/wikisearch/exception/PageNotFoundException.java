package wikisearch.exception;

public class PageNotFoundException extends PageFetchException {
    public PageNotFoundException(String url) {
        super("Page not found (404): " + url, 404);
    }
}
