package wikisearch.exception;

public class CrossDomainRedirectException extends PageFetchException {
    public CrossDomainRedirectException(String url, String allowedHost) {
        super("Request to " + url + " is outside of allowed domain " + allowedHost);
    }
}
