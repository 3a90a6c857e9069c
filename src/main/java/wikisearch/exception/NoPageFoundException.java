package wikisearch.exception;

public class NoPageFoundException extends RuntimeException {
    private final String term;

    public NoPageFoundException(String term) {
        super("No valid page found for term '" + term + "'");
        this.term = term;
    }

    public String getTerm() {
        return term;
    }
}
