package wikisearch.services;

/**
 * Record of terms that have already triggered an ingestion attempt.
 */
public interface ProcessedTermLedger {

    /**
     * @return {@code true} if the term was marked before; {@code false} when it was not
     * or when the ledger could not be read
     */
    boolean isProcessed(String term);

    /**
     * Marks the term as processed. Marking the same term twice is a no-op.
     */
    void markProcessed(String term);
}
