package wikisearch.services.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import wikisearch.repository.ProcessedTermRepository;
import wikisearch.services.ProcessedTermLedger;

@Slf4j
@Service
@RequiredArgsConstructor
public class ProcessedTermLedgerImpl implements ProcessedTermLedger {
    private final ProcessedTermRepository processedTermRepository;

    @Override
    public boolean isProcessed(String term) {
        try {
            return processedTermRepository.existsByTerm(term);
        } catch (DataAccessException e) {
            // treated as unprocessed, the page upsert makes a repeated ingestion harmless
            log.error("Error checking processed term '{}': {}", term, e.getMessage());
            return false;
        }
    }

    @Override
    public void markProcessed(String term) {
        try {
            int inserted = processedTermRepository.insertIgnoreConflict(term);
            if (inserted == 0) {
                log.debug("Term '{}' was already marked as processed", term);
            }
        } catch (DataIntegrityViolationException e) {
            log.debug("Term '{}' was marked concurrently", term);
        } catch (DataAccessException e) {
            log.error("Error marking term '{}' as processed: {}", term, e.getMessage());
        }
    }
}
