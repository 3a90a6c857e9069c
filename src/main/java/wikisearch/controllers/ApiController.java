package wikisearch.controllers;

import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import wikisearch.dto.response.OperationResponse;
import wikisearch.dto.response.SyncReport;
import wikisearch.dto.search.SearchHit;
import wikisearch.services.IndexSyncService;
import wikisearch.services.IngestionService;
import wikisearch.services.SearchService;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ApiController {
    private static final Logger SEARCH_LOG = LoggerFactory.getLogger("SEARCH_LOG");

    private final SearchService searchService;
    private final IngestionService ingestionService;
    private final IndexSyncService indexSyncService;
    private final AtomicBoolean ingestionProcessing = new AtomicBoolean(false);
    private final ExecutorService executor = Executors.newSingleThreadExecutor();

    @GetMapping("/search")
    public ResponseEntity<Object> search(@RequestParam(name = "q", required = false) String query,
                                         HttpServletRequest request) {
        if (query == null || query.isBlank()) {
            return ResponseEntity.badRequest().body(new OperationResponse(false, "No search query provided"));
        }
        String trimmed = query.trim();
        SEARCH_LOG.info("query=\"{}\" from={}", sanitizeForLog(trimmed), request.getRemoteAddr());

        List<SearchHit> hits = searchService.search(trimmed);
        return ResponseEntity.ok(hits);
    }

    @PostMapping("/ingestion")
    public ResponseEntity<OperationResponse> startIngestion() {
        if (!ingestionProcessing.compareAndSet(false, true)) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(new OperationResponse(false, "Ingestion is already running"));
        }
        executor.submit(() -> {
            try {
                ingestionService.runCycle();
            } catch (RuntimeException ex) {
                log.error("Ingestion cycle failed", ex);
            } finally {
                ingestionProcessing.set(false);
            }
        });
        return ResponseEntity.ok(new OperationResponse(true));
    }

    @PostMapping("/sync")
    public ResponseEntity<SyncReport> sync() {
        return ResponseEntity.ok(indexSyncService.synchronize());
    }

    private String sanitizeForLog(String query) {
        return query.replace('"', '\'').replaceAll("[\\r\\n]+", " ");
    }
}
