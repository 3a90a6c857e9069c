package wikisearch.controllers;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import wikisearch.dto.response.OperationResponse;
import wikisearch.exception.IndexSyncException;
import wikisearch.exception.SearchFailedException;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(SearchFailedException.class)
    public ResponseEntity<OperationResponse> handleSearchFailed(SearchFailedException ex) {
        log.error("Error during search", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new OperationResponse(false, "Error during search"));
    }

    @ExceptionHandler(IndexSyncException.class)
    public ResponseEntity<OperationResponse> handleSyncFailed(IndexSyncException ex) {
        log.error("Index sync failed", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new OperationResponse(false, "Index sync failed"));
    }
}
