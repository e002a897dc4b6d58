package com.esports.scraper.controller;

import com.esports.scraper.service.pipeline.NoDataExtractedException;
import com.esports.scraper.service.pipeline.RunSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps pipeline and request errors onto HTTP responses.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> invalid(final MethodArgumentNotValidException ex) {
        List<String> violations = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + " " + e.getDefaultMessage())
                .sorted()
                .toList();
        return badRequest("Invalid request", violations);
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<Map<String, Object>> badInput(final Exception ex) {
        return badRequest(ex.getMessage(), List.of());
    }

    /**
     * Total failure: 502, with the run report as the body.
     */
    @ExceptionHandler(NoDataExtractedException.class)
    public ResponseEntity<Map<String, Object>> noData(final NoDataExtractedException ex) {
        log.warn("Run produced no data: {}", ex.getMessage());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "NO_DATA_EXTRACTED");
        body.put("message", ex.getMessage());
        RunSummary summary = ex.getSummary();
        body.put("summary", summary);
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(body);
    }

    private static ResponseEntity<Map<String, Object>> badRequest(final String message, final List<String> details) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "BAD_REQUEST");
        body.put("message", message);
        body.put("details", details);
        return ResponseEntity.badRequest().body(body);
    }
}
