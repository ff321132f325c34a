package org.example.imagegen.config;

import jakarta.servlet.http.HttpServletRequest;
import org.example.imagegen.model.ErrorResponse;
import org.example.imagegen.service.JobConflictException;
import org.example.imagegen.service.JobNotFoundException;
import org.example.imagegen.service.JobValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps domain exceptions to {@code {error, message, details}} bodies.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(JobValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(JobValidationException e, HttpServletRequest request) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("fields", e.getFieldErrors());
        details.put("request_id", RequestCorrelation.resolveRequestId(request));
        log.info("Rejected generation request: {}", e.getFieldErrors());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(new ErrorResponse("validation_error", "Request parameters are invalid", details));
    }

    @ExceptionHandler(JobNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(JobNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ErrorResponse.of("not_found", e.getMessage()));
    }

    @ExceptionHandler(JobConflictException.class)
    public ResponseEntity<ErrorResponse> handleConflict(JobConflictException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(new ErrorResponse("conflict", e.getMessage(),
                        Map.of("status", e.getCurrentStatus().wireName())));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleMalformed(Exception e) {
        log.debug("Malformed request: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.of("bad_request", "Malformed request"));
    }
}
