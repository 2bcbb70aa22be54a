package com.replyfeed.api;

import com.replyfeed.domain.service.SubscriptionNotFoundException;
import com.replyfeed.infrastructure.persistence.StorageException;
import com.replyfeed.infrastructure.persistence.StoreUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Map;

/**
 * Maps failures to a status code and a short {"error": ...} body.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentNotValidException.class,
            HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, String>> badRequest(Exception e) {
        log.warn("Bad request: {}", e.getMessage());
        String message = e instanceof IllegalArgumentException ? e.getMessage() : "invalid request";
        return error(HttpStatus.BAD_REQUEST, message);
    }

    @ExceptionHandler(MissingRequesterException.class)
    public ResponseEntity<Map<String, String>> unauthorized(MissingRequesterException e) {
        return error(HttpStatus.UNAUTHORIZED, e.getMessage());
    }

    @ExceptionHandler(SubscriptionNotFoundException.class)
    public ResponseEntity<Map<String, String>> notFound(SubscriptionNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<Map<String, String>> storeUnavailable(StoreUnavailableException e) {
        log.error("Store unavailable during {}: {}", e.getOperation(), e.getMessage(), e);
        return error(HttpStatus.SERVICE_UNAVAILABLE, "storage unavailable");
    }

    @ExceptionHandler(StorageException.class)
    public ResponseEntity<Map<String, String>> storageFailure(StorageException e) {
        log.error("Store failure during {}: {}", e.getOperation(), e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "storage error");
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("error", message));
    }
}
