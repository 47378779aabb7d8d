package com.agrichain.offchain.web;

import com.agrichain.offchain.domain.error.ErrorKind;
import com.agrichain.offchain.domain.error.PinFailedException;
import com.agrichain.offchain.domain.error.ProvenanceException;
import com.agrichain.offchain.domain.error.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;


/**
 * Renders every failure as {@code {"error": <code>, "message": <text>}}.
 * Internal errors are logged with their stack trace and answered with a
 * generic message.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    static final String INTERNAL_MESSAGE = "Internal server error";

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(ValidationException ex) {
        Map<String, Object> body = body(ErrorKind.VALIDATION, ex.getMessage());
        body.put("details", ex.getErrors());
        return new ResponseEntity<>(body, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(PinFailedException.class)
    public ResponseEntity<Map<String, Object>> handlePin(PinFailedException ex) {
        Map<String, Object> body = body(ErrorKind.PIN_FAILED, ex.getMessage());
        body.put("cid", ex.getAddress().value());
        return new ResponseEntity<>(body, HttpStatus.BAD_GATEWAY);
    }

    @ExceptionHandler(ProvenanceException.class)
    public ResponseEntity<Map<String, Object>> handleProvenance(ProvenanceException ex) {
        return switch (ex.kind()) {
            case STORAGE_UNAVAILABLE -> {
                log.warn("Storage unavailable: {}", ex.getMessage());
                yield new ResponseEntity<>(body(ex.kind(), ex.getMessage()), HttpStatus.SERVICE_UNAVAILABLE);
            }
            case NOT_FOUND -> new ResponseEntity<>(body(ex.kind(), ex.getMessage()), HttpStatus.NOT_FOUND);
            case VALIDATION -> new ResponseEntity<>(body(ex.kind(), ex.getMessage()), HttpStatus.BAD_REQUEST);
            case PIN_FAILED -> new ResponseEntity<>(body(ex.kind(), ex.getMessage()), HttpStatus.BAD_GATEWAY);
            case INTERNAL -> internal(ex);
        };
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
        log.debug("Unreadable request body: {}", ex.getMessage());
        return new ResponseEntity<>(body(ErrorKind.VALIDATION, "Malformed request body"), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleOther(Exception ex) {
        return internal(ex);
    }

    private ResponseEntity<Map<String, Object>> internal(Exception ex) {
        log.error("Unhandled error", ex);
        return new ResponseEntity<>(body(ErrorKind.INTERNAL, INTERNAL_MESSAGE), HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private static Map<String, Object> body(ErrorKind kind, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", kind.code());
        body.put("message", message);
        return body;
    }
}
