package com.example.audittrail.http;

import com.example.audittrail.access.CorruptEntryException;
import com.example.audittrail.service.AuditTrailException;
import java.util.Map;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badReq(IllegalArgumentException ex) {
        return body(HttpStatus.BAD_REQUEST, "BAD_REQUEST", ex.getMessage());
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, Object>> unreadable(Exception ex) {
        return body(HttpStatus.BAD_REQUEST, "BAD_REQUEST", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> invalid(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + " " + e.getDefaultMessage())
                .findFirst()
                .orElse("invalid request body");
        return body(HttpStatus.BAD_REQUEST, AuditTrailException.Code.VALIDATION_ERROR.name(), message);
    }

    @ExceptionHandler(AuditTrailException.class)
    public ResponseEntity<Map<String, Object>> domainError(AuditTrailException ex) {
        HttpStatus status;
        switch (ex.getCode()) {
            case ENCODING_ERROR, VALIDATION_ERROR -> status = HttpStatus.BAD_REQUEST;
            case ENTRY_NOT_FOUND -> status = HttpStatus.NOT_FOUND;
            case INTEGRITY_VIOLATION -> status = HttpStatus.CONFLICT;
            case APPEND_ERROR -> status = HttpStatus.SERVICE_UNAVAILABLE;
            case SEQUENCE_CONFLICT -> {
                log.error("Sequence conflict reached the API; append serialization is broken", ex);
                status = HttpStatus.INTERNAL_SERVER_ERROR;
            }
            default -> status = HttpStatus.INTERNAL_SERVER_ERROR;
        }

        return body(status, ex.getCode().name(), ex.getMessage());
    }

    @ExceptionHandler(CorruptEntryException.class)
    public ResponseEntity<Map<String, Object>> corrupt(CorruptEntryException ex) {
        log.error("Ledger entry {} could not be read; run a verification", ex.getSequence(), ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "CORRUPT_ENTRY", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> boom(Exception ex) {
        log.error("Unexpected error handling request", ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", ex.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status)
                .body(Map.of(
                        "code", code,
                        "message", Objects.toString(message, code)
                ));
    }
}
