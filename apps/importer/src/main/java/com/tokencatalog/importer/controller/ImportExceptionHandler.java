package com.tokencatalog.importer.controller;

import com.tokencatalog.importer.exception.LockTimeoutException;
import com.tokencatalog.importer.exception.TokenConstraintViolationException;
import com.tokencatalog.importer.exception.TokenImportException;
import com.tokencatalog.importer.exception.TokenValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps import failures to HTTP statuses with an {@link ErrorBody}.
 */
@Slf4j
@RestControllerAdvice
public class ImportExceptionHandler {

    @ExceptionHandler(TokenImportException.class)
    public ResponseEntity<ErrorBody> handleImportFailure(TokenImportException ex) {
        HttpStatus status = statusOf(ex);
        log.warn("Token import failed: status={}, operation={}, error={}", status.value(), ex.getOperation(), ex.getMessage());
        String key = ex.getContractAddressHash() != null ? ex.getContractAddressHash().toString() : null;
        return ResponseEntity.status(status)
                .body(ErrorBody.of(ex.getErrorCode(), ex.getMessage(), ex.getOperation(), key));
    }

    static HttpStatus statusOf(TokenImportException ex) {
        if (ex instanceof TokenValidationException) {
            return HttpStatus.BAD_REQUEST;
        }
        if (ex instanceof LockTimeoutException) {
            return HttpStatus.CONFLICT;
        }
        if (ex instanceof TokenConstraintViolationException) {
            return HttpStatus.UNPROCESSABLE_ENTITY;
        }
        return HttpStatus.SERVICE_UNAVAILABLE;
    }
}
