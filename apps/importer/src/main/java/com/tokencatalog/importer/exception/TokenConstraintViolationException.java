package com.tokencatalog.importer.exception;

/**
 * Uniqueness or type violation reported by the store. The store's message is kept as is.
 */
public class TokenConstraintViolationException extends TokenImportException {

    public TokenConstraintViolationException(String operation, String message, Throwable cause) {
        super(operation, null, message, cause);
    }

    @Override
    public String getErrorCode() {
        return "CONSTRAINT_VIOLATION";
    }
}
