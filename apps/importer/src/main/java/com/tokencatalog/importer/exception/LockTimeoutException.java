package com.tokencatalog.importer.exception;

/**
 * Row locks were not acquired within the call's timeout, or the store broke a lock cycle.
 */
public class LockTimeoutException extends TokenImportException {

    public LockTimeoutException(String operation, String message, Throwable cause) {
        super(operation, null, message, cause);
    }

    @Override
    public String getErrorCode() {
        return "LOCK_TIMEOUT";
    }
}
