package com.tokencatalog.importer.exception;

public class StoreUnavailableException extends TokenImportException {

    public StoreUnavailableException(String operation, String message, Throwable cause) {
        super(operation, null, message, cause);
    }

    @Override
    public String getErrorCode() {
        return "STORE_UNAVAILABLE";
    }
}
