package com.tokencatalog.importer.exception;

import com.tokencatalog.importer.entity.AddressHash;

/**
 * Batch rejected before touching the store: duplicate key, malformed key or malformed field.
 */
public class TokenValidationException extends TokenImportException {

    public TokenValidationException(AddressHash contractAddressHash, String message) {
        this(null, contractAddressHash, message, null);
    }

    public TokenValidationException(AddressHash contractAddressHash, String message, Throwable cause) {
        this(null, contractAddressHash, message, cause);
    }

    public TokenValidationException(String operation, AddressHash contractAddressHash, String message, Throwable cause) {
        super(operation, contractAddressHash, message, cause);
    }

    /**
     * Copy of this failure attributed to an import stage.
     */
    public TokenValidationException withOperation(String operation) {
        return new TokenValidationException(operation, getContractAddressHash(), getMessage(), getCause());
    }

    @Override
    public String getErrorCode() {
        return "VALIDATION_ERROR";
    }
}
