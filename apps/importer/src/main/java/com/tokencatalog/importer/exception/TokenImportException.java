package com.tokencatalog.importer.exception;

import com.tokencatalog.importer.entity.AddressHash;

/**
 * Base failure of a token import call. The whole call has been rolled back when this is thrown.
 */
public abstract class TokenImportException extends RuntimeException {

    private final String operation;
    private final AddressHash contractAddressHash;

    protected TokenImportException(String operation, AddressHash contractAddressHash, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
        this.contractAddressHash = contractAddressHash;
    }

    /**
     * Import stage that failed, e.g. {@code tokens} or {@code holder_count_deltas}. May be null when
     * the failure happened before any stage started.
     */
    public String getOperation() {
        return operation;
    }

    /**
     * Offending key when the failure is tied to a single row, otherwise null.
     */
    public AddressHash getContractAddressHash() {
        return contractAddressHash;
    }

    public abstract String getErrorCode();
}
