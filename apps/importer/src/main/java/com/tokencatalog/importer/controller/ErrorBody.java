package com.tokencatalog.importer.controller;

import java.time.Instant;

/**
 * Error response: code, message, failing import stage and offending key where known.
 */
public record ErrorBody(String error, String message, String operation, String contractAddressHash, Instant timestamp) {

    public static ErrorBody of(String error, String message, String operation, String contractAddressHash) {
        return new ErrorBody(error, message, operation, contractAddressHash, Instant.now());
    }
}
