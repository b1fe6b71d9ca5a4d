package com.tokencatalog.importer.model;

import com.tokencatalog.importer.merge.MergePolicy;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Per-call options shared by the upsert and the holder count paths.
 */
@Value
@Builder(toBuilder = true)
public class ImportOptions {

    /**
     * Upper bound for lock waits and statement execution. Null means the configured default.
     */
    Duration timeout;

    Instant insertedAt;

    Instant updatedAt;

    /**
     * Replaces the configured merge policy for this call.
     */
    MergePolicy onConflict;
}
