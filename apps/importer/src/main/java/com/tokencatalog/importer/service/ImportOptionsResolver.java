package com.tokencatalog.importer.service;

import com.tokencatalog.importer.config.TokenImportProperties;
import com.tokencatalog.importer.merge.MergePolicy;
import com.tokencatalog.importer.model.ImportOptions;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Fills the options a caller left out: configured timeout, "now" timestamps and the configured
 * merge policy.
 */
@Component
public class ImportOptionsResolver {

    private final TokenImportProperties properties;
    private final MergePolicy defaultMergePolicy;

    public ImportOptionsResolver(TokenImportProperties properties, MergePolicy defaultMergePolicy) {
        this.properties = properties;
        this.defaultMergePolicy = defaultMergePolicy;
    }

    public ImportOptions resolve(ImportOptions options) {
        ImportOptions given = options != null ? options : ImportOptions.builder().build();
        Instant updatedAt = given.getUpdatedAt() != null ? given.getUpdatedAt() : Instant.now();
        return given.toBuilder()
                .timeout(given.getTimeout() != null ? given.getTimeout() : Duration.ofMillis(properties.getTimeoutMs()))
                .updatedAt(updatedAt)
                .insertedAt(given.getInsertedAt() != null ? given.getInsertedAt() : updatedAt)
                .onConflict(given.getOnConflict() != null ? given.getOnConflict() : defaultMergePolicy)
                .build();
    }
}
