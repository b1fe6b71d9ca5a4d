package com.tokencatalog.importer.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Token import configuration ({@code token-import.*}).
 */
@Component
@ConfigurationProperties(prefix = "token-import")
public class TokenImportProperties {

    /**
     * Let {@code bridged} take part in metadata merges.
     */
    private boolean extendedFieldSetEnabled = false;

    /**
     * Default lock wait and statement timeout for one import call, in milliseconds.
     */
    private long timeoutMs = 60_000;

    /**
     * Rows per upsert statement. Larger batches are written in several statements within one
     * transaction.
     */
    private int upsertChunkSize = 1_000;

    public boolean isExtendedFieldSetEnabled() {
        return extendedFieldSetEnabled;
    }

    public void setExtendedFieldSetEnabled(boolean extendedFieldSetEnabled) {
        this.extendedFieldSetEnabled = extendedFieldSetEnabled;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    public void setTimeoutMs(long timeoutMs) {
        this.timeoutMs = timeoutMs;
    }

    public int getUpsertChunkSize() {
        return upsertChunkSize;
    }

    public void setUpsertChunkSize(int upsertChunkSize) {
        this.upsertChunkSize = upsertChunkSize;
    }
}
