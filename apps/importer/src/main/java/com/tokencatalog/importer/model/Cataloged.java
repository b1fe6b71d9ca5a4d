package com.tokencatalog.importer.model;

/**
 * Whether a token has been matched against the external token catalog.
 *
 * <p>{@link #UNKNOWN} is stored as SQL NULL so that a later {@code COALESCE} can still prefer an
 * incoming {@code false} over it.
 */
public enum Cataloged {
    UNKNOWN,
    CATALOGED,
    NOT_CATALOGED;

    public static Cataloged fromColumn(Boolean value) {
        if (value == null) {
            return UNKNOWN;
        }
        return value ? CATALOGED : NOT_CATALOGED;
    }

    public Boolean toColumn() {
        return switch (this) {
            case UNKNOWN -> null;
            case CATALOGED -> Boolean.TRUE;
            case NOT_CATALOGED -> Boolean.FALSE;
        };
    }
}
