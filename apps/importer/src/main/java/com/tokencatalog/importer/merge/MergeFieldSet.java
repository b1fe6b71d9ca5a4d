package com.tokencatalog.importer.merge;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Mergeable fields active for an import. The base set is always present; {@code bridged} joins it
 * when the extended field set is enabled.
 */
public final class MergeFieldSet {

    private static final Set<TokenField> BASE = EnumSet.of(
            TokenField.NAME,
            TokenField.SYMBOL,
            TokenField.TOTAL_SUPPLY,
            TokenField.DECIMALS,
            TokenField.TYPE,
            TokenField.CATALOGED,
            TokenField.SKIP_METADATA);

    private final Set<TokenField> fields;

    private MergeFieldSet(Set<TokenField> fields) {
        this.fields = Collections.unmodifiableSet(fields);
    }

    public static MergeFieldSet base() {
        return new MergeFieldSet(EnumSet.copyOf(BASE));
    }

    public static MergeFieldSet of(boolean extendedFieldSetEnabled) {
        EnumSet<TokenField> fields = EnumSet.copyOf(BASE);
        if (extendedFieldSetEnabled) {
            fields.add(TokenField.BRIDGED);
        }
        return new MergeFieldSet(fields);
    }

    /**
     * Arbitrary field set, for callers that bring their own policy.
     *
     * @throws IllegalArgumentException if a non-mergeable field such as the key or the holder
     *                                  count is requested
     */
    public static MergeFieldSet of(Collection<TokenField> fields) {
        if (fields == null || fields.isEmpty()) {
            throw new IllegalArgumentException("Merge field set must not be empty");
        }
        for (TokenField field : fields) {
            if (!field.isMergeable()) {
                throw new IllegalArgumentException(field.column() + " cannot take part in a merge");
            }
        }
        return new MergeFieldSet(EnumSet.copyOf(fields));
    }

    /**
     * Fields in column order.
     */
    public Set<TokenField> fields() {
        return fields;
    }

    public boolean contains(TokenField field) {
        return fields.contains(field);
    }

    @Override
    public String toString() {
        return fields.toString();
    }
}
