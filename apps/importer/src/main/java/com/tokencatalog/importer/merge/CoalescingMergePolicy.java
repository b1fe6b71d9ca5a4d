package com.tokencatalog.importer.merge;

import com.tokencatalog.importer.entity.Token;
import com.tokencatalog.importer.model.TokenParams;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Default policy: a provided value replaces the stored one, a missing value keeps it.
 * {@code inserted_at} keeps the earliest and {@code updated_at} the latest timestamp seen.
 */
public class CoalescingMergePolicy implements MergePolicy {

    private final MergeFieldSet fieldSet;

    public CoalescingMergePolicy(MergeFieldSet fieldSet) {
        this.fieldSet = Objects.requireNonNull(fieldSet, "fieldSet");
    }

    @Override
    public MergeFieldSet fieldSet() {
        return fieldSet;
    }

    @Override
    public boolean shouldWrite(TokenParams candidate, Token existing) {
        for (TokenField field : fieldSet.fields()) {
            Object provided = field.candidateValue(candidate);
            if (provided != null && !sameValue(provided, field.existingValue(existing))) {
                return true;
            }
        }
        return false;
    }

    @Override
    public Token merge(Token existing, TokenParams candidate, Instant insertedAt, Instant updatedAt) {
        Token merged = copyOf(existing);
        for (TokenField field : fieldSet.fields()) {
            field.assign(merged, coalesce(field.candidateValue(candidate), field.existingValue(existing)));
        }
        merged.setInsertedAt(earliest(existing.getInsertedAt(), insertedAt));
        merged.setUpdatedAt(latest(existing.getUpdatedAt(), updatedAt));
        return merged;
    }

    @Override
    public String conflictAction(String alias) {
        String assignments = fieldSet.fields().stream()
                .map(f -> f.column() + " = COALESCE(EXCLUDED." + f.column() + ", " + alias + "." + f.column() + ")")
                .collect(Collectors.joining(",\n    "));
        String guard = fieldSet.fields().stream()
                .map(f -> "(EXCLUDED." + f.column() + " IS NOT NULL AND EXCLUDED." + f.column()
                        + " IS DISTINCT FROM " + alias + "." + f.column() + ")")
                .collect(Collectors.joining("\n   OR "));
        return "DO UPDATE SET\n    " + assignments + ",\n"
                + "    inserted_at = LEAST(" + alias + ".inserted_at, EXCLUDED.inserted_at),\n"
                + "    updated_at = GREATEST(" + alias + ".updated_at, EXCLUDED.updated_at)\n"
                + "WHERE " + guard;
    }

    static Object coalesce(Object incoming, Object current) {
        return incoming != null ? incoming : current;
    }

    static Instant earliest(Instant a, Instant b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.isBefore(b) ? a : b;
    }

    static Instant latest(Instant a, Instant b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.isAfter(b) ? a : b;
    }

    // numeric columns compare by value, like IS DISTINCT FROM does
    private static boolean sameValue(Object provided, Object current) {
        if (provided instanceof BigDecimal && current instanceof BigDecimal) {
            return ((BigDecimal) provided).compareTo((BigDecimal) current) == 0;
        }
        return Objects.equals(provided, current);
    }

    private static Token copyOf(Token source) {
        Token copy = new Token();
        copy.setContractAddressHash(source.getContractAddressHash());
        copy.setName(source.getName());
        copy.setSymbol(source.getSymbol());
        copy.setTotalSupply(source.getTotalSupply());
        copy.setDecimals(source.getDecimals());
        copy.setType(source.getType());
        copy.setCataloged(source.getCataloged());
        copy.setSkipMetadata(source.getSkipMetadata());
        copy.setBridged(source.getBridged());
        copy.setHolderCount(source.getHolderCount());
        copy.setInsertedAt(source.getInsertedAt());
        copy.setUpdatedAt(source.getUpdatedAt());
        return copy;
    }
}
