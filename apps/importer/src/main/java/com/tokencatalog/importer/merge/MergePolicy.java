package com.tokencatalog.importer.merge;

import com.tokencatalog.importer.entity.Token;
import com.tokencatalog.importer.model.TokenParams;

import java.time.Instant;

/**
 * How a candidate combines with an already stored token.
 *
 * <p>The same rules are expressed twice: in Java, for the advisory change filter and for callers
 * that merge in memory, and as the SQL conflict action executed by the store at write time. The two
 * must agree.
 */
public interface MergePolicy {

    MergeFieldSet fieldSet();

    /**
     * Write guard: true iff at least one provided field of the candidate differs from the stored
     * value.
     */
    boolean shouldWrite(TokenParams candidate, Token existing);

    /**
     * Merged copy of {@code existing}. {@code existing} itself is not modified; the holder count
     * and the key are carried over untouched.
     */
    Token merge(Token existing, TokenParams candidate, Instant insertedAt, Instant updatedAt);

    /**
     * Conflict action following {@code ON CONFLICT (contract_address_hash)}, i.e.
     * {@code DO UPDATE SET ... WHERE ...}. {@code alias} names the stored row, {@code EXCLUDED}
     * the candidate.
     */
    String conflictAction(String alias);
}
