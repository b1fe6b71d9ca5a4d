package com.tokencatalog.importer.repository;

import com.tokencatalog.importer.entity.AddressHash;
import com.tokencatalog.importer.entity.Token;
import com.tokencatalog.importer.merge.MergePolicy;
import com.tokencatalog.importer.model.HolderCountDelta;
import com.tokencatalog.importer.model.TokenHolderCount;
import com.tokencatalog.importer.model.TokenParams;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * PostgreSQL-specific bulk writes for {@code tokens}. All methods must run inside a transaction;
 * the timeout is applied with {@code SET LOCAL} and ends with it. It bounds the whole call: each
 * statement gets what is left of it.
 */
public interface TokenRepositoryCustom {

    /**
     * {@code INSERT ... ON CONFLICT (contract_address_hash)} with the policy's conflict action.
     *
     * @param orderedBatch candidates in ascending key order, without duplicates, defaults applied
     * @return the post-operation row of every key in the batch, ascending, whether or not the
     * write guard let the row be updated
     */
    List<Token> upsertAll(List<TokenParams> orderedBatch, MergePolicy policy,
                          Instant insertedAt, Instant updatedAt, Duration timeout);

    /**
     * Adds each delta to the stored holder count in one statement, locking the rows in ascending
     * key order first. Rows without a holder count are neither changed nor returned.
     *
     * @param orderedDeltas ascending, one entry per key
     * @return new holder counts, ascending
     */
    List<TokenHolderCount> applyHolderCountDeltas(List<HolderCountDelta> orderedDeltas,
                                                  Instant updatedAt, Duration timeout);

    /**
     * Current rows for the given keys, ascending. Keys are bound as one array, so any number of
     * keys fits in a single statement. Takes no locks.
     */
    List<Token> findRows(Collection<AddressHash> keys);
}
