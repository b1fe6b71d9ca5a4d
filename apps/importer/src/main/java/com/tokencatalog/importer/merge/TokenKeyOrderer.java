package com.tokencatalog.importer.merge;

import com.tokencatalog.importer.entity.AddressHash;
import com.tokencatalog.importer.exception.TokenValidationException;
import com.tokencatalog.importer.model.HolderCountDelta;
import com.tokencatalog.importer.model.TokenParams;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Puts batches into ascending key order before any row lock is taken.
 *
 * <p>Every writer of the {@code tokens} table goes through this ordering, so two calls with
 * overlapping keys always wait on each other in the same direction and never form a cycle.
 */
@Component
public class TokenKeyOrderer {

    /**
     * Ascending copy of an upsert batch.
     *
     * @throws TokenValidationException on a missing or duplicated key; a single statement cannot
     *                                  resolve two conflicts on the same row
     */
    public List<TokenParams> orderForUpsert(List<TokenParams> batch) {
        Set<AddressHash> seen = new HashSet<>();
        for (TokenParams params : batch) {
            AddressHash key = params.getContractAddressHash();
            if (key == null) {
                throw new TokenValidationException(null, "Token candidate without contract address hash");
            }
            if (!seen.add(key)) {
                throw new TokenValidationException(key, "Duplicate contract address hash in batch: " + key);
            }
        }
        return sortByKey(batch, TokenParams::getContractAddressHash);
    }

    /**
     * Ascending deltas with one entry per key; deltas for the same key are summed.
     */
    public List<HolderCountDelta> orderForDeltas(List<HolderCountDelta> deltas) {
        Map<AddressHash, Long> sums = new TreeMap<>();
        for (HolderCountDelta delta : deltas) {
            AddressHash key = delta.getContractAddressHash();
            if (key == null) {
                throw new TokenValidationException(null, "Holder count delta without contract address hash");
            }
            try {
                sums.merge(key, delta.getDelta(), Math::addExact);
            } catch (ArithmeticException e) {
                throw new TokenValidationException(key, "Holder count deltas overflow for " + key, e);
            }
        }
        List<HolderCountDelta> ordered = new ArrayList<>(sums.size());
        sums.forEach((key, sum) -> ordered.add(new HolderCountDelta(key, sum)));
        return ordered;
    }

    public static <T> List<T> sortByKey(List<T> items, Function<T, AddressHash> key) {
        List<T> sorted = new ArrayList<>(items);
        sorted.sort(Comparator.comparing(key));
        return sorted;
    }
}
