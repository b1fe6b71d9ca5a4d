package com.tokencatalog.importer.merge;

import com.tokencatalog.importer.entity.AddressHash;
import com.tokencatalog.importer.entity.Token;
import com.tokencatalog.importer.model.TokenParams;
import com.tokencatalog.importer.repository.TokenRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Drops candidates that would not change their stored row.
 *
 * <p>Only an optimization: the snapshot read here may already be stale when the batch is written,
 * and the store re-evaluates the same guard at write time.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TokenChangeFilter {

    private final TokenRepository tokenRepository;

    /**
     * Reads the stored rows for the batch keys and filters against them.
     */
    public List<TokenParams> filter(List<TokenParams> candidates, MergePolicy policy) {
        if (candidates.isEmpty()) {
            return List.of();
        }
        Set<AddressHash> keys = candidates.stream()
                .map(TokenParams::getContractAddressHash)
                .collect(Collectors.toCollection(LinkedHashSet::new));

        Map<AddressHash, Token> existing = new HashMap<>();
        for (Token token : tokenRepository.findRows(keys)) {
            existing.put(token.getContractAddressHash(), token);
        }

        List<TokenParams> kept = filter(candidates, existing, policy);
        log.debug("Change filter kept {} of {} token candidates ({} already stored)",
                kept.size(), candidates.size(), existing.size());
        return kept;
    }

    /**
     * Keeps candidates without a stored row and candidates the write guard lets through, in their
     * original order and unmodified.
     */
    public List<TokenParams> filter(List<TokenParams> candidates, Map<AddressHash, Token> existing, MergePolicy policy) {
        return candidates.stream()
                .filter(candidate -> {
                    Token stored = existing.get(candidate.getContractAddressHash());
                    return stored == null || policy.shouldWrite(candidate, stored);
                })
                .toList();
    }
}
