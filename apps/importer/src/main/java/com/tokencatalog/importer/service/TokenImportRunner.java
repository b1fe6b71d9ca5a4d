package com.tokencatalog.importer.service;

import com.tokencatalog.importer.entity.AddressHash;
import com.tokencatalog.importer.entity.Token;
import com.tokencatalog.importer.exception.TokenValidationException;
import com.tokencatalog.importer.merge.TokenChangeFilter;
import com.tokencatalog.importer.merge.TokenKeyOrderer;
import com.tokencatalog.importer.model.ImportOptions;
import com.tokencatalog.importer.model.TokenParams;
import com.tokencatalog.importer.repository.TokenRepository;
import com.tokencatalog.importer.util.DataAccessErrors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Token stage of a block import: drop no-op candidates, then upsert the rest.
 */
@Slf4j
@Service
public class TokenImportRunner {

    public static final String FILTER_STAGE = "filter_token_params";

    private final TokenChangeFilter changeFilter;
    private final TokenKeyOrderer keyOrderer;
    private final TokenUpsertService upsertService;
    private final TokenRepository tokenRepository;
    private final ImportOptionsResolver optionsResolver;
    private final TransactionTemplate transactionTemplate;

    public TokenImportRunner(TokenChangeFilter changeFilter,
                             TokenKeyOrderer keyOrderer,
                             TokenUpsertService upsertService,
                             TokenRepository tokenRepository,
                             ImportOptionsResolver optionsResolver,
                             PlatformTransactionManager transactionManager) {
        this.changeFilter = changeFilter;
        this.keyOrderer = keyOrderer;
        this.upsertService = upsertService;
        this.tokenRepository = tokenRepository;
        this.optionsResolver = optionsResolver;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * Runs both stages in one transaction.
     *
     * @return current rows for every key of {@code changes}, ascending by key, including the ones
     * the change filter dropped
     */
    public List<Token> run(List<TokenParams> changes, ImportOptions options) {
        if (changes.isEmpty()) {
            return List.of();
        }
        ImportOptions resolved = optionsResolver.resolve(options);
        AtomicReference<String> stage = new AtomicReference<>(FILTER_STAGE);
        try {
            return transactionTemplate.execute(status -> runStages(changes, resolved, stage));
        } catch (TransactionException e) {
            log.error("Token import transaction failed: stage={}, batch={}, error={}",
                    stage.get(), changes.size(), e.getMessage(), e);
            throw DataAccessErrors.translate(stage.get(), e);
        }
    }

    private List<Token> runStages(List<TokenParams> changes, ImportOptions resolved, AtomicReference<String> stage) {
        List<TokenParams> ordered;
        List<TokenParams> filtered;
        try {
            ordered = keyOrderer.orderForUpsert(changes);
            filtered = changeFilter.filter(ordered, resolved.getOnConflict());
        } catch (TokenValidationException e) {
            throw e.withOperation(FILTER_STAGE);
        } catch (DataAccessException e) {
            log.error("Token change filter failed: batch={}, error={}", changes.size(), e.getMessage(), e);
            throw DataAccessErrors.translate(FILTER_STAGE, e);
        }
        log.info("Token import: {} candidates, {} after change filter", changes.size(), filtered.size());

        stage.set(TokenUpsertService.OPERATION);
        List<Token> tokens = new ArrayList<>(upsertService.upsert(filtered, resolved));
        if (filtered.size() == ordered.size()) {
            return tokens;
        }

        Set<AddressHash> written = tokens.stream()
                .map(Token::getContractAddressHash)
                .collect(Collectors.toSet());
        List<AddressHash> skipped = ordered.stream()
                .map(TokenParams::getContractAddressHash)
                .filter(key -> !written.contains(key))
                .toList();
        try {
            tokens.addAll(tokenRepository.findRows(skipped));
        } catch (DataAccessException e) {
            throw DataAccessErrors.translate(TokenUpsertService.OPERATION, e);
        }
        return TokenKeyOrderer.sortByKey(tokens, Token::getContractAddressHash);
    }
}
