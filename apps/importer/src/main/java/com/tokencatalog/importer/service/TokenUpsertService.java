package com.tokencatalog.importer.service;

import com.tokencatalog.importer.entity.Token;
import com.tokencatalog.importer.exception.TokenValidationException;
import com.tokencatalog.importer.merge.TokenKeyOrderer;
import com.tokencatalog.importer.model.Cataloged;
import com.tokencatalog.importer.model.ImportOptions;
import com.tokencatalog.importer.model.TokenParams;
import com.tokencatalog.importer.repository.TokenRepository;
import com.tokencatalog.importer.util.DataAccessErrors;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;

/**
 * Inserts new tokens and merges candidates into existing ones.
 */
@Service
public class TokenUpsertService {

    public static final String OPERATION = "tokens";

    private static final Logger logger = LoggerFactory.getLogger(TokenUpsertService.class);

    private final TokenRepository tokenRepository;
    private final TokenKeyOrderer keyOrderer;
    private final ImportOptionsResolver optionsResolver;
    private final TransactionTemplate transactionTemplate;
    private final Tracer tracer;

    public TokenUpsertService(TokenRepository tokenRepository,
                              TokenKeyOrderer keyOrderer,
                              ImportOptionsResolver optionsResolver,
                              PlatformTransactionManager transactionManager,
                              Tracer tracer) {
        this.tokenRepository = tokenRepository;
        this.keyOrderer = keyOrderer;
        this.optionsResolver = optionsResolver;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.tracer = tracer;
    }

    /**
     * Upserts a batch in ascending key order within one transaction.
     *
     * <p>New tokens start with a holder count of 0 and an unknown catalog state. Existing tokens are
     * merged with the merge policy and only written when the write guard passes; their holder count
     * is never touched.
     *
     * @return post-operation rows for every key of the batch, ascending by key
     * <p>Joins the caller's transaction when there is one.
     *
     * @throws TokenValidationException on duplicate or missing keys, before the store is touched
     */
    public List<Token> upsert(List<TokenParams> batch, ImportOptions options) {
        Span span = tracer.spanBuilder("TokenUpsertService.upsert")
                .setAttribute("batch.size", batch.size())
                .startSpan();
        try {
            if (batch.isEmpty()) {
                return List.of();
            }
            ImportOptions resolved = optionsResolver.resolve(options);
            List<TokenParams> ordered = keyOrderer.orderForUpsert(withDefaults(batch));

            List<Token> tokens = transactionTemplate.execute(status -> tokenRepository.upsertAll(ordered,
                    resolved.getOnConflict(), resolved.getInsertedAt(), resolved.getUpdatedAt(), resolved.getTimeout()));
            logger.info("Upserted {} tokens", tokens.size());
            return tokens;
        } catch (TokenValidationException e) {
            span.recordException(e);
            throw e.withOperation(OPERATION);
        } catch (DataAccessException e) {
            logger.error("Token upsert failed: batch={}, error={}", batch.size(), e.getMessage(), e);
            span.recordException(e);
            throw DataAccessErrors.translate(OPERATION, e);
        } catch (TransactionException e) {
            logger.error("Token upsert transaction failed: batch={}, error={}", batch.size(), e.getMessage(), e);
            span.recordException(e);
            throw DataAccessErrors.translate(OPERATION, e);
        } finally {
            span.end();
        }
    }

    static List<TokenParams> withDefaults(List<TokenParams> batch) {
        return batch.stream()
                .map(params -> {
                    if (params.getHolderCount() != null && params.getCataloged() != null) {
                        return params;
                    }
                    return params.toBuilder()
                            .holderCount(params.getHolderCount() != null ? params.getHolderCount() : 0L)
                            .cataloged(params.getCataloged() != null ? params.getCataloged() : Cataloged.UNKNOWN)
                            .build();
                })
                .toList();
    }
}
