package com.tokencatalog.importer.service;

import com.tokencatalog.importer.exception.TokenValidationException;
import com.tokencatalog.importer.merge.TokenKeyOrderer;
import com.tokencatalog.importer.model.HolderCountDelta;
import com.tokencatalog.importer.model.ImportOptions;
import com.tokencatalog.importer.model.TokenHolderCount;
import com.tokencatalog.importer.repository.TokenRepository;
import com.tokencatalog.importer.util.DataAccessErrors;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;

/**
 * Applies signed holder count deltas to tokens whose holder count is already initialized.
 */
@Slf4j
@Service
public class TokenHolderCountService {

    public static final String OPERATION = "holder_count_deltas";

    private final TokenRepository tokenRepository;
    private final TokenKeyOrderer keyOrderer;
    private final ImportOptionsResolver optionsResolver;
    private final TransactionTemplate transactionTemplate;
    private final Tracer tracer;

    public TokenHolderCountService(TokenRepository tokenRepository,
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
     * Adds the deltas in a single statement. Deltas for the same key are summed first.
     * Tokens that do not exist or whose holder count is null are skipped and absent from the result.
     *
     * @return new holder counts, ascending by key
     */
    public List<TokenHolderCount> applyDeltas(List<HolderCountDelta> deltas, ImportOptions options) {
        Span span = tracer.spanBuilder("TokenHolderCountService.applyDeltas")
                .setAttribute("delta.count", deltas.size())
                .startSpan();
        try {
            if (deltas.isEmpty()) {
                return List.of();
            }
            ImportOptions resolved = optionsResolver.resolve(options);
            List<HolderCountDelta> ordered = keyOrderer.orderForDeltas(deltas);

            List<TokenHolderCount> counts = transactionTemplate.execute(status ->
                    tokenRepository.applyHolderCountDeltas(ordered, resolved.getUpdatedAt(), resolved.getTimeout()));
            log.info("Applied holder count deltas: requested={}, keys={}, updated={}",
                    deltas.size(), ordered.size(), counts.size());
            return counts;
        } catch (TokenValidationException e) {
            span.recordException(e);
            throw e.withOperation(OPERATION);
        } catch (DataAccessException e) {
            log.error("Holder count update failed: deltas={}, error={}", deltas.size(), e.getMessage(), e);
            span.recordException(e);
            throw DataAccessErrors.translate(OPERATION, e);
        } catch (TransactionException e) {
            log.error("Holder count transaction failed: deltas={}, error={}", deltas.size(), e.getMessage(), e);
            span.recordException(e);
            throw DataAccessErrors.translate(OPERATION, e);
        } finally {
            span.end();
        }
    }
}
