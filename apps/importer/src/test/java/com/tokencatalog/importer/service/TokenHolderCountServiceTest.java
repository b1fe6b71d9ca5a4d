package com.tokencatalog.importer.service;

import com.tokencatalog.importer.config.TokenImportProperties;
import com.tokencatalog.importer.entity.AddressHash;
import com.tokencatalog.importer.exception.LockTimeoutException;
import com.tokencatalog.importer.exception.StoreUnavailableException;
import com.tokencatalog.importer.merge.CoalescingMergePolicy;
import com.tokencatalog.importer.merge.MergeFieldSet;
import com.tokencatalog.importer.merge.TokenKeyOrderer;
import com.tokencatalog.importer.model.HolderCountDelta;
import com.tokencatalog.importer.model.ImportOptions;
import com.tokencatalog.importer.model.TokenHolderCount;
import com.tokencatalog.importer.repository.TokenRepository;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.Test;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static com.tokencatalog.importer.TestTokens.address;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class TokenHolderCountServiceTest {

    private static final Instant UPDATED = Instant.parse("2024-05-02T00:00:00Z");

    private final TokenRepository repo = mock(TokenRepository.class);
    private final PlatformTransactionManager transactionManager = mock(PlatformTransactionManager.class);
    private final TokenHolderCountService service = new TokenHolderCountService(
            repo,
            new TokenKeyOrderer(),
            new ImportOptionsResolver(new TokenImportProperties(), new CoalescingMergePolicy(MergeFieldSet.base())),
            transactionManager,
            OpenTelemetry.noop().getTracer("test"));

    private final ImportOptions options = ImportOptions.builder()
            .updatedAt(UPDATED)
            .timeout(Duration.ofSeconds(2))
            .build();

    @Test
    void sumsAndOrdersDeltasIntoOneStoreCall() {
        AddressHash k1 = address(1);
        AddressHash k2 = address(2);
        List<TokenHolderCount> counts = List.of(new TokenHolderCount(k1, 7L));
        when(repo.applyHolderCountDeltas(anyList(), any(), any())).thenReturn(counts);

        List<TokenHolderCount> result = service.applyDeltas(List.of(
                new HolderCountDelta(k2, 4),
                new HolderCountDelta(k1, -3),
                new HolderCountDelta(k2, 1)), options);

        verify(repo).applyHolderCountDeltas(
                eq(List.of(new HolderCountDelta(k1, -3), new HolderCountDelta(k2, 5))),
                eq(UPDATED),
                eq(Duration.ofSeconds(2)));
        assertEquals(counts, result);
    }

    @Test
    void emptyDeltasAreNoOp() {
        assertTrue(service.applyDeltas(List.of(), options).isEmpty());
        verifyNoInteractions(repo);
    }

    @Test
    void lockFailureAbortsWholeCall() {
        when(repo.applyHolderCountDeltas(anyList(), any(), any()))
                .thenThrow(new PessimisticLockingFailureException("deadlock detected"));

        LockTimeoutException e = assertThrows(LockTimeoutException.class,
                () -> service.applyDeltas(List.of(new HolderCountDelta(address(1), 1)), options));
        assertEquals(TokenHolderCountService.OPERATION, e.getOperation());
    }

    @Test
    void storeDownAtBeginIsStoreUnavailable() {
        when(transactionManager.getTransaction(any()))
                .thenThrow(new CannotCreateTransactionException("Could not open JPA EntityManager"));

        StoreUnavailableException e = assertThrows(StoreUnavailableException.class,
                () -> service.applyDeltas(List.of(new HolderCountDelta(address(1), 1)), options));

        assertEquals(TokenHolderCountService.OPERATION, e.getOperation());
        verifyNoInteractions(repo);
    }

    @Test
    void failedStatementRollsBack() {
        when(repo.applyHolderCountDeltas(anyList(), any(), any()))
                .thenThrow(new PessimisticLockingFailureException("deadlock detected"));

        assertThrows(LockTimeoutException.class,
                () -> service.applyDeltas(List.of(new HolderCountDelta(address(1), 1)), options));

        verify(transactionManager).rollback(any());
        verify(transactionManager, never()).commit(any());
    }
}
