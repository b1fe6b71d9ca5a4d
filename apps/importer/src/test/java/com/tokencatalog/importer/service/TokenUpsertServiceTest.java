package com.tokencatalog.importer.service;

import com.tokencatalog.importer.config.TokenImportProperties;
import com.tokencatalog.importer.entity.AddressHash;
import com.tokencatalog.importer.entity.Token;
import com.tokencatalog.importer.exception.LockTimeoutException;
import com.tokencatalog.importer.exception.StoreUnavailableException;
import com.tokencatalog.importer.exception.TokenValidationException;
import com.tokencatalog.importer.merge.CoalescingMergePolicy;
import com.tokencatalog.importer.merge.MergeFieldSet;
import com.tokencatalog.importer.merge.MergePolicy;
import com.tokencatalog.importer.merge.TokenKeyOrderer;
import com.tokencatalog.importer.model.Cataloged;
import com.tokencatalog.importer.model.ImportOptions;
import com.tokencatalog.importer.model.TokenParams;
import com.tokencatalog.importer.repository.TokenRepository;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;

import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static com.tokencatalog.importer.TestTokens.address;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class TokenUpsertServiceTest {

    private static final Instant INSERTED = Instant.parse("2024-05-01T00:00:00Z");
    private static final Instant UPDATED = Instant.parse("2024-05-02T00:00:00Z");

    private final TokenRepository repo = mock(TokenRepository.class);
    private final PlatformTransactionManager transactionManager = mock(PlatformTransactionManager.class);
    private final MergePolicy defaultPolicy = new CoalescingMergePolicy(MergeFieldSet.base());
    private final TokenUpsertService service = new TokenUpsertService(
            repo,
            new TokenKeyOrderer(),
            new ImportOptionsResolver(new TokenImportProperties(), defaultPolicy),
            transactionManager,
            OpenTelemetry.noop().getTracer("test"));

    private final ImportOptions options = ImportOptions.builder()
            .insertedAt(INSERTED)
            .updatedAt(UPDATED)
            .timeout(Duration.ofSeconds(5))
            .build();

    @Test
    @SuppressWarnings("unchecked")
    void appliesDefaultsAndOrdersBeforeWriting() {
        AddressHash k1 = address(1);
        AddressHash k2 = address(2);
        when(repo.upsertAll(anyList(), any(), any(), any(), any())).thenReturn(List.of());

        service.upsert(List.of(
                TokenParams.builder().contractAddressHash(k2).name("Two").build(),
                TokenParams.builder().contractAddressHash(k1).holderCount(7L).cataloged(Cataloged.CATALOGED).build()),
                options);

        ArgumentCaptor<List<TokenParams>> captor = ArgumentCaptor.forClass(List.class);
        verify(repo).upsertAll(captor.capture(), eq(defaultPolicy), eq(INSERTED), eq(UPDATED), eq(Duration.ofSeconds(5)));
        List<TokenParams> written = captor.getValue();

        assertEquals(k1, written.get(0).getContractAddressHash());
        assertEquals(7L, written.get(0).getHolderCount());
        assertEquals(Cataloged.CATALOGED, written.get(0).getCataloged());

        assertEquals(k2, written.get(1).getContractAddressHash());
        assertEquals(0L, written.get(1).getHolderCount());
        assertEquals(Cataloged.UNKNOWN, written.get(1).getCataloged());
        assertEquals("Two", written.get(1).getName());
    }

    @Test
    void returnsRowsFromStore() {
        Token row = new Token();
        row.setContractAddressHash(address(1));
        row.setHolderCount(12L);
        when(repo.upsertAll(anyList(), any(), any(), any(), any())).thenReturn(List.of(row));

        List<Token> result = service.upsert(List.of(TokenParams.builder().contractAddressHash(address(1)).build()), options);

        assertEquals(List.of(row), result);
    }

    @Test
    void usesOverridePolicyAndConfiguredTimeout() {
        MergePolicy override = mock(MergePolicy.class);
        when(repo.upsertAll(anyList(), any(), any(), any(), any())).thenReturn(List.of());

        service.upsert(List.of(TokenParams.builder().contractAddressHash(address(1)).build()),
                ImportOptions.builder().onConflict(override).build());

        verify(repo).upsertAll(anyList(), eq(override), any(), any(), eq(Duration.ofMillis(60_000)));
    }

    @Test
    void emptyBatchIsNoOp() {
        assertTrue(service.upsert(List.of(), options).isEmpty());
        verifyNoInteractions(repo);
    }

    @Test
    void duplicateKeysRejectedBeforeStore() {
        AddressHash k1 = address(1);

        TokenValidationException e = assertThrows(TokenValidationException.class, () -> service.upsert(List.of(
                TokenParams.builder().contractAddressHash(k1).build(),
                TokenParams.builder().contractAddressHash(k1).build()), options));

        assertEquals(TokenUpsertService.OPERATION, e.getOperation());
        assertEquals(k1, e.getContractAddressHash());
        verifyNoInteractions(repo);
    }

    @Test
    void translatesStoreFailures() {
        CannotAcquireLockException lockFailure = new CannotAcquireLockException("lock timeout");
        when(repo.upsertAll(anyList(), any(), any(), any(), any())).thenThrow(lockFailure);

        LockTimeoutException e = assertThrows(LockTimeoutException.class, () ->
                service.upsert(List.of(TokenParams.builder().contractAddressHash(address(1)).build()), options));
        assertEquals(TokenUpsertService.OPERATION, e.getOperation());
        assertSame(lockFailure, e.getCause());
    }

    @Test
    void translatesConnectivityFailures() {
        when(repo.upsertAll(anyList(), any(), any(), any(), any()))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThrows(StoreUnavailableException.class, () ->
                service.upsert(List.of(TokenParams.builder().contractAddressHash(address(1)).build()), options));
    }

    @Test
    void storeDownAtBeginIsStoreUnavailable() {
        CannotCreateTransactionException outage = new CannotCreateTransactionException("Could not open JPA EntityManager",
                new SQLException("Connection to localhost:5432 refused", "08001"));
        when(transactionManager.getTransaction(any())).thenThrow(outage);

        StoreUnavailableException e = assertThrows(StoreUnavailableException.class, () ->
                service.upsert(List.of(TokenParams.builder().contractAddressHash(address(1)).build()), options));

        assertEquals(TokenUpsertService.OPERATION, e.getOperation());
        assertSame(outage, e.getCause());
        verifyNoInteractions(repo);
    }

    @Test
    void writesInsideOneTransaction() {
        when(repo.upsertAll(anyList(), any(), any(), any(), any())).thenReturn(List.of());

        service.upsert(List.of(TokenParams.builder().contractAddressHash(address(1)).build()), options);

        verify(transactionManager).getTransaction(any());
        verify(transactionManager).commit(any());
    }
}
