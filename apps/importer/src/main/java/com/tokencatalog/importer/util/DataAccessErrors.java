package com.tokencatalog.importer.util;

import com.tokencatalog.importer.exception.LockTimeoutException;
import com.tokencatalog.importer.exception.StoreUnavailableException;
import com.tokencatalog.importer.exception.TokenConstraintViolationException;
import com.tokencatalog.importer.exception.TokenImportException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.TransactionTimedOutException;

import java.sql.SQLException;
import java.util.Set;

/**
 * Maps Spring's data access exceptions onto the import error taxonomy.
 */
public final class DataAccessErrors {

    // lock_not_available, deadlock_detected, query_canceled (statement_timeout)
    private static final Set<String> TIMEOUT_SQL_STATES = Set.of("55P03", "40P01", "57014");

    private DataAccessErrors() {
    }

    public static TokenImportException translate(String operation, DataAccessException e) {
        String sqlState = sqlState(e);
        if ((sqlState != null && TIMEOUT_SQL_STATES.contains(sqlState))
                || e instanceof PessimisticLockingFailureException
                || e instanceof QueryTimeoutException) {
            return new LockTimeoutException(operation,
                    "Timed out waiting for token row locks in " + operation + ": " + message(e), e);
        }
        if (e instanceof DataIntegrityViolationException) {
            return new TokenConstraintViolationException(operation, message(e), e);
        }
        return new StoreUnavailableException(operation,
                "Token store failed during " + operation + ": " + message(e), e);
    }

    /**
     * Begin, commit and rollback failures. The cause is usually the store being unreachable.
     */
    public static TokenImportException translate(String operation, TransactionException e) {
        if (e instanceof TransactionTimedOutException) {
            return new LockTimeoutException(operation,
                    "Transaction timed out in " + operation + ": " + e.getMessage(), e);
        }
        return new StoreUnavailableException(operation,
                "Token store transaction failed during " + operation + ": " + e.getMostSpecificCause().getMessage(), e);
    }

    private static String sqlState(DataAccessException e) {
        Throwable cause = e.getMostSpecificCause();
        if (cause instanceof SQLException) {
            return ((SQLException) cause).getSQLState();
        }
        return null;
    }

    private static String message(DataAccessException e) {
        return e.getMostSpecificCause().getMessage();
    }
}
