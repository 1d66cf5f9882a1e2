package com.flagship.procurement_ledger.store;

import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;

/**
 * Base type for failures of the backing ledger store.
 */
public abstract class LedgerStoreException extends RuntimeException {

    protected LedgerStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Maps a Spring data access failure onto the ledger taxonomy.
     * Resource failures (no connection, pool exhausted) become {@link LedgerConnectionException},
     * everything else {@link LedgerPersistenceException}.
     */
    public static LedgerStoreException from(String operation, DataAccessException e) {
        // CannotGetJdbcConnectionException is a DataAccessResourceFailureException
        if (e instanceof DataAccessResourceFailureException) {
            return new LedgerConnectionException("Ledger store unreachable during " + operation, e);
        }
        return new LedgerPersistenceException("Ledger store failed to " + operation, e);
    }
}
