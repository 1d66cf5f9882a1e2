package com.flagship.procurement_ledger.store;

/**
 * A read or write round-trip failed after a connection was obtained.
 */
public class LedgerPersistenceException extends LedgerStoreException {

    public LedgerPersistenceException(String message) {
        super(message, null);
    }

    public LedgerPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
