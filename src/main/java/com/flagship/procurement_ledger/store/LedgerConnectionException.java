package com.flagship.procurement_ledger.store;

/**
 * The backing store could not be reached (network, authentication, pool exhaustion).
 */
public class LedgerConnectionException extends LedgerStoreException {

    public LedgerConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
