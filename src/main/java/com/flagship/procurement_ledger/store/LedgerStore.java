package com.flagship.procurement_ledger.store;

import java.util.List;

/**
 * Row-level access to the tabular ledger.
 *
 * Every call is a synchronous round-trip to the backing store. Implementations report
 * an unreachable store with {@link LedgerConnectionException} and any other failed
 * round-trip with {@link LedgerPersistenceException}; they never return partial results.
 */
public interface LedgerStore {

    /**
     * Checks that the backing store can be reached.
     *
     * @throws LedgerConnectionException if no connection can be obtained
     */
    void verifyConnection();

    /**
     * Reads every row, header included, ordered by position.
     */
    List<LedgerRow> readAllRows();

    /**
     * Appends a row after the current last row.
     *
     * @param cells cell values in {@link LedgerColumn} order
     * @return the 1-indexed position the row was written to
     */
    int appendRow(List<String> cells);

    /**
     * Overwrites a single cell of an existing data row.
     *
     * @throws IllegalArgumentException if the column is write-once or the position is the header
     * @throws LedgerPersistenceException if no row exists at the position
     */
    void updateCell(int rowPosition, LedgerColumn column, String value);
}
