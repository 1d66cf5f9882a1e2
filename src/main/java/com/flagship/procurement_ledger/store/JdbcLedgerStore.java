package com.flagship.procurement_ledger.store;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Ledger store backed by the {@code ledger_rows} table.
 *
 * The table mirrors a spreadsheet: a {@code position} key plus one TEXT column per
 * {@link LedgerColumn}, with the header stored as row 1 (seeded by schema.sql).
 *
 * Plain JDBC on purpose: the store only knows rows and cells, request semantics live
 * in {@code RequestLedger}.
 */
@Repository
@Slf4j
public class JdbcLedgerStore implements LedgerStore {

    private static final String COLUMN_LIST = Arrays.stream(LedgerColumn.values())
        .map(LedgerColumn::sqlName)
        .collect(Collectors.joining(", "));

    private static final String SELECT_ALL =
        "SELECT position, " + COLUMN_LIST + " FROM ledger_rows ORDER BY position";

    // Next position is computed inside the insert; callers serialize appends through
    // the order-number counter lock held by the surrounding transaction.
    private static final String APPEND =
        "INSERT INTO ledger_rows (position, " + COLUMN_LIST + ") " +
        "SELECT COALESCE(MAX(position), 0) + 1, " +
        Arrays.stream(LedgerColumn.values()).map(c -> "CAST(? AS TEXT)").collect(Collectors.joining(", ")) +
        " FROM ledger_rows RETURNING position";

    private final JdbcTemplate jdbcTemplate;

    public JdbcLedgerStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void verifyConnection() {
        try {
            jdbcTemplate.queryForObject("SELECT 1", Integer.class);
        } catch (DataAccessException e) {
            throw LedgerStoreException.from("verify connection", e);
        }
    }

    @Override
    public List<LedgerRow> readAllRows() {
        try {
            return jdbcTemplate.query(SELECT_ALL, ledgerRowMapper());
        } catch (DataAccessException e) {
            throw LedgerStoreException.from("read rows", e);
        }
    }

    @Override
    public int appendRow(List<String> cells) {
        if (cells.size() > LedgerColumn.count()) {
            throw new IllegalArgumentException(
                String.format("Row has %d cells but the ledger has only %d columns",
                    cells.size(), LedgerColumn.count()));
        }

        Object[] args = new Object[LedgerColumn.count()];
        for (int i = 0; i < args.length; i++) {
            args[i] = i < cells.size() && cells.get(i) != null ? cells.get(i) : "";
        }

        try {
            Integer position = jdbcTemplate.queryForObject(APPEND, Integer.class, args);
            if (position == null) {
                throw new LedgerPersistenceException("Append returned no row position");
            }
            log.debug("Appended ledger row at position {}", position);
            return position;
        } catch (DataAccessException e) {
            throw LedgerStoreException.from("append row", e);
        }
    }

    @Override
    public void updateCell(int rowPosition, LedgerColumn column, String value) {
        if (!column.isMutable()) {
            throw new IllegalArgumentException("Column " + column + " is write-once");
        }
        if (rowPosition <= LedgerRow.HEADER_POSITION) {
            throw new IllegalArgumentException("Cannot update header or invalid row position " + rowPosition);
        }

        int updated;
        try {
            updated = jdbcTemplate.update(
                "UPDATE ledger_rows SET " + column.sqlName() + " = ? WHERE position = ?",
                value == null ? "" : value,
                rowPosition
            );
        } catch (DataAccessException e) {
            throw LedgerStoreException.from("update cell", e);
        }

        if (updated == 0) {
            throw new LedgerPersistenceException("No ledger row at position " + rowPosition);
        }
    }

    private RowMapper<LedgerRow> ledgerRowMapper() {
        return (rs, rowNum) -> {
            List<String> cells = new ArrayList<>(LedgerColumn.count());
            for (LedgerColumn column : LedgerColumn.values()) {
                String value = rs.getString(column.sqlName());
                cells.add(value == null ? "" : value);
            }
            return new LedgerRow(rs.getInt("position"), cells);
        };
    }
}
