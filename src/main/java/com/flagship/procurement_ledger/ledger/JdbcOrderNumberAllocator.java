package com.flagship.procurement_ledger.ledger;

import com.flagship.procurement_ledger.store.LedgerPersistenceException;
import com.flagship.procurement_ledger.store.LedgerStoreException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Order number counter kept in the {@code ledger_counters} table.
 *
 * The increment is a single {@code UPDATE ... RETURNING}, so the row lock it takes
 * is held until the surrounding transaction ends. Two concurrent submissions therefore
 * cannot observe the same value, and their rows are appended in counter order.
 */
@Component
@Slf4j
public class JdbcOrderNumberAllocator implements OrderNumberAllocator {

    static final String COUNTER_NAME = "order_number";

    private final JdbcTemplate jdbcTemplate;

    public JdbcOrderNumberAllocator(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Must run inside the transaction that appends the row.
     */
    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public long reserveNext() {
        try {
            Long value = jdbcTemplate.queryForObject(
                "UPDATE ledger_counters SET current_value = current_value + 1 " +
                "WHERE name = ? RETURNING current_value",
                Long.class,
                COUNTER_NAME
            );
            if (value == null) {
                throw new LedgerPersistenceException("Order number counter returned no value");
            }
            log.debug("Reserved order sequence value {}", value);
            return value;
        } catch (EmptyResultDataAccessException e) {
            throw new LedgerPersistenceException("Order number counter '" + COUNTER_NAME + "' is missing", e);
        } catch (DataAccessException e) {
            throw LedgerStoreException.from("reserve order number", e);
        }
    }
}
